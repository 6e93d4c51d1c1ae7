/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.weft.workflow;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to every task attempt.
 *
 * <p>The engine cancels the token when the attempt's deadline passes or the attempt's
 * result is no longer wanted. Tasks poll it between units of work.</p>
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile String reason;

    /**
     * Cancels the token. Only the first call records its reason.
     *
     * @return {@code true} if this call cancelled the token
     */
    public boolean cancel(String reason) {
        if (cancelled.compareAndSet(false, true)) {
            this.reason = reason;
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }

    /**
     * @throws CancellationException if the token has been cancelled
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException(reason != null ? reason : "cancelled");
        }
    }
}
