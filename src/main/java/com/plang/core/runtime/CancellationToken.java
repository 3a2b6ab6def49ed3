package com.plang.core.runtime;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-wide cancellation flag shared by every context copy of one execution.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
