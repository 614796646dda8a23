package com.habrok.core.util;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public final class DefaultDelayScheduler implements DelayScheduler {
    @Override public CompletableFuture<Void> delay(Duration d) {
        long ms = (d == null) ? 0 : Math.max(0, d.toMillis());
        if (ms == 0) return CompletableFuture.completedFuture(null);
        return CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(ms, TimeUnit.MILLISECONDS));
    }
}
