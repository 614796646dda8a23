package com.habrok.core.util;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/** 재시도 사이 대기. 스레드를 막지 않고, 지연 후 완료되는 future를 돌려준다. */
@FunctionalInterface
public interface DelayScheduler {
    CompletableFuture<Void> delay(Duration d);
}
