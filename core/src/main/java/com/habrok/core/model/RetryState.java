package com.habrok.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * 진행 중인 논리 호출 1건의 재시도 상태. 불변 값이며 재시도마다 {@link #next()}로 새 값을 만든다.
 * attemptIndex는 0부터 시작.
 */
public record RetryState(int attemptIndex, int maxAttempts, Duration minDelay, Duration maxDelay) {

    public RetryState {
        if (attemptIndex < 0) throw new IllegalArgumentException("attemptIndex must be >= 0");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        Objects.requireNonNull(minDelay, "minDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
    }

    public static RetryState initial(int maxAttempts, Duration minDelay, Duration maxDelay) {
        return new RetryState(0, maxAttempts, minDelay, maxDelay);
    }

    public RetryState next() {
        return new RetryState(attemptIndex + 1, maxAttempts, minDelay, maxDelay);
    }

    public boolean isExhausted() {
        return attemptIndex >= maxAttempts;
    }
}
