package com.habrok.core.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 재시도 전 대기 시간 계산. minDelay를 기준으로 factor^(attempt-1)배 증가, ±jitter 후
 * [minDelay, maxDelay]로 자른다. 예: 100ms → 200ms → 400ms ...
 * min/max 중 하나라도 0이면 항상 0 (테스트용 즉시 재시도).
 * 값만 계산하며 직접 대기하지 않는다.
 */
public final class BackoffScheduler {

    private final double factor;
    private final double jitter;

    public BackoffScheduler() { this(2.0, 0.0); }

    public BackoffScheduler(double factor, double jitter) {
        if (factor < 1.0) throw new IllegalArgumentException("factor must be >= 1.0");
        if (jitter < 0.0 || jitter > 1.0) throw new IllegalArgumentException("jitter must be 0.0-1.0");
        this.factor = factor;
        this.jitter = jitter;
    }

    /** attemptIndex는 방금 실패한 시도 수(1 이상). 0 이하는 1로 취급. */
    public Duration computeDelay(int attemptIndex, Duration minDelay, Duration maxDelay) {
        long minMs = Math.max(0, minDelay.toMillis());
        long maxMs = Math.max(0, maxDelay.toMillis());
        if (minMs == 0 || maxMs == 0) return Duration.ZERO;

        int exp = Math.max(0, attemptIndex - 1);
        double raw = minMs * Math.pow(factor, exp);   // 지수 증가(오버플로는 clamp에서 정리)
        if (jitter > 0) {
            raw = raw * (1 + ThreadLocalRandom.current().nextDouble(-jitter, jitter));
        }

        long ms = (raw >= maxMs) ? maxMs : Math.max(minMs, (long) raw);
        return Duration.ofMillis(Math.min(ms, maxMs));
    }
}
