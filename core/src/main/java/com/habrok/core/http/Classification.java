package com.habrok.core.http;

import com.habrok.core.model.AttemptResult;

import java.util.Objects;

/** 판정 + 정규화기에 넘길 원본 결과 */
public record Classification(Verdict verdict, AttemptResult result) {
    public Classification {
        Objects.requireNonNull(verdict, "verdict");
        Objects.requireNonNull(result, "result");
    }

    public boolean isRetryable() { return verdict == Verdict.RETRYABLE; }
}
