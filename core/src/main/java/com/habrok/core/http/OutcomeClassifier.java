package com.habrok.core.http;

import com.habrok.core.model.AttemptResult;
import com.habrok.core.model.AttemptResult.HttpReply;
import com.habrok.core.model.AttemptResult.TransportFailure;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 시도 결과 분류기 (순서 중요):
 * <ol>
 *   <li>HTTP &lt; 400 → SUCCESS</li>
 *   <li>HTTP 429 → RETRYABLE</li>
 *   <li>그 외 HTTP ≥ 400 → TERMINAL (재시도 안 함)</li>
 *   <li>재시도 대상 코드의 전송 오류 → RETRYABLE</li>
 *   <li>그 외 전송 오류(코드 없음 포함) → TERMINAL</li>
 * </ol>
 * 입력과 불변 코드 집합에만 의존하는 순수 함수. 여러 호출이 공유해도 안전하다.
 */
public final class OutcomeClassifier {

    public static final int TOO_MANY_REQUESTS = 429;

    private final Set<String> retryableCodes;

    public OutcomeClassifier(Collection<String> retryableCodes) {
        this.retryableCodes = (retryableCodes == null)
                ? Set.of()
                : retryableCodes.stream()
                        .map(c -> c.toUpperCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableSet());
    }

    public Classification classify(AttemptResult result) {
        return new Classification(verdictOf(result), result);
    }

    public Verdict verdictOf(AttemptResult result) {
        if (result instanceof HttpReply reply) {
            int sc = reply.statusCode();
            if (sc < 400) return Verdict.SUCCESS;
            if (sc == TOO_MANY_REQUESTS) return Verdict.RETRYABLE;
            return Verdict.TERMINAL;
        }
        if (result instanceof TransportFailure failure) {
            return isRetryableCode(failure.code()) ? Verdict.RETRYABLE : Verdict.TERMINAL;
        }
        throw new IllegalArgumentException("Unexpected attempt result: " + result);
    }

    public boolean isRetryableCode(String code) {
        return code != null && retryableCodes.contains(code.toUpperCase(Locale.ROOT));
    }
}
