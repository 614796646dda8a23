package com.habrok.core.http;

import com.habrok.core.model.AttemptResult;
import com.habrok.core.model.RequestDescriptor;
import com.habrok.core.model.ResponseData;
import com.habrok.core.model.RetryState;
import com.habrok.core.util.DelayScheduler;
import com.habrok.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * 재시도 루프:
 *  - attempt → classify → (성공 반환 | 즉시 실패 | 백오프 후 재시도)
 *  - 논리 호출당 전송 호출은 최대 maxAttempts회
 *  - 대기는 DelayScheduler의 future로 이어 붙이며 스레드를 막지 않는다
 *  - 호출마다 RetryState를 따로 가지므로 같은 인스턴스로 동시 호출해도 서로 독립
 */
public final class ResilientExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ResilientExecutor.class);
    private static final StructuredLog SLOG = StructuredLog.get(ResilientExecutor.class);

    private final Transport transport;
    private final OutcomeClassifier classifier;
    private final BackoffScheduler backoff;
    private final ErrorNormalizer normalizer;
    private final DelayScheduler delays;

    private final int maxAttempts;
    private final Duration minDelay;
    private final Duration maxDelay;

    public ResilientExecutor(Transport transport,
                             OutcomeClassifier classifier,
                             BackoffScheduler backoff,
                             ErrorNormalizer normalizer,
                             DelayScheduler delays,
                             int maxAttempts,
                             Duration minDelay,
                             Duration maxDelay) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.delays = Objects.requireNonNull(delays, "delays");
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        this.maxAttempts = maxAttempts;
        this.minDelay = Objects.requireNonNull(minDelay, "minDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    }

    /** 성공이면 ResponseData로, 실패면 종결 오류(HttpStatusException 또는 원본 전송 예외)로 완료 */
    public CompletableFuture<ResponseData> execute(RequestDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        return run(descriptor, RetryState.initial(maxAttempts, minDelay, maxDelay));
    }

    private CompletableFuture<ResponseData> run(RequestDescriptor descriptor, RetryState state) {
        return attemptOnce(descriptor)
                .thenCompose(result -> onResult(descriptor, state, result));
    }

    private CompletableFuture<ResponseData> onResult(RequestDescriptor descriptor, RetryState state, AttemptResult result) {
        Classification c = classifier.classify(result);
        switch (c.verdict()) {
            case SUCCESS:
                return CompletableFuture.completedFuture(((AttemptResult.HttpReply) result).toResponseData());
            case TERMINAL:
                return fail(descriptor, state, result, "terminal");
            case RETRYABLE:
            default:
                break;
        }

        RetryState next = state.next();
        if (next.isExhausted()) {
            return fail(descriptor, next, result, "exhausted");
        }

        Duration delay = backoff.computeDelay(next.attemptIndex(), next.minDelay(), next.maxDelay());
        LOG.debug("Retrying {} (attempt {}/{}) after {}ms: {}",
                descriptor, next.attemptIndex() + 1, maxAttempts, delay.toMillis(), describe(result));
        SLOG.debug("attempt-retry",
                "method", descriptor.getMethod(),
                "uri", descriptor.getUri(),
                "attempt", next.attemptIndex(),
                "maxAttempts", maxAttempts,
                "delayMs", delay.toMillis(),
                "cause", describe(result));

        return delays.delay(delay)
                .thenCompose(ignored -> run(descriptor, next));
    }

    private CompletableFuture<ResponseData> fail(RequestDescriptor descriptor, RetryState state,
                                                 AttemptResult result, String reason) {
        Throwable error = normalizer.build(result);
        SLOG.info("attempt-" + reason,
                "method", descriptor.getMethod(),
                "uri", descriptor.getUri(),
                "attempts", Math.min(state.attemptIndex() + 1, maxAttempts),
                "cause", describe(result));
        return CompletableFuture.failedFuture(error);
    }

    /** 전송 어댑터가 던지거나 예외로 끝난 future를 돌려줘도 TransportFailure로 통일 */
    private CompletableFuture<AttemptResult> attemptOnce(RequestDescriptor descriptor) {
        final CompletableFuture<AttemptResult> f;
        try {
            f = transport.attempt(descriptor);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(new AttemptResult.TransportFailure(e, TransportErrors.codeOf(e)));
        }
        if (f == null) return CompletableFuture.completedFuture(noResult());
        return f.handle((result, ex) -> {
            if (ex != null) {
                Throwable cause = TransportErrors.unwrap(ex);
                return new AttemptResult.TransportFailure(cause, TransportErrors.codeOf(cause));
            }
            return (result != null) ? result : noResult();
        });
    }

    private static AttemptResult noResult() {
        return new AttemptResult.TransportFailure(new IllegalStateException("transport returned no result"), null);
    }

    private static String describe(AttemptResult result) {
        if (result instanceof AttemptResult.HttpReply r) return "HTTP " + r.statusCode();
        if (result instanceof AttemptResult.TransportFailure f) {
            return (f.code() != null ? f.code() + ": " : "") + f.message();
        }
        return String.valueOf(result);
    }
}
