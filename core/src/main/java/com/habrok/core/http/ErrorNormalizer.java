package com.habrok.core.http;

import com.habrok.core.model.AttemptResult;
import com.habrok.core.model.AttemptResult.HttpReply;
import com.habrok.core.model.AttemptResult.TransportFailure;

/**
 * 분류된 실패 → 호출자에게 돌려줄 종결 오류.
 * HTTP 실패는 {@link HttpStatusException}으로 정규화, 전송 실패는 원본 예외를 손대지 않고 반환.
 */
public final class ErrorNormalizer {

    public Throwable build(AttemptResult failure) {
        if (failure instanceof HttpReply reply) {
            if (reply.statusCode() < 400) {
                throw new IllegalArgumentException("not a failure: status " + reply.statusCode());
            }
            return new HttpStatusException(
                    reply.statusCode(),
                    HttpStatusReason.of(reply.statusCode()),
                    reply.body(),
                    reply.headers());
        }
        if (failure instanceof TransportFailure tf) {
            return tf.error();
        }
        throw new IllegalArgumentException("Unexpected attempt result: " + failure);
    }
}
