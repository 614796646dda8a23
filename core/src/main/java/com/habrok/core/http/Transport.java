package com.habrok.core.http;

import com.habrok.core.model.AttemptResult;
import com.habrok.core.model.RequestDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * 전송 어댑터: 요청 1회를 수행하고 정확히 하나의 {@link AttemptResult}를 돌려준다.
 * 실패도 가능하면 {@link AttemptResult.TransportFailure}로 정상 완료시키는 것이 계약이다.
 * (예외로 끝나도 실행기가 TransportFailure로 감싸 처리한다.)
 */
@FunctionalInterface
public interface Transport {
    CompletableFuture<AttemptResult> attempt(RequestDescriptor descriptor);
}
