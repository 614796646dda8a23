// IRequestClient.java
package com.habrok.core.api;

import com.habrok.core.model.Request;
import com.habrok.core.model.ResponseData;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

/** 재시도 포함 요청 실행 최소 계약: Request를 받아 성공 응답 또는 종결 오류를 돌려준다. */
public interface IRequestClient {
    CompletableFuture<ResponseData> request(Request request);
    ResponseData send(Request request) throws IOException, InterruptedException;
    /** 논리 호출당 최대 시도 횟수(고정값) */
    int getRetries();
}
