package com.habrok.core;

import com.habrok.core.api.IRequestClient;
import com.habrok.core.http.BackoffScheduler;
import com.habrok.core.http.ErrorNormalizer;
import com.habrok.core.http.JdkHttpTransport;
import com.habrok.core.http.OutcomeClassifier;
import com.habrok.core.http.RequestEnvelopeFactory;
import com.habrok.core.http.ResilientExecutor;
import com.habrok.core.http.Transport;
import com.habrok.core.http.TransportErrors;
import com.habrok.core.model.ClientConfig;
import com.habrok.core.model.Request;
import com.habrok.core.model.RequestDescriptor;
import com.habrok.core.model.ResponseData;
import com.habrok.core.util.DefaultDelayScheduler;
import com.habrok.core.util.DelayScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 설정된 클라이언트 인스턴스:
 *  - 생성 시 ClientConfig 스냅샷을 떠서 불변으로 보관 (전역 상태 없음)
 *  - request(): 비동기, send(): 블로킹
 *  - 재시도 상한은 {@link #RETRIES} 고정
 *
 * <pre>{@code
 * Habrok habrok = new Habrok(new ClientConfig().setRetryMinDelayMs(250));
 * ResponseData out = habrok.send(Request.get("https://api.example.com/ships/1"));
 * }</pre>
 */
public final class Habrok implements IRequestClient {

    private static final Logger LOG = LoggerFactory.getLogger(Habrok.class);

    public static final String VERSION = "0.1.0";

    /** 논리 호출당 최대 전송 시도 횟수(첫 시도 포함) */
    public static final int RETRIES = 3;

    private final ClientConfig config;
    private final RequestEnvelopeFactory envelopes;
    private final ResilientExecutor executor;

    /** 기본 설정 + JDK HttpClient */
    public Habrok() {
        this(ClientConfig.defaults());
    }

    public Habrok(ClientConfig config) {
        this(config, null, new DefaultDelayScheduler());
    }

    /** DI/테스트용: transport가 null이면 JdkHttpTransport 사용 */
    public Habrok(ClientConfig config, Transport transport) {
        this(config, transport, new DefaultDelayScheduler());
    }

    public Habrok(ClientConfig config, Transport transport, DelayScheduler delays) {
        Objects.requireNonNull(config, "config").validate();
        this.config = config.copy();
        this.envelopes = new RequestEnvelopeFactory(this.config, VERSION);
        this.executor = new ResilientExecutor(
                (transport != null) ? transport : new JdkHttpTransport(this.config),
                new OutcomeClassifier(this.config.getRetryableErrorCodes()),
                new BackoffScheduler(this.config.getRetryFactor(), this.config.getRetryJitter()),
                new ErrorNormalizer(),
                Objects.requireNonNull(delays, "delays"),
                RETRIES,
                this.config.getRetryMinDelay(),
                this.config.getRetryMaxDelay());
        LOG.debug("Habrok {} ready: {}", VERSION, this.config);
    }

    @Override
    public CompletableFuture<ResponseData> request(Request request) {
        RequestDescriptor descriptor = envelopes.resolve(request);
        return executor.execute(descriptor);
    }

    /**
     * 블로킹 호출. IOException(HttpStatusException 포함)/RuntimeException/Error는 원본 객체 그대로 던지고,
     * 그 밖의 checked 예외만 IOException으로 감싼다.
     */
    @Override
    public ResponseData send(Request request) throws IOException, InterruptedException {
        try {
            return request(request).get();
        } catch (ExecutionException e) {
            Throwable cause = TransportErrors.unwrap(e);
            if (cause instanceof IOException io) throw io;
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IOException(cause.getMessage(), cause);
        }
    }

    @Override
    public int getRetries() { return RETRIES; }

    /** 인스턴스가 사용하는 설정 사본(수정해도 인스턴스에는 영향 없음) */
    public ClientConfig getConfig() { return config.copy(); }
}
