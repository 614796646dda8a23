package com.habrok.core.model;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 클라이언트 설정 (habrok.yml 매핑 대상). 순수 설정 보관용.
 * Habrok 인스턴스는 생성 시점에 {@link #copy()}로 스냅샷을 떠서 쓰므로,
 * 이후 이 객체를 바꿔도 이미 만든 인스턴스에는 영향이 없다.
 */
public final class ClientConfig {

    /** 재시도 대상 전송 오류 코드 기본값 */
    public static final Set<String> DEFAULT_RETRYABLE_CODES =
            Set.of("ECONNRESET", "ETIMEDOUT", "ESOCKETTIMEDOUT", "EPIPE");

    // ---------- 요청 봉투 ----------
    private boolean disableCustomHeaders = false;  // 기본 헤더(User-Agent 등) 주입 끄기
    private boolean disableAutomaticJson = false;  // JSON 플래그 끄기

    // ---------- 백오프 ----------
    private Duration retryMinDelay = Duration.ofMillis(100);
    private Duration retryMaxDelay = Duration.ofSeconds(10);
    private double retryFactor = 2.0;               // 지수 증가 배수
    private double retryJitter = 0.1;               // ±10%
    private Set<String> retryableErrorCodes = new LinkedHashSet<>(DEFAULT_RETRYABLE_CODES);

    // ---------- 전송 ----------
    private Duration timeout = Duration.ofSeconds(30); // 시도 1회당 타임아웃
    private boolean followRedirects = true;

    // ---------- getters ----------
    public boolean isDisableCustomHeaders() { return disableCustomHeaders; }
    public boolean isDisableAutomaticJson() { return disableAutomaticJson; }
    public Duration getRetryMinDelay() { return retryMinDelay; }
    public Duration getRetryMaxDelay() { return retryMaxDelay; }
    public double getRetryFactor() { return retryFactor; }
    public double getRetryJitter() { return retryJitter; }
    public Set<String> getRetryableErrorCodes() { return Set.copyOf(retryableErrorCodes); }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }

    // ---------- fluent setters ----------
    public ClientConfig setDisableCustomHeaders(boolean v) { this.disableCustomHeaders = v; return this; }
    public ClientConfig setDisableAutomaticJson(boolean v) { this.disableAutomaticJson = v; return this; }
    public ClientConfig setRetryMinDelay(Duration d) { this.retryMinDelay = d; return this; }
    public ClientConfig setRetryMaxDelay(Duration d) { this.retryMaxDelay = d; return this; }

    /** 음수는 0으로 보정 */
    public ClientConfig setRetryMinDelayMs(long ms) { return setRetryMinDelay(Duration.ofMillis(Math.max(0, ms))); }
    public ClientConfig setRetryMaxDelayMs(long ms) { return setRetryMaxDelay(Duration.ofMillis(Math.max(0, ms))); }

    public ClientConfig setRetryFactor(double v) { this.retryFactor = v; return this; }
    public ClientConfig setRetryJitter(double v) { this.retryJitter = v; return this; }

    /** 코드는 대문자로 정규화. null/빈 컬렉션이면 재시도 대상 코드 없음. */
    public ClientConfig setRetryableErrorCodes(Collection<String> codes) {
        Set<String> out = new LinkedHashSet<>();
        if (codes != null) {
            for (String c : codes) {
                if (c != null && !c.isBlank()) out.add(c.trim().toUpperCase(Locale.ROOT));
            }
        }
        this.retryableErrorCodes = out;
        return this;
    }

    public ClientConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ClientConfig setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public ClientConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(retryMinDelay, "retryMinDelay");
        Objects.requireNonNull(retryMaxDelay, "retryMaxDelay");
        if (retryMinDelay.isNegative()) throw new IllegalArgumentException("retryMinDelay must be >= 0");
        if (retryMaxDelay.isNegative()) throw new IllegalArgumentException("retryMaxDelay must be >= 0");
        if (retryFactor < 1.0 || Double.isNaN(retryFactor))
            throw new IllegalArgumentException("retryFactor must be >= 1.0");
        if (retryJitter < 0.0 || retryJitter > 1.0 || Double.isNaN(retryJitter))
            throw new IllegalArgumentException("retryJitter must be 0.0-1.0");
        Objects.requireNonNull(retryableErrorCodes, "retryableErrorCodes");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
    }

    // ---------- helpers ----------
    public static ClientConfig defaults() { return new ClientConfig(); }

    /** 인스턴스 생성 시 스냅샷용 */
    public ClientConfig copy() {
        return new ClientConfig()
                .setDisableCustomHeaders(disableCustomHeaders)
                .setDisableAutomaticJson(disableAutomaticJson)
                .setRetryMinDelay(retryMinDelay)
                .setRetryMaxDelay(retryMaxDelay)
                .setRetryFactor(retryFactor)
                .setRetryJitter(retryJitter)
                .setRetryableErrorCodes(retryableErrorCodes)
                .setTimeout(timeout)
                .setFollowRedirects(followRedirects);
    }

    @Override
    public String toString() {
        return "ClientConfig[customHeaders=" + !disableCustomHeaders
                + ", json=" + !disableAutomaticJson
                + ", minDelay=" + retryMinDelay.toMillis() + "ms"
                + ", maxDelay=" + retryMaxDelay.toMillis() + "ms"
                + ", factor=" + retryFactor
                + ", jitter=" + retryJitter
                + ", codes=" + retryableErrorCodes
                + ", timeout=" + timeout.toMillis() + "ms]";
    }
}
