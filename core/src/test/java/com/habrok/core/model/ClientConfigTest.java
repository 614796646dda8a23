package com.habrok.core.model;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;

class ClientConfigTest {

    @Test
    void defaultsAreValid() {
        ClientConfig cfg = ClientConfig.defaults();
        cfg.validate();

        assertThat(cfg.isDisableCustomHeaders()).isFalse();
        assertThat(cfg.isDisableAutomaticJson()).isFalse();
        assertThat(cfg.getRetryMinDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(cfg.getRetryMaxDelay()).isEqualTo(Duration.ofSeconds(10));
        assertThat(cfg.getRetryFactor()).isEqualTo(2.0);
        assertThat(cfg.getRetryJitter()).isEqualTo(0.1);
        assertThat(cfg.getRetryableErrorCodes())
                .containsExactlyInAnyOrder("ECONNRESET", "ETIMEDOUT", "ESOCKETTIMEDOUT", "EPIPE");
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(cfg.isFollowRedirects()).isTrue();
    }

    @Test
    void delayMsSettersClampNegativeToZero() {
        ClientConfig cfg = new ClientConfig().setRetryMinDelayMs(-5).setRetryMaxDelayMs(-1);

        assertThat(cfg.getRetryMinDelay()).isEqualTo(Duration.ZERO);
        assertThat(cfg.getRetryMaxDelay()).isEqualTo(Duration.ZERO);
        cfg.validate(); // 0 지연은 유효
    }

    @Test
    void setTimeoutMsClampsToPositive() {
        ClientConfig cfg = new ClientConfig();

        cfg.setTimeoutMs(0);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(1));

        cfg.setTimeoutMs(-5);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(1));

        cfg.validate();
    }

    @Test
    void errorCodesAreNormalized() {
        ClientConfig cfg = new ClientConfig().setRetryableErrorCodes(Arrays.asList(" econnreset ", null, "", "epipe"));

        assertThat(cfg.getRetryableErrorCodes()).containsExactlyInAnyOrder("ECONNRESET", "EPIPE");

        cfg.setRetryableErrorCodes(null);
        assertThat(cfg.getRetryableErrorCodes()).isEmpty();
    }

    @Test
    void validateRejectsFactorBelowOne() {
        ClientConfig cfg = new ClientConfig().setRetryFactor(0.5);

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retryFactor");
    }

    @Test
    void validateRejectsJitterOutOfRange() {
        assertThatThrownBy(new ClientConfig().setRetryJitter(1.5)::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retryJitter");
        assertThatThrownBy(new ClientConfig().setRetryJitter(-0.1)::validate)
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validateRejectsNegativeDuration() {
        ClientConfig cfg = new ClientConfig().setRetryMinDelay(Duration.ofMillis(-1));

        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retryMinDelay");
    }

    @Test
    void validateRequiresDelays() {
        ClientConfig cfg = new ClientConfig().setRetryMaxDelay(null);
        assertThrows(NullPointerException.class, cfg::validate);
    }

    @Test
    void copyIsIndependent() {
        ClientConfig cfg = new ClientConfig().setRetryMinDelayMs(7).setRetryableErrorCodes(List.of("EPIPE"));
        ClientConfig snap = cfg.copy();

        cfg.setRetryMinDelayMs(99).setDisableAutomaticJson(true).setRetryableErrorCodes(List.of("ETIMEDOUT"));

        assertThat(snap.getRetryMinDelay()).isEqualTo(Duration.ofMillis(7));
        assertThat(snap.isDisableAutomaticJson()).isFalse();
        assertThat(snap.getRetryableErrorCodes()).containsExactly("EPIPE");
    }
}
