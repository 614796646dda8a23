package com.habrok.core.util;

import com.habrok.core.model.ClientConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.LongConsumer;

/**
 * habrok.yml을 읽어 ClientConfig로 변환.
 *
 * 예상 YAML 키:
 * disableCustomHeaders: false
 * disableAutomaticJson: false
 * timeoutMs: 30000
 * followRedirects: true
 * retry:
 *   minDelayMs: 100
 *   maxDelayMs: 10000
 *   factor: 2.0
 *   jitter: 0.1
 *   errorCodes: ["ECONNRESET", "ETIMEDOUT"]   # 또는 "ECONNRESET,ETIMEDOUT"
 *
 * retry.* 키는 평면 키(retryMinDelayMs, retryMaxDelayMs, retryFactor, retryJitter, retryableErrorCodes)로도 받는다.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ClientConfig loadDefault() throws IOException {
        return load(Path.of("habrok.yml"));
    }

    public static ClientConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("habrok.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ClientConfig load(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        final Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML: " + e.getMessage(), e);
        }

        ClientConfig cfg = ClientConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        try {
            // 1) 평면 키
            setBoolean(map, "disableCustomHeaders", cfg::setDisableCustomHeaders);
            setBoolean(map, "disableAutomaticJson", cfg::setDisableAutomaticJson);
            setLong(map, "timeoutMs", cfg::setTimeoutMs);
            setBoolean(map, "followRedirects", cfg::setFollowRedirects);

            setLong(map, "retryMinDelayMs", cfg::setRetryMinDelayMs);
            setLong(map, "retryMaxDelayMs", cfg::setRetryMaxDelayMs);
            setDouble(map, "retryFactor", cfg::setRetryFactor);
            setDouble(map, "retryJitter", cfg::setRetryJitter);
            setStringList(map, "retryableErrorCodes", cfg::setRetryableErrorCodes);

            // 2) retry.* (평면 키보다 우선)
            Map<?, ?> retry = getMap(map, "retry");
            if (retry != null) {
                setLong(retry, "minDelayMs", cfg::setRetryMinDelayMs);
                setLong(retry, "maxDelayMs", cfg::setRetryMaxDelayMs);
                setDouble(retry, "factor", cfg::setRetryFactor);
                setDouble(retry, "jitter", cfg::setRetryJitter);
                setStringList(retry, "errorCodes", cfg::setRetryableErrorCodes);
            }
        } catch (NumberFormatException e) {
            throw new IOException("Invalid number in habrok.yml: " + e.getMessage(), e);
        }

        // 기본값/범위 확인 (IllegalArgumentException 그대로 전파)
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).split("\\s*,\\s*")) {
                if (!p.isBlank()) out.add(p.trim());
            }
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }
}
