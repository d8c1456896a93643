package com.webtext.core.util;

import com.webtext.core.model.ExtractConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * webtext.yml을 읽어 ExtractConfig로 변환. 없는 키는 기본값 유지.
 *
 * 예상 YAML 키:
 * userAgent: "Mozilla/5.0 ..."
 * timeoutMs: 30000
 * connectTimeoutMs: 10000
 * retry:
 *   maxRetries: 3
 *   baseDelayMs: 500
 * output:
 *   defaultDir: "~/Documents/URL Text"
 * input:
 *   suffix: ".txt"
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ExtractConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static ExtractConfig load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        ExtractConfig cfg = ExtractConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "userAgent", cfg::setUserAgent);
        setMillis(map, "timeoutMs", cfg::setTimeout);
        setMillis(map, "connectTimeoutMs", cfg::setConnectTimeout);

        // 2) retry.*
        Map<?, ?> retry = getMap(map, "retry");
        if (retry != null) {
            setInt(retry, "maxRetries", cfg::setMaxRetries);
            setMillis(retry, "baseDelayMs", cfg::setRetryBaseDelay);
        }

        // 3) output.defaultDir
        Map<?, ?> output = getMap(map, "output");
        if (output != null) {
            setString(output, "defaultDir", s -> cfg.setDefaultOutputDir(PathUtil.expandHome(s)));
        }

        // 4) input.suffix
        Map<?, ?> input = getMap(map, "input");
        if (input != null) {
            setString(input, "suffix", cfg::setInputSuffix);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, String.valueOf(v)));
    }

    /** 음수/0 검증은 ExtractConfig.validate()에 맡긴다. */
    private static void setMillis(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parseInt(key, String.valueOf(v));
        setter.accept(Duration.ofMillis(ms));
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, e);
        }
    }
}
