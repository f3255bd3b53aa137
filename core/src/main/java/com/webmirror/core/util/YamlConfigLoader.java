package com.webmirror.core.util;

import com.webmirror.core.model.MirrorConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * mirror.yml을 읽어 MirrorConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com/docs"
 * concurrency: 0          # 0 = 상한 없음
 * timeoutMs: 0            # 0 = 무제한
 * followRedirects: true
 * report: "out/crawl-report.json"
 * output:
 *   dir: "./data"
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    /** 읽고 검증까지 수행 */
    public static MirrorConfig load(Path yamlPath) throws IOException {
        MirrorConfig cfg = read(yamlPath);
        cfg.validate();
        return cfg;
    }

    /** 검증 없이 읽기만 한다. CLI 플래그를 덮어쓴 뒤 호출자가 validate() 해야 한다. */
    public static MirrorConfig read(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("mirror.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            MirrorConfig cfg = MirrorConfig.defaults();
            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 defaults 유지
                return cfg;
            }

            setString(map, "target", cfg::setTarget);
            setInt(map, "concurrency", cfg::setConcurrency);
            setLong(map, "timeoutMs", cfg::setRequestTimeoutMs);
            setBoolean(map, "followRedirects", cfg::setFollowRedirects);
            setPath(map, "report", cfg::setReportFile);

            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                setPath(output, "dir", cfg::setOutputDir);
            }
            return cfg;
        } catch (RuntimeException e) {
            // YAML 문법 오류, 숫자 형식 오류 등
            throw new IOException("invalid mirror.yml (" + yamlPath + "): " + e.getMessage(), e);
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(Path.of(String.valueOf(v)));
    }
}
