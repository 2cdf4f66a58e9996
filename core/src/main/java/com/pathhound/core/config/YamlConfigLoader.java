package com.pathhound.core.config;

import com.pathhound.core.model.RunConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.Function;
import java.util.function.IntConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * scan.yml 을 읽어 RunConfig 로 변환.
 *
 * 예상 YAML 키:
 * targets: ["https://example.com"]      # 또는 target: "https://example.com"
 * wordlist: "words.txt"
 * extensions: ["php","bak"]
 * addSlash: false
 * threads: 50
 * scanLimit: 0                           # 0 = 무제한
 * rateLimit: 0                           # 스캔별 초당 요청, 0 = 무제한
 * timeoutMs: 7000
 * retryAttempts: 2
 * userAgent: "pathhound/0.3"
 * followRedirects: false
 * headers:                               # 모든 요청에 붙는 헤더
 *   Authorization: "Bearer xyz"
 * queries: ["token=abc"]                 # 모든 요청 URL 에 붙는 쿼리(name=value)
 *
 * scope:
 *   maxDepth: 4                          # 0 = 무제한
 *   domains: ["cdn.example.com"]
 *   dontScan: ["/logout", "re:.*\\.pdf$"]
 *   noRecursion: false
 *   forceRecursion: false
 *   recurseExtensionless: true
 *   extractLinks: false
 *   scanDirListings: false               # 디렉터리 목록 페이지도 워드리스트로 스캔
 *
 * filters:
 *   statusCodes: [200, 301, 403]         # 허용 목록(생략 시 기본 목록)
 *   filterStatus: [404]
 *   filterSize: [1234]
 *   filterWords: [10]
 *   filterLines: [3]
 *   filterRegex: ["Not Found"]
 *   filterSimilarTo: ["https://example.com/404page"]
 *   similarityThreshold: 0.95
 *   wildcardTolerance: 0.05
 *   dontFilter: false
 *
 * policy:
 *   autoTune: false
 *   autoBail: false
 *   window: 50
 *   tuneErrorRatio: 0.25
 *   bailErrorRatio: 0.90
 *   timeLimit: "10m"                     # 숫자는 초, 접미사 ms/s/m/h/d
 *
 * state:
 *   enabled: true
 *   interval: "0"                        # 주기 저장(0 = 종료 시에만)
 *   dir: "out"
 */
public final class YamlConfigLoader {

    private static final Pattern DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h|d)?");

    private YamlConfigLoader() {}

    public static RunConfig loadDefault() throws IOException {
        return load(Path.of("scan.yml"));
    }

    public static RunConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scan.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static RunConfig load(InputStream in) {
        LoaderOptions opts = new LoaderOptions();
        Yaml yaml = new Yaml(new SafeConstructor(opts));
        Object root = yaml.load(in);

        RunConfig.Builder b = RunConfig.defaults().toBuilder();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            return b.build();
        }

        // 1) 평면 키
        setStringList(map, "targets", b::targets);
        setString(map, "target", b::target);
        setString(map, "wordlist", b::wordlist);
        setStringList(map, "extensions", b::extensions);
        setBoolean(map, "addSlash", b::addSlash);
        setInt(map, "threads", b::threads);
        setInt(map, "scanLimit", b::scanLimit);
        setInt(map, "rateLimit", b::rateLimit);
        setInt(map, "maxDepth", b::maxDepth);
        setIntAsDurationMs(map, "timeoutMs", b::timeout);
        setInt(map, "retryAttempts", b::retryAttempts);
        setString(map, "userAgent", b::userAgent);
        setBoolean(map, "followRedirects", b::followRedirects);
        Map<String, Object> headers = getMap(map, "headers");
        if (headers != null) {
            headers.forEach((k, v) -> b.header(String.valueOf(k), v == null ? "" : String.valueOf(v)));
        }
        setStringList(map, "queries", b::queries);

        // 2) scope.*
        Map<String, Object> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", b::maxDepth);
            setStringList(scope, "domains", b::scope);
            setStringList(scope, "dontScan", b::dontScan);
            setBoolean(scope, "noRecursion", b::noRecursion);
            setBoolean(scope, "forceRecursion", b::forceRecursion);
            setBoolean(scope, "recurseExtensionless", b::recurseExtensionless);
            setBoolean(scope, "extractLinks", b::extractLinks);
            setBoolean(scope, "scanDirListings", b::scanDirListings);
        }

        // 3) filters.*
        Map<String, Object> filters = getMap(map, "filters");
        if (filters != null) {
            setList(filters, "statusCodes", YamlConfigLoader::toInt, b::statusCodes);
            setList(filters, "filterStatus", YamlConfigLoader::toInt, b::filterStatus);
            setList(filters, "filterSize", YamlConfigLoader::toLong, b::filterSize);
            setList(filters, "filterWords", YamlConfigLoader::toLong, b::filterWords);
            setList(filters, "filterLines", YamlConfigLoader::toLong, b::filterLines);
            setStringList(filters, "filterRegex", b::filterRegex);
            setStringList(filters, "filterSimilarTo", b::filterSimilarTo);
            setDouble(filters, "similarityThreshold", b::similarityThreshold);
            setDouble(filters, "wildcardTolerance", b::wildcardTolerance);
            setBoolean(filters, "dontFilter", b::dontFilter);
        }

        // 4) policy.*
        Map<String, Object> policy = getMap(map, "policy");
        if (policy != null) {
            setBoolean(policy, "autoTune", b::autoTune);
            setBoolean(policy, "autoBail", b::autoBail);
            setInt(policy, "window", b::policyWindow);
            setDouble(policy, "tuneErrorRatio", b::tuneErrorRatio);
            setDouble(policy, "bailErrorRatio", b::bailErrorRatio);
            setDuration(policy, "timeLimit", b::timeLimit);
        }

        // 5) state.*
        Map<String, Object> state = getMap(map, "state");
        if (state != null) {
            setBoolean(state, "enabled", on -> b.noState(!on));
            setDuration(state, "interval", b::stateInterval);
            setString(state, "dir", b::outputDir);
        }

        // 검증은 build() 에서
        return b.build();
    }

    /** "90" → 90초, "500ms", "30s", "10m", "2h", "1d" */
    static Duration parseDuration(String raw) {
        String s = raw.trim().toLowerCase(Locale.ROOT);
        Matcher m = DURATION.matcher(s);
        if (!m.matches()) throw new IllegalArgumentException("invalid duration: " + raw);
        long n = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "s" : m.group(2);
        switch (unit) {
            case "ms": return Duration.ofMillis(n);
            case "m":  return Duration.ofMinutes(n);
            case "h":  return Duration.ofHours(n);
            case "d":  return Duration.ofDays(n);
            default:   return Duration.ofSeconds(n);
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

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        setList(map, key, String::valueOf, setter);
    }

    private static <T> void setList(Map<?, ?> map, String key, Function<Object, T> conv, Consumer<List<T>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<T> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(conv.apply(o));
        } else {
            // "a,b,c" 형태 지원
            String s = String.valueOf(v).trim();
            if (s.isEmpty()) return;
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(conv.apply(p));
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(toInt(v));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static void setIntAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static void setDuration(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(Duration.ofSeconds(n.longValue()));
        else if (v != null) setter.accept(parseDuration(String.valueOf(v)));
    }

    private static Integer toInt(Object v) {
        if (v instanceof Number n) return n.intValue();
        return Integer.parseInt(String.valueOf(v).trim());
    }

    private static Long toLong(Object v) {
        if (v instanceof Number n) return n.longValue();
        return Long.parseLong(String.valueOf(v).trim());
    }
}
