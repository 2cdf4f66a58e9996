package com.pathhound.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 실행 설정 스냅샷 (scan.yml 매핑 대상, 상태 파일에 함께 저장).
 *
 * <p>빌더에서 한 번 만들어지면 불변이고, 모든 컴포넌트가 같은 인스턴스를 참조로 공유한다.
 * 검증은 {@link Builder#build()} 에서 수행한다.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = RunConfig.Builder.class)
public final class RunConfig {

    /** 허용 상태 코드 기본값 (사용자가 allow/deny 어느 쪽도 주지 않았을 때) */
    public static final List<Integer> DEFAULT_STATUS_CODES =
            List.of(200, 204, 301, 302, 307, 308, 401, 403, 405, 500);

    // ---------- 대상 / 입력 ----------
    private final List<String> targets;
    private final String wordlist;
    private final List<String> extensions;
    private final boolean addSlash;

    // ---------- 동시성 / 레이트 ----------
    private final int threads;
    private final int scanLimit;
    private final int rateLimit;
    private final int maxDepth;
    private final Duration timeout;
    private final int retryAttempts;
    private final String userAgent;
    private final boolean followRedirects;
    private final Map<String, String> headers;
    private final List<String> queries;

    // ---------- 정책(auto-tune / auto-bail) ----------
    private final boolean autoTune;
    private final boolean autoBail;
    private final int policyWindow;
    private final double tuneErrorRatio;
    private final double bailErrorRatio;
    private final Duration timeLimit;

    // ---------- 상태 파일 ----------
    private final boolean noState;
    private final Duration stateInterval;
    private final String outputDir;

    // ---------- 범위 / 재귀 ----------
    private final List<String> dontScan;
    private final List<String> scope;
    private final boolean forceRecursion;
    private final boolean noRecursion;
    private final boolean recurseExtensionless;
    private final boolean extractLinks;
    private final boolean scanDirListings;

    // ---------- 필터 ----------
    private final List<Integer> statusCodes;   // null = 미지정
    private final List<Integer> filterStatus;
    private final List<Long> filterSize;
    private final List<Long> filterWords;
    private final List<Long> filterLines;
    private final List<String> filterRegex;
    private final List<String> filterSimilarTo;
    private final double similarityThreshold;
    private final double wildcardTolerance;
    private final boolean dontFilter;

    private RunConfig(Builder b) {
        this.targets = List.copyOf(b.targets);
        this.wordlist = b.wordlist;
        this.extensions = List.copyOf(b.extensions);
        this.addSlash = b.addSlash;
        this.threads = b.threads;
        this.scanLimit = b.scanLimit;
        this.rateLimit = b.rateLimit;
        this.maxDepth = b.maxDepth;
        this.timeout = b.timeout;
        this.retryAttempts = b.retryAttempts;
        this.userAgent = b.userAgent;
        this.followRedirects = b.followRedirects;
        this.headers = Map.copyOf(b.headers);
        this.queries = List.copyOf(b.queries);
        this.autoTune = b.autoTune;
        this.autoBail = b.autoBail;
        this.policyWindow = b.policyWindow;
        this.tuneErrorRatio = b.tuneErrorRatio;
        this.bailErrorRatio = b.bailErrorRatio;
        this.timeLimit = b.timeLimit;
        this.noState = b.noState;
        this.stateInterval = b.stateInterval;
        this.outputDir = b.outputDir;
        this.dontScan = List.copyOf(b.dontScan);
        this.scope = List.copyOf(b.scope);
        this.forceRecursion = b.forceRecursion;
        this.noRecursion = b.noRecursion;
        this.recurseExtensionless = b.recurseExtensionless;
        this.extractLinks = b.extractLinks;
        this.scanDirListings = b.scanDirListings;
        this.statusCodes = (b.statusCodes == null ? null : List.copyOf(b.statusCodes));
        this.filterStatus = List.copyOf(b.filterStatus);
        this.filterSize = List.copyOf(b.filterSize);
        this.filterWords = List.copyOf(b.filterWords);
        this.filterLines = List.copyOf(b.filterLines);
        this.filterRegex = List.copyOf(b.filterRegex);
        this.filterSimilarTo = List.copyOf(b.filterSimilarTo);
        this.similarityThreshold = b.similarityThreshold;
        this.wildcardTolerance = b.wildcardTolerance;
        this.dontFilter = b.dontFilter;
    }

    public static RunConfig defaults() {
        return builder().build();
    }

    // ---------- getters ----------
    public List<String> getTargets() { return targets; }
    public String getWordlist() { return wordlist; }
    public List<String> getExtensions() { return extensions; }
    public boolean isAddSlash() { return addSlash; }
    public int getThreads() { return threads; }
    public int getScanLimit() { return scanLimit; }
    public int getRateLimit() { return rateLimit; }
    public int getMaxDepth() { return maxDepth; }
    public Duration getTimeout() { return timeout; }
    public int getRetryAttempts() { return retryAttempts; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public Map<String, String> getHeaders() { return headers; }
    public List<String> getQueries() { return queries; }
    public boolean isAutoTune() { return autoTune; }
    public boolean isAutoBail() { return autoBail; }
    public int getPolicyWindow() { return policyWindow; }
    public double getTuneErrorRatio() { return tuneErrorRatio; }
    public double getBailErrorRatio() { return bailErrorRatio; }
    public Duration getTimeLimit() { return timeLimit; }
    public boolean isNoState() { return noState; }
    public Duration getStateInterval() { return stateInterval; }
    public String getOutputDir() { return outputDir; }
    public List<String> getDontScan() { return dontScan; }
    public List<String> getScope() { return scope; }
    public boolean isForceRecursion() { return forceRecursion; }
    public boolean isNoRecursion() { return noRecursion; }
    public boolean isRecurseExtensionless() { return recurseExtensionless; }
    public boolean isExtractLinks() { return extractLinks; }
    public boolean isScanDirListings() { return scanDirListings; }
    public List<Integer> getStatusCodes() { return statusCodes; }
    public List<Integer> getFilterStatus() { return filterStatus; }
    public List<Long> getFilterSize() { return filterSize; }
    public List<Long> getFilterWords() { return filterWords; }
    public List<Long> getFilterLines() { return filterLines; }
    public List<String> getFilterRegex() { return filterRegex; }
    public List<String> getFilterSimilarTo() { return filterSimilarTo; }
    public double getSimilarityThreshold() { return similarityThreshold; }
    public double getWildcardTolerance() { return wildcardTolerance; }
    public boolean isDontFilter() { return dontFilter; }

    public boolean hasTimeLimit() { return timeLimit != null && !timeLimit.isZero() && !timeLimit.isNegative(); }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.targets = new ArrayList<>(targets);
        b.wordlist = wordlist;
        b.extensions = new ArrayList<>(extensions);
        b.addSlash = addSlash;
        b.threads = threads;
        b.scanLimit = scanLimit;
        b.rateLimit = rateLimit;
        b.maxDepth = maxDepth;
        b.timeout = timeout;
        b.retryAttempts = retryAttempts;
        b.userAgent = userAgent;
        b.followRedirects = followRedirects;
        b.headers = new LinkedHashMap<>(headers);
        b.queries = new ArrayList<>(queries);
        b.autoTune = autoTune;
        b.autoBail = autoBail;
        b.policyWindow = policyWindow;
        b.tuneErrorRatio = tuneErrorRatio;
        b.bailErrorRatio = bailErrorRatio;
        b.timeLimit = timeLimit;
        b.noState = noState;
        b.stateInterval = stateInterval;
        b.outputDir = outputDir;
        b.dontScan = new ArrayList<>(dontScan);
        b.scope = new ArrayList<>(scope);
        b.forceRecursion = forceRecursion;
        b.noRecursion = noRecursion;
        b.recurseExtensionless = recurseExtensionless;
        b.extractLinks = extractLinks;
        b.scanDirListings = scanDirListings;
        b.statusCodes = (statusCodes == null ? null : new ArrayList<>(statusCodes));
        b.filterStatus = new ArrayList<>(filterStatus);
        b.filterSize = new ArrayList<>(filterSize);
        b.filterWords = new ArrayList<>(filterWords);
        b.filterLines = new ArrayList<>(filterLines);
        b.filterRegex = new ArrayList<>(filterRegex);
        b.filterSimilarTo = new ArrayList<>(filterSimilarTo);
        b.similarityThreshold = similarityThreshold;
        b.wildcardTolerance = wildcardTolerance;
        b.dontFilter = dontFilter;
        return b;
    }

    public static Builder builder() { return new Builder(); }

    /** fluent 빌더. 메서드명 = 프로퍼티명(Jackson 역직렬화 겸용) */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private List<String> targets = new ArrayList<>();
        private String wordlist;
        private List<String> extensions = new ArrayList<>();
        private boolean addSlash = false;

        private int threads = 50;
        private int scanLimit = 0;
        private int rateLimit = 0;
        private int maxDepth = 4;
        private Duration timeout = Duration.ofSeconds(7);
        private int retryAttempts = 2;
        private String userAgent = "pathhound/0.3";
        private boolean followRedirects = false;
        private Map<String, String> headers = new LinkedHashMap<>();
        private List<String> queries = new ArrayList<>();

        private boolean autoTune = false;
        private boolean autoBail = false;
        private int policyWindow = 50;
        private double tuneErrorRatio = 0.25;
        private double bailErrorRatio = 0.90;
        private Duration timeLimit = Duration.ZERO;

        private boolean noState = false;
        private Duration stateInterval = Duration.ZERO;
        private String outputDir = "out";

        private List<String> dontScan = new ArrayList<>();
        private List<String> scope = new ArrayList<>();
        private boolean forceRecursion = false;
        private boolean noRecursion = false;
        private boolean recurseExtensionless = true;
        private boolean extractLinks = false;
        private boolean scanDirListings = false;

        private List<Integer> statusCodes = null;
        private List<Integer> filterStatus = new ArrayList<>();
        private List<Long> filterSize = new ArrayList<>();
        private List<Long> filterWords = new ArrayList<>();
        private List<Long> filterLines = new ArrayList<>();
        private List<String> filterRegex = new ArrayList<>();
        private List<String> filterSimilarTo = new ArrayList<>();
        private double similarityThreshold = 0.95;
        private double wildcardTolerance = 0.05;
        private boolean dontFilter = false;

        public Builder targets(List<String> v) { this.targets = copy(v); return this; }
        public Builder target(String v) { if (v != null && !v.isBlank()) this.targets.add(v.trim()); return this; }
        public Builder wordlist(String v) { this.wordlist = v; return this; }
        public Builder extensions(List<String> v) { this.extensions = copy(v); return this; }
        public Builder addSlash(boolean v) { this.addSlash = v; return this; }

        public Builder threads(int v) { this.threads = v; return this; }
        public Builder scanLimit(int v) { this.scanLimit = v; return this; }
        public Builder rateLimit(int v) { this.rateLimit = v; return this; }
        public Builder maxDepth(int v) { this.maxDepth = v; return this; }
        public Builder timeout(Duration v) { if (v != null) this.timeout = v; return this; }
        public Builder retryAttempts(int v) { this.retryAttempts = v; return this; }
        public Builder userAgent(String v) { if (v != null && !v.isBlank()) this.userAgent = v; return this; }
        public Builder followRedirects(boolean v) { this.followRedirects = v; return this; }
        public Builder headers(Map<String, String> v) {
            this.headers = new LinkedHashMap<>();
            if (v != null) v.forEach((k, val) -> { if (k != null && val != null) this.headers.put(k.trim(), val); });
            return this;
        }
        public Builder header(String name, String value) { if (name != null && value != null) this.headers.put(name.trim(), value); return this; }
        public Builder queries(List<String> v) { this.queries = copy(v); return this; }

        public Builder autoTune(boolean v) { this.autoTune = v; return this; }
        public Builder autoBail(boolean v) { this.autoBail = v; return this; }
        public Builder policyWindow(int v) { this.policyWindow = v; return this; }
        public Builder tuneErrorRatio(double v) { this.tuneErrorRatio = v; return this; }
        public Builder bailErrorRatio(double v) { this.bailErrorRatio = v; return this; }
        public Builder timeLimit(Duration v) { this.timeLimit = (v == null ? Duration.ZERO : v); return this; }

        public Builder noState(boolean v) { this.noState = v; return this; }
        public Builder stateInterval(Duration v) { this.stateInterval = (v == null ? Duration.ZERO : v); return this; }
        public Builder outputDir(String v) { if (v != null && !v.isBlank()) this.outputDir = v; return this; }

        public Builder dontScan(List<String> v) { this.dontScan = copy(v); return this; }
        public Builder scope(List<String> v) { this.scope = copy(v); return this; }
        public Builder forceRecursion(boolean v) { this.forceRecursion = v; return this; }
        public Builder noRecursion(boolean v) { this.noRecursion = v; return this; }
        public Builder recurseExtensionless(boolean v) { this.recurseExtensionless = v; return this; }
        public Builder extractLinks(boolean v) { this.extractLinks = v; return this; }
        public Builder scanDirListings(boolean v) { this.scanDirListings = v; return this; }

        public Builder statusCodes(List<Integer> v) { this.statusCodes = (v == null ? null : copy(v)); return this; }
        public Builder filterStatus(List<Integer> v) { this.filterStatus = copy(v); return this; }
        public Builder filterSize(List<Long> v) { this.filterSize = copy(v); return this; }
        public Builder filterWords(List<Long> v) { this.filterWords = copy(v); return this; }
        public Builder filterLines(List<Long> v) { this.filterLines = copy(v); return this; }
        public Builder filterRegex(List<String> v) { this.filterRegex = copy(v); return this; }
        public Builder filterSimilarTo(List<String> v) { this.filterSimilarTo = copy(v); return this; }
        public Builder similarityThreshold(double v) { this.similarityThreshold = v; return this; }
        public Builder wildcardTolerance(double v) { this.wildcardTolerance = v; return this; }
        public Builder dontFilter(boolean v) { this.dontFilter = v; return this; }

        private static <T> List<T> copy(List<T> v) {
            List<T> out = new ArrayList<>();
            if (v != null) for (T t : v) if (t != null) out.add(t);
            return out;
        }

        /** 검증 후 불변 스냅샷 생성. 잘못된 값은 IllegalArgumentException. */
        public RunConfig build() {
            if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
            if (scanLimit < 0) throw new IllegalArgumentException("scanLimit must be >= 0");
            if (rateLimit < 0) throw new IllegalArgumentException("rateLimit must be >= 0");
            if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
            if (retryAttempts < 1) throw new IllegalArgumentException("retryAttempts must be >= 1");
            if (policyWindow < 1) throw new IllegalArgumentException("policyWindow must be >= 1");
            if (timeout.isZero() || timeout.isNegative()) throw new IllegalArgumentException("timeout must be > 0");
            if (timeLimit.isNegative()) throw new IllegalArgumentException("timeLimit must be >= 0");
            if (stateInterval.isNegative()) throw new IllegalArgumentException("stateInterval must be >= 0");
            requireRatio("tuneErrorRatio", tuneErrorRatio);
            requireRatio("bailErrorRatio", bailErrorRatio);
            requireRatio("similarityThreshold", similarityThreshold);
            if (wildcardTolerance < 0 || wildcardTolerance >= 1)
                throw new IllegalArgumentException("wildcardTolerance must be in [0,1)");
            if (forceRecursion && noRecursion)
                throw new IllegalArgumentException("forceRecursion and noRecursion are mutually exclusive");

            for (String name : headers.keySet()) {
                if (name.isEmpty() || name.indexOf(':') >= 0)
                    throw new IllegalArgumentException("invalid header name: " + name);
            }
            for (String q : queries) {
                if (q.isBlank() || q.startsWith("="))
                    throw new IllegalArgumentException("query must be name=value: " + q);
            }

            for (String t : targets) {
                URI u;
                try {
                    u = URI.create(t);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("invalid target: " + t, e);
                }
                String s = (u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT));
                if (!(s.equals("http") || s.equals("https")) || u.getHost() == null) {
                    throw new IllegalArgumentException("target must be absolute http(s) URL: " + t);
                }
            }
            return new RunConfig(this);
        }

        private static void requireRatio(String name, double v) {
            if (!(v > 0.0 && v <= 1.0)) throw new IllegalArgumentException(name + " must be in (0,1]");
        }
    }
}
