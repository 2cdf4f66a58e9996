package com.pathhound.core.util;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * dont-scan 제외 규칙 (생성 시 한 번 컴파일해 워커 간 공유).
 * <ul>
 *   <li>접두(prefix): {@code "/oauth2"} 또는 {@code "https://host/path"}</li>
 *   <li>glob: {@code '*'}, {@code '?'} 포함 (예: {@code "/admin/*"})</li>
 *   <li>정규식: {@code "re:"} 접두 (예: {@code re:\?.*token=.*})</li>
 * </ul>
 */
public final class UrlExclusion {

    public static final UrlExclusion NONE = new UrlExclusion(List.of(), List.of());

    private final List<String> prefixes;
    private final List<Pattern> patterns;

    private UrlExclusion(List<String> prefixes, List<Pattern> patterns) {
        this.prefixes = prefixes;
        this.patterns = patterns;
    }

    /** 잘못된 정규식은 PatternSyntaxException 으로 그대로 전파 */
    public static UrlExclusion compile(List<String> rules) {
        if (rules == null || rules.isEmpty()) return NONE;
        List<String> prefixes = new ArrayList<>();
        List<Pattern> patterns = new ArrayList<>();
        for (String p : rules) {
            if (p == null || p.isBlank()) continue;
            String r = p.trim();
            if (r.startsWith("re:")) {
                patterns.add(Pattern.compile(r.substring(3), Pattern.CASE_INSENSITIVE));
            } else if (r.indexOf('*') >= 0 || r.indexOf('?') >= 0) {
                patterns.add(Pattern.compile(globToRegex(r), Pattern.CASE_INSENSITIVE));
            } else {
                prefixes.add(r);
            }
        }
        return new UrlExclusion(List.copyOf(prefixes), List.copyOf(patterns));
    }

    public boolean isEmpty() {
        return prefixes.isEmpty() && patterns.isEmpty();
    }

    public boolean isExcluded(URI url) {
        return url != null && isExcluded(url.toString());
    }

    public boolean isExcluded(String s) {
        if (s == null || isEmpty()) return false;
        for (Pattern p : patterns) {
            if (p.matcher(s).find()) return true;
        }
        if (prefixes.isEmpty()) return false;

        // 호스트 상대 prefix("/oauth2") 비교용 경로부
        String pathAndMore = null;
        int schemeEnd = s.indexOf("://");
        if (schemeEnd >= 0) {
            int i = s.indexOf('/', schemeEnd + 3);
            pathAndMore = (i > 0) ? s.substring(i) : "/";
        }
        for (String p : prefixes) {
            if (s.startsWith(p)) return true;
            if (pathAndMore != null && p.startsWith("/") && pathAndMore.startsWith(p)) return true;
        }
        return false;
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
