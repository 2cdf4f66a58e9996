package com.pathhound.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

/** URL 정규화 / 결합 / 호스트 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙:
     * - fragment 제거(#... 제거)
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈/누락 경로를 "/"로, 중복 슬래시 축소
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getPath() == null || u.getPath().isEmpty()) ? "/" : u.getPath();
        path = path.replaceAll("/{2,}", "/");

        try {
            return new URI(scheme, null, host, port, path, u.getQuery(), null);
        } catch (URISyntaxException e) {
            return u;
        }
    }

    /** 디렉터리 스캔 베이스용: 정규화 + 끝 '/' 보장 (쿼리는 제거) */
    public static String directoryBase(String url) {
        URI n = normalize(URI.create(url.trim()));
        String s = n.toString();
        int q = s.indexOf('?');
        if (q >= 0) s = s.substring(0, q);
        return s.endsWith("/") ? s : s + "/";
    }

    /**
     * 베이스 디렉터리 + 워드 결합. 워드가 URL 로 만들 수 없는 형태면 empty.
     * 워드 앞의 '/' 는 제거해 항상 베이스 하위로 붙인다.
     */
    public static Optional<URI> join(String base, String word) {
        if (base == null || word == null) return Optional.empty();
        String w = word;
        while (w.startsWith("/")) w = w.substring(1);
        if (w.isEmpty()) return Optional.empty();
        String b = base.endsWith("/") ? base : base + "/";
        try {
            URI u = new URI(b + w);
            if (u.getHost() == null) return Optional.empty();
            return Optional.of(u);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    /** 소문자 호스트(없으면 빈 문자열) */
    public static String hostOf(URI u) {
        if (u == null || u.getHost() == null) return "";
        return u.getHost().toLowerCase(Locale.ROOT);
    }

    /** host 기준 동일 도메인 판정(소문자 비교) */
    public static boolean sameDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        return hostOf(a).equals(hostOf(b));
    }
}
