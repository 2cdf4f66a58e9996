package com.pathhound.core.filter;

import com.pathhound.core.model.ScanResponse;

/**
 * 디렉터리별 와일드카드(soft-404) 응답 서명.
 * <ul>
 *   <li>STATIC: (status, length) 완전 일치</li>
 *   <li>REFLECTED: 요청 경로가 본문에 반사됨 → contentLength - path 길이 가 일치</li>
 *   <li>BANDED: 두 프로브 길이가 달라 허용 구간 [min, max] 로 판정</li>
 * </ul>
 * 모든 종류는 상태 코드 일치를 전제로 한다.
 */
public record WildcardSignature(Kind kind, int status, long length, long min, long max) {

    public enum Kind { STATIC, REFLECTED, BANDED }

    public static WildcardSignature fixed(int status, long length) {
        return new WildcardSignature(Kind.STATIC, status, length, length, length);
    }

    public static WildcardSignature reflected(int status, long baseLength) {
        return new WildcardSignature(Kind.REFLECTED, status, baseLength, baseLength, baseLength);
    }

    /** 두 길이를 포함하는 구간을 tolerance 비율만큼 넓힌다 */
    public static WildcardSignature banded(int status, long a, long b, double tolerance) {
        long lo = Math.min(a, b);
        long hi = Math.max(a, b);
        long min = (long) Math.floor(lo * (1.0 - tolerance));
        long max = (long) Math.ceil(hi * (1.0 + tolerance));
        return new WildcardSignature(Kind.BANDED, status, lo, Math.max(0, min), max);
    }

    public boolean matches(ScanResponse r) {
        if (r.getStatusCode() != status) return false;
        long len = r.getContentLength();
        return switch (kind) {
            case STATIC -> len == length;
            case REFLECTED -> len - r.getPath().length() == length;
            case BANDED -> len >= min && len <= max;
        };
    }
}
