package com.pathhound.core.filter;

import org.jsoup.Jsoup;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 64비트 SimHash (본문 가시 텍스트 토큰 기준, 토큰 해시는 FNV-1a 64).
 *
 * <p>토큰화 전에 구두점을 공백으로 바꾸고 소문자화한 뒤 불용어를 뺀다.
 * 그래서 "/uploads" 처럼 경로만 되비치는 soft-404 페이지는 토큰 하나만 달라진다.</p>
 *
 * <p>유사도는 해밍 거리로 보정한 점수다: 거리 {@link #NEAR_DUPLICATE_DISTANCE} 가 기본 임계값 0.95 에 대응하고,
 * 점수 1%p 당 {@code NEAR_DUPLICATE_DISTANCE / 5} 비트를 허용한다.</p>
 */
public final class SimHash {
    private SimHash() {}

    /** 이 거리 이하면 거의 같은 페이지 */
    public static final int NEAR_DUPLICATE_DISTANCE = 14;

    /** 점수 1.0 에서 0.0 까지 내려가는 데 필요한 비트 수(64 를 넘으므로 최저 점수는 0 보다 크다) */
    private static final double FULL_SCALE_BITS = NEAR_DUPLICATE_DISTANCE / 0.05;

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final String PUNCTUATION = "!\\\"#$%&()*+:;<=>?@[]^{}|~,'“”’‘/\u2013\u2014.";

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "above", "after", "again", "against", "all", "am", "an", "and", "any", "are",
            "as", "at", "be", "because", "been", "before", "being", "below", "between", "both", "but",
            "by", "can", "could", "did", "do", "does", "doing", "down", "during", "each", "few", "for",
            "from", "further", "had", "has", "have", "having", "he", "her", "here", "hers", "herself",
            "him", "himself", "his", "how", "i", "if", "in", "into", "is", "it", "its", "itself", "just",
            "me", "more", "most", "my", "myself", "no", "nor", "not", "now", "of", "off", "on", "once",
            "only", "or", "other", "our", "ours", "ourselves", "out", "over", "own", "same", "she",
            "should", "so", "some", "such", "than", "that", "the", "their", "theirs", "them",
            "themselves", "then", "there", "these", "they", "this", "those", "through", "to", "too",
            "under", "until", "up", "very", "was", "we", "were", "what", "when", "where", "which",
            "while", "who", "whom", "why", "will", "with", "would", "you", "your", "yours", "yourself",
            "yourselves");

    public static long of(String body) {
        if (body == null || body.isBlank()) return 0L;
        String text = looksLikeHtml(body) ? Jsoup.parse(body).text() : body;
        List<String> tokens = tokens(text);
        if (tokens.isEmpty()) return 0L;

        int[] weights = new int[64];
        for (String tok : tokens) {
            long h = fnv1a(tok);
            for (int i = 0; i < 64; i++) {
                weights[i] += ((h >>> i) & 1L) == 1L ? 1 : -1;
            }
        }
        long out = 0L;
        for (int i = 0; i < 64; i++) {
            if (weights[i] > 0) out |= (1L << i);
        }
        return out;
    }

    /** 구두점 제거 → 소문자화 → 공백 분리 → 불용어 제거 */
    static List<String> tokens(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            sb.append(PUNCTUATION.indexOf(c) >= 0 ? ' ' : c);
        }
        List<String> out = new ArrayList<>();
        for (String tok : sb.toString().toLowerCase(Locale.ROOT).split("\\s+")) {
            if (!tok.isEmpty() && !STOP_WORDS.contains(tok)) out.add(tok);
        }
        return out;
    }

    public static int hamming(long a, long b) {
        return Long.bitCount(a ^ b);
    }

    /** 보정 점수: 1 - hamming / (NEAR_DUPLICATE_DISTANCE / 0.05) */
    public static double similarity(long a, long b) {
        return 1.0 - hamming(a, b) / FULL_SCALE_BITS;
    }

    /** 임계값이 허용하는 최대 해밍 거리. 0.95 → 14, 1.0 → 0 */
    public static int maxDistance(double threshold) {
        double bits = (1.0 - threshold) * FULL_SCALE_BITS;
        return (int) Math.min(64, Math.floor(bits + 1e-9));
    }

    static long fnv1a(String s) {
        long h = FNV_OFFSET;
        for (int i = 0; i < s.length(); i++) {
            h ^= s.charAt(i);
            h *= FNV_PRIME;
        }
        return h;
    }

    private static boolean looksLikeHtml(String body) {
        int lt = body.indexOf('<');
        return lt >= 0 && body.indexOf('>', lt) > lt;
    }
}
