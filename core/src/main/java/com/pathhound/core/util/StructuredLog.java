package com.pathhound.core.util;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 이벤트 로거 (java.util.logging 위에서 동작).
 * LogSetup 이 붙인 콘솔/파일 핸들러로 한 줄짜리 JSON 이 나간다.
 *
 * <pre>
 * SLOG.info("scan-admitted", "scan", id, "url", base, "running", n);
 * SLOG.forScan(id).warn("auto-bail", "errors", 50);
 * </pre>
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;
    private final String scanId;   // null 이면 컨텍스트 없음

    private StructuredLog(Logger jul, String comp, String scanId) {
        this.jul = jul;
        this.comp = comp;
        this.scanId = scanId;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(Logger.getLogger(cls.getName()), cls.getSimpleName(), null);
    }

    /** 모든 이벤트에 "scan" 키를 붙이는 파생 로거 */
    public StructuredLog forScan(String id) {
        return new StructuredLog(jul, comp, id);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,    event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,    event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = buildJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String buildJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(160);
        sb.append('{');
        kv(sb, "ts", Instant.now().toString());
        kv(sb, "lvl", lvl.getName());
        kv(sb, "comp", comp);
        kv(sb, "thread", Thread.currentThread().getName());
        kv(sb, "event", event);
        if (scanId != null) kv(sb, "scan", scanId);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                kv(sb, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) kv(sb, "_kv_mismatch", true);
        }
        if (t != null) {
            kv(sb, "error", t.getClass().getSimpleName());
            kv(sb, "message", t.getMessage());
        }
        if (sb.charAt(sb.length() - 1) == ',') sb.setLength(sb.length() - 1);
        sb.append('}');
        return sb.toString();
    }

    private static void kv(StringBuilder sb, String k, Object v) {
        quoted(sb, k).append(':');
        if (v == null) {
            sb.append("null");
        } else if (v instanceof Double d && (d.isNaN() || d.isInfinite())) {
            quoted(sb, d.toString());   // JSON 에는 NaN/Infinity 리터럴이 없다
        } else if (v instanceof Number || v instanceof Boolean) {
            sb.append(v);
        } else {
            quoted(sb, String.valueOf(v));
        }
        sb.append(',');
    }

    /** 따옴표로 감싸 이스케이프하며 sb 에 바로 붙인다 */
    private static StringBuilder quoted(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0, n = s.length(); i < n; i++) {
            char c = s.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\').append(c);
            } else if (c == '\n') {
                sb.append("\\n");
            } else if (c == '\r') {
                sb.append("\\r");
            } else if (c == '\t') {
                sb.append("\\t");
            } else if (c < 0x20) {
                sb.append(String.format("\\u%04x", (int) c));
            } else {
                sb.append(c);
            }
        }
        return sb.append('"');
    }
}
