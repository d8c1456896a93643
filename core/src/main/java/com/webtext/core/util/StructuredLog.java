package com.webtext.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * 이벤트 단위 JSON 한 줄 로그. 일반 로그와 같은 SLF4J 경로로 나가며,
 * 로그 파일을 grep/jq로 집계할 때 쓴다.
 *
 *   SLOG.info("item-done", "index", 3, "url", url, "chars", 1200);
 */
public final class StructuredLog {
    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls.getName() + ".events");
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) {
        if (log.isDebugEnabled()) log.debug(toJson("DEBUG", event, kvs));
    }

    public void info(String event, Object... kvs) {
        if (log.isInfoEnabled()) log.info(toJson("INFO", event, kvs));
    }

    public void warn(String event, Object... kvs) {
        if (log.isWarnEnabled()) log.warn(toJson("WARN", event, kvs));
    }

    /** kvs: "key", value, "key", value ... (홀수면 _kv_mismatch 표시) */
    String toJson(String lvl, String event, Object... kvs) {
        StringBuilder sb = new StringBuilder(128).append('{');
        kv(sb, "ts", Instant.now().toString());
        kv(sb, "lvl", lvl);
        kv(sb, "comp", comp);
        kv(sb, "event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                kv(sb, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) kv(sb, "_kv_mismatch", true);
        }
        sb.setLength(sb.length() - 1); // 마지막 콤마
        return sb.append('}').toString();
    }

    private static void kv(StringBuilder sb, String k, Object v) {
        sb.append('"').append(esc(k)).append("\":");
        if (v == null) sb.append("null");
        else if (v instanceof Number || v instanceof Boolean) sb.append(v);
        else sb.append('"').append(esc(String.valueOf(v))).append('"');
        sb.append(',');
    }

    private static String esc(String s) {
        StringBuilder r = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"':  r.append("\\\""); break;
                case '\\': r.append("\\\\"); break;
                case '\n': r.append("\\n");  break;
                case '\r': r.append("\\r");  break;
                case '\t': r.append("\\t");  break;
                default:
                    if (c < 0x20) r.append(String.format("\\u%04x", (int) c));
                    else r.append(c);
            }
        }
        return r.toString();
    }
}
