package com.webmirror.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.time.Instant;

/**
 * JSON 라인 기반 구조화 이벤트 로거.
 * 로거 이름은 "<클래스명>.events" 라서 사람이 읽는 로그와 레벨을 따로 조절할 수 있다.
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

    public void debug(String event, Object... kvs) { emit(Level.DEBUG, event, null, kvs); }
    public void info (String event, Object... kvs) { emit(Level.INFO,  event, null, kvs); }
    public void warn (String event, Object... kvs) { emit(Level.WARN,  event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { emit(Level.ERROR, event, t, kvs); }

    private void emit(Level lvl, String event, Throwable t, Object... kvs) {
        if (!log.isEnabledForLevel(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) log.atLevel(lvl).log(line);
        else log.atLevel(lvl).setCause(t).log(line);
    }

    /** kvs: "key", value, ... (홀수 개면 _kv_mismatch 표시) */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        StringBuilder sb = new StringBuilder(128);
        sb.append('{');
        kv(sb, "ts", Instant.now().toString());
        kv(sb, "lvl", lvl.name());
        kv(sb, "comp", comp);
        kv(sb, "thread", Thread.currentThread().getName());
        kv(sb, "event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                kv(sb, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) kv(sb, "_kv_mismatch", true);
        }
        if (t != null) {
            kv(sb, "error", t.getClass().getSimpleName());
            kv(sb, "message", t.getMessage());
        }
        sb.setLength(sb.length() - 1); // 마지막 콤마
        sb.append('}');
        return sb.toString();
    }

    private static void kv(StringBuilder sb, String k, Object v) {
        sb.append('"').append(esc(k)).append("\":");
        if (v == null) {
            sb.append("null");
        } else if (v instanceof Number || v instanceof Boolean) {
            sb.append(v);
        } else {
            sb.append('"').append(esc(String.valueOf(v))).append('"');
        }
        sb.append(',');
    }

    private static String esc(String s) {
        StringBuilder r = new StringBuilder(s.length() + 8);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"'  -> r.append("\\\"");
                case '\\' -> r.append("\\\\");
                case '\n' -> r.append("\\n");
                case '\r' -> r.append("\\r");
                case '\t' -> r.append("\\t");
                default -> {
                    if (c < 0x20) r.append(String.format("\\u%04x", (int) c));
                    else r.append(c);
                }
            }
        }
        return r.toString();
    }
}
