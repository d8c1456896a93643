package com.webtext.core.util;

import java.nio.file.Path;

public final class PathUtil {
    private PathUtil() {}

    /** 앞의 "~" 또는 "~/"를 user.home으로 바꾼다. 그 외는 그대로 Path.of. */
    public static Path expandHome(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        String home = System.getProperty("user.home");
        if (s.equals("~")) return Path.of(home);
        if (s.startsWith("~/") || s.startsWith("~\\")) return Path.of(home, s.substring(2));
        return Path.of(s);
    }
}
