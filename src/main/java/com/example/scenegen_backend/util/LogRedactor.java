package com.example.scenegen_backend.util;

import java.util.regex.Pattern;

public final class LogRedactor {
    private static final Pattern URL_QUERY = Pattern.compile("(https?://[^\\s\"'?]+)\\?[^\\s\"']*");

    private LogRedactor() {
    }

    public static String redact(String text) {
        if (text == null) return null;
        return URL_QUERY.matcher(text).replaceAll("$1?[redacted]");
    }

    public static String truncate(String body, int max) {
        if (body == null) return "";
        if (body.length() <= max) return body;
        return body.substring(0, max) + "...";
    }
}
