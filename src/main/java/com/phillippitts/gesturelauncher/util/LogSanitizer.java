package com.phillippitts.gesturelauncher.util;

/** Utility for privacy-safe logging of URLs and spoken text. */
public final class LogSanitizer {
    private LogSanitizer() {}

    /**
     * Truncate the input string to at most max characters; returns "" for null.
     */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        if (max <= 0) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    /**
     * Strips query string and fragment from a URL so tokens in links never reach the logs.
     * Returns "" for null.
     */
    public static String urlForLog(String url) {
        if (url == null) {
            return "";
        }
        int cut = url.length();
        int q = url.indexOf('?');
        if (q >= 0) {
            cut = q;
        }
        int f = url.indexOf('#');
        if (f >= 0 && f < cut) {
            cut = f;
        }
        return truncate(url.substring(0, cut), 120);
    }
}
