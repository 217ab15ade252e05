package com.leakgate.policy;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Shell-style glob matching on whole paths. {@code *} matches any run of characters including
 * {@code /}, so {@code tests/*} covers nested files; {@code ?} matches one character;
 * {@code [abc]} and {@code [!abc]} are character classes.
 */
public final class GlobMatcher {
    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private GlobMatcher() {
    }

    public static boolean matches(String glob, String path) {
        if (glob == null || path == null) return false;
        return CACHE.computeIfAbsent(glob, GlobMatcher::compile).matcher(path).matches();
    }

    static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() * 2);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') j++;
                if (j < n && glob.charAt(j) == ']') j++;
                while (j < n && glob.charAt(j) != ']') j++;
                if (j >= n) {
                    // Unterminated class is a literal bracket
                    regex.append("\\[");
                } else {
                    String body = glob.substring(i, j);
                    i = j + 1;
                    boolean negated = body.startsWith("!");
                    if (negated) body = body.substring(1);
                    body = body.replace("\\", "\\\\").replace("[", "\\[").replace("]", "\\]").replace("&", "\\&").replace("^", "\\^");
                    if (negated) body = "^" + body;
                    regex.append('[').append(body).append(']');
                }
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
