package com.leakgate.redact;

import com.leakgate.model.Finding;
import com.leakgate.validate.ValidationResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks secret text before it leaves the pipeline. One scheme everywhere: first 6 characters,
 * {@code ****}, last 4 characters; anything of 10 characters or less collapses to {@code ****}.
 *
 * <p>Re-applying any of these functions is a no-op: the mask characters split a redacted value
 * into fragments too short to look secret-shaped again.</p>
 */
public final class Redactor {
    public static final String MASK = "****";

    private static final int MIN_VISIBLE_LENGTH = 10;
    private static final int PREFIX = 6;
    private static final int SUFFIX = 4;

    // Maximal runs of token characters, 16 or longer
    private static final Pattern SECRET_SHAPED =
            Pattern.compile("(?<![A-Za-z0-9+/_-])[A-Za-z0-9+/_-]{16,}(?![A-Za-z0-9+/_-])");

    private Redactor() {
    }

    public static String redact(String secret) {
        if (secret == null) return null;
        if (secret.length() <= MIN_VISIBLE_LENGTH) return MASK;
        return secret.substring(0, PREFIX) + MASK + secret.substring(secret.length() - SUFFIX);
    }

    public static String redactEvidence(String text) {
        if (text == null || text.isEmpty()) return text;
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) out.append('\n');
            out.append(redactLine(lines[i]));
        }
        return out.toString();
    }

    private static String redactLine(String line) {
        Matcher m = SECRET_SHAPED.matcher(line);
        StringBuilder sb = new StringBuilder(line.length());
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(redact(m.group())));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /** Copy of the finding with {@code match} and {@code match_hint} masked and string meta values scrubbed. */
    public static Finding redactFinding(Finding finding) {
        if (finding == null) return null;
        return finding.toBuilder()
                .match(redact(finding.getMatch()))
                .matchHint(redact(finding.getMatchHint()))
                .meta(redactMeta(finding.getMeta()))
                .build();
    }

    public static ValidationResult redactResult(ValidationResult result) {
        if (result == null) return null;
        return result.toBuilder()
                .evidence(redactEvidence(result.getEvidence()))
                .reason(redactEvidence(result.getReason()))
                .build();
    }

    private static Map<String, Object> redactMeta(Map<?, ?> meta) {
        if (meta == null) return null;
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : meta.entrySet()) {
            out.put(String.valueOf(e.getKey()), redactValue(e.getValue()));
        }
        return out;
    }

    private static Object redactValue(Object value) {
        if (value instanceof String) {
            return redactEvidence((String) value);
        }
        if (value instanceof Map) {
            return redactMeta((Map<?, ?>) value);
        }
        if (value instanceof Iterable) {
            List<Object> out = new ArrayList<>();
            for (Object o : (Iterable<?>) value) {
                out.add(redactValue(o));
            }
            return out;
        }
        return value;
    }
}
