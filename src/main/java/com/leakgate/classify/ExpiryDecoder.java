package com.leakgate.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leakgate.config.IsoTimestamps;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads expiry timestamps that credentials carry about themselves, without any network call:
 * the {@code exp} claim of a JWT and the {@code se} (signed expiry) parameter of an Azure SAS.
 */
final class ExpiryDecoder {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern SAS_EXPIRY = Pattern.compile("(?:^|[?&])se=([^&\\s\"']+)");

    private ExpiryDecoder() {
    }

    static boolean looksLikeJwt(String token) {
        if (token == null) return false;
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) return false;
        for (String part : parts) {
            if (part.isEmpty()) return false;
        }
        return true;
    }

    static Optional<Instant> jwtExpiry(String token) {
        if (!looksLikeJwt(token)) return Optional.empty();
        String payload = token.split("\\.", -1)[1].trim();
        try {
            byte[] decoded = Base64.getUrlDecoder().decode(toUrlAlphabetUnpadded(payload));
            JsonNode claims = MAPPER.readTree(decoded);
            JsonNode exp = claims == null ? null : claims.get("exp");
            if (exp == null || !exp.isNumber() || !exp.canConvertToLong()) return Optional.empty();
            return Optional.of(Instant.ofEpochSecond(exp.asLong()));
        } catch (IllegalArgumentException | DateTimeException | IOException e) {
            // Undecodable or out-of-range claims carry no usable expiry
            return Optional.empty();
        }
    }

    static Optional<Instant> sasExpiry(String sas) {
        if (sas == null) return Optional.empty();
        Matcher m = SAS_EXPIRY.matcher(sas);
        if (!m.find()) return Optional.empty();
        String raw;
        try {
            raw = URLDecoder.decode(m.group(1), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        return parseTimestamp(raw);
    }

    private static Optional<Instant> parseTimestamp(String raw) {
        try {
            return Optional.of(IsoTimestamps.parse(raw, ZoneOffset.UTC));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static String toUrlAlphabetUnpadded(String segment) {
        String s = segment.replace('+', '-').replace('/', '_');
        int end = s.length();
        while (end > 0 && s.charAt(end - 1) == '=') end--;
        return s.substring(0, end);
    }
}
