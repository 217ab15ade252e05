package com.leakgate.policy;

import com.leakgate.config.Waiver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether a waiver covers a finding. A waiver is active when the rule matches exactly,
 * the path glob matches and the expiry lies strictly in the future.
 */
public class WaiverMatcher {
    private static final Logger logger = LoggerFactory.getLogger(WaiverMatcher.class);

    private final Clock clock;

    public WaiverMatcher(Clock clock) {
        this.clock = clock;
    }

    public boolean isActive(Waiver waiver, String rule, String path) {
        if (!Objects.equals(waiver.getRule(), rule)) return false;
        if (!GlobMatcher.matches(waiver.getPath(), path)) return false;
        return isUnexpired(waiver);
    }

    public boolean isUnexpired(Waiver waiver) {
        Instant expiry;
        try {
            expiry = waiver.expiresAt(clock.getZone());
        } catch (DateTimeParseException e) {
            logger.warn("Ignoring waiver for rule {} with unparseable expiry", waiver.getRule());
            return false;
        }
        return clock.instant().isBefore(expiry);
    }

    /** First active waiver in configuration order. Any active waiver suppresses; no ranking among them. */
    public Optional<Waiver> findActive(List<Waiver> waivers, String rule, String path) {
        for (Waiver waiver : waivers) {
            if (isActive(waiver, rule, path)) {
                return Optional.of(waiver);
            }
        }
        return Optional.empty();
    }
}
