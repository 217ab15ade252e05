package com.leakgate.classify;

import com.leakgate.model.Category;
import com.leakgate.model.Classification;
import com.leakgate.model.Finding;
import com.leakgate.validate.ValidationResult;
import com.leakgate.validate.ValidationState;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Sorts a finding into actual / expired / test / unknown.
 *
 * <p>Rules run in a fixed order and evidence outranks heuristics:</p>
 * <ol>
 *   <li>Offline expiry (JWT {@code exp}, SAS {@code se})</li>
 *   <li>Validator signals</li>
 *   <li>Test markers in path, file name or value</li>
 *   <li>Entropy / placeholder heuristics, only when nothing else fired</li>
 * </ol>
 * A rule with confidence above 0.8 wins immediately. Otherwise the most confident candidate
 * wins, the earlier rule on a tie.
 */
public class FindingClassifier {
    private static final double SHORT_CIRCUIT = 0.8;

    private static final List<Pattern> TEST_PATH_PATTERNS = List.of(
            Pattern.compile("(^|/)tests?/"),
            Pattern.compile("(^|/)fixtures?/"),
            Pattern.compile("(^|/)examples?/"),
            Pattern.compile("(^|/)samples?/"),
            Pattern.compile("(^|/)mocks?/"),
            Pattern.compile("(^|/)demos?/"),
            Pattern.compile("(^|/)spec/"),
            Pattern.compile("(^|/)__tests__/"),
            Pattern.compile("(^|/)run_tests\\.py$"),
            Pattern.compile("(^|/)test_[^/]*$"),
            Pattern.compile("_test\\.[^/]*$"));

    private static final List<String> TEST_FILENAME_MARKERS =
            List.of("test", "sample", "example", "dummy", "fixture", "mock", "demo");

    private static final List<String> VALUE_MARKERS =
            List.of("TEST", "EXAMPLE", "DUMMY", "SAMPLE", "MOCK", "FAKE", "PLACEHOLDER", "XXX");

    private static final List<String> SHORT_PLACEHOLDERS = List.of("000000", "123456", "ABCDEF");

    private static final Pattern ALL_ZEROS = Pattern.compile("^0+$");
    private static final Pattern REPEATED_DIGIT = Pattern.compile("^(\\d)\\1{5,}$");

    private static final List<String> VALID_BUT_EXPIRED_WORDS = List.of("expired", "invalid", "revoked");
    private static final List<String> INVALID_EXPIRED_WORDS = List.of("expired", "expiry");

    private final Clock clock;

    public FindingClassifier() {
        this(Clock.systemUTC());
    }

    public FindingClassifier(Clock clock) {
        this.clock = clock;
    }

    public Classification classify(Finding finding, List<ValidationResult> validationResults) {
        String match = finding.getMatch() == null ? "" : finding.getMatch();
        String path = finding.getPath() == null ? "" : finding.getPath();
        String rule = finding.getRule() == null ? "" : finding.getRule().toLowerCase(Locale.ROOT);
        List<ValidationResult> results = validationResults == null ? List.of() : validationResults;

        List<String> allReasons = new ArrayList<>();
        List<Classification> candidates = new ArrayList<>();

        Classification expiry = checkOfflineExpiry(match, rule);
        allReasons.addAll(expiry.getReasons());
        if (expiry.getConfidence() > SHORT_CIRCUIT) return expiry;
        if (expiry.getConfidence() > 0.0) candidates.add(expiry);

        Classification validator = checkValidatorSignals(results);
        allReasons.addAll(validator.getReasons());
        if (validator.getConfidence() > SHORT_CIRCUIT) return validator;
        if (validator.getConfidence() > 0.0) candidates.add(validator);

        Classification markers = checkTestMarkers(match, path);
        allReasons.addAll(markers.getReasons());
        if (markers.getConfidence() > SHORT_CIRCUIT) return markers;
        if (markers.getConfidence() > 0.0) candidates.add(markers);

        if (candidates.isEmpty()) {
            Classification entropy = checkEntropyPlaceholder(match);
            allReasons.addAll(entropy.getReasons());
            if (entropy.getConfidence() > 0.0) candidates.add(entropy);
        }

        Classification best = null;
        for (Classification c : candidates) {
            if (best == null || c.getConfidence() > best.getConfidence()) {
                best = c;
            }
        }
        if (best != null) return best;

        return Classification.unknown(allReasons.isEmpty() ? List.of("no_classification_rules_matched") : allReasons);
    }

    private Classification checkOfflineExpiry(String match, String rule) {
        List<String> reasons = new ArrayList<>();
        Instant now = clock.instant();

        if (rule.contains("jwt") || ExpiryDecoder.looksLikeJwt(match)) {
            Optional<Instant> exp = ExpiryDecoder.jwtExpiry(match);
            if (exp.isPresent()) {
                if (exp.get().isBefore(now)) {
                    reasons.add("offline:jwt_expired");
                    return new Classification(Category.EXPIRED, 0.95, reasons);
                }
                reasons.add("offline:jwt_valid_future_exp");
            }
        }

        if (rule.contains("azure") || rule.contains("sas") || match.contains("se=")) {
            Optional<Instant> se = ExpiryDecoder.sasExpiry(match);
            if (se.isPresent()) {
                if (se.get().isBefore(now)) {
                    reasons.add("offline:azure_sas_expired");
                    return new Classification(Category.EXPIRED, 0.95, reasons);
                }
                reasons.add("offline:azure_sas_valid_future_exp");
            }
        }

        return none(reasons);
    }

    /*
     * A valid result anywhere in the list decides; an invalid result only matters when it
     * explicitly talks about expiry and no validator confirmed the credential.
     */
    private Classification checkValidatorSignals(List<ValidationResult> results) {
        for (ValidationResult result : results) {
            if (result.getState() != ValidationState.VALID) continue;
            String name = result.getValidatorName();
            if (mentionsAny(result, VALID_BUT_EXPIRED_WORDS)) {
                return new Classification(Category.EXPIRED, 0.9, List.of("validator:" + name + ":expired"));
            }
            return new Classification(Category.ACTUAL, 0.9, List.of("validator:" + name + ":confirmed"));
        }
        for (ValidationResult result : results) {
            if (result.getState() == ValidationState.INVALID && mentionsAny(result, INVALID_EXPIRED_WORDS)) {
                return new Classification(Category.EXPIRED, 0.85,
                        List.of("validator:" + result.getValidatorName() + ":expired"));
            }
        }
        return none(List.of());
    }

    private Classification checkTestMarkers(String match, String path) {
        String pathLower = path.toLowerCase(Locale.ROOT).replace('\\', '/');
        for (Pattern pattern : TEST_PATH_PATTERNS) {
            if (pattern.matcher(pathLower).find()) {
                return new Classification(Category.TEST, 0.9, List.of("path:" + pattern.pattern()));
            }
        }

        String filename = pathLower.substring(pathLower.lastIndexOf('/') + 1);
        for (String marker : TEST_FILENAME_MARKERS) {
            if (filename.contains(marker)) {
                return new Classification(Category.TEST, 0.85, List.of("filename:" + marker));
            }
        }

        String upper = match.toUpperCase(Locale.ROOT);
        for (String marker : VALUE_MARKERS) {
            if (upper.contains(marker)) {
                return valueMarker(marker);
            }
        }

        if (match.length() >= 10) {
            if (ALL_ZEROS.matcher(match).matches()) return valueMarker("all_zeros");
            if (EntropyHeuristics.distinctChars(upper) == 1) return valueMarker("repeated_char");
            if (REPEATED_DIGIT.matcher(match).matches()) return valueMarker("repeated_digit");
        }

        if (!match.isEmpty() && match.length() <= 16) {
            for (String placeholder : SHORT_PLACEHOLDERS) {
                if (upper.contains(placeholder) && placeholder.length() >= match.length() * 0.6) {
                    return valueMarker(placeholder);
                }
            }
        }

        return none(List.of());
    }

    private Classification checkEntropyPlaceholder(String match) {
        if (match.length() < 8) return none(List.of());

        if (EntropyHeuristics.hasAscendingRun(match)) {
            return new Classification(Category.TEST, 0.3, List.of("entropy:sequential"));
        }
        if (EntropyHeuristics.distinctChars(match) <= 3 && match.length() > 10) {
            return new Classification(Category.TEST, 0.4, List.of("entropy:repeated_chars"));
        }
        if (EntropyHeuristics.shannonEntropy(match) < 2.0) {
            return new Classification(Category.TEST, 0.3, List.of("entropy:low"));
        }
        return none(List.of());
    }

    private static Classification valueMarker(String marker) {
        return new Classification(Category.TEST, 0.7, List.of("marker:" + marker));
    }

    private static Classification none(List<String> reasons) {
        return new Classification(Category.UNKNOWN, 0.0, reasons);
    }

    private static boolean mentionsAny(ValidationResult result, List<String> words) {
        String evidence = result.getEvidence() == null ? "" : result.getEvidence();
        String reason = result.getReason() == null ? "" : result.getReason();
        String text = (evidence + " " + reason).toLowerCase(Locale.ROOT);
        return words.stream().anyMatch(text::contains);
    }
}
