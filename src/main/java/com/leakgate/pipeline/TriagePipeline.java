package com.leakgate.pipeline;

import com.leakgate.classify.FindingClassifier;
import com.leakgate.config.IsoTimestamps;
import com.leakgate.config.PolicyConfig;
import com.leakgate.model.Classification;
import com.leakgate.model.EnrichedFinding;
import com.leakgate.model.Finding;
import com.leakgate.model.RepoContext;
import com.leakgate.policy.PolicyEnforcer;
import com.leakgate.policy.PolicyResult;
import com.leakgate.redact.Redactor;
import com.leakgate.score.RiskLevel;
import com.leakgate.score.RiskScorer;
import com.leakgate.validate.ValidationEngine;
import com.leakgate.validate.ValidationResult;
import com.leakgate.validate.ValidationState;
import com.leakgate.validate.ValidatorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs detector findings through validation, classification and scoring, then gates the batch
 * on the policy. Findings are handled one at a time so the shared rate limits apply across the
 * whole batch.
 */
public class TriagePipeline {
    private static final Logger logger = LoggerFactory.getLogger(TriagePipeline.class);

    private final ValidationEngine validationEngine;
    private final FindingClassifier classifier;
    private final RiskScorer riskScorer;
    private final PolicyEnforcer enforcer;

    public TriagePipeline(ValidatorRegistry registry, PolicyConfig policyConfig) {
        this(registry, policyConfig, Clock.system(IsoTimestamps.DEFAULT_ZONE));
    }

    public TriagePipeline(ValidatorRegistry registry, PolicyConfig policyConfig, Clock clock) {
        this(new ValidationEngine(registry, policyConfig.getValidators(), clock),
                new FindingClassifier(clock),
                new RiskScorer(),
                new PolicyEnforcer(policyConfig, clock));
    }

    TriagePipeline(ValidationEngine validationEngine, FindingClassifier classifier, RiskScorer riskScorer,
                   PolicyEnforcer enforcer) {
        this.validationEngine = validationEngine;
        this.classifier = classifier;
        this.riskScorer = riskScorer;
        this.enforcer = enforcer;
    }

    public TriageResult run(List<Finding> findings, RepoContext repoContext) {
        logger.info("Triaging {} findings (network validation {})", findings.size(),
                validationEngine.isNetworkAllowed() ? "enabled" : "disabled");

        List<EnrichedFinding> enriched = new ArrayList<>(findings.size());
        for (Finding finding : findings) {
            enriched.add(process(finding, repoContext));
        }
        PolicyResult policyResult = enforcer.enforce(enriched);
        return new TriageResult(List.copyOf(enriched), policyResult);
    }

    public EnrichedFinding process(Finding finding, RepoContext repoContext) {
        List<ValidationResult> results = validationEngine.run(finding);

        Classification classification;
        try {
            classification = classifier.classify(finding, results);
        } catch (RuntimeException e) {
            String message = Redactor.redactEvidence(String.valueOf(e.getMessage()));
            logger.warn("Classification failed for {}:{}: {}", finding.getPath(), finding.getLine(), message);
            classification = Classification.error(message);
        }

        int score = riskScorer.score(finding, results, classification.getCategory(), repoContext);
        logger.debug("{}:{} [{}] -> {} ({}), risk {}", finding.getPath(), finding.getLine(), finding.getRule(),
                classification.getCategory().wireName(), classification.getConfidence(), score);

        return EnrichedFinding.builder()
                .finding(Redactor.redactFinding(finding))
                .category(classification.getCategory())
                .confidence(classification.getConfidence())
                .reasons(classification.getReasons())
                .riskScore(score)
                .riskLevel(RiskLevel.of(score))
                .validated(summarize(results))
                .validationResults(results)
                .build();
    }

    /** Strongest state across all validators: valid, then invalid, then indeterminate. */
    static ValidationResult summarize(List<ValidationResult> results) {
        ValidationResult best = null;
        for (ValidationResult r : results) {
            if (best == null || rank(r.getState()) > rank(best.getState())) {
                best = r;
            }
        }
        if (best == null) {
            return ValidationResult.builder().state(ValidationState.INDETERMINATE).build();
        }
        return ValidationResult.builder().state(best.getState()).evidence(best.getEvidence()).build();
    }

    private static int rank(ValidationState state) {
        switch (state) {
            case VALID:
                return 2;
            case INVALID:
                return 1;
            default:
                return 0;
        }
    }
}
