package com.leakgate.score;

import lombok.Builder;
import lombok.Value;

/** Score plus every factor that produced it, for reports and debugging. */
@Value
@Builder
public class RiskBreakdown {
    int score;
    RiskLevel level;
    int baseScore;
    double validationModifier;
    double pathModifier;
    double exposureModifier;
    double historyModifier;
    double categoryModifier;
}
