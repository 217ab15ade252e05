package com.leakgate.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.leakgate.model.Category;
import lombok.Data;

/** Finding budgets. A {@code null} limit means the budget is not enforced. */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class BudgetsConfig {
    @JsonProperty("new_findings")
    private Integer newFindings;

    @JsonProperty("new_actual_findings")
    private Integer newActualFindings;

    @JsonProperty("new_expired_findings")
    private Integer newExpiredFindings;

    @JsonProperty("new_test_findings")
    private Integer newTestFindings;

    @JsonProperty("new_unknown_findings")
    private Integer newUnknownFindings;

    @JsonProperty("max_risk_score")
    private Integer maxRiskScore;

    public Integer limitFor(Category category) {
        switch (category) {
            case ACTUAL: return newActualFindings;
            case EXPIRED: return newExpiredFindings;
            case TEST: return newTestFindings;
            default: return newUnknownFindings;
        }
    }

    public static String keyFor(Category category) {
        return "new_" + category.wireName() + "_findings";
    }
}
