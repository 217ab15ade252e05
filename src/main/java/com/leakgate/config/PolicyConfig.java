package com.leakgate.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyConfig {
    public static final int SUPPORTED_VERSION = 1;

    @JsonProperty("version")
    private int version = SUPPORTED_VERSION;

    @JsonProperty("validators")
    private ValidatorsConfig validators = new ValidatorsConfig();

    @JsonProperty("budgets")
    private BudgetsConfig budgets = new BudgetsConfig();

    @JsonProperty("waivers")
    private List<Waiver> waivers = new ArrayList<>();

    public List<Waiver> getWaivers() {
        if (waivers == null) {
            waivers = new ArrayList<>();
        }
        return waivers;
    }

    public ValidatorsConfig getValidators() {
        if (validators == null) {
            validators = new ValidatorsConfig();
        }
        return validators;
    }

    public BudgetsConfig getBudgets() {
        if (budgets == null) {
            budgets = new BudgetsConfig();
        }
        return budgets;
    }
}
