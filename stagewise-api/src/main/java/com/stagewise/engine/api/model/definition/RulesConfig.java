package com.stagewise.engine.api.model.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Sequencing, visibility and capacity rules attached to a node.
 *
 * <p>{@code pickCount} is applied before {@code ordering}: the ordering policy
 * only sees the picked subset.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RulesConfig(
        @JsonProperty("ordering") OrderingMode ordering,
        @JsonProperty("visibility") String visibility,
        @JsonProperty("balance_on") BalanceOn balanceOn,
        @JsonProperty("weights") List<WeightEntry> weights,
        @JsonProperty("pick_count") Integer pickCount,
        @JsonProperty("pick_strategy") PickStrategy pickStrategy,
        @JsonProperty("pick_weights") List<WeightEntry> pickWeights,
        @JsonProperty("pick_conditions") List<PickCondition> pickConditions,
        @JsonProperty("quota") Integer quota,
        @JsonProperty("quota_strategy") QuotaStrategy quotaStrategy
) {
    private static final RulesConfig NONE = new RulesConfig(
            null, null, null, null, null, null, null, null, null, null);

    public RulesConfig {
        if (ordering == null) ordering = OrderingMode.SEQUENTIAL;
        if (balanceOn == null) balanceOn = BalanceOn.STARTED;
        weights = weights == null ? List.of() : List.copyOf(weights);
        if (pickStrategy == null) pickStrategy = PickStrategy.RANDOM;
        pickWeights = pickWeights == null ? List.of() : List.copyOf(pickWeights);
        pickConditions = pickConditions == null ? List.of() : List.copyOf(pickConditions);
        if (quotaStrategy == null) quotaStrategy = QuotaStrategy.SKIP_IF_FULL;
        if (visibility != null && visibility.isBlank()) visibility = null;
    }

    public static RulesConfig none() {
        return NONE;
    }

    public boolean hasPick() {
        return pickCount != null && pickCount > 0;
    }

    public boolean hasQuota() {
        return quota != null;
    }

    public int weightOf(String childId) {
        return lookup(weights, childId);
    }

    public int pickWeightOf(String childId) {
        return lookup(pickWeights, childId);
    }

    private static int lookup(List<WeightEntry> entries, String childId) {
        for (WeightEntry entry : entries) {
            if (entry.id() != null && entry.id().equals(childId)) {
                return entry.value();
            }
        }
        return 1;
    }
}
