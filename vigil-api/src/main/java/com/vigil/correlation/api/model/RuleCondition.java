package com.vigil.correlation.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single condition of a correlation rule. The engine only inspects
 * equality conditions when indexing; everything else is left to the
 * {@link com.vigil.correlation.api.RuleEvaluator}.
 */
public record RuleCondition(
        @JsonProperty("id") String id,
        @JsonProperty("condition_type") String conditionType,
        @JsonProperty("field_name") String fieldName,
        @JsonProperty("operator") String operator,
        @JsonProperty("value") String value,
        @JsonProperty("condition_order") int conditionOrder,
        @JsonProperty("is_required") boolean required) {

    public static RuleCondition equalsCondition(String fieldName, String value) {
        return new RuleCondition(null, "field_match", fieldName, "equals", value, 0, true);
    }

    @JsonIgnore
    public boolean isEquality() {
        return "equals".equalsIgnoreCase(operator);
    }
}
