package com.xammer.s3baseline.domain;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One statement of a bucket policy.
 * <p>
 * Principal, Action, Resource and Condition are kept as JSON trees because IAM allows
 * either a string or a list/object in those positions. Keys this class does not model
 * (NotAction, NotPrincipal, ...) are carried in {@link #otherFields} so a statement
 * written back is the statement that was read.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"Sid", "Effect", "Principal", "Action", "Resource", "Condition"})
public class PolicyStatement {

    @JsonProperty("Sid")
    private String sid;

    @JsonProperty("Effect")
    private String effect;

    @JsonProperty("Principal")
    private JsonNode principal;

    @JsonProperty("Action")
    private JsonNode action;

    @JsonProperty("Resource")
    private JsonNode resource;

    @JsonProperty("Condition")
    private JsonNode condition;

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private Map<String, JsonNode> otherFields = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, JsonNode> getOtherFields() {
        return otherFields;
    }

    @JsonAnySetter
    public void putOtherField(String name, JsonNode value) {
        if (otherFields == null) {
            otherFields = new LinkedHashMap<>();
        }
        otherFields.put(name, value);
    }
}
