package com.xammer.s3baseline.domain;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"Version", "Id", "Statement"})
public class PolicyDocument {

    public static final String DEFAULT_VERSION = "2012-10-17";

    @JsonProperty("Version")
    private String version;

    @JsonProperty("Id")
    private String id;

    // IAM accepts a lone statement object as well as an array
    @JsonProperty("Statement")
    @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
    private List<PolicyStatement> statements = new ArrayList<>();

    public static PolicyDocument empty() {
        return new PolicyDocument(DEFAULT_VERSION, null, new ArrayList<>());
    }
}
