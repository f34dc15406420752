package com.xammer.s3baseline.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.s3baseline.domain.PolicyDocument;
import com.xammer.s3baseline.domain.PolicyStatement;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PolicyDocumentMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PolicyDocumentMapper mapper = new PolicyDocumentMapper(objectMapper);

    @Test
    void acceptsSingleStatementObject() throws Exception {
        PolicyDocument policy = mapper.read("{\"Version\":\"2008-10-17\",\"Id\":\"Legacy\","
                + "\"Statement\":{\"Sid\":\"A\",\"Effect\":\"Allow\",\"Principal\":{\"AWS\":\"*\"},"
                + "\"Action\":\"s3:GetObject\",\"Resource\":\"arn:aws:s3:::web/*\"}}");

        assertThat(policy.getVersion()).isEqualTo("2008-10-17");
        assertThat(policy.getId()).isEqualTo("Legacy");
        assertThat(policy.getStatements()).hasSize(1);
        assertThat(policy.getStatements().get(0).getPrincipal().path("AWS").asText()).isEqualTo("*");
    }

    @Test
    void unmodelledStatementKeysSurviveARoundTrip() throws Exception {
        String json = "{\"Version\":\"2012-10-17\",\"Statement\":[{\"Sid\":\"OnlyReads\",\"Effect\":\"Deny\","
                + "\"NotPrincipal\":{\"AWS\":\"arn:aws:iam::1:root\"},\"NotAction\":[\"s3:GetObject\"],"
                + "\"NotResource\":\"arn:aws:s3:::web/public/*\"}]}";

        PolicyDocument policy = mapper.read(json);
        PolicyStatement statement = policy.getStatements().get(0);
        assertThat(statement.getOtherFields()).containsOnlyKeys("NotPrincipal", "NotAction", "NotResource");

        JsonNode written = objectMapper.readTree(mapper.write(policy));
        assertThat(written).isEqualTo(objectMapper.readTree(json));
    }
}
