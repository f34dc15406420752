package com.xammer.s3baseline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xammer.s3baseline.domain.PolicyDocument;
import org.springframework.stereotype.Component;

/**
 * JSON conversion for bucket policies and for the before/after display.
 */
@Component
public class PolicyDocumentMapper {

    private final ObjectMapper objectMapper;

    public PolicyDocumentMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PolicyDocument read(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, PolicyDocument.class);
    }

    public String write(PolicyDocument document) throws JsonProcessingException {
        return objectMapper.writeValueAsString(document);
    }

    public String pretty(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
