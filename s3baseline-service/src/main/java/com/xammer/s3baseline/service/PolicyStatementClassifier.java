package com.xammer.s3baseline.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.xammer.s3baseline.domain.BaselineContext;
import com.xammer.s3baseline.domain.Classification;
import com.xammer.s3baseline.domain.PolicyDocument;
import com.xammer.s3baseline.domain.PolicyStatement;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides whether a bucket policy carries a complete deny-insecure-transport statement.
 * <p>
 * Only the statement with the managed Sid is inspected. A Sid used more than once is
 * treated as a malformed managed statement and classified {@link Classification#NEEDS_CHANGE}.
 */
@Component
public class PolicyStatementClassifier {

    public Classification classify(PolicyDocument document, String bucketName) {
        if (document == null || document.getStatements() == null) {
            return Classification.NOT_APPLIED;
        }
        List<PolicyStatement> managed = managedStatements(document);
        if (managed.isEmpty()) {
            return Classification.NOT_APPLIED;
        }
        if (managed.size() > 1) {
            return Classification.NEEDS_CHANGE;
        }
        return isComplete(managed.get(0), bucketName) ? Classification.APPLIED : Classification.NEEDS_CHANGE;
    }

    List<PolicyStatement> managedStatements(PolicyDocument document) {
        return document.getStatements().stream()
                .filter(ManagedStatements::isManaged)
                .collect(Collectors.toList());
    }

    boolean isComplete(PolicyStatement statement, String bucketName) {
        return "Deny".equals(statement.getEffect())
                && isAnyone(statement.getPrincipal())
                && coversServiceActions(statement.getAction())
                && coversBucket(statement.getResource(), bucketName)
                && deniesInsecureTransport(statement.getCondition());
    }

    private boolean isAnyone(JsonNode principal) {
        return principal != null && principal.isTextual() && "*".equals(principal.asText());
    }

    private boolean coversServiceActions(JsonNode action) {
        Set<String> actions = textValues(action);
        return actions.contains(ManagedStatements.SERVICE_WILDCARD_ACTION) || actions.contains("*");
    }

    private boolean coversBucket(JsonNode resource, String bucketName) {
        Set<String> resources = textValues(resource);
        return resources.contains(BaselineContext.bucketArn(bucketName))
                && resources.contains(BaselineContext.objectsArn(bucketName));
    }

    private boolean deniesInsecureTransport(JsonNode condition) {
        if (condition == null || !condition.isObject()) {
            return false;
        }
        JsonNode value = condition.path("Bool").path(ManagedStatements.SECURE_TRANSPORT_KEY);
        if (value.isBoolean()) {
            return !value.booleanValue();
        }
        return value.isTextual() && "false".equalsIgnoreCase(value.asText());
    }

    private Set<String> textValues(JsonNode node) {
        Set<String> values = new HashSet<>();
        if (node == null) {
            return values;
        }
        if (node.isTextual()) {
            values.add(node.asText());
        } else if (node.isArray()) {
            node.forEach(item -> {
                if (item.isTextual()) {
                    values.add(item.asText());
                }
            });
        }
        return values;
    }
}
