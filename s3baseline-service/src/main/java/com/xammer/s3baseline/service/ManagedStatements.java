package com.xammer.s3baseline.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xammer.s3baseline.domain.BaselineContext;
import com.xammer.s3baseline.domain.PolicyStatement;

/**
 * Builders for the statements this tool writes into bucket policies.
 */
public final class ManagedStatements {

    public static final String DENY_INSECURE_TRANSPORT_SID = "DenyInsecureTransport";
    public static final String LOG_DELIVERY_SID = "S3ServerAccessLogsPolicy";

    public static final String SERVICE_WILDCARD_ACTION = "s3:*";
    public static final String SECURE_TRANSPORT_KEY = "aws:SecureTransport";
    static final String LOGGING_SERVICE_PRINCIPAL = "logging.s3.amazonaws.com";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ManagedStatements() {
    }

    public static boolean isManaged(PolicyStatement statement) {
        return statement != null && DENY_INSECURE_TRANSPORT_SID.equals(statement.getSid());
    }

    /**
     * Deny every S3 action on the bucket and its objects when the request is not made over TLS.
     */
    public static PolicyStatement denyInsecureTransport(String bucketName) {
        ObjectNode condition = NODES.objectNode();
        condition.putObject("Bool").put(SECURE_TRANSPORT_KEY, "false");

        return PolicyStatement.builder()
                .sid(DENY_INSECURE_TRANSPORT_SID)
                .effect("Deny")
                .principal(NODES.textNode("*"))
                .action(NODES.textNode(SERVICE_WILDCARD_ACTION))
                .resource(NODES.arrayNode()
                        .add(BaselineContext.bucketArn(bucketName))
                        .add(BaselineContext.objectsArn(bucketName)))
                .condition(condition)
                .build();
    }

    /**
     * Lets the S3 logging service write access logs into the sink, for this account only.
     */
    public static PolicyStatement allowLogDelivery(BaselineContext context) {
        ObjectNode principal = NODES.objectNode().put("Service", LOGGING_SERVICE_PRINCIPAL);
        ObjectNode condition = NODES.objectNode();
        condition.putObject("StringEquals").put("aws:SourceAccount", context.getAccountId());

        return PolicyStatement.builder()
                .sid(LOG_DELIVERY_SID)
                .effect("Allow")
                .principal(principal)
                .action(NODES.arrayNode().add("s3:PutObject"))
                .resource(NODES.textNode(BaselineContext.objectsArn(context.getLogSinkName())))
                .condition(condition)
                .build();
    }
}
