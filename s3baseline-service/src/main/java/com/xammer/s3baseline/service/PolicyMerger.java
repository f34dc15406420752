package com.xammer.s3baseline.service;

import com.xammer.s3baseline.domain.PolicyDocument;
import com.xammer.s3baseline.domain.PolicyStatement;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the complete policy to write back for a bucket.
 * <p>
 * PutBucketPolicy replaces the whole document, so the result always carries every
 * statement of the current policy except the managed one, in their original order,
 * followed by a fresh managed statement.
 */
@Component
public class PolicyMerger {

    public PolicyDocument merge(PolicyDocument current, String bucketName) {
        if (current == null) {
            current = PolicyDocument.empty();
        }
        List<PolicyStatement> statements = new ArrayList<>();
        if (current.getStatements() != null) {
            for (PolicyStatement statement : current.getStatements()) {
                if (!ManagedStatements.isManaged(statement)) {
                    statements.add(statement);
                }
            }
        }
        statements.add(ManagedStatements.denyInsecureTransport(bucketName));

        String version = current.getVersion() != null ? current.getVersion() : PolicyDocument.DEFAULT_VERSION;
        return new PolicyDocument(version, current.getId(), statements);
    }
}
