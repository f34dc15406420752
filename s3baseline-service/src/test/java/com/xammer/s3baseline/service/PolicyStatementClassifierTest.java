package com.xammer.s3baseline.service;

import com.xammer.s3baseline.domain.Classification;
import com.xammer.s3baseline.domain.PolicyDocument;
import org.junit.jupiter.api.Test;

import static com.xammer.s3baseline.service.Policies.allowReadStatement;
import static com.xammer.s3baseline.service.Policies.bothArns;
import static com.xammer.s3baseline.service.Policies.denyInsecure;
import static com.xammer.s3baseline.service.Policies.document;
import static org.assertj.core.api.Assertions.assertThat;

class PolicyStatementClassifierTest {

    private static final String BUCKET = "data-bucket";

    private final PolicyStatementClassifier classifier = new PolicyStatementClassifier();

    @Test
    void noPolicyIsNotApplied() {
        assertThat(classifier.classify(null, BUCKET)).isEqualTo(Classification.NOT_APPLIED);
    }

    @Test
    void policyWithoutManagedSidIsNotApplied() {
        PolicyDocument policy = document(allowReadStatement(BUCKET));

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.NOT_APPLIED);
    }

    @Test
    void canonicalStatementIsApplied() {
        PolicyDocument policy = document(allowReadStatement(BUCKET), denyInsecure(BUCKET, "'s3:*'", bothArns(BUCKET)));

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.APPLIED);
    }

    @Test
    void actionListContainingServiceWildcardIsApplied() {
        PolicyDocument policy = document(denyInsecure(BUCKET, "['s3:GetObject','s3:*']", bothArns(BUCKET)));

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.APPLIED);
    }

    @Test
    void booleanConditionValueIsAccepted() {
        PolicyDocument policy = Policies.parse("{'Statement':{'Sid':'DenyInsecureTransport','Effect':'Deny',"
                + "'Principal':'*','Action':'s3:*','Resource':" + bothArns(BUCKET) + ","
                + "'Condition':{'Bool':{'aws:SecureTransport':false}}}}");

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.APPLIED);
    }

    @Test
    void narrowActionNeedsChange() {
        PolicyDocument policy = document(denyInsecure(BUCKET, "['s3:GetObject','s3:PutObject']", bothArns(BUCKET)));

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.NEEDS_CHANGE);
    }

    @Test
    void missingObjectArnNeedsChange() {
        PolicyDocument policy = document(denyInsecure(BUCKET, "'s3:*'", "'arn:aws:s3:::" + BUCKET + "'"));

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.NEEDS_CHANGE);
    }

    @Test
    void resourcesOfAnotherBucketNeedChange() {
        PolicyDocument policy = document(denyInsecure(BUCKET, "'s3:*'", bothArns("other-bucket")));

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.NEEDS_CHANGE);
    }

    @Test
    void wrongConditionKeyNeedsChange() {
        PolicyDocument policy = document("{'Sid':'DenyInsecureTransport','Effect':'Deny','Principal':'*',"
                + "'Action':'s3:*','Resource':" + bothArns(BUCKET) + ","
                + "'Condition':{'NumericLessThan':{'s3:TlsVersion':'1.2'}}}");

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.NEEDS_CHANGE);
    }

    @Test
    void allowEffectNeedsChange() {
        PolicyDocument policy = document(denyInsecure(BUCKET, "'s3:*'", bothArns(BUCKET)).replace("'Effect':'Deny'", "'Effect':'Allow'"));

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.NEEDS_CHANGE);
    }

    @Test
    void duplicatedManagedSidNeedsChange() {
        String canonical = denyInsecure(BUCKET, "'s3:*'", bothArns(BUCKET));
        PolicyDocument policy = document(canonical, canonical);

        assertThat(classifier.classify(policy, BUCKET)).isEqualTo(Classification.NEEDS_CHANGE);
    }
}
