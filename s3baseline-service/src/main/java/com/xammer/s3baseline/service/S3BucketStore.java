package com.xammer.s3baseline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.xammer.s3baseline.domain.LoggingConfig;
import com.xammer.s3baseline.domain.PolicyDocument;
import com.xammer.s3baseline.exception.BucketListUnavailableException;
import com.xammer.s3baseline.exception.BucketReadException;
import com.xammer.s3baseline.exception.BucketWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.BucketLoggingStatus;
import software.amazon.awssdk.services.s3.model.CreateBucketConfiguration;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.GetBucketLoggingRequest;
import software.amazon.awssdk.services.s3.model.GetBucketLoggingResponse;
import software.amazon.awssdk.services.s3.model.GetBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.LoggingEnabled;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.PublicAccessBlockConfiguration;
import software.amazon.awssdk.services.s3.model.PutBucketLoggingRequest;
import software.amazon.awssdk.services.s3.model.PutBucketPolicyRequest;
import software.amazon.awssdk.services.s3.model.PutPublicAccessBlockRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link BucketStore} backed by the AWS SDK S3 client.
 */
@Service
public class S3BucketStore implements BucketStore {

    private static final Logger logger = LoggerFactory.getLogger(S3BucketStore.class);
    private static final String NO_SUCH_BUCKET_POLICY = "NoSuchBucketPolicy";
    private static final String US_EAST_1 = "us-east-1";

    private final S3Client s3Client;
    private final PolicyDocumentMapper policyMapper;
    private final String region;

    public S3BucketStore(S3Client s3Client,
                         PolicyDocumentMapper policyMapper,
                         Region awsRegion) {
        this.s3Client = s3Client;
        this.policyMapper = policyMapper;
        this.region = awsRegion.id();
    }

    @Override
    public List<String> listBuckets() {
        try {
            List<String> names = s3Client.listBuckets().buckets().stream()
                    .map(Bucket::name)
                    .collect(Collectors.toList());
            logger.info("Found {} S3 buckets", names.size());
            return names;
        } catch (SdkException e) {
            logger.error("Could not list S3 buckets: {}", e.getMessage());
            throw new BucketListUnavailableException(e);
        }
    }

    @Override
    public boolean bucketExists(String bucketName) {
        try {
            s3Client.headBucket(HeadBucketRequest.builder().bucket(bucketName).build());
            return true;
        } catch (NoSuchBucketException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            throw new BucketReadException(bucketName, "HeadBucket", e);
        } catch (SdkException e) {
            throw new BucketReadException(bucketName, "HeadBucket", e);
        }
    }

    @Override
    public void createBucket(String bucketName) {
        try {
            CreateBucketRequest.Builder request = CreateBucketRequest.builder().bucket(bucketName);
            // us-east-1 rejects an explicit location constraint
            if (!US_EAST_1.equals(region)) {
                request.createBucketConfiguration(CreateBucketConfiguration.builder()
                        .locationConstraint(region)
                        .build());
            }
            s3Client.createBucket(request.build());
            s3Client.putPublicAccessBlock(PutPublicAccessBlockRequest.builder()
                    .bucket(bucketName)
                    .publicAccessBlockConfiguration(PublicAccessBlockConfiguration.builder()
                            .blockPublicAcls(true)
                            .ignorePublicAcls(true)
                            .blockPublicPolicy(true)
                            .restrictPublicBuckets(true)
                            .build())
                    .build());
            logger.info("Created bucket {} in region {} with public access blocked", bucketName, region);
        } catch (SdkException e) {
            throw new BucketWriteException(bucketName, "CreateBucket", e);
        }
    }

    @Override
    public PolicyDocument getPolicy(String bucketName) {
        String json;
        try {
            json = s3Client.getBucketPolicy(GetBucketPolicyRequest.builder().bucket(bucketName).build()).policy();
        } catch (S3Exception e) {
            if (e.awsErrorDetails() != null && NO_SUCH_BUCKET_POLICY.equals(e.awsErrorDetails().errorCode())) {
                return null;
            }
            throw new BucketReadException(bucketName, "GetBucketPolicy", e);
        } catch (SdkException e) {
            throw new BucketReadException(bucketName, "GetBucketPolicy", e);
        }
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return policyMapper.read(json);
        } catch (JsonProcessingException e) {
            throw new BucketReadException(bucketName, "Parsing bucket policy", e);
        }
    }

    @Override
    public void putPolicy(String bucketName, PolicyDocument policy) {
        try {
            String json = policyMapper.write(policy);
            s3Client.putBucketPolicy(PutBucketPolicyRequest.builder().bucket(bucketName).policy(json).build());
        } catch (JsonProcessingException | SdkException e) {
            throw new BucketWriteException(bucketName, "PutBucketPolicy", e);
        }
    }

    @Override
    public LoggingConfig getLogging(String bucketName) {
        try {
            GetBucketLoggingResponse response = s3Client.getBucketLogging(
                    GetBucketLoggingRequest.builder().bucket(bucketName).build());
            LoggingEnabled enabled = response.loggingEnabled();
            if (enabled == null) {
                return null;
            }
            return new LoggingConfig(enabled.targetBucket(), enabled.targetPrefix());
        } catch (SdkException e) {
            throw new BucketReadException(bucketName, "GetBucketLogging", e);
        }
    }

    @Override
    public void putLogging(String bucketName, LoggingConfig logging) {
        try {
            BucketLoggingStatus status = BucketLoggingStatus.builder()
                    .loggingEnabled(LoggingEnabled.builder()
                            .targetBucket(logging.getTargetBucket())
                            .targetPrefix(logging.getTargetPrefix())
                            .build())
                    .build();
            s3Client.putBucketLogging(PutBucketLoggingRequest.builder()
                    .bucket(bucketName)
                    .bucketLoggingStatus(status)
                    .build());
        } catch (SdkException e) {
            throw new BucketWriteException(bucketName, "PutBucketLogging", e);
        }
    }
}
