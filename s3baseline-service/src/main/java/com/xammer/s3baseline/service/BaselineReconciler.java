package com.xammer.s3baseline.service;

import com.xammer.s3baseline.domain.BaselineContext;
import com.xammer.s3baseline.domain.Classification;
import com.xammer.s3baseline.domain.Dimension;
import com.xammer.s3baseline.domain.LoggingConfig;
import com.xammer.s3baseline.domain.PolicyDocument;
import com.xammer.s3baseline.dto.BucketOutcome;
import com.xammer.s3baseline.dto.DimensionResult;
import com.xammer.s3baseline.dto.RunOptions;
import com.xammer.s3baseline.dto.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Runs one reconciliation pass over the account's buckets.
 * <p>
 * Every bucket goes through read, classify, merge and (in apply mode) write for each
 * enabled dimension. Policies are always rewritten as a whole document built from the
 * policy just read. A failure on one bucket is recorded against that bucket's dimension
 * and never stops the pass.
 */
@Service
public class BaselineReconciler {

    private static final Logger logger = LoggerFactory.getLogger(BaselineReconciler.class);

    private final AccountIdentity accountIdentity;
    private final BucketStore bucketStore;
    private final LogSinkBootstrapper logSinkBootstrapper;
    private final BucketSetResolver bucketSetResolver;
    private final PolicyStatementClassifier policyClassifier;
    private final PolicyMerger policyMerger;
    private final LoggingClassifier loggingClassifier;
    private final LoggingMerger loggingMerger;
    private final PolicyDocumentMapper policyMapper;
    private final Executor executor;

    @Autowired
    public BaselineReconciler(AccountIdentity accountIdentity,
                              BucketStore bucketStore,
                              LogSinkBootstrapper logSinkBootstrapper,
                              BucketSetResolver bucketSetResolver,
                              PolicyStatementClassifier policyClassifier,
                              PolicyMerger policyMerger,
                              LoggingClassifier loggingClassifier,
                              LoggingMerger loggingMerger,
                              PolicyDocumentMapper policyMapper,
                              @Qualifier("baselineTaskExecutor") Executor executor) {
        this.accountIdentity = accountIdentity;
        this.bucketStore = bucketStore;
        this.logSinkBootstrapper = logSinkBootstrapper;
        this.bucketSetResolver = bucketSetResolver;
        this.policyClassifier = policyClassifier;
        this.policyMerger = policyMerger;
        this.loggingClassifier = loggingClassifier;
        this.loggingMerger = loggingMerger;
        this.policyMapper = policyMapper;
        this.executor = executor;
    }

    public RunReport run(RunOptions options) {
        BaselineContext context = BaselineContext.forAccount(accountIdentity.getAccountId());
        logger.info("Reconciling S3 baseline for account {} (log sink: {})",
                context.getAccountId(), context.getLogSinkName());

        logSinkBootstrapper.ensureLogSink(context, options.isDryRun());

        List<String> worklist = resolveWorklist(options, context);
        if (worklist.isEmpty()) {
            logger.warn("No buckets to process");
        } else {
            logger.info("Buckets to process: {}", worklist.size());
        }

        // each future owns exactly one slot; joining in order keeps the worklist order
        List<CompletableFuture<BucketOutcome>> futures = worklist.stream()
                .map(bucket -> CompletableFuture.supplyAsync(() -> reconcileBucket(bucket, context, options), executor))
                .collect(Collectors.toList());
        List<BucketOutcome> outcomes = futures.stream()
                .map(CompletableFuture::join)
                .collect(Collectors.toList());

        return new RunReport(options.isDryRun(), outcomes);
    }

    private List<String> resolveWorklist(RunOptions options, BaselineContext context) {
        List<String> listed = bucketStore.listBuckets();
        if (options.getBucket() != null && !options.getBucket().isBlank()) {
            return bucketSetResolver.resolveSingle(options.getBucket(), listed,
                    options.getExcludedBuckets(), context.getLogSinkName());
        }
        return bucketSetResolver.resolve(listed, options.getExcludedBuckets(), context.getLogSinkName());
    }

    /**
     * Never throws: anything unexpected is recorded as an error on every enabled dimension
     * so the other buckets still get processed and reported.
     */
    public BucketOutcome reconcileBucket(String bucket, BaselineContext context, RunOptions options) {
        logger.info("Processing bucket {}", bucket);
        try {
            DimensionResult policy = options.isEnabled(Dimension.POLICY)
                    ? reconcilePolicy(bucket, options)
                    : DimensionResult.skipped();
            DimensionResult logging = options.isEnabled(Dimension.LOGGING)
                    ? reconcileLogging(bucket, context, options)
                    : DimensionResult.skipped();
            return new BucketOutcome(bucket, policy, logging);
        } catch (RuntimeException e) {
            logger.error("Bucket {}: unexpected error, bucket left as is", bucket, e);
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new BucketOutcome(bucket, failedIfEnabled(Dimension.POLICY, options, error),
                    failedIfEnabled(Dimension.LOGGING, options, error));
        }
    }

    private static DimensionResult failedIfEnabled(Dimension dimension, RunOptions options, String error) {
        return options.isEnabled(dimension) ? DimensionResult.failed(null, error) : DimensionResult.skipped();
    }

    DimensionResult reconcilePolicy(String bucket, RunOptions options) {
        PolicyDocument current;
        try {
            current = bucketStore.getPolicy(bucket);
        } catch (RuntimeException e) {
            logger.error("Bucket {}: could not read bucket policy: {}", bucket, e.getMessage());
            return DimensionResult.failed(null, e.getMessage());
        }

        Classification observed = policyClassifier.classify(current, bucket);
        if (observed == Classification.APPLIED) {
            logger.info("Bucket {}: deny insecure transport policy already applied", bucket);
            return DimensionResult.unchanged(observed);
        }
        if (observed == Classification.NEEDS_CHANGE) {
            logger.warn("Bucket {}: incomplete {} statement found, it will be replaced",
                    bucket, ManagedStatements.DENY_INSECURE_TRANSPORT_SID);
        }

        PolicyDocument desired = policyMerger.merge(current, bucket);
        if (options.isShowPolicy()) {
            display("bucket policy", bucket, current == null ? null : policyMapper.pretty(current),
                    policyMapper.pretty(desired), "(no policy)");
        }

        if (options.isDryRun()) {
            logger.info("[DRY RUN] Bucket {}: would apply deny insecure transport policy", bucket);
            return DimensionResult.unchanged(observed);
        }

        try {
            bucketStore.putPolicy(bucket, desired);
        } catch (RuntimeException e) {
            logger.error("Bucket {}: failed to apply bucket policy: {}", bucket, e.getMessage());
            return DimensionResult.failed(observed, e.getMessage());
        }
        logger.info("Bucket {}: applied deny insecure transport policy", bucket);
        return DimensionResult.written(observed, policyClassifier.classify(desired, bucket));
    }

    DimensionResult reconcileLogging(String bucket, BaselineContext context, RunOptions options) {
        LoggingConfig current;
        try {
            current = bucketStore.getLogging(bucket);
        } catch (RuntimeException e) {
            logger.error("Bucket {}: could not read logging configuration: {}", bucket, e.getMessage());
            return DimensionResult.failed(null, e.getMessage());
        }

        Classification observed = loggingClassifier.classify(current, context);
        Optional<LoggingConfig> desired = loggingMerger.desired(observed, context);
        if (desired.isEmpty()) {
            logger.info("Bucket {}: access logging already targets {}", bucket, context.getLogSinkName());
            return DimensionResult.unchanged(observed);
        }
        LoggingConfig target = desired.get();
        String destination = String.format("s3://%s/%s", target.getTargetBucket(), target.getTargetPrefix());
        if (observed == Classification.NEEDS_CHANGE) {
            logger.warn("Bucket {}: access logging goes to s3://{}/{}, expected {}", bucket,
                    current.getTargetBucket(), current.getTargetPrefix(), destination);
        }

        if (options.isShowLogging()) {
            display("access logging", bucket, current == null || !current.isEnabled() ? null : policyMapper.pretty(current),
                    policyMapper.pretty(target), "(access logging disabled)");
        }

        if (options.isDryRun()) {
            logger.info("[DRY RUN] Bucket {}: would send access logs to {}", bucket, destination);
            return DimensionResult.unchanged(observed);
        }

        try {
            bucketStore.putLogging(bucket, target);
        } catch (RuntimeException e) {
            logger.error("Bucket {}: failed to configure access logging: {}", bucket, e.getMessage());
            return DimensionResult.failed(observed, e.getMessage());
        }
        logger.info("Bucket {}: access logs now sent to {}", bucket, destination);
        return DimensionResult.written(observed, loggingClassifier.classify(target, context));
    }

    private void display(String what, String bucket, String before, String after, String missing) {
        StringBuilder out = new StringBuilder()
                .append(System.lineSeparator()).append("=".repeat(80))
                .append(System.lineSeparator()).append("Bucket ").append(bucket).append(": ").append(what).append(" change")
                .append(System.lineSeparator()).append("Before:")
                .append(System.lineSeparator()).append(before != null ? before : missing)
                .append(System.lineSeparator()).append("After:")
                .append(System.lineSeparator()).append(after)
                .append(System.lineSeparator()).append("=".repeat(80));
        logger.info("{}", out);
    }
}
