package com.xammer.s3baseline.service;

import com.xammer.s3baseline.domain.BaselineContext;
import com.xammer.s3baseline.domain.PolicyDocument;
import com.xammer.s3baseline.exception.BucketAccessException;
import com.xammer.s3baseline.exception.LogSinkCreateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Makes sure the account's access log bucket exists before any logging target is
 * pointed at it. An existing sink is left alone.
 */
@Service
public class LogSinkBootstrapper {

    private static final Logger logger = LoggerFactory.getLogger(LogSinkBootstrapper.class);

    private final BucketStore bucketStore;
    private final PolicyMerger policyMerger;

    public LogSinkBootstrapper(BucketStore bucketStore, PolicyMerger policyMerger) {
        this.bucketStore = bucketStore;
        this.policyMerger = policyMerger;
    }

    /**
     * @return {@code true} if the sink was created by this call
     * @throws LogSinkCreateException if the sink cannot be checked or created, or was created
     *         but its policy could not be attached
     */
    public boolean ensureLogSink(BaselineContext context, boolean dryRun) {
        String sink = context.getLogSinkName();
        try {
            if (bucketStore.bucketExists(sink)) {
                logger.info("Log sink bucket {} already exists", sink);
                return false;
            }
            if (dryRun) {
                logger.info("[DRY RUN] Would create log sink bucket {}", sink);
                return false;
            }

            logger.info("Creating log sink bucket {}...", sink);
            bucketStore.createBucket(sink);
        } catch (BucketAccessException e) {
            logger.error("Failed to prepare log sink bucket {}: {}", sink, e.getMessage());
            throw new LogSinkCreateException(sink, e);
        }

        // later runs see an existing sink and leave it alone, so a missing policy stays missing
        try {
            bucketStore.putPolicy(sink, logSinkPolicy(context));
        } catch (BucketAccessException e) {
            logger.error("Log sink bucket {} was created but its policy could not be attached: {}. "
                    + "Attach the log delivery and secure transport policy by hand before the next run.",
                    sink, e.getMessage());
            throw new LogSinkCreateException(sink,
                    "Log sink bucket " + sink + " was created without its policy and must be repaired by hand: "
                            + e.getMessage(), e);
        }
        logger.info("Created log sink bucket {}", sink);
        return true;
    }

    /**
     * Log delivery allow statement followed by the deny-insecure-transport statement.
     */
    PolicyDocument logSinkPolicy(BaselineContext context) {
        PolicyDocument seed = PolicyDocument.empty();
        seed.getStatements().add(ManagedStatements.allowLogDelivery(context));
        return policyMerger.merge(seed, context.getLogSinkName());
    }
}
