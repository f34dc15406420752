package com.xammer.s3baseline.runner;

import com.xammer.s3baseline.dto.RunOptions;
import com.xammer.s3baseline.dto.RunReport;
import com.xammer.s3baseline.exception.BaselineAbortException;
import com.xammer.s3baseline.service.BaselineReconciler;
import com.xammer.s3baseline.service.BaselineReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Command line entry: parses the options, runs one pass and turns the result into the
 * process exit code.
 */
@Component
public class BaselineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(BaselineRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private final BaselineReconciler reconciler;
    private final BaselineReporter reporter;
    private int exitCode = EXIT_OK;

    public BaselineRunner(BaselineReconciler reconciler, BaselineReporter reporter) {
        this.reconciler = reconciler;
        this.reporter = reporter;
    }

    @Override
    public void run(ApplicationArguments args) {
        RunOptions options;
        try {
            options = RunOptionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            logger.error(RunOptionsParser.USAGE);
            exitCode = EXIT_USAGE;
            return;
        }
        exitCode = execute(options);
    }

    int execute(RunOptions options) {
        if (options.isDryRun()) {
            logger.info("Running in DRY RUN mode, no changes will be made. Use --apply to apply changes.");
        } else {
            logger.info("Applying changes");
        }
        if (options.isPolicyOnly()) {
            logger.info("Only the deny insecure transport policy will be checked (access logging skipped)");
        } else if (options.isLoggingOnly()) {
            logger.info("Only access logging will be checked (bucket policy skipped)");
        }

        RunReport report;
        try {
            report = reconciler.run(options);
        } catch (BaselineAbortException e) {
            logger.error("Aborting: {}", e.getMessage());
            return EXIT_FAILED;
        }

        reporter.report(report);
        if (!report.isDryRun() && report.hasFailures()) {
            logger.warn("Some buckets are not compliant after applying changes");
            return EXIT_FAILED;
        }
        return EXIT_OK;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
