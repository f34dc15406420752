package com.xammer.s3baseline.runner;

import com.xammer.s3baseline.dto.RunOptions;
import org.springframework.boot.ApplicationArguments;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps {@code --name[=value]} command line options onto {@link RunOptions}.
 */
final class RunOptionsParser {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: s3baseline [--apply] [--bucket=<name>] [--profile=<name>] [--exclude=<name>]...",
            "                  [--show-policy] [--show-logging] [--http-only | --logging-only]",
            "Runs in DRY RUN mode unless --apply is given.");

    private RunOptionsParser() {
    }

    static RunOptions parse(ApplicationArguments args) {
        if (args.containsOption("http-only") && args.containsOption("logging-only")) {
            throw new IllegalArgumentException("--http-only and --logging-only cannot be used together");
        }

        Set<String> excluded = new LinkedHashSet<>();
        List<String> excludeValues = args.getOptionValues("exclude");
        if (excludeValues != null) {
            excludeValues.stream()
                    .flatMap(value -> Arrays.stream(value.split(",")))
                    .map(String::trim)
                    .filter(value -> !value.isEmpty())
                    .forEach(excluded::add);
        }

        String bucket = null;
        List<String> bucketValues = args.getOptionValues("bucket");
        if (bucketValues != null && !bucketValues.isEmpty()) {
            bucket = bucketValues.get(0).trim();
            if (bucket.isEmpty()) {
                throw new IllegalArgumentException("--bucket requires a bucket name");
            }
        }

        return RunOptions.builder()
                .apply(args.containsOption("apply"))
                .bucket(bucket)
                .excludedBuckets(excluded)
                .showPolicy(args.containsOption("show-policy"))
                .showLogging(args.containsOption("show-logging"))
                .policyOnly(args.containsOption("http-only"))
                .loggingOnly(args.containsOption("logging-only"))
                .build();
    }
}
