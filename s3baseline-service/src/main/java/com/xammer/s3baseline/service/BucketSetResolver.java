package com.xammer.s3baseline.service;

import com.xammer.s3baseline.exception.BucketNotFoundException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Works out which buckets a run touches: everything listed, minus exclusions, minus the
 * log sink. Listing order is kept and duplicates are dropped.
 */
@Component
public class BucketSetResolver {

    public List<String> resolve(List<String> listed, Collection<String> excluded, String logSinkName) {
        Set<String> skip = new LinkedHashSet<>();
        if (excluded != null) {
            skip.addAll(excluded);
        }
        skip.add(logSinkName);

        Set<String> worklist = new LinkedHashSet<>();
        for (String bucket : listed) {
            if (!skip.contains(bucket)) {
                worklist.add(bucket);
            }
        }
        return new ArrayList<>(worklist);
    }

    public List<String> resolveSingle(String bucket, List<String> listed, Collection<String> excluded, String logSinkName) {
        if (bucket.equals(logSinkName)) {
            throw new BucketNotFoundException(bucket, "it is the access log sink");
        }
        if (excluded != null && excluded.contains(bucket)) {
            throw new BucketNotFoundException(bucket, "it is excluded");
        }
        if (!listed.contains(bucket)) {
            throw new BucketNotFoundException(bucket, "it does not exist in this account");
        }
        return List.of(bucket);
    }
}
