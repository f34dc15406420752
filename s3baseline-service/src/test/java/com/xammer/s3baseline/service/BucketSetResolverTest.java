package com.xammer.s3baseline.service;

import com.xammer.s3baseline.exception.BucketNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BucketSetResolverTest {

    private static final String SINK = "access-logs-123";

    private final BucketSetResolver resolver = new BucketSetResolver();

    @Test
    void removesExclusionsAndLogSinkKeepingOrder() {
        List<String> resolved = resolver.resolve(List.of("A", "B", SINK, "C"), Set.of("B"), SINK);

        assertThat(resolved).containsExactly("A", "C");
    }

    @Test
    void dropsDuplicates() {
        assertThat(resolver.resolve(List.of("A", "C", "A"), null, SINK)).containsExactly("A", "C");
    }

    @Test
    void singleBucketMustBeListed() {
        assertThat(resolver.resolveSingle("C", List.of("A", "C"), Set.of(), SINK)).containsExactly("C");

        assertThatThrownBy(() -> resolver.resolveSingle("missing", List.of("A", "C"), Set.of(), SINK))
                .isInstanceOf(BucketNotFoundException.class)
                .hasMessageContaining("does not exist");
    }

    @Test
    void singleBucketCannotBeExcludedOrTheLogSink() {
        assertThatThrownBy(() -> resolver.resolveSingle("A", List.of("A"), Set.of("A"), SINK))
                .isInstanceOf(BucketNotFoundException.class)
                .hasMessageContaining("excluded");
        assertThatThrownBy(() -> resolver.resolveSingle(SINK, List.of(SINK), Set.of(), SINK))
                .isInstanceOf(BucketNotFoundException.class)
                .hasMessageContaining("log sink");
    }
}
