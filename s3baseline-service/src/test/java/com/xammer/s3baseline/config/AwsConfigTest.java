package com.xammer.s3baseline.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;

import static org.assertj.core.api.Assertions.assertThat;

class AwsConfigTest {

    @Test
    void profileComesFromCommandLineOption() {
        AwsConfig config = new AwsConfig(new DefaultApplicationArguments("--apply", "--profile=audit"), "");

        assertThat(config.getProfile()).isEqualTo("audit");
    }

    @Test
    void noProfileOptionMeansDefaultCredentialChain() {
        AwsConfig config = new AwsConfig(new DefaultApplicationArguments("--apply"), "");

        assertThat(config.getProfile()).isNull();
    }

    @Test
    void blankProfileOptionIsIgnored() {
        AwsConfig config = new AwsConfig(new DefaultApplicationArguments("--profile="), "");

        assertThat(config.getProfile()).isNull();
    }

    @Test
    void configuredRegionWinsOverLookup() {
        Region region = AwsConfig.resolveRegion("eu-central-1", () -> Region.AP_SOUTHEAST_2);

        assertThat(region).isEqualTo(Region.EU_CENTRAL_1);
    }

    @Test
    void blankRegionUsesProfileLookup() {
        Region region = AwsConfig.resolveRegion(" ", () -> Region.EU_WEST_2);

        assertThat(region).isEqualTo(Region.EU_WEST_2);
    }

    @Test
    void unresolvableRegionFallsBackToUsEast1() {
        Region region = AwsConfig.resolveRegion(null, () -> {
            throw SdkClientException.create("Unable to load region from any of the providers in the chain");
        });

        assertThat(region).isEqualTo(Region.US_EAST_1);
    }
}
