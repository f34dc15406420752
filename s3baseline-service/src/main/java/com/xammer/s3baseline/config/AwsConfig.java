package com.xammer.s3baseline.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.providers.AwsRegionProvider;
import software.amazon.awssdk.regions.providers.DefaultAwsRegionProviderChain;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sts.StsClient;

import java.util.List;

@Configuration
public class AwsConfig {

    private static final Logger logger = LoggerFactory.getLogger(AwsConfig.class);

    static final Region FALLBACK_REGION = Region.US_EAST_1;

    private final String profile;
    private final String configuredRegion;

    public AwsConfig(ApplicationArguments arguments,
                     @Value("${aws.region:}") String configuredRegion) {
        this.profile = profileOf(arguments);
        this.configuredRegion = configuredRegion;
    }

    /**
     * Only the {@code --profile=<name>} command line option selects a profile; environment
     * variables that happen to be called {@code PROFILE} are ignored.
     */
    static String profileOf(ApplicationArguments arguments) {
        List<String> values = arguments.getOptionValues("profile");
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0).trim();
    }

    /**
     * An explicit {@code aws.region} wins. Otherwise the region comes from the SDK's lookup
     * chain (environment, system properties, the chosen profile's config), then us-east-1.
     */
    static Region resolveRegion(String configuredRegion, AwsRegionProvider lookup) {
        if (configuredRegion != null && !configuredRegion.isBlank()) {
            return Region.of(configuredRegion.trim());
        }
        try {
            return lookup.getRegion();
        } catch (SdkClientException e) {
            logger.warn("No AWS region configured, using {}", FALLBACK_REGION.id());
            return FALLBACK_REGION;
        }
    }

    String getProfile() {
        return profile;
    }

    private AwsCredentialsProvider getCredentialsProvider() {
        if (profile != null) {
            logger.info("Using AWS profile '{}'", profile);
            return ProfileCredentialsProvider.create(profile);
        }
        return DefaultCredentialsProvider.create();
    }

    @Bean
    public Region awsRegion() {
        DefaultAwsRegionProviderChain.Builder lookup = DefaultAwsRegionProviderChain.builder();
        if (profile != null) {
            lookup.profileName(profile);
        }
        Region region = resolveRegion(configuredRegion, lookup.build());
        logger.info("Using AWS region {}", region.id());
        return region;
    }

    @Bean
    public StsClient stsClient(Region awsRegion) {
        return StsClient.builder()
                .region(awsRegion)
                .credentialsProvider(getCredentialsProvider())
                .build();
    }

    @Bean
    public S3Client s3Client(Region awsRegion) {
        // buckets live in many regions; let the SDK follow redirects to the right one
        return S3Client.builder()
                .region(awsRegion)
                .crossRegionAccessEnabled(true)
                .credentialsProvider(getCredentialsProvider())
                .build();
    }
}
