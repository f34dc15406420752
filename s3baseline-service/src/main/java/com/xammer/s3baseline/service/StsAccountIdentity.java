package com.xammer.s3baseline.service;

import com.xammer.s3baseline.exception.IdentityUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.StsClient;

@Service
public class StsAccountIdentity implements AccountIdentity {

    private static final Logger logger = LoggerFactory.getLogger(StsAccountIdentity.class);

    private final StsClient stsClient;

    public StsAccountIdentity(StsClient stsClient) {
        this.stsClient = stsClient;
    }

    @Override
    public String getAccountId() {
        try {
            String account = stsClient.getCallerIdentity().account();
            logger.debug("Retrieved account ID: {}", account);
            return account;
        } catch (SdkException e) {
            logger.error("Failed to determine account ID: {}", e.getMessage());
            throw new IdentityUnavailableException(e);
        }
    }
}
