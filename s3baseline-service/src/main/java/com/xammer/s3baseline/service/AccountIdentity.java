package com.xammer.s3baseline.service;

public interface AccountIdentity {

    /**
     * @return the id of the account the credentials belong to
     * @throws com.xammer.s3baseline.exception.IdentityUnavailableException when it cannot be determined
     */
    String getAccountId();
}
