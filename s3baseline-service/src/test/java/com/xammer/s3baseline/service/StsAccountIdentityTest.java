package com.xammer.s3baseline.service;

import com.xammer.s3baseline.exception.IdentityUnavailableException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.GetCallerIdentityResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StsAccountIdentityTest {

    @Mock
    private StsClient stsClient;

    @Test
    void returnsCallerAccount() {
        when(stsClient.getCallerIdentity())
                .thenReturn(GetCallerIdentityResponse.builder().account("123456789012").build());

        assertThat(new StsAccountIdentity(stsClient).getAccountId()).isEqualTo("123456789012");
    }

    @Test
    void sdkFailureIsIdentityUnavailable() {
        when(stsClient.getCallerIdentity()).thenThrow(SdkClientException.create("Unable to load credentials"));

        assertThatThrownBy(() -> new StsAccountIdentity(stsClient).getAccountId())
                .isInstanceOf(IdentityUnavailableException.class)
                .hasMessageContaining("Unable to load credentials");
    }
}
