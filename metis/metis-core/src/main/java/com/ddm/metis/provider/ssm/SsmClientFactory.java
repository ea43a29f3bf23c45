package com.ddm.metis.provider.ssm;

import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.SsmClientBuilder;

import java.time.Duration;

public final class SsmClientFactory {
    private SsmClientFactory() {}

    static final Duration DEFAULT_API_CALL_TIMEOUT = Duration.ofSeconds(6);

    /**
     * @param region         为 null 时使用 SDK 默认 region 链
     * @param apiCallTimeout 单次 API 调用总超时，超时即视为不可用
     */
    public static SsmClient ssm(Region region, Duration apiCallTimeout) {
        SsmClientBuilder builder = SsmClient.builder()
                .credentialsProvider(DefaultCredentialsProvider.create())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(apiCallTimeout == null ? DEFAULT_API_CALL_TIMEOUT : apiCallTimeout)
                        .build());
        if (region != null) {
            builder.region(region);
        }
        return builder.build();
    }
}
