package com.spendmonitor.monitor.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.sns.SnsClient;

/**
 * AWS SDK clients. Credentials come from the default provider chain.
 */
@Configuration
public class AwsClientConfig {

    @Bean(destroyMethod = "close")
    public SnsClient snsClient(SpendMonitorProperties properties) {
        return SnsClient.builder()
                .region(Region.of(properties.aws().region()))
                .build();
    }

    @Bean(destroyMethod = "close")
    public BedrockRuntimeClient bedrockRuntimeClient(SpendMonitorProperties properties) {
        return BedrockRuntimeClient.builder()
                .region(Region.of(properties.aws().region()))
                .build();
    }

    @Bean(destroyMethod = "close")
    public CostExplorerClient costExplorerClient() {
        // Cost Explorer is served from us-east-1 only
        return CostExplorerClient.builder()
                .region(Region.US_EAST_1)
                .build();
    }
}
