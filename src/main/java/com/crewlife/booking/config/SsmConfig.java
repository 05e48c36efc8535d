package com.crewlife.booking.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ssm.SsmClient;

/**
 * Parameter Store client used for the link signing secret and the admin API key.
 * Only created when aws.ssm.enabled=true; without it both fall back to properties.
 */
@Configuration
public class SsmConfig {

    private static final Logger logger = LoggerFactory.getLogger(SsmConfig.class);

    @Value("${aws.region:us-east-1}")
    private String awsRegion;

    @Bean
    @ConditionalOnProperty(name = "aws.ssm.enabled", havingValue = "true", matchIfMissing = false)
    public SsmClient ssmClient() {
        logger.info("Initializing SSM client for signing secret and admin key retrieval");
        return SsmClient.builder()
                .region(Region.of(awsRegion))
                .build();
    }
}
