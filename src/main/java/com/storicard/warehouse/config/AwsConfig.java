package com.storicard.warehouse.config;

import com.storicard.warehouse.staging.S3StagingStore;
import com.storicard.warehouse.staging.StagingStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

@Configuration
public class AwsConfig {

    @Bean
    public S3Client s3Client(PipelineProperties properties) {
        PipelineProperties.Aws aws = properties.getAws();
        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(aws.getRegion()))
            .credentialsProvider(credentialsProvider(aws));
        if (StringUtils.hasText(aws.getEndpoint())) {
            builder.endpointOverride(URI.create(aws.getEndpoint())).forcePathStyle(true);
        }
        return builder.build();
    }

    @Bean
    public StagingStore stagingStore(S3Client s3Client) {
        return new S3StagingStore(s3Client);
    }

    /**
     * Explicit keys when both are configured, otherwise the SDK's default chain.
     */
    static AwsCredentialsProvider credentialsProvider(PipelineProperties.Aws aws) {
        if (StringUtils.hasText(aws.getAccessKeyId()) && StringUtils.hasText(aws.getSecretAccessKey())) {
            return StaticCredentialsProvider.create(
                AwsBasicCredentials.create(aws.getAccessKeyId(), aws.getSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
