package com.survey.boothsampling.config;

import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.survey.boothsampling.storage.LayerStorage;
import com.survey.boothsampling.storage.LocalLayerStorage;
import com.survey.boothsampling.storage.S3LayerStorage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Chooses where state layers are read from: a local folder (default) or an S3 bucket.
 */
@Configuration
@Slf4j
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(name = "sampling.storage.type", havingValue = "local", matchIfMissing = true)
    public LayerStorage localLayerStorage(@Value("${sampling.storage.local.base-dir:Data}") String baseDir) {
        log.info("Reading state layers from local directory {}", Paths.get(baseDir).toAbsolutePath());
        return new LocalLayerStorage(Paths.get(baseDir));
    }

    @Bean
    @ConditionalOnProperty(name = "sampling.storage.type", havingValue = "s3")
    public AmazonS3 amazonS3(@Value("${sampling.storage.s3.region:ap-south-1}") String region,
                             @Value("${sampling.storage.s3.access-key:}") String accessKey,
                             @Value("${sampling.storage.s3.secret-key:}") String secretKey) {
        AmazonS3ClientBuilder builder = AmazonS3ClientBuilder.standard().withRegion(region);
        if (!accessKey.isBlank() && !secretKey.isBlank()) {
            builder.withCredentials(new AWSStaticCredentialsProvider(new BasicAWSCredentials(accessKey, secretKey)));
        } else {
            builder.withCredentials(new DefaultAWSCredentialsProviderChain());
        }
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = "sampling.storage.type", havingValue = "s3")
    public LayerStorage s3LayerStorage(AmazonS3 amazonS3,
                                       @Value("${sampling.storage.s3.bucket}") String bucket,
                                       @Value("${sampling.storage.s3.prefix:state-layers/}") String prefix) {
        log.info("Reading state layers from s3://{}/{}", bucket, prefix);
        return new S3LayerStorage(amazonS3, bucket, prefix);
    }
}
