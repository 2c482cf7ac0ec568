/*
 * Copyright 2025 VillageCompute Inc.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package villagecompute.inspections.config;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Produces the S3 client and presigner for S3-compatible object storage (Cloudflare R2 in production, MinIO in dev).
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code inspections.storage.endpoint} - S3 endpoint URL</li>
 * <li>{@code inspections.storage.region} - region, {@code auto} for R2</li>
 * <li>{@code inspections.storage.access-key-id} / {@code secret-access-key} - static credentials</li>
 * </ul>
 *
 * <p>
 * Path-style addressing is always enabled; R2 and MinIO both accept it.
 */
@ApplicationScoped
public class StorageClientFactory {

    private static final Logger LOG = Logger.getLogger(StorageClientFactory.class);

    @ConfigProperty(
            name = "inspections.storage.endpoint")
    String endpoint;

    @ConfigProperty(
            name = "inspections.storage.region",
            defaultValue = "auto")
    String region;

    @ConfigProperty(
            name = "inspections.storage.access-key-id")
    String accessKeyId;

    @ConfigProperty(
            name = "inspections.storage.secret-access-key")
    String secretAccessKey;

    @Produces
    @ApplicationScoped
    public S3Client createS3Client() {
        LOG.infof("Creating S3 client: endpoint=%s, region=%s", endpoint, region);
        return S3Client.builder().endpointOverride(URI.create(endpoint)).region(Region.of(region))
                .credentialsProvider(credentials())
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build())
                .httpClientBuilder(UrlConnectionHttpClient.builder()).build();
    }

    @Produces
    @ApplicationScoped
    public S3Presigner createS3Presigner() {
        return S3Presigner.builder().endpointOverride(URI.create(endpoint)).region(Region.of(region))
                .credentialsProvider(credentials())
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build()).build();
    }

    void closeS3Client(@Disposes S3Client client) {
        client.close();
    }

    void closeS3Presigner(@Disposes S3Presigner presigner) {
        presigner.close();
    }

    private StaticCredentialsProvider credentials() {
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
    }
}
