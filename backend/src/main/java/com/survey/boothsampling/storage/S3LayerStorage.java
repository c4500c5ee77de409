package com.survey.boothsampling.storage;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsV2Request;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import com.survey.boothsampling.exception.LayerNotFoundException;
import com.survey.boothsampling.exception.LayerStorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * Layers in an S3 bucket. Every state is a folder under {@code prefix}; the layer of a kind is the
 * first GeoJSON object in that folder whose file name contains the kind token.
 */
@Slf4j
public class S3LayerStorage implements LayerStorage {

    private final AmazonS3 s3Client;
    private final String bucket;
    private final String prefix;

    public S3LayerStorage(AmazonS3 s3Client, String bucket, String prefix) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.prefix = prefix == null || prefix.isEmpty() || prefix.endsWith("/") ? nullToEmpty(prefix) : prefix + "/";
    }

    @Override
    public List<String> listStates() {
        TreeSet<String> states = new TreeSet<>();
        ListObjectsV2Request request = new ListObjectsV2Request()
                .withBucketName(bucket)
                .withPrefix(prefix)
                .withDelimiter("/");
        try {
            ListObjectsV2Result result;
            do {
                result = s3Client.listObjectsV2(request);
                for (String commonPrefix : result.getCommonPrefixes()) {
                    String state = commonPrefix.substring(prefix.length()).replaceAll("/+$", "");
                    if (!state.isEmpty()) {
                        states.add(state);
                    }
                }
                request.setContinuationToken(result.getNextContinuationToken());
            } while (result.isTruncated());
        } catch (AmazonServiceException e) {
            throw new LayerStorageException(
                    String.format("Failed to list states in s3://%s/%s", bucket, prefix), e);
        }
        return new ArrayList<>(states);
    }

    @Override
    public InputStream openLayer(String state, LayerKind kind) throws IOException {
        String statePrefix = prefix + state + "/";
        List<String> available = new ArrayList<>();
        try {
            ListObjectsV2Request request = new ListObjectsV2Request()
                    .withBucketName(bucket)
                    .withPrefix(statePrefix);
            ListObjectsV2Result result;
            do {
                result = s3Client.listObjectsV2(request);
                for (S3ObjectSummary summary : result.getObjectSummaries()) {
                    String fileName = fileName(summary.getKey());
                    if (!isGeoJson(fileName)) {
                        continue;
                    }
                    if (fileName.contains(kind.getFileToken())) {
                        log.debug("Opening {} layer for {} from s3://{}/{}", kind, state, bucket, summary.getKey());
                        return s3Client.getObject(bucket, summary.getKey()).getObjectContent();
                    }
                    available.add(fileName);
                }
                request.setContinuationToken(result.getNextContinuationToken());
            } while (result.isTruncated());
        } catch (AmazonServiceException e) {
            throw new IOException(String.format("Failed to read %s layer for %s from s3://%s/%s",
                    kind.getFileToken(), state, bucket, statePrefix), e);
        }
        throw new LayerNotFoundException(String.format(
                "No %s layer found for state %s. Available layers: %s", kind.getFileToken(), state, available));
    }

    @Override
    public String describe() {
        return "s3://" + bucket + "/" + prefix;
    }

    private static String fileName(String key) {
        return key.substring(key.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
    }

    private static boolean isGeoJson(String fileName) {
        return fileName.endsWith(".geojson") || fileName.endsWith(".json");
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
