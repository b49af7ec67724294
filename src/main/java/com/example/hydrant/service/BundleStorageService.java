package com.example.hydrant.service;

import com.example.hydrant.model.Bundle;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.time.Clock;
import java.time.LocalDate;

/**
 * Stores bundle JSON in the bundle bucket.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BundleStorageService {

    private final MinioClient minioClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${hydrant.storage.bucket:hydrant-bundles}")
    private String bucketName;

    @PostConstruct
    public void init() {
        try {
            boolean found = minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucketName).build());
            if (!found) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucketName).build());
                log.info("Created MinIO bucket: {}", bucketName);
            } else {
                log.info("MinIO bucket already exists: {}", bucketName);
            }
        } catch (Exception e) {
            log.error("Failed to initialize MinIO bucket: {}", bucketName, e);
        }
    }

    /**
     * Path: yy/MM/dd/bundleId.json
     *
     * @return the object name inside the bucket
     */
    public String store(Bundle bundle) {
        try {
            LocalDate now = LocalDate.now(clock);
            String datePath = String.format("%02d/%02d/%02d", now.getYear() % 100, now.getMonthValue(),
                    now.getDayOfMonth());
            String objectName = datePath + "/" + bundle.id() + ".json";

            byte[] json = objectMapper.writeValueAsBytes(bundle);
            minioClient.putObject(
                    PutObjectArgs.builder()
                            .bucket(bucketName)
                            .object(objectName)
                            .stream(new ByteArrayInputStream(json), json.length, -1)
                            .contentType("application/json")
                            .build());

            log.info("Stored bundle {} at {}/{}", bundle.id(), bucketName, objectName);
            return objectName;
        } catch (Exception e) {
            throw new RuntimeException("Failed to store bundle " + bundle.id(), e);
        }
    }
}
