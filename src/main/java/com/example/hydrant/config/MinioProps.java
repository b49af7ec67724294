package com.example.hydrant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "minio")
public class MinioProps {
    private String endpoint;
    private String accessKey;
    private String secretKey;
}
