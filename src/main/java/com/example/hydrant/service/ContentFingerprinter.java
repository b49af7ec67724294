package com.example.hydrant.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Streaming content hash. Files are read in fixed-size chunks, never loaded whole.
 */
@Component
public class ContentFingerprinter {

    private final String algorithm;
    private final int bufferSize;

    public ContentFingerprinter(@Value("${hydrant.classifier.hash-algorithm:SHA-256}") String algorithm,
                                @Value("${hydrant.classifier.buffer-size:8192}") int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("buffer size must be positive: " + bufferSize);
        }
        this.algorithm = algorithm;
        this.bufferSize = bufferSize;
        newDigest(); // fail at start-up on an unknown algorithm
    }

    public String fingerprint(Path file) throws IOException {
        try (InputStream is = Files.newInputStream(file)) {
            return fingerprint(is);
        }
    }

    public String fingerprint(InputStream is) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[bufferSize];
        int read;
        while ((read = is.read(buffer)) != -1) {
            digest.update(buffer, 0, read);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public String getAlgorithm() {
        return algorithm;
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unsupported hash algorithm: " + algorithm, e);
        }
    }
}
