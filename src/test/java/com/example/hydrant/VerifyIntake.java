package com.example.hydrant;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestTemplate;

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;

/**
 * Manual smoke check against a running instance (not part of the test run).
 */
public class VerifyIntake {

    private static final String API_URL = "http://localhost:8080/api/files/upload";

    public static void main(String[] args) throws IOException {
        RestTemplate restTemplate = new RestTemplateBuilder().build();

        // 1. Create a plain-text document; it is its own text layer, so no OCR tools are needed
        File note = createDummyFile("hydrant-note.txt", "Patient: John Doe\nDOB: 1970-01-01\n");

        // 2. Prepare Multipart Request
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("files", new FileSystemResource(note));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        HttpEntity<MultiValueMap<String, Object>> requestEntity = new HttpEntity<>(body, headers);

        // 3. Send Request
        System.out.println("Sending upload request to " + API_URL);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(API_URL, requestEntity, String.class);
            System.out.println("Enqueued: " + response.getBody());
            System.out.println("Verify in Elasticsearch (http://localhost:9200/hydrant-jobs-*/_search)");
            System.out.println("Verify in MinIO Console (http://localhost:9001 -> hydrant-bundles)");
        } catch (Exception e) {
            System.err.println("Request failed: " + e.getMessage());
            e.printStackTrace();
        }

        // Cleanup
        if (!note.delete()) {
            System.err.println("Could not delete " + note);
        }
    }

    private static File createDummyFile(String name, String content) throws IOException {
        File file = new File(name);
        try (FileWriter writer = new FileWriter(file)) {
            writer.write(content);
        }
        return file;
    }
}
