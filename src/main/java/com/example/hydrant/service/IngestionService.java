package com.example.hydrant.service;

import com.example.hydrant.model.EnqueuedFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Producer side of the work queue: puts files into the inbox and enqueues their paths.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionService {

    private final WorkQueue workQueue;

    @Value("${hydrant.inbox.dir:${java.io.tmpdir}/hydrant/inbox}")
    private Path inboxDir;

    public List<EnqueuedFile> processUpload(List<MultipartFile> files) {
        List<EnqueuedFile> enqueued = new ArrayList<>();
        try {
            Files.createDirectories(inboxDir);
            for (MultipartFile file : files) {
                String originalFilename = StringUtils.getFilename(file.getOriginalFilename());
                String name = UUID.randomUUID() + "-" + (StringUtils.hasText(originalFilename) ? originalFilename : "upload");
                Path target = inboxDir.resolve(name).toAbsolutePath();

                try (InputStream is = file.getInputStream()) {
                    Files.copy(is, target);
                }
                log.info("Stored upload {} at {}", originalFilename, target);

                String itemId = workQueue.enqueue(target.toString());
                enqueued.add(new EnqueuedFile(itemId, target.toString()));
            }
        } catch (IOException e) {
            log.error("Upload failed after {} file(s)", enqueued.size(), e);
            throw new RuntimeException("Upload failed", e);
        }
        return enqueued;
    }

    public List<EnqueuedFile> enqueuePaths(List<String> fileReferences) {
        if (fileReferences.stream().anyMatch(reference -> !StringUtils.hasText(reference))) {
            throw new IllegalArgumentException("File references must not be blank");
        }
        List<EnqueuedFile> enqueued = new ArrayList<>();
        for (String reference : fileReferences) {
            enqueued.add(new EnqueuedFile(workQueue.enqueue(reference), reference));
        }
        return enqueued;
    }
}
