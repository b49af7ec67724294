package com.example.hydrant.controller;

import com.example.hydrant.model.EnqueuedFile;
import com.example.hydrant.service.IngestionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/api/files")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;

    @PostMapping("/upload")
    public ResponseEntity<List<EnqueuedFile>> upload(@RequestParam("files") List<MultipartFile> files) {
        return ResponseEntity.ok(ingestionService.processUpload(files));
    }

    @PostMapping("/enqueue")
    public ResponseEntity<List<EnqueuedFile>> enqueue(@RequestBody List<String> fileReferences) {
        return ResponseEntity.ok(ingestionService.enqueuePaths(fileReferences));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
