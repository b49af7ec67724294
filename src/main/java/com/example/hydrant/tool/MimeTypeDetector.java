package com.example.hydrant.tool;

import com.example.hydrant.model.MimeClassification;

import java.nio.file.Path;

public interface MimeTypeDetector {

    MimeClassification detect(Path file);
}
