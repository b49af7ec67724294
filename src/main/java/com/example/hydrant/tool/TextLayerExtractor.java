package com.example.hydrant.tool;

import java.nio.file.Path;

public interface TextLayerExtractor {

    /**
     * @return the document's embedded text, empty when it has no text layer
     */
    String extractText(Path document, Path workDir);
}
