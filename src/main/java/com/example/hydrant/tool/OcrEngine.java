package com.example.hydrant.tool;

import java.nio.file.Path;

public interface OcrEngine {

    /**
     * Recognises text in {@code image} and writes positional markup next to {@code outputBase}.
     *
     * @return the markup file that was produced
     */
    Path recognize(Path image, Path outputBase, String language);
}
