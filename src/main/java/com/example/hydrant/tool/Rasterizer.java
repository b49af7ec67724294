package com.example.hydrant.tool;

import java.nio.file.Path;

public interface Rasterizer {

    /**
     * Renders every page of {@code document} into one multi-page raster image at {@code target}.
     */
    void rasterize(Path document, Path target, int dpi);
}
