package com.example.hydrant.service;

import com.example.hydrant.model.ExtractionResult;
import com.example.hydrant.model.Job;
import com.example.hydrant.model.MimeClassification;
import com.example.hydrant.model.SourceKind;
import com.example.hydrant.tool.ExternalToolException;
import com.example.hydrant.tool.OcrEngine;
import com.example.hydrant.tool.Rasterizer;
import com.example.hydrant.tool.ScopedArtifact;
import com.example.hydrant.tool.TextLayerExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Chooses between the document's own text layer and rasterize + OCR, and runs the chosen path.
 * <p>
 * PDFs (and anything unclassified) try the text layer first; OCR only runs when that text is
 * blank. Images go straight to OCR. Plain-text files are their own text layer.
 * The raster image is always a temporary artifact and is removed on every exit path.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExtractionDecider {

    public static final String TEXT_EXTENSION = ".txt";

    private final TextLayerExtractor textLayerExtractor;
    private final Rasterizer rasterizer;
    private final OcrEngine ocrEngine;

    @Value("${hydrant.extraction.dpi:600}")
    private int dpi;

    @Value("${hydrant.extraction.language:eng}")
    private String language;

    @Value("${hydrant.extraction.work-dir:${java.io.tmpdir}/hydrant}")
    private Path workDir;

    /**
     * @param outputBase where the result is written: {@code <outputBase>.txt} for text,
     *                   {@code <outputBase>.hocr} for OCR markup
     * @throws ExtractionException when any tool fails
     */
    public ExtractionResult extract(Job job, Path outputBase) {
        MimeClassification mime = job.mime();
        ExtractionState state = ExtractionState.START;

        try {
            Path source = Path.of(job.fileReference());
            Files.createDirectories(outputBase.toAbsolutePath().getParent());
            if (mime != null && mime.isImage()) {
                state = transition(job, state, ExtractionState.OCR);
                Path hocr = ocrEngine.recognize(source, outputBase, language);
                return markup(job, state, hocr);
            }

            state = transition(job, state, ExtractionState.TRY_TEXT_LAYER);
            String text = mime != null && mime.isText()
                    ? new String(Files.readAllBytes(source), charsetOf(mime))
                    : textLayerExtractor.extractText(source, workDir);

            String trimmed = text == null ? "" : text.strip();
            if (!trimmed.isEmpty() || (mime != null && mime.isText())) {
                Path out = outputBase.resolveSibling(outputBase.getFileName() + TEXT_EXTENSION);
                Files.writeString(out, trimmed, StandardCharsets.UTF_8);
                transition(job, state, ExtractionState.EXTRACTED_TEXT);
                return new ExtractionResult(SourceKind.TEXT_LAYER, trimmed, job.transactionId(), out);
            }

            state = transition(job, state, ExtractionState.RASTERIZE);
            try (ScopedArtifact raster = ScopedArtifact.create(workDir, job.transactionId() + "-", ".tiff")) {
                rasterizer.rasterize(source, raster.path(), dpi);

                state = transition(job, state, ExtractionState.OCR);
                Path hocr = ocrEngine.recognize(raster.path(), outputBase, language);
                return markup(job, state, hocr);
            }
        } catch (ExternalToolException | IOException | InvalidPathException e) {
            transition(job, state, ExtractionState.FAILED);
            log.error("Extraction failed for {} (transaction {}) in state {}",
                    job.fileReference(), job.transactionId(), state, e);
            throw new ExtractionException(job.transactionId(), state, e.getMessage(), e);
        }
    }

    private ExtractionResult markup(Job job, ExtractionState state, Path hocr) throws IOException {
        String payload = Files.readString(hocr, StandardCharsets.UTF_8);
        transition(job, state, ExtractionState.EXTRACTED_MARKUP);
        return new ExtractionResult(SourceKind.OCR, payload, job.transactionId(), hocr);
    }

    private static ExtractionState transition(Job job, ExtractionState from, ExtractionState to) {
        log.debug("Transaction {}: {} -> {}", job.transactionId(), from, to);
        return to;
    }

    private static Charset charsetOf(MimeClassification mime) {
        if (mime.charset() != null) {
            try {
                return Charset.forName(mime.charset());
            } catch (IllegalArgumentException e) {
                log.debug("Unknown charset '{}', reading as UTF-8", mime.charset());
            }
        }
        return StandardCharsets.UTF_8;
    }
}
