package com.example.hydrant.tool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Tesseract in hOCR mode; output lands at {@code <outputBase>.hocr}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TesseractOcrEngine implements OcrEngine {

    public static final String HOCR_EXTENSION = ".hocr";

    private final CommandRunner commandRunner;

    @Value("${hydrant.tools.tesseract:tesseract}")
    private String tesseractBinary;

    @Value("${hydrant.tools.timeout:PT5M}")
    private Duration timeout;

    @Override
    public Path recognize(Path image, Path outputBase, String language) {
        List<String> command = List.of(
                tesseractBinary, image.toString(), outputBase.toString(), "hocr", "-l", language);

        CommandResult result = commandRunner.run(command, timeout);
        if (!result.succeeded()) {
            throw ExternalToolException.nonZeroExit(tesseractBinary, result);
        }

        Path hocr = outputBase.resolveSibling(outputBase.getFileName() + HOCR_EXTENSION);
        if (!Files.exists(hocr)) {
            throw new ExternalToolException(tesseractBinary, "no output produced at " + hocr);
        }
        log.info("OCR completed, output: {}", hocr);
        return hocr;
    }
}
