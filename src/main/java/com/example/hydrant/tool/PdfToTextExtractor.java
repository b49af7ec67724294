package com.example.hydrant.tool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class PdfToTextExtractor implements TextLayerExtractor {

    private final CommandRunner commandRunner;

    @Value("${hydrant.tools.pdftotext:pdftotext}")
    private String pdftotextBinary;

    @Value("${hydrant.tools.timeout:PT5M}")
    private Duration timeout;

    @Override
    public String extractText(Path document, Path workDir) {
        try (ScopedArtifact text = ScopedArtifact.create(workDir, "text-layer-", ".txt")) {
            CommandResult result = commandRunner.run(
                    List.of(pdftotextBinary, document.toString(), text.path().toString()), timeout);
            if (!result.succeeded()) {
                throw ExternalToolException.nonZeroExit(pdftotextBinary, result);
            }
            if (!Files.exists(text.path())) {
                return "";
            }
            return Files.readString(text.path(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExternalToolException(pdftotextBinary, "could not read extracted text", e);
        }
    }
}
