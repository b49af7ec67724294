package com.example.hydrant.tool;

import com.example.hydrant.model.MimeClassification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Sniffs content with {@code file --brief --mime}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileCommandMimeTypeDetector implements MimeTypeDetector {

    private final CommandRunner commandRunner;

    @Value("${hydrant.tools.file:file}")
    private String fileBinary;

    @Value("${hydrant.tools.timeout:PT5M}")
    private Duration timeout;

    @Override
    public MimeClassification detect(Path file) {
        CommandResult result = commandRunner.run(
                List.of(fileBinary, "--brief", "--mime", file.toString()), timeout);
        if (!result.succeeded()) {
            throw ExternalToolException.nonZeroExit(fileBinary, result);
        }
        String line = result.stdout().lines().findFirst().orElse("");
        log.debug("MIME for {}: {}", file, line);
        return MimeClassification.parse(line);
    }
}
