package com.example.hydrant.tool;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * 24-bit colour multi-page TIFF through Ghostscript.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GhostscriptRasterizer implements Rasterizer {

    private final CommandRunner commandRunner;

    @Value("${hydrant.tools.ghostscript:gs}")
    private String gsBinary;

    @Value("${hydrant.tools.timeout:PT5M}")
    private Duration timeout;

    @Override
    public void rasterize(Path document, Path target, int dpi) {
        List<String> command = List.of(
                gsBinary,
                "-q",
                "-dNOPAUSE",
                "-dBATCH",
                "-sDEVICE=tiff24nc",
                "-r" + dpi,
                "-sOutputFile=" + target,
                document.toString());

        CommandResult result = commandRunner.run(command, timeout);
        if (!result.succeeded()) {
            throw ExternalToolException.nonZeroExit(gsBinary, result);
        }
        log.info("Rasterized {} to {} at {} dpi", document, target, dpi);
    }
}
