package com.example.hydrant.tool;

import com.example.hydrant.model.MimeClassification;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolAdaptersTest {

    private static final Duration TIMEOUT = Duration.ofMinutes(5);

    @Mock
    private CommandRunner commandRunner;

    @Captor
    private ArgumentCaptor<List<String>> command;

    @TempDir
    Path tempDir;

    private <T> T configure(T adapter, String binaryField, String binary) {
        ReflectionTestUtils.setField(adapter, binaryField, binary);
        ReflectionTestUtils.setField(adapter, "timeout", TIMEOUT);
        return adapter;
    }

    @Test
    void fileDetector_ParsesFirstLine() {
        FileCommandMimeTypeDetector detector =
                configure(new FileCommandMimeTypeDetector(commandRunner), "fileBinary", "file");
        when(commandRunner.run(anyList(), eq(TIMEOUT)))
                .thenReturn(new CommandResult(0, "application/pdf; charset=binary\n", ""));

        MimeClassification mime = detector.detect(Path.of("/data/in/report.pdf"));

        assertEquals(new MimeClassification("application", "pdf", "binary"), mime);
        verify(commandRunner).run(command.capture(), eq(TIMEOUT));
        assertEquals(List.of("file", "--brief", "--mime", "/data/in/report.pdf"), command.getValue());
    }

    @Test
    void fileDetector_NonZeroExitThrows() {
        FileCommandMimeTypeDetector detector =
                configure(new FileCommandMimeTypeDetector(commandRunner), "fileBinary", "file");
        when(commandRunner.run(anyList(), any(Duration.class)))
                .thenReturn(new CommandResult(1, "", "cannot open"));

        ExternalToolException ex = assertThrows(ExternalToolException.class,
                () -> detector.detect(Path.of("/data/in/missing.pdf")));

        assertEquals("file: exited with status 1 (cannot open)", ex.getMessage());
    }

    @Test
    void ghostscript_UsesConfiguredResolution() {
        GhostscriptRasterizer rasterizer =
                configure(new GhostscriptRasterizer(commandRunner), "gsBinary", "gs");
        when(commandRunner.run(anyList(), eq(TIMEOUT))).thenReturn(new CommandResult(0, "", ""));

        rasterizer.rasterize(Path.of("/in/scan.pdf"), Path.of("/work/tx-1.tiff"), 600);

        verify(commandRunner).run(command.capture(), eq(TIMEOUT));
        assertTrue(command.getValue().contains("-sDEVICE=tiff24nc"));
        assertTrue(command.getValue().contains("-r600"));
        assertTrue(command.getValue().contains("-sOutputFile=/work/tx-1.tiff"));
        assertEquals("/in/scan.pdf", command.getValue().get(command.getValue().size() - 1));
    }

    @Test
    void tesseract_ReturnsHocrNextToOutputBase() throws Exception {
        TesseractOcrEngine engine =
                configure(new TesseractOcrEngine(commandRunner), "tesseractBinary", "tesseract");
        Path outputBase = tempDir.resolve("tx-1");
        when(commandRunner.run(anyList(), eq(TIMEOUT))).thenAnswer(inv -> {
            Files.writeString(tempDir.resolve("tx-1.hocr"), "<html/>");
            return new CommandResult(0, "", "");
        });

        Path hocr = engine.recognize(tempDir.resolve("tx-1.tiff"), outputBase, "eng");

        assertEquals(tempDir.resolve("tx-1.hocr"), hocr);
        verify(commandRunner).run(eq(List.of("tesseract", tempDir.resolve("tx-1.tiff").toString(),
                outputBase.toString(), "hocr", "-l", "eng")), eq(TIMEOUT));
    }

    @Test
    void tesseract_MissingOutputThrows() {
        TesseractOcrEngine engine =
                configure(new TesseractOcrEngine(commandRunner), "tesseractBinary", "tesseract");
        when(commandRunner.run(anyList(), eq(TIMEOUT))).thenReturn(new CommandResult(0, "", ""));

        assertThrows(ExternalToolException.class,
                () -> engine.recognize(tempDir.resolve("tx-1.tiff"), tempDir.resolve("tx-1"), "eng"));
    }

    @Test
    void pdftotext_ReadsAndRemovesTextFile() throws Exception {
        PdfToTextExtractor extractor =
                configure(new PdfToTextExtractor(commandRunner), "pdftotextBinary", "pdftotext");
        Path[] written = new Path[1];
        when(commandRunner.run(anyList(), eq(TIMEOUT))).thenAnswer(inv -> {
            List<String> command = inv.getArgument(0);
            written[0] = Path.of(command.get(2));
            Files.writeString(written[0], "Patient: John Doe\n");
            return new CommandResult(0, "", "");
        });

        String text = extractor.extractText(Path.of("/in/report.pdf"), tempDir);

        assertEquals("Patient: John Doe\n", text);
        assertFalse(Files.exists(written[0]));
    }

    @Test
    void pdftotext_NonZeroExitThrows() {
        PdfToTextExtractor extractor =
                configure(new PdfToTextExtractor(commandRunner), "pdftotextBinary", "pdftotext");
        when(commandRunner.run(anyList(), eq(TIMEOUT))).thenReturn(new CommandResult(1, "", "Syntax Error"));

        assertThrows(ExternalToolException.class, () -> extractor.extractText(Path.of("/in/broken.pdf"), tempDir));
    }
}
