package com.example.hydrant.service;

import com.example.hydrant.model.EnqueuedFile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    @Mock
    private WorkQueue workQueue;

    @InjectMocks
    private IngestionService ingestionService;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setup() {
        ReflectionTestUtils.setField(ingestionService, "inboxDir", tempDir.resolve("inbox"));
    }

    @Test
    void processUpload_StoresAndEnqueuesEachFile() throws Exception {
        // Arrange
        MockMultipartFile first = new MockMultipartFile("files", "report.pdf", "application/pdf", "%PDF-1.4".getBytes());
        MockMultipartFile second = new MockMultipartFile("files", "scan.png", "image/png", new byte[]{1, 2, 3});
        when(workQueue.enqueue(anyString())).thenReturn("item-1", "item-2");

        // Act
        List<EnqueuedFile> enqueued = ingestionService.processUpload(List.of(first, second));

        // Assert
        assertEquals(2, enqueued.size());
        assertEquals("item-1", enqueued.get(0).queueItemId());
        Path stored = Path.of(enqueued.get(0).fileReference());
        assertTrue(stored.getFileName().toString().endsWith("-report.pdf"));
        assertEquals("%PDF-1.4", Files.readString(stored));
        verify(workQueue).enqueue(stored.toString());
    }

    @Test
    void processUpload_StripsClientDirectories() {
        MockMultipartFile file = new MockMultipartFile("files", "../../etc/report.pdf", "application/pdf", new byte[]{1});
        when(workQueue.enqueue(anyString())).thenReturn("item-1");

        List<EnqueuedFile> enqueued = ingestionService.processUpload(List.of(file));

        Path stored = Path.of(enqueued.get(0).fileReference());
        assertEquals(tempDir.resolve("inbox").toAbsolutePath(), stored.getParent());
    }

    @Test
    void enqueuePaths_EnqueuesInOrder() {
        when(workQueue.enqueue("/data/a.pdf")).thenReturn("item-a");
        when(workQueue.enqueue("/data/b.pdf")).thenReturn("item-b");

        List<EnqueuedFile> enqueued = ingestionService.enqueuePaths(List.of("/data/a.pdf", "/data/b.pdf"));

        assertEquals(List.of(new EnqueuedFile("item-a", "/data/a.pdf"), new EnqueuedFile("item-b", "/data/b.pdf")),
                enqueued);
    }

    @Test
    void enqueuePaths_RejectsBlankReferenceBeforeEnqueueing() {
        assertThrows(IllegalArgumentException.class,
                () -> ingestionService.enqueuePaths(Arrays.asList("/data/a.pdf", " ", null)));

        verifyNoInteractions(workQueue);
    }
}
