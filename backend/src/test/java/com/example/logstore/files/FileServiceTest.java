package com.example.logstore.files;

import com.example.logstore.exceptions.InvalidQueryException;
import com.example.logstore.files.DTOs.FileContentResponse;
import com.example.logstore.files.DTOs.SegmentInfoResponse;
import com.example.logstore.storage.segment.LinesPage;
import com.example.logstore.storage.segment.SegmentInfo;
import com.example.logstore.storage.segment.SegmentManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FileServiceTest {

    private static final Instant T0 = Instant.parse("2026-10-18T10:00:00Z");

    @Mock
    private SegmentManager segmentManager;

    @InjectMocks
    private FileService fileService;

    // ==================== File name validation ====================

    @Test
    void shouldStripLogExtensionFromFileName() {
        assertThat(fileService.segmentId("app_2026-10-18_001.log")).isEqualTo("app_2026-10-18_001");
        assertThat(fileService.segmentId("app_2026-10-18_001")).isEqualTo("app_2026-10-18_001");
        assertThat(fileService.segmentId("app_2026-10-18_001.log.gz")).isEqualTo("app_2026-10-18_001");
    }

    @Test
    void shouldRejectPathTraversal() {
        assertThatThrownBy(() -> fileService.segmentId("../etc/passwd")).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> fileService.segmentId("a\\b.log")).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> fileService.segmentId(" ")).isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> fileService.segmentId("x".repeat(256))).isInstanceOf(InvalidQueryException.class);
    }

    // ==================== Listing / content ====================

    @Test
    void shouldListMostRecentlyWrittenFirst() {
        when(segmentManager.listSegments()).thenReturn(List.of(
                new SegmentInfo("app_2026-10-17_001", "app_2026-10-17_001.log.gz", "/d/app_2026-10-17_001.log.gz",
                        512, 3, T0.minusSeconds(86_400), T0.minusSeconds(86_000), T0.minusSeconds(86_000), true, true),
                new SegmentInfo("app_2026-10-18_001", "app_2026-10-18_001.log", "/d/app_2026-10-18_001.log",
                        3 * 1024 * 1024, 9, T0, T0, T0, false, false)));

        List<SegmentInfoResponse> files = fileService.listFiles();

        assertThat(files).extracting(SegmentInfoResponse::id).containsExactly("app_2026-10-18_001", "app_2026-10-17_001");
        assertThat(files.get(0).sizeHuman()).isEqualTo("3.00 MB");
        assertThat(files.get(1).sizeHuman()).isEqualTo("512 B");
        assertThat(files.get(1).compressed()).isTrue();
        assertThat(files.get(1).name()).isEqualTo("app_2026-10-17_001.log.gz");
    }

    @Test
    void shouldApplyContentDefaults() {
        when(segmentManager.segmentInfo("app_2026-10-18_001")).thenReturn(new SegmentInfo("app_2026-10-18_001",
                "app_2026-10-18_001.log", "/d/app_2026-10-18_001.log", 4, 1, T0, T0, T0, false, false));
        when(segmentManager.readContent("app_2026-10-18_001", 1000, 0, null))
                .thenReturn(new LinesPage(List.of("line"), 1));

        FileContentResponse content = fileService.readContent("app_2026-10-18_001.log", null, -1, "");

        assertThat(content.limit()).isEqualTo(1000);
        assertThat(content.offset()).isZero();
        assertThat(content.returned()).isEqualTo(1);
        assertThat(content.fileName()).isEqualTo("app_2026-10-18_001.log");
    }

    @Test
    void shouldDeleteBySegmentId() throws IOException {
        fileService.deleteFile("app_2026-10-17_001.log");

        verify(segmentManager).deleteSegment("app_2026-10-17_001");
    }

    @Test
    void shouldFormatFileSizes() {
        assertThat(FileService.formatFileSize(0)).isEqualTo("0 B");
        assertThat(FileService.formatFileSize(1023)).isEqualTo("1023 B");
        assertThat(FileService.formatFileSize(1536)).isEqualTo("1.50 KB");
        assertThat(FileService.formatFileSize(5L * 1024 * 1024 * 1024)).isEqualTo("5.00 GB");
    }
}
