package com.example.logstore.files;

import com.example.logstore.exceptions.InvalidQueryException;
import com.example.logstore.exceptions.SegmentActiveException;
import com.example.logstore.exceptions.SegmentNotFoundException;
import com.example.logstore.files.DTOs.FileContentResponse;
import com.example.logstore.files.DTOs.SegmentInfoResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(FileController.class)
public class FileControllerTest {

    private static final Instant T0 = Instant.parse("2026-10-18T10:00:00Z");

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    private FileService fileService;

    private static SegmentInfoResponse info(String id, boolean sealed) {
        return new SegmentInfoResponse(id, id + ".log", 2048, "2.00 KB", 12, T0, T0.plusSeconds(30),
                T0.plusSeconds(30), sealed, false, "/var/log/store/" + id + ".log");
    }

    @Test
    void shouldListFiles() throws Exception {
        when(fileService.listFiles()).thenReturn(List.of(
                info("app_2026-10-18_002", false),
                info("app_2026-10-18_001", true)));

        mockMvc.perform(get("/api/v1/files"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].name").value("app_2026-10-18_002.log"))
                .andExpect(jsonPath("$.data[0].size_human").value("2.00 KB"))
                .andExpect(jsonPath("$.data[1].sealed").value(true));
    }

    @Test
    void shouldReturnNotFoundForUnknownFile() throws Exception {
        when(fileService.getFile("missing.log")).thenThrow(new SegmentNotFoundException("missing"));

        mockMvc.perform(get("/api/v1/files/missing.log"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value(1004));
    }

    @Test
    void shouldReturnFileContent() throws Exception {
        when(fileService.readContent("app_2026-10-18_001.log", 10, null, "boom"))
                .thenReturn(new FileContentResponse("app_2026-10-18_001.log",
                        List.of("{\"id\":1,\"message\":\"boom\"}"), 1, 1, 0, 10, "boom"));

        mockMvc.perform(get("/api/v1/files/content/app_2026-10-18_001.log")
                        .param("limit", "10")
                        .param("search", "boom"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.total_lines").value(1))
                .andExpect(jsonPath("$.data.lines[0]").value("{\"id\":1,\"message\":\"boom\"}"));
    }

    @Test
    void shouldRejectDeletingActiveFile() throws Exception {
        doThrow(new SegmentActiveException("app_2026-10-18_002")).when(fileService).deleteFile("app_2026-10-18_002.log");

        mockMvc.perform(delete("/api/v1/files/app_2026-10-18_002.log"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value(1005));
    }

    @Test
    void shouldDeleteSealedFile() throws Exception {
        mockMvc.perform(delete("/api/v1/files/app_2026-10-18_001.log"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        verify(fileService).deleteFile("app_2026-10-18_001.log");
    }

    @Test
    void shouldRejectInvalidFileName() throws Exception {
        when(fileService.getFile("..secret")).thenThrow(new InvalidQueryException("invalid file name: ..secret"));

        mockMvc.perform(get("/api/v1/files/..secret"))
                .andExpect(status().isBadRequest());
    }
}
