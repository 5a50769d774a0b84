package com.example.logstore.files;

import com.example.logstore.files.DTOs.FileContentResponse;
import com.example.logstore.files.DTOs.SegmentInfoResponse;
import com.example.logstore.logs.DTOs.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1/files")
public class FileController {

    private final FileService fileService;

    public FileController(FileService fileService) {
        this.fileService = fileService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<SegmentInfoResponse>>> listFiles() {
        List<SegmentInfoResponse> files = fileService.listFiles();
        return ResponseEntity.ok(ApiResponse.ok(files, "Found " + files.size() + " log files"));
    }

    @GetMapping("/{name}")
    public ResponseEntity<ApiResponse<SegmentInfoResponse>> getFile(@PathVariable String name) {
        return ResponseEntity.ok(ApiResponse.ok(fileService.getFile(name), "File info retrieved"));
    }

    @GetMapping("/content/{name}")
    public ResponseEntity<ApiResponse<FileContentResponse>> getFileContent(
            @PathVariable String name,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset,
            @RequestParam(required = false) String search) {
        FileContentResponse content = fileService.readContent(name, limit, offset, search);
        return ResponseEntity.ok(ApiResponse.ok(content, "File content retrieved"));
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<ApiResponse<Void>> deleteFile(@PathVariable String name) {
        fileService.deleteFile(name);
        return ResponseEntity.ok(ApiResponse.ok(null, "File deleted: " + name));
    }
}
