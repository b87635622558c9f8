package com.filelink.api.controller;

import com.filelink.api.service.DownloadService;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * Public side of a link. Anything that is not a live file answers with the same 404.
 */
@RestController
public class DownloadController {

    private final DownloadService downloadService;

    public DownloadController(DownloadService downloadService) {
        this.downloadService = downloadService;
    }

    // GET /d/{token}  short URL for "download"
    @GetMapping("/d/{token}")
    public ResponseEntity<Resource> download(@PathVariable String token) {
        DownloadService.Download download = downloadService.open(token);

        MediaType type;
        try {
            type = MediaType.parseMediaType(download.getFile().getContentType());
        } catch (RuntimeException e) {
            type = MediaType.APPLICATION_OCTET_STREAM;
        }

        // "attachment" forces the browser to download instead of opening
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(download.getFile().getOriginalFilename(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .contentType(type)
                .contentLength(download.getFile().getSize())
                .body(download.getResource());
    }
}
