package com.example.scenegen_backend.controller;

import com.example.scenegen_backend.config.StorageProperties;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.service.Interfaces.StorageService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.io.File;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;

@RestController
@RequestMapping("/v1/files")
public class FileController {

    private final StorageService storage;
    private final StorageProperties props;
    private final Clock clock;

    public FileController(StorageService storage, StorageProperties props, Clock clock) {
        this.storage = storage;
        this.props = props;
        this.clock = clock;
    }

    @GetMapping(value = "/signed/**", produces = MediaType.ALL_VALUE)
    public ResponseEntity<Resource> signed(HttpServletRequest req,
                                           @RequestParam("expires") long expires,
                                           @RequestParam("sig") String sig) {
        String objectKey = extractTailFromWildcard(req, "/v1/files/signed/");
        if (!storage.verifySignature(objectKey, expires, sig)) {
            throw SceneGenException.forbidden("Invalid signature");
        }
        if (clock.instant().getEpochSecond() >= expires) {
            throw new ResponseStatusException(HttpStatus.GONE, "Signed URL expired");
        }
        return serve(objectKey);
    }

    @GetMapping(value = "/public/**", produces = MediaType.ALL_VALUE)
    public ResponseEntity<Resource> publicObject(HttpServletRequest req) {
        String tail = extractTailFromWildcard(req, "/v1/files/public/");
        String area = props.getPublicPrefix() + "/";
        String objectKey = normalize(area + tail);
        if (!objectKey.startsWith(area)) {
            throw SceneGenException.forbidden("Path outside the public area");
        }
        return serve(objectKey);
    }

    private ResponseEntity<Resource> serve(String objectKey) {
        if (objectKey.isBlank() || !storage.exists(objectKey)) {
            throw SceneGenException.notFound("File not found");
        }
        Path file = storage.resolve(objectKey);
        if (!Files.isRegularFile(file)) {
            throw SceneGenException.notFound("File not found");
        }
        FileSystemResource resource = new FileSystemResource(file);
        MediaType type = MediaTypeFactory.getMediaType(resource).orElse(MediaType.APPLICATION_OCTET_STREAM);
        return ResponseEntity.ok()
                .contentType(type)
                .header(HttpHeaders.CACHE_CONTROL, "private, max-age=300")
                .body(resource);
    }

    private static String normalize(String key) {
        return Path.of(key.replace('\\', '/')).normalize().toString().replace(File.separatorChar, '/');
    }

    private static String extractTailFromWildcard(HttpServletRequest req, String prefix) {
        String uri = URLDecoder.decode(req.getRequestURI(), StandardCharsets.UTF_8);
        int i = uri.indexOf(prefix);
        if (i < 0) throw SceneGenException.validation("Bad path");
        String tail = uri.substring(i + prefix.length());
        while (tail.startsWith("/")) tail = tail.substring(1);
        return tail;
    }
}
