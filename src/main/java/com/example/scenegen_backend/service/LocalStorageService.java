package com.example.scenegen_backend.service;

import com.example.scenegen_backend.dto.SignedAccessGrant;
import com.example.scenegen_backend.exception.StorageException;
import com.example.scenegen_backend.service.Interfaces.StorageService;
import com.example.scenegen_backend.util.Hmacs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Filesystem-backed storage. Signed URLs point at {@code /v1/files/signed/**} and carry an HMAC over
 * key and expiry; public objects live under the public prefix and are served unsigned.
 */
public class LocalStorageService implements StorageService {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalStorageService.class);
    private static final String SIGNED_PATH = "/v1/files/signed/";
    private static final String FILES_PATH = "/v1/files/";

    private final Path baseDir;
    private final String publicPrefix;
    private final String publicBaseUrl;
    private final String signingSecret;
    private final Clock clock;

    public LocalStorageService(Path baseDir, String publicPrefix, String publicBaseUrl, String signingSecret, Clock clock) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.publicPrefix = trimSlashes(publicPrefix);
        this.publicBaseUrl = publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
        this.signingSecret = signingSecret;
        this.clock = clock;

        try {
            Files.createDirectories(this.baseDir.resolve(this.publicPrefix));
            LOGGER.info("LocalStorageService ready. base={}, publicPrefix={}", this.baseDir, this.publicPrefix);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories", e);
        }
    }

    @Override
    public List<String> list(String prefix) {
        String normalized = normalizeKey(prefix == null ? "" : prefix);
        int slash = normalized.lastIndexOf('/');
        Path dir = slash < 0 ? baseDir : safeResolve(normalized.substring(0, slash));
        if (!Files.isDirectory(dir)) return List.of();
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .map(this::toKey)
                    .filter(k -> k.startsWith(normalized))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("List failed: " + prefix, e);
        }
    }

    @Override
    public void upload(String objectKey, byte[] bytes) {
        Path target = safeResolve(objectKey);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, bytes);
        } catch (IOException e) {
            throw new StorageException("Upload failed: " + objectKey, e);
        }
    }

    @Override
    public void remove(Collection<String> objectKeys) {
        for (String key : objectKeys) {
            try {
                Files.deleteIfExists(safeResolve(key));
            } catch (IOException e) {
                throw new StorageException("Delete failed: " + key, e);
            }
        }
    }

    @Override
    public void copy(String sourceKey, String targetKey) {
        Path source = safeResolve(sourceKey);
        Path target = safeResolve(targetKey);
        if (!Files.exists(source)) {
            throw new StorageException("Copy source missing: " + sourceKey);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.copy(source, target, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Copy failed " + sourceKey + " -> " + targetKey, e);
        }
    }

    @Override
    public SignedAccessGrant createSignedUrl(String objectKey, Duration ttl) {
        if (signingSecret == null || signingSecret.isBlank()) {
            throw new StorageException("storage.local.signing-secret is not configured");
        }
        String key = normalizeKey(objectKey);
        if (!Files.exists(safeResolve(key))) {
            throw new StorageException("Object not found: " + key);
        }
        long expires = Instant.now(clock).plus(ttl).getEpochSecond();
        String sig = Hmacs.sha256Hex(signingSecret, key + "\n" + expires);
        String url = publicBaseUrl + SIGNED_PATH + encodePath(key) + "?expires=" + expires + "&sig=" + sig;
        return new SignedAccessGrant(key, url, Instant.ofEpochSecond(expires));
    }

    @Override
    public String publicUrl(String objectKey) {
        String key = normalizeKey(objectKey);
        if (!key.startsWith(publicPrefix + "/")) {
            throw new StorageException("Not a public object: " + key);
        }
        return publicBaseUrl + FILES_PATH + encodePath(key);
    }

    @Override
    public String publicKeyFor(String sourceKey) {
        return publicPrefix + "/" + normalizeKey(sourceKey);
    }

    @Override
    public boolean exists(String objectKey) {
        return Files.exists(safeResolve(objectKey));
    }

    @Override
    public byte[] read(String objectKey) {
        try {
            return Files.readAllBytes(safeResolve(objectKey));
        } catch (IOException e) {
            throw new StorageException("Read failed: " + objectKey, e);
        }
    }

    @Override
    public Path resolve(String objectKey) {
        return safeResolve(objectKey);
    }

    @Override
    public boolean verifySignature(String objectKey, long expiresEpochSecond, String signature) {
        if (signingSecret == null || signingSecret.isBlank() || signature == null) return false;
        String expected = Hmacs.sha256Hex(signingSecret, normalizeKey(objectKey) + "\n" + expiresEpochSecond);
        return Hmacs.constantTimeEquals(expected, signature);
    }

    @Override
    public Optional<String> objectKeyFromUrl(String url) {
        if (url == null || !url.startsWith(publicBaseUrl)) return Optional.empty();
        String path;
        try {
            path = URI.create(url).getRawPath();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        if (path == null) return Optional.empty();
        String tail;
        if (path.startsWith(SIGNED_PATH)) {
            tail = path.substring(SIGNED_PATH.length());
        } else if (path.startsWith(FILES_PATH + publicPrefix + "/")) {
            tail = path.substring(FILES_PATH.length());
        } else {
            return Optional.empty();
        }
        return Optional.of(UriUtils.decode(tail, StandardCharsets.UTF_8));
    }

    private Path safeResolve(String objectKey) {
        if (objectKey == null || objectKey.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        Path p = baseDir.resolve(normalizeKey(objectKey)).normalize();
        if (!p.startsWith(baseDir)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + objectKey);
        }
        return p;
    }

    private String toKey(Path file) {
        return baseDir.relativize(file).toString().replace('\\', '/');
    }

    private static String normalizeKey(String key) {
        // Force forward slashes; strip leading slashes
        return key.replace('\\', '/').replaceAll("^/+", "");
    }

    private static String trimSlashes(String s) {
        return s == null ? "" : s.replaceAll("^/+", "").replaceAll("/+$", "");
    }

    private static String encodePath(String key) {
        return Arrays.stream(key.split("/"))
                .map(seg -> UriUtils.encodePathSegment(seg, StandardCharsets.UTF_8))
                .collect(Collectors.joining("/"));
    }
}
