package com.example.scenegen_backend.service.Interfaces;

import com.example.scenegen_backend.dto.SignedAccessGrant;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Object storage seen by the scene flow. Keys are forward-slash paths such as
 * {@code users/u1/Scenes/projA/scene-1-v1.mp4}.
 */
public interface StorageService {

    /** Keys starting with {@code prefix}, sorted. The prefix may end mid-name. */
    List<String> list(String prefix);

    void upload(String objectKey, byte[] bytes);

    /** Missing keys are ignored. */
    void remove(Collection<String> objectKeys);

    void copy(String sourceKey, String targetKey);

    SignedAccessGrant createSignedUrl(String objectKey, Duration ttl);

    /** Unsigned URL, only for keys under the public area. */
    String publicUrl(String objectKey);

    String publicKeyFor(String sourceKey);

    boolean exists(String objectKey);

    byte[] read(String objectKey);

    Path resolve(String objectKey);

    boolean verifySignature(String objectKey, long expiresEpochSecond, String signature);

    /** Reverses {@link #createSignedUrl} and {@link #publicUrl}; empty for foreign URLs. */
    Optional<String> objectKeyFromUrl(String url);
}
