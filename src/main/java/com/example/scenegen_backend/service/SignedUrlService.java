package com.example.scenegen_backend.service;

import com.example.scenegen_backend.config.LumaProperties;
import com.example.scenegen_backend.config.SceneProperties;
import com.example.scenegen_backend.dto.KeyframeUrls;
import com.example.scenegen_backend.dto.RefreshResult;
import com.example.scenegen_backend.dto.SignedAccessGrant;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.exception.StorageException;
import com.example.scenegen_backend.model.PublicMirror;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.repository.PublicMirrorRepository;
import com.example.scenegen_backend.repository.SceneRepository;
import com.example.scenegen_backend.service.Interfaces.StorageService;
import com.example.scenegen_backend.util.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues keyframe URLs for the provider and keeps the ones stored on a scene fresh.
 *
 * <p>Delivery policy: when the provider needs publicly dereferenceable URLs each source object is
 * mirrored into the public area exactly once and the public URL is cached; otherwise a signed URL
 * with the configured TTL is issued.
 */
@Service
public class SignedUrlService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SignedUrlService.class);

    private final StorageService storage;
    private final SceneRepository scenes;
    private final PublicMirrorRepository mirrors;
    private final SceneProperties sceneProps;
    private final LumaProperties lumaProps;
    private final Clock clock;

    public SignedUrlService(StorageService storage,
                            SceneRepository scenes,
                            PublicMirrorRepository mirrors,
                            SceneProperties sceneProps,
                            LumaProperties lumaProps,
                            Clock clock) {
        this.storage = storage;
        this.scenes = scenes;
        this.mirrors = mirrors;
        this.sceneProps = sceneProps;
        this.lumaProps = lumaProps;
        this.clock = clock;
    }

    public SignedAccessGrant issue(String objectKey, Duration ttl) {
        try {
            return storage.createSignedUrl(objectKey, ttl);
        } catch (StorageException e) {
            LOGGER.warn("SignedUrl issue FAIL key={} error={}", objectKey, e.getMessage());
            throw new SceneGenException(ErrorCode.STORAGE_ERROR, "Could not issue a signed URL for " + objectKey,
                    Map.of("objectKey", objectKey), null, e);
        }
    }

    /** A missing expiry counts as expired. */
    public boolean isExpired(Instant expiresAt) {
        return expiresAt == null || !clock.instant().isBefore(expiresAt);
    }

    public KeyframeUrls resolveKeyframes(String startKey, String endKey) {
        boolean hasEnd = endKey != null && !endKey.isBlank();
        if (lumaProps.isRequiresPublicUrls()) {
            String start = mirrorToPublic(startKey);
            String end = hasEnd ? mirrorToPublic(endKey) : null;
            return new KeyframeUrls(start, end, null);
        }
        SignedAccessGrant start = issue(startKey, sceneProps.getSignedUrlTtl());
        SignedAccessGrant end = hasEnd ? issue(endKey, sceneProps.getSignedUrlTtl()) : null;
        Instant expiresAt = end == null || start.expiresAt().isBefore(end.expiresAt()) ? start.expiresAt() : end.expiresAt();
        return new KeyframeUrls(start.url(), end == null ? null : end.url(), expiresAt);
    }

    /**
     * Copies {@code sourceKey} into the public area unless a mirror already exists. A copy failure
     * aborts the caller.
     */
    public String mirrorToPublic(String sourceKey) {
        Optional<PublicMirror> cached = mirrors.findBySourceKey(sourceKey);
        if (cached.isPresent()) {
            return cached.get().getPublicUrl();
        }
        String publicKey = storage.publicKeyFor(sourceKey);
        String publicUrl;
        try {
            storage.copy(sourceKey, publicKey);
            publicUrl = storage.publicUrl(publicKey);
        } catch (StorageException e) {
            LOGGER.warn("PublicMirror FAIL source={} error={}", sourceKey, e.getMessage());
            throw new SceneGenException(ErrorCode.STORAGE_ERROR, "Could not mirror keyframe to public storage",
                    Map.of("objectKey", sourceKey), null, e);
        }
        try {
            mirrors.saveAndFlush(new PublicMirror(sourceKey, publicKey, publicUrl));
            LOGGER.info("PublicMirror CREATED source={} public={}", sourceKey, publicKey);
        } catch (DataIntegrityViolationException race) {
            // another request mirrored the same object first; its row is authoritative
            return mirrors.findBySourceKey(sourceKey).map(PublicMirror::getPublicUrl).orElse(publicUrl);
        }
        return publicUrl;
    }

    public RefreshResult refresh(UUID sceneId, boolean force) {
        Scene scene = scenes.findActiveById(sceneId)
                .orElseThrow(() -> SceneGenException.notFound("Scene not found"));
        return refresh(scene, force);
    }

    /**
     * Re-issues the scene's keyframe URLs once they are expired (or always with {@code force}). On
     * failure the previous URLs stay in place and the next access tries again.
     */
    public RefreshResult refresh(Scene scene, boolean force) {
        if (!force && !isExpired(scene.getSignedUrlExpiresAt())) {
            return new RefreshResult(scene.getId(), false, scene.getStartFrameSignedUrl(),
                    scene.getEndFrameSignedUrl(), scene.getSignedUrlExpiresAt(), null);
        }
        try {
            KeyframeUrls urls = resolveKeyframes(scene.getStartKey(), scene.getEndKey());
            scenes.updateSignedUrls(scene.getId(), urls.startUrl(), urls.endUrl(), urls.expiresAt(), clock.instant());
            scene.setStartFrameSignedUrl(urls.startUrl());
            scene.setEndFrameSignedUrl(urls.endUrl());
            scene.setSignedUrlExpiresAt(urls.expiresAt());
            LOGGER.info("SignedUrl REFRESH sceneId={} expiresAt={}", scene.getId(), urls.expiresAt());
            return new RefreshResult(scene.getId(), true, urls.startUrl(), urls.endUrl(), urls.expiresAt(), null);
        } catch (SceneGenException e) {
            LOGGER.warn("SignedUrl REFRESH FAIL sceneId={} code={} error={}", scene.getId(), e.getCode(), e.getMessage());
            return new RefreshResult(scene.getId(), false, scene.getStartFrameSignedUrl(),
                    scene.getEndFrameSignedUrl(), scene.getSignedUrlExpiresAt(), e.getMessage());
        }
    }

    /**
     * Returns keyframe URLs that are safe to hand to the provider right now, reissuing them when the
     * stored ones are expired.
     */
    public KeyframeUrls ensureFresh(Scene scene) {
        String start = scene.getStartFrameSignedUrl();
        boolean publicMirror = lumaProps.isRequiresPublicUrls() && scene.getSignedUrlExpiresAt() == null;
        if (start != null && (publicMirror || !isExpired(scene.getSignedUrlExpiresAt()))) {
            return new KeyframeUrls(start, scene.getEndFrameSignedUrl(), scene.getSignedUrlExpiresAt());
        }
        RefreshResult refreshed = refresh(scene, true);
        if (!refreshed.refreshed()) {
            throw new SceneGenException(ErrorCode.STORAGE_ERROR, "Keyframe URLs expired and could not be reissued",
                    Map.of("sceneId", scene.getId().toString()));
        }
        return new KeyframeUrls(refreshed.startUrl(), refreshed.endUrl(), refreshed.expiresAt());
    }

    /** Fresh signed URL for an archived object, or null when issuance fails. */
    public String readUrlOrNull(String objectKey) {
        if (objectKey == null) return null;
        try {
            return issue(objectKey, sceneProps.getSignedUrlTtl()).url();
        } catch (SceneGenException e) {
            return null;
        }
    }

    public Optional<String> extractObjectKey(String url) {
        return storage.objectKeyFromUrl(url);
    }
}
