package com.example.scenegen_backend.service;

import com.example.scenegen_backend.config.LumaProperties;
import com.example.scenegen_backend.config.SceneProperties;
import com.example.scenegen_backend.dto.KeyframeUrls;
import com.example.scenegen_backend.dto.RefreshResult;
import com.example.scenegen_backend.dto.SignedAccessGrant;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.model.Account;
import com.example.scenegen_backend.model.Project;
import com.example.scenegen_backend.model.PublicMirror;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.repository.PublicMirrorRepository;
import com.example.scenegen_backend.repository.SceneRepository;
import com.example.scenegen_backend.support.MutableClock;
import com.example.scenegen_backend.util.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SignedUrlServiceTest {

    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");
    private static final String START = "u1/projA/photos/a.jpg";
    private static final String END = "u1/projA/photos/b.jpg";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private LocalStorageService storage;
    private SceneRepository scenes;
    private PublicMirrorRepository mirrors;
    private LumaProperties lumaProps;
    private SignedUrlService service;

    @BeforeEach
    void setup() throws Exception {
        clock = new MutableClock(T0);
        storage = new LocalStorageService(tempDir, "public", "http://files.test", "secret", clock);
        storage.upload(START, "start".getBytes(StandardCharsets.UTF_8));
        storage.upload(END, "end".getBytes(StandardCharsets.UTF_8));

        scenes = mock(SceneRepository.class);
        mirrors = mock(PublicMirrorRepository.class);
        SceneProperties sceneProps = new SceneProperties();
        sceneProps.setSignedUrlTtl(Duration.ofHours(1));
        lumaProps = new LumaProperties();
        service = new SignedUrlService(storage, scenes, mirrors, sceneProps, lumaProps, clock);
    }

    @Test
    void grantIsValidUntilItsExpiryAndNotAtIt() {
        SignedAccessGrant grant = service.issue(START, Duration.ofHours(1));

        assertThat(grant.expiresAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(service.isExpired(grant.expiresAt())).isFalse();

        clock.advance(Duration.ofMinutes(59));
        assertThat(service.isExpired(grant.expiresAt())).isFalse();

        clock.advance(Duration.ofMinutes(1));
        assertThat(service.isExpired(grant.expiresAt())).isTrue();
        assertThat(service.isExpired(null)).isTrue();
    }

    @Test
    void issuedUrlCarriesVerifiableSignature() {
        SignedAccessGrant grant = service.issue(START, Duration.ofMinutes(5));
        UriComponents uri = UriComponentsBuilder.fromUriString(grant.url()).build();

        long expires = Long.parseLong(uri.getQueryParams().getFirst("expires"));
        String sig = uri.getQueryParams().getFirst("sig");

        assertThat(storage.verifySignature(START, expires, sig)).isTrue();
        assertThat(storage.verifySignature(END, expires, sig)).isFalse();
        assertThat(service.extractObjectKey(grant.url())).contains(START);
    }

    @Test
    void missingObjectBecomesStorageError() {
        SceneGenException ex = assertThrows(SceneGenException.class,
                () -> service.issue("u1/projA/photos/missing.jpg", Duration.ofMinutes(5)));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.STORAGE_ERROR);
    }

    @Test
    void keyframeExpiryIsTheEarlierOfBothGrants() {
        KeyframeUrls urls = service.resolveKeyframes(START, END);

        assertThat(urls.startUrl()).contains("/v1/files/signed/");
        assertThat(urls.endUrl()).contains("b.jpg");
        assertThat(urls.expiresAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
    }

    @Test
    void refreshIsSkippedWhileUrlsAreValid() {
        Scene scene = sceneWithUrls("old-start", "old-end", T0.plus(Duration.ofMinutes(10)));

        RefreshResult result = service.refresh(scene, false);

        assertThat(result.refreshed()).isFalse();
        assertThat(result.startUrl()).isEqualTo("old-start");
        verify(scenes, never()).updateSignedUrls(any(), any(), any(), any(), any());
    }

    @Test
    void refreshReissuesExpiredUrls() {
        Scene scene = sceneWithUrls("old-start", "old-end", T0.minusSeconds(1));

        RefreshResult result = service.refresh(scene, false);

        assertThat(result.refreshed()).isTrue();
        assertThat(result.startUrl()).isNotEqualTo("old-start").contains("a.jpg");
        assertThat(result.expiresAt()).isEqualTo(T0.plus(Duration.ofHours(1)));
        assertThat(scene.getStartFrameSignedUrl()).isEqualTo(result.startUrl());
        verify(scenes).updateSignedUrls(any(), any(), any(), any(), any());
    }

    @Test
    void failedRefreshKeepsPreviousUrls() throws Exception {
        Scene scene = sceneWithUrls("old-start", "old-end", T0.minusSeconds(1));
        Files.delete(storage.resolve(START));

        RefreshResult result = service.refresh(scene, false);

        assertThat(result.refreshed()).isFalse();
        assertThat(result.error()).isNotBlank();
        assertThat(result.startUrl()).isEqualTo("old-start");
        assertThat(scene.getStartFrameSignedUrl()).isEqualTo("old-start");
        verify(scenes, never()).updateSignedUrls(any(), any(), any(), any(), any());
    }

    @Test
    void publicMirrorIsCopiedOncePerSource() {
        lumaProps.setRequiresPublicUrls(true);
        Map<String, PublicMirror> rows = new HashMap<>();
        when(mirrors.findBySourceKey(any())).thenAnswer(inv -> Optional.ofNullable(rows.get(inv.<String>getArgument(0))));
        when(mirrors.saveAndFlush(any(PublicMirror.class))).thenAnswer(inv -> {
            PublicMirror m = inv.getArgument(0);
            rows.put(m.getSourceKey(), m);
            return m;
        });

        KeyframeUrls first = service.resolveKeyframes(START, null);
        KeyframeUrls second = service.resolveKeyframes(START, null);

        assertThat(first.startUrl()).isEqualTo("http://files.test/v1/files/public/u1/projA/photos/a.jpg");
        assertThat(second.startUrl()).isEqualTo(first.startUrl());
        assertThat(first.expiresAt()).isNull();
        assertThat(storage.exists("public/" + START)).isTrue();
        verify(mirrors, times(1)).saveAndFlush(any(PublicMirror.class));
        assertThat(storage.list("public/")).isEqualTo(List.of("public/" + START));
    }

    private static Scene sceneWithUrls(String start, String end, Instant expiresAt) {
        Account owner = new Account("u1", "User One");
        Scene scene = new Scene(owner, new Project(owner, "projA"), null, 1, START, END);
        scene.setStartFrameSignedUrl(start);
        scene.setEndFrameSignedUrl(end);
        scene.setSignedUrlExpiresAt(expiresAt);
        return scene;
    }
}
