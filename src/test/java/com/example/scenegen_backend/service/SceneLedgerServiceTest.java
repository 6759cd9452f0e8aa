package com.example.scenegen_backend.service;

import com.example.scenegen_backend.dto.QueuedGeneration;
import com.example.scenegen_backend.exception.SceneGenException;
import com.example.scenegen_backend.model.Account;
import com.example.scenegen_backend.model.Generation;
import com.example.scenegen_backend.model.Project;
import com.example.scenegen_backend.model.Scene;
import com.example.scenegen_backend.repository.AccountRepository;
import com.example.scenegen_backend.repository.GenerationRepository;
import com.example.scenegen_backend.repository.ProjectRepository;
import com.example.scenegen_backend.repository.SceneRepository;
import com.example.scenegen_backend.util.ErrorCode;
import com.example.scenegen_backend.util.GenerationStatus;
import com.example.scenegen_backend.util.SceneStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DataJpaTest
@Import(SceneLedgerService.class)
class SceneLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2025-04-01T09:00:00Z");

    @Autowired private SceneLedgerService ledger;
    @Autowired private AccountRepository accountRepository;
    @Autowired private ProjectRepository projectRepository;
    @Autowired private SceneRepository sceneRepository;
    @Autowired private GenerationRepository generationRepository;

    private QueuedGeneration first;

    @BeforeEach
    void setup() {
        Account owner = accountRepository.saveAndFlush(new Account("ext-" + UUID.randomUUID(), "Owner"));
        Project project = projectRepository.saveAndFlush(new Project(owner, "projA"));
        first = ledger.createQueued(owner.getId(), project.getId(), null, "u/projA/photos/a.jpg", null, null,
                "key-1", "dolly in", "ray-flash-2");
    }

    @Test
    void regenerateIsRefusedWhileQueued() {
        SceneGenException ex = assertThrows(SceneGenException.class,
                () -> ledger.queueRegeneration(first.sceneId(), null, "key-2", "dolly in", "ray-flash-2"));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.CONFLICT_ERROR);
        assertThat(generationRepository.findBySceneIdOrderByVersionNumberAsc(first.sceneId())).hasSize(1);
    }

    @Test
    void regenerateIsRefusedWhileProcessing() {
        generationRepository.markProcessing(first.generationId(), "job-1", NOW);

        SceneGenException ex = assertThrows(SceneGenException.class,
                () -> ledger.queueRegeneration(first.sceneId(), null, "key-2", "dolly in", "ray-flash-2"));

        assertThat(ex.getCode()).isEqualTo(ErrorCode.CONFLICT_ERROR);
        assertThat(sceneRepository.findById(first.sceneId()).orElseThrow().getCurrentVersion()).isEqualTo(1);
    }

    @Test
    void settledSceneGetsNextVersionAndKeepsHistory() {
        generationRepository.markProcessing(first.generationId(), "job-1", NOW);
        generationRepository.markCompleted(first.generationId(), "users/u/Scenes/projA/scene-1-v1.mp4", null, null, NOW);
        sceneRepository.updateStatusIfNotTerminal(first.sceneId(), 1, SceneStatus.READY, null, null, NOW);

        QueuedGeneration second = ledger.queueRegeneration(first.sceneId(), null, "key-2", "dolly in", "ray-flash-2");

        assertThat(second.version()).isEqualTo(2);
        assertThat(second.ordinal()).isEqualTo(first.ordinal());
        assertThat(second.generationId()).isNotEqualTo(first.generationId());

        Scene scene = sceneRepository.findById(first.sceneId()).orElseThrow();
        assertThat(scene.getCurrentVersion()).isEqualTo(2);
        assertThat(scene.getStatus()).isEqualTo(SceneStatus.QUEUED);

        List<Generation> history = generationRepository.findBySceneIdOrderByVersionNumberAsc(first.sceneId());
        assertThat(history).extracting(Generation::getVersionNumber).containsExactly(1, 2);
        assertThat(history.get(0).getStatus()).isEqualTo(GenerationStatus.COMPLETED);
        assertThat(history.get(0).getVideoKey()).isEqualTo("users/u/Scenes/projA/scene-1-v1.mp4");
        assertThat(history.get(1).getStatus()).isEqualTo(GenerationStatus.QUEUED);
    }
}
