package com.ryuqq.prp.adapter.file.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.prp.core.exception.StateStoreException;
import com.ryuqq.prp.core.spi.StateStore;
import com.ryuqq.prp.core.state.OrchestratorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * JSON file implementation of {@link StateStore} SPI.
 *
 * <p>The whole record is a single JSON document. Every write goes to a sibling temp file
 * which is then moved over the state file with {@link StandardCopyOption#ATOMIC_MOVE}, so a
 * crash leaves either the previous or the new document, never a truncated one.</p>
 *
 * <p><strong>Load Semantics:</strong></p>
 * <ul>
 *   <li>Missing or empty file: initial state</li>
 *   <li>Unparseable document: WARN and initial state</li>
 *   <li>File present but unreadable (permissions, I/O): {@link StateStoreException}</li>
 * </ul>
 *
 * <p><strong>Format:</strong></p>
 * <pre>
 * {
 *   "last_batch_time" : "2025-01-01T10:00:00Z",
 *   "processed_files" : [ "feature-a.md" ],
 *   "current_processing" : null,
 *   "batch_count_1h" : 1,
 *   "batch_times" : [ "2025-01-01T10:00:00Z" ]
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JsonFileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStateStore.class);

    private final Path stateFile;
    private final Clock clock;
    private final ObjectMapper mapper;

    private OrchestratorState snapshot;

    /**
     * 시스템 시계와 시스템 zone을 사용하는 생성자.
     *
     * @param stateFile 상태 파일 경로
     */
    public JsonFileStateStore(Path stateFile) {
        this(stateFile, Clock.systemDefaultZone());
    }

    /**
     * 생성자.
     *
     * <p>clock의 zone은 offset 없는 레거시 시각을 해석할 때 사용됩니다.</p>
     *
     * @param stateFile 상태 파일 경로
     * @param clock batch_count_1h 계산 및 레거시 시각 해석용 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public JsonFileStateStore(Path stateFile, Clock clock) {
        if (stateFile == null) {
            throw new IllegalArgumentException("stateFile cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.stateFile = stateFile;
        this.clock = clock;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(new SimpleModule("lenient-instant")
                .addDeserializer(Instant.class, new LenientInstantDeserializer(clock.getZone())))
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);
        this.snapshot = OrchestratorState.initial();
    }

    @Override
    public synchronized OrchestratorState load() {
        if (!Files.exists(stateFile)) {
            log.debug("State file not found, starting fresh: {}", stateFile);
            snapshot = OrchestratorState.initial();
            return snapshot;
        }

        String content;
        try {
            content = Files.readString(stateFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StateStoreException("Cannot read state file: " + stateFile, e);
        }

        if (content.isBlank()) {
            snapshot = OrchestratorState.initial();
            return snapshot;
        }

        try {
            StateDocument document = mapper.readValue(content, StateDocument.class);
            snapshot = document.toState();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Could not load state file {}, starting fresh: {}", stateFile, e.getMessage());
            snapshot = OrchestratorState.initial();
        }
        return snapshot;
    }

    @Override
    public synchronized void save(OrchestratorState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        write(state);
        snapshot = state;
    }

    @Override
    public synchronized OrchestratorState snapshot() {
        return snapshot;
    }

    @Override
    public synchronized void recordSubmission(Instant at) {
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        save(snapshot.withSubmission(at));
    }

    @Override
    public synchronized void markCurrent(String itemName) {
        save(snapshot.withCurrentItem(itemName));
    }

    @Override
    public synchronized void markCompleted(String itemName) {
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("itemName cannot be null or blank");
        }
        save(snapshot.withCompleted(itemName));
    }

    public Path getStateFile() {
        return stateFile;
    }

    private void write(OrchestratorState state) {
        Path tmp = null;
        try {
            Path dir = stateFile.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = dir.resolve(stateFile.getFileName() + "." + UUID.randomUUID() + ".tmp");

            byte[] json = mapper.writeValueAsBytes(StateDocument.from(state, clock.instant()));
            Files.write(tmp, json, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE,
                StandardOpenOption.SYNC);
            try {
                Files.move(tmp, stateFile, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved state to {} ({} completed, {} in window)",
                stateFile, state.completedItems().size(), state.submissionTimes().size());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new StateStoreException("Cannot write state file: " + stateFile, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp state file {}: {}", tmp, e.getMessage());
        }
    }
}
