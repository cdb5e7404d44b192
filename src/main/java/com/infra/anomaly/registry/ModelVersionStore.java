package com.infra.anomaly.registry;

import com.infra.anomaly.exception.ModelVersionNotFoundException;
import com.infra.anomaly.exception.PromotionConflictException;
import com.infra.anomaly.model.EvaluationMetrics;
import com.infra.anomaly.model.ModelStatus;
import com.infra.anomaly.model.ModelVersion;
import com.infra.anomaly.repository.ModelVersionRepository;
import com.infra.anomaly.repository.ModelVersionRepository.StoredVersion;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Append-only registry of trained model versions with a single active pointer.
 *
 * <p>Scoring reads the active version through {@link #getActive()} without taking any lock:
 * the pointer is an {@link AtomicReference} to an immutable {@link ModelVersion}, so every
 * reader sees either the previous version or the new one in full. Writers serialize on
 * {@code writeLock}; a promotion is a single reference swap.
 *
 * <p>Versions are never deleted. Promoting or rolling back only changes which version is
 * active and marks the previous one RETIRED.
 */
@Component
public class ModelVersionStore {

    private static final Logger log = LoggerFactory.getLogger(ModelVersionStore.class);

    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final ModelVersionRepository repository;
    private final Clock clock;

    private final AtomicReference<ModelVersion> active = new AtomicReference<>();
    private final Map<String, ModelVersion> versions = new ConcurrentHashMap<>();
    private final List<String> order = new ArrayList<>();
    private final Object writeLock = new Object();
    private long nextSequence = 1;

    public ModelVersionStore(ModelVersionRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Reload every persisted version and re-establish the active pointer.
     */
    @PostConstruct
    public void restore() {
        List<StoredVersion> stored;
        try {
            stored = repository.findAll();
        } catch (Exception e) {
            log.error("Failed to restore model versions, starting with an empty registry", e);
            return;
        }

        synchronized (writeLock) {
            StoredVersion latestActive = null;
            for (StoredVersion s : stored) {
                ModelVersion version = s.version();
                if (versions.putIfAbsent(version.getId(), version) == null) {
                    order.add(version.getId());
                }
                nextSequence = Math.max(nextSequence, version.getSequence() + 1);
                if (version.getStatus() == ModelStatus.ACTIVE
                        && (latestActive == null || s.statusAt() >= latestActive.statusAt())) {
                    latestActive = s;
                }
            }
            if (latestActive != null) {
                active.set(latestActive.version());
            }
            log.info("Restored {} model versions, active={}", stored.size(),
                    latestActive == null ? null : latestActive.version().getId());
        }
    }

    /**
     * The model scoring should use right now, or null before the first promotion.
     */
    public ModelVersion getActive() {
        return active.get();
    }

    public String getActiveId() {
        ModelVersion current = active.get();
        return current == null ? null : current.getId();
    }

    /**
     * Register a freshly trained model. The store assigns the id and sequence and the
     * version starts as a CANDIDATE.
     */
    public ModelVersion registerCandidate(ModelVersion trained) {
        synchronized (writeLock) {
            long sequence = nextSequence++;
            long now = clock.millis();
            String id = "v" + ID_FORMAT.format(Instant.ofEpochMilli(now)) + "_" + sequence;
            ModelVersion candidate = trained.toBuilder()
                    .id(id)
                    .sequence(sequence)
                    .createdAt(now)
                    .status(ModelStatus.CANDIDATE)
                    .build();

            versions.put(id, candidate);
            order.add(id);
            repository.save(candidate, now);
            log.info("Registered candidate model {} (trainedOn={}, threshold={})",
                    id, candidate.getTrainedOnCount(), candidate.getThreshold());
            return candidate;
        }
    }

    /**
     * Attach evaluation results to a candidate. The active pointer is untouched.
     */
    public ModelVersion recordEvaluation(String versionId, EvaluationMetrics metrics) {
        synchronized (writeLock) {
            ModelVersion existing = require(versionId);
            ModelVersion updated = existing.toBuilder().evaluationMetrics(metrics).build();
            versions.put(versionId, updated);
            if (isActive(versionId)) {
                active.set(updated);
            }
            repository.save(updated, clock.millis());
            return updated;
        }
    }

    /**
     * Make {@code candidateId} active, provided the active model is still {@code expectedActiveId}.
     *
     * @throws PromotionConflictException if another promotion happened since the caller read the active id
     */
    public ModelVersion promote(String candidateId, String expectedActiveId) {
        synchronized (writeLock) {
            String actualActiveId = getActiveId();
            if (!Objects.equals(actualActiveId, expectedActiveId)) {
                throw new PromotionConflictException(candidateId, expectedActiveId, actualActiveId);
            }
            return activate(candidateId, "promoted");
        }
    }

    /**
     * Make {@code candidateId} active regardless of what is currently active.
     */
    public ModelVersion forcePromote(String candidateId) {
        synchronized (writeLock) {
            return activate(candidateId, "force-promoted");
        }
    }

    /**
     * Reactivate an earlier version. The version keeps its original id and artifacts.
     */
    public ModelVersion rollback(String versionId) {
        synchronized (writeLock) {
            return activate(versionId, "rolled back to");
        }
    }

    public Optional<ModelVersion> find(String versionId) {
        return Optional.ofNullable(versions.get(versionId));
    }

    /**
     * Every registered version, oldest first.
     */
    public List<ModelVersion> list() {
        synchronized (writeLock) {
            List<ModelVersion> result = new ArrayList<>(order.size());
            for (String id : order) {
                result.add(versions.get(id));
            }
            return Collections.unmodifiableList(result);
        }
    }

    public int size() {
        return versions.size();
    }

    // Caller holds writeLock
    private ModelVersion activate(String versionId, String action) {
        ModelVersion target = require(versionId);
        ModelVersion previous = active.get();
        if (previous != null && previous.getId().equals(versionId)) {
            return previous;
        }

        long now = clock.millis();
        ModelVersion activated = target.withStatus(ModelStatus.ACTIVE);
        versions.put(versionId, activated);
        active.set(activated);
        repository.updateStatus(versionId, ModelStatus.ACTIVE, now);

        if (previous != null) {
            versions.put(previous.getId(), versions.get(previous.getId()).withStatus(ModelStatus.RETIRED));
            repository.updateStatus(previous.getId(), ModelStatus.RETIRED, now);
        }

        log.info("Model {} {} (previous active={})", action, versionId,
                previous == null ? null : previous.getId());
        return activated;
    }

    private boolean isActive(String versionId) {
        return versionId.equals(getActiveId());
    }

    private ModelVersion require(String versionId) {
        ModelVersion version = versions.get(versionId);
        if (version == null) {
            throw new ModelVersionNotFoundException(versionId);
        }
        return version;
    }
}
