package com.infra.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.infra.anomaly.config.AerospikeConfig;
import com.infra.anomaly.engine.isolationforest.FeatureScaler;
import com.infra.anomaly.engine.isolationforest.IsolationForest;
import com.infra.anomaly.model.EvaluationMetrics;
import com.infra.anomaly.model.Hyperparameters;
import com.infra.anomaly.model.ModelStatus;
import com.infra.anomaly.model.ModelVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Persists model versions to the {@code model_versions} set, one record per version.
 *
 * <p>The forest and the reference matrix are stored as gzipped JSON blobs because a
 * 100-tree forest easily exceeds the default record size as plain text. The active
 * version is the ACTIVE record with the latest {@code statusAt}.
 */
@Repository
public class ModelVersionRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelVersionRepository.class);

    // Aerospike bin names are limited to 15 characters
    private static final String BIN_ID = "id";
    private static final String BIN_SEQUENCE = "seq";
    private static final String BIN_FOREST = "forestGz";
    private static final String BIN_SCALER = "scalerJson";
    private static final String BIN_THRESHOLD = "threshold";
    private static final String BIN_HYPER = "hyperJson";
    private static final String BIN_TRAINED_ON = "trainedOn";
    private static final String BIN_VAL_RATE = "valAnomRate";
    private static final String BIN_METRICS = "metricsJson";
    private static final String BIN_REFERENCE = "refGz";
    private static final String BIN_CREATED_AT = "createdAt";
    private static final String BIN_STATUS = "status";
    private static final String BIN_STATUS_AT = "statusAt";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final ObjectMapper objectMapper;

    public ModelVersionRepository(AerospikeClient client,
                                  @Qualifier("aerospikeNamespace") String namespace,
                                  @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.objectMapper = new ObjectMapper();
    }

    public void save(ModelVersion version, long statusAt) {
        try {
            Key key = key(version.getId());
            client.put(writePolicy, key,
                    new Bin(BIN_ID, version.getId()),
                    new Bin(BIN_SEQUENCE, version.getSequence()),
                    new Bin(BIN_FOREST, gzip(objectMapper.writeValueAsBytes(version.getForest()))),
                    new Bin(BIN_SCALER, objectMapper.writeValueAsString(version.getScaler())),
                    new Bin(BIN_THRESHOLD, version.getThreshold()),
                    new Bin(BIN_HYPER, objectMapper.writeValueAsString(version.getHyperparameters())),
                    new Bin(BIN_TRAINED_ON, version.getTrainedOnCount()),
                    new Bin(BIN_VAL_RATE, version.getValidationAnomalyRate()),
                    new Bin(BIN_METRICS, version.getEvaluationMetrics() == null
                            ? null : objectMapper.writeValueAsString(version.getEvaluationMetrics())),
                    new Bin(BIN_REFERENCE, gzip(objectMapper.writeValueAsBytes(version.getReferenceData()))),
                    new Bin(BIN_CREATED_AT, version.getCreatedAt()),
                    new Bin(BIN_STATUS, version.getStatus().name()),
                    new Bin(BIN_STATUS_AT, statusAt));

            log.info("Saved model version {}: {} trees, trained on {} samples, status={}",
                    version.getId(), version.getForest().getTreeCount(),
                    version.getTrainedOnCount(), version.getStatus());
        } catch (Exception e) {
            log.error("Failed to save model version {}", version.getId(), e);
        }
    }

    public void updateStatus(String versionId, ModelStatus status, long statusAt) {
        try {
            client.put(writePolicy, key(versionId),
                    new Bin(BIN_STATUS, status.name()),
                    new Bin(BIN_STATUS_AT, statusAt));
        } catch (Exception e) {
            log.error("Failed to update status of model version {} to {}", versionId, status, e);
        }
    }

    /**
     * Every readable version, oldest first. Unreadable records are skipped with a warning.
     */
    public List<StoredVersion> findAll() {
        List<StoredVersion> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_MODEL_VERSIONS,
                (key, record) -> {
                    try {
                        StoredVersion stored = new StoredVersion(mapRecord(record), record.getLong(BIN_STATUS_AT));
                        synchronized (results) {
                            results.add(stored);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read model version record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(s -> s.version().getSequence()));
        return results;
    }

    private ModelVersion mapRecord(Record record) throws IOException {
        String metricsJson = record.getString(BIN_METRICS);
        return ModelVersion.builder()
                .id(record.getString(BIN_ID))
                .sequence(record.getLong(BIN_SEQUENCE))
                .forest(objectMapper.readValue(gunzip((byte[]) record.getValue(BIN_FOREST)), IsolationForest.class))
                .scaler(objectMapper.readValue(record.getString(BIN_SCALER), FeatureScaler.class))
                .threshold(record.getDouble(BIN_THRESHOLD))
                .hyperparameters(objectMapper.readValue(record.getString(BIN_HYPER), Hyperparameters.class))
                .trainedOnCount(record.getInt(BIN_TRAINED_ON))
                .validationAnomalyRate(record.getDouble(BIN_VAL_RATE))
                .evaluationMetrics(metricsJson == null
                        ? null : objectMapper.readValue(metricsJson, EvaluationMetrics.class))
                .referenceData(objectMapper.readValue(gunzip((byte[]) record.getValue(BIN_REFERENCE)), double[][].class))
                .createdAt(record.getLong(BIN_CREATED_AT))
                .status(ModelStatus.valueOf(record.getString(BIN_STATUS)))
                .build();
    }

    private Key key(String versionId) {
        return new Key(namespace, AerospikeConfig.SET_MODEL_VERSIONS, versionId);
    }

    private static byte[] gzip(byte[] raw) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length / 4 + 64);
        try (GZIPOutputStream gz = new GZIPOutputStream(out)) {
            gz.write(raw);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] compressed) throws IOException {
        try (GZIPInputStream gz = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return gz.readAllBytes();
        }
    }

    /**
     * A version as read back from storage, with the time its status last changed.
     */
    public record StoredVersion(ModelVersion version, long statusAt) {}
}
