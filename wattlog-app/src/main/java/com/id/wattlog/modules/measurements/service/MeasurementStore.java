package com.id.wattlog.modules.measurements.service;

import com.id.wattlog.errors.StorageUnavailableException;
import com.id.wattlog.modules.measurements.model.BucketTotal;
import com.id.wattlog.modules.measurements.model.WattMeasurementEntity;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.springframework.data.mongodb.core.query.Criteria.where;
import static org.springframework.data.mongodb.core.query.Query.query;

/**
 * Append-only access to the {@code WattMeasurement} collection.
 * <p>
 * Every method is a single driver round trip; driver and connection failures surface as
 * {@link StorageUnavailableException}.
 */
@Service
@Slf4j
public class MeasurementStore {

    private final MongoTemplate mongoTemplate;

    public MeasurementStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public WattMeasurementEntity append(WattMeasurementEntity measurement) {
        if (measurement == null || measurement.getZeit() == null) {
            throw new IllegalArgumentException("Measurement and its timestamp cannot be null");
        }
        log.trace("Appending measurement at {}: {} W, {} kWh",
                measurement.getZeit(), measurement.getPowerWatts(), measurement.getEnergyKwh());
        return guarded("append", () -> mongoTemplate.insert(measurement, WattMeasurementEntity.COLLECTION));
    }

    public int appendAll(List<WattMeasurementEntity> measurements) {
        if (measurements == null) {
            throw new IllegalArgumentException("Measurements cannot be null");
        }
        if (measurements.isEmpty()) {
            return 0;
        }
        return guarded("appendAll",
                () -> mongoTemplate.insert(measurements, WattMeasurementEntity.COLLECTION).size());
    }

    /**
     * Most recent sample by timestamp. Ties on the timestamp are resolved arbitrarily.
     */
    public Optional<WattMeasurementEntity> findLatest() {
        Query q = new Query().with(Sort.by(Sort.Direction.DESC, WattMeasurementEntity.ZEIT)).limit(1);
        return guarded("findLatest",
                () -> Optional.ofNullable(mongoTemplate.findOne(q, WattMeasurementEntity.class, WattMeasurementEntity.COLLECTION)));
    }

    public Optional<Instant> findLatestTimestamp() {
        return findLatest().map(WattMeasurementEntity::getZeit);
    }

    /**
     * All samples with {@code zeit >= start}, ascending.
     */
    public List<WattMeasurementEntity> findSince(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("Start cannot be null");
        }
        Query q = query(where(WattMeasurementEntity.ZEIT).gte(start))
                .with(Sort.by(Sort.Direction.ASC, WattMeasurementEntity.ZEIT));
        return guarded("findSince",
                () -> mongoTemplate.find(q, WattMeasurementEntity.class, WattMeasurementEntity.COLLECTION));
    }

    /**
     * Groups the non-null values of {@code field} into the buckets delimited by
     * {@code boundaries}: bucket {@code i} holds samples with
     * {@code max(from, boundaries[i]) <= zeit < boundaries[i + 1]}. Only buckets with at least one
     * value are returned.
     *
     * @param boundaries ascending bucket starts followed by the end of the last bucket
     */
    public List<BucketTotal> totalsByBucket(String field, Instant from, List<Instant> boundaries) {
        if (field == null || from == null || boundaries == null || boundaries.size() < 2) {
            throw new IllegalArgumentException("Field, start and at least two bucket boundaries are required");
        }
        Object[] edges = boundaries.stream().map(Date::from).toArray();
        Instant end = boundaries.get(boundaries.size() - 1);

        Aggregation aggregation = Aggregation.newAggregation(
                Aggregation.match(where(WattMeasurementEntity.ZEIT).gte(Date.from(from)).lt(Date.from(end))
                        .and(field).ne(null)),
                Aggregation.bucket(WattMeasurementEntity.ZEIT)
                        .withBoundaries(edges)
                        .andOutput(field).sum().as(BucketTotal.SUM)
                        .andOutputCount().as(BucketTotal.COUNT));

        return guarded("totalsByBucket", () -> mongoTemplate
                .aggregate(aggregation, WattMeasurementEntity.COLLECTION, Document.class)
                .getMappedResults()
                .stream()
                .map(MeasurementStore::toBucketTotal)
                .toList());
    }

    public long deleteOlderThan(Instant cutoff) {
        if (cutoff == null) {
            throw new IllegalArgumentException("Cutoff cannot be null");
        }
        return guarded("deleteOlderThan",
                () -> mongoTemplate.remove(query(where(WattMeasurementEntity.ZEIT).lt(cutoff)),
                        WattMeasurementEntity.COLLECTION).getDeletedCount());
    }

    public long count() {
        return guarded("count", () -> mongoTemplate.count(new Query(), WattMeasurementEntity.COLLECTION));
    }

    private static BucketTotal toBucketTotal(Document doc) {
        Date bucketStart = doc.getDate("_id");
        Number sum = (Number) doc.get(BucketTotal.SUM);
        Number count = (Number) doc.get(BucketTotal.COUNT);
        return new BucketTotal(bucketStart.toInstant(),
                sum == null ? 0.0 : sum.doubleValue(),
                count == null ? 0 : count.longValue());
    }

    private <T> T guarded(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Measurement store %s failed: %s".formatted(operation, ex.getMessage()), ex);
        }
    }
}
