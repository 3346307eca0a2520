package com.assessval.service.lineage;

import com.assessval.model.lineage.LineageRecord;
import com.assessval.model.lineage.LineageValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mutation Tracker
 *
 * Diffs the state of an entity before an update against the update payload and
 * files one lineage record per changed field. Only keys present in the payload
 * are compared. Values are compared in their canonical serialized form, so
 * {@code 300000.00} and {@code 300000} are the same value while the string
 * {@code "5"} and the number {@code 5} are not.
 *
 * All records of one call share a timestamp and a batch id and are appended in
 * the caller's transaction: either the whole batch and the entity change are
 * stored, or neither is.
 */
@Service
@Slf4j
public class MutationTracker {

    private final LineageLedgerService ledger;
    private final LineageValueCodec codec;
    private final Clock clock;

    public MutationTracker(LineageLedgerService ledger, LineageValueCodec codec, Clock clock) {
        this.ledger = ledger;
        this.codec = codec;
        this.clock = clock;
    }

    /**
     * Record the changes an update makes.
     *
     * @param update      who, what and why
     * @param beforeState current values of the entity, keyed like the payload
     * @param patch       values the caller is setting; iteration order is kept in the ledger
     * @return the records written, empty when nothing changed
     */
    @Transactional
    public List<LineageRecord> trackUpdate(TrackedUpdate update, Map<String, ?> beforeState, Map<String, ?> patch) {
        List<LineageRecord> batch = diff(update, beforeState, patch);
        if (batch.isEmpty()) {
            log.debug("No field changes for {} {} in {}", update.entityKind(), update.lineageKey(), update.operation());
            return batch;
        }
        return ledger.append(batch);
    }

    /**
     * Compute the lineage batch for an update without writing it.
     */
    public List<LineageRecord> diff(TrackedUpdate update, Map<String, ?> beforeState, Map<String, ?> patch) {
        List<LineageRecord> batch = new ArrayList<>();
        if (patch == null || patch.isEmpty()) {
            return batch;
        }

        LocalDateTime timestamp = LocalDateTime.now(clock);
        String batchId = UUID.randomUUID().toString();
        String details = codec.encodeDetails(sourceDetails(update));

        for (Map.Entry<String, ?> entry : patch.entrySet()) {
            String key = entry.getKey();
            Object before = beforeState != null ? beforeState.get(key) : null;

            LineageValue oldValue = codec.encode(before);
            LineageValue newValue = codec.encode(entry.getValue());
            if (oldValue.equals(newValue)) {
                continue;
            }

            batch.add(LineageRecord.builder()
                .entityId(update.lineageKey())
                .fieldName(update.qualify(key))
                .oldValue(oldValue)
                .newValue(newValue)
                .changeTimestamp(timestamp)
                .source(update.source())
                .userId(update.userId())
                .sourceDetails(details)
                .batchId(batchId)
                .createdAt(timestamp)
                .build());
        }
        return batch;
    }

    private static Map<String, Object> sourceDetails(TrackedUpdate update) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("updateOperation", update.operation());
        details.put("entityType", update.entityKind());
        details.put("entityId", update.storageId());
        return details;
    }
}
