package com.assessval.repository;

import com.assessval.model.enums.LineageSource;
import com.assessval.model.lineage.LineageRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.repository.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Append-only access to the lineage ledger. Deliberately extends the bare
 * {@link Repository} marker so no delete or bulk-update method is exposed.
 * Newest first throughout; records of one batch share a timestamp and are
 * ordered by id.
 */
@org.springframework.stereotype.Repository
public interface LineageRecordRepository extends Repository<LineageRecord, Long> {

    LineageRecord save(LineageRecord record);

    List<LineageRecord> saveAll(Iterable<LineageRecord> records);

    Optional<LineageRecord> findById(Long id);

    long count();

    List<LineageRecord> findByEntityIdAndFieldNameOrderByChangeTimestampDescIdDesc(String entityId, String fieldName);

    List<LineageRecord> findByEntityIdOrderByChangeTimestampDescIdDesc(String entityId);

    List<LineageRecord> findByUserIdOrderByChangeTimestampDescIdDesc(Long userId, Pageable pageable);

    List<LineageRecord> findByChangeTimestampBetweenOrderByChangeTimestampDescIdDesc(
        LocalDateTime start, LocalDateTime end, Pageable pageable);

    List<LineageRecord> findBySourceOrderByChangeTimestampDescIdDesc(LineageSource source, Pageable pageable);

    List<LineageRecord> findByBatchIdOrderByIdAsc(String batchId);
}
