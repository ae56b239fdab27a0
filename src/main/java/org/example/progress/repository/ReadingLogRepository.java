package org.example.progress.repository;

import org.example.progress.entity.ReadingLogEntity;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

/**
 * Insert-and-read access to the reading ledger. Entries are never updated or
 * deleted, so only {@code save} and queries are exposed.
 */
@org.springframework.stereotype.Repository
public interface ReadingLogRepository extends Repository<ReadingLogEntity, String> {

    ReadingLogEntity save(ReadingLogEntity entry);

    long countByProgress_Id(String progressId);

    List<ReadingLogEntity> findByProgress_IdOrderByLogDateAscRecordedAtAsc(String progressId);

    @Query("""
            SELECT l FROM ReadingLogEntity l
            JOIN FETCH l.progress p
            WHERE p.readerId = :readerId
              AND l.logDate >= :from
              AND l.logDate <= :to
            ORDER BY l.logDate ASC, l.recordedAt ASC
            """)
    List<ReadingLogEntity> findReaderEntriesBetween(
            @Param("readerId") String readerId,
            @Param("from") LocalDate from,
            @Param("to") LocalDate to);
}
