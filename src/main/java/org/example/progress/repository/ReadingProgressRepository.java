package org.example.progress.repository;

import jakarta.persistence.LockModeType;
import org.example.progress.entity.ReadingProgressEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReadingProgressRepository extends JpaRepository<ReadingProgressEntity, String> {

    Optional<ReadingProgressEntity> findByReaderIdAndBookIdAndContextKey(String readerId, String bookId, String contextKey);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT p FROM ReadingProgressEntity p
            WHERE p.readerId = :readerId
              AND p.bookId = :bookId
              AND p.contextKey = :contextKey
            """)
    Optional<ReadingProgressEntity> findForUpdate(
            @Param("readerId") String readerId,
            @Param("bookId") String bookId,
            @Param("contextKey") String contextKey);

    @Query("""
            SELECT p FROM ReadingProgressEntity p
            WHERE p.readerId = :readerId
              AND p.completedAt >= :from
              AND p.completedAt < :to
            ORDER BY p.completedAt ASC
            """)
    List<ReadingProgressEntity> findCompletedBetween(
            @Param("readerId") String readerId,
            @Param("from") LocalDateTime from,
            @Param("to") LocalDateTime to);
}
