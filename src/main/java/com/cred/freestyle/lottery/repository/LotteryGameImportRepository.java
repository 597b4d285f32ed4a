package com.cred.freestyle.lottery.repository;

import com.cred.freestyle.lottery.domain.importing.CommitSummary;
import com.cred.freestyle.lottery.domain.model.LotteryGameImport;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for pending lottery game imports.
 *
 * @author Lottery Back Office Team
 */
@Repository
public interface LotteryGameImportRepository extends JpaRepository<LotteryGameImport, String> {

    /**
     * Find a pending import by its validation token.
     *
     * @param validationToken Token issued by the validation phase
     * @return Optional containing the import if found
     */
    Optional<LotteryGameImport> findByValidationToken(String validationToken);

    /**
     * Mark an import committed, only if no other commit got there first.
     * Must run inside the commit transaction.
     *
     * @param importId Import ID
     * @param committedAt Commit timestamp
     * @param commitResult Row counts
     * @return 1 if this call committed the import, 0 if it was already committed
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE LotteryGameImport i SET i.committedAt = :committedAt, i.commitResult = :commitResult " +
           "WHERE i.importId = :importId AND i.committedAt IS NULL")
    int markCommitted(
            @Param("importId") String importId,
            @Param("committedAt") Instant committedAt,
            @Param("commitResult") CommitSummary commitResult
    );

    /**
     * Delete imports whose token expired without a commit.
     *
     * @param now Current timestamp
     * @return Number of imports deleted
     */
    @Modifying
    @Query("DELETE FROM LotteryGameImport i WHERE i.expiresAt < :now AND i.committedAt IS NULL")
    int deleteExpiredUncommitted(@Param("now") Instant now);

    /**
     * Find a user's imports, newest first.
     *
     * @param userId User ID
     * @param pageable Page holding the history limit
     * @return Imports created by the user
     */
    List<LotteryGameImport> findByCreatedByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);
}
