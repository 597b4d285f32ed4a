package com.cred.freestyle.lottery.domain.model;

import com.cred.freestyle.lottery.domain.converter.CommitSummaryConverter;
import com.cred.freestyle.lottery.domain.converter.ImportOptionsConverter;
import com.cred.freestyle.lottery.domain.converter.ValidatedRowListConverter;
import com.cred.freestyle.lottery.domain.importing.CommitSummary;
import com.cred.freestyle.lottery.domain.importing.ImportOptions;
import com.cred.freestyle.lottery.domain.importing.ValidatedRow;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Pending lottery game import created by the validation phase.
 *
 * Lifecycle:
 * - Created with a validation token that expires 15 minutes later
 * - Marked committed exactly once (committed_at + commit_result)
 * - Deleted by the cleanup job if it expires uncommitted
 *
 * The validated rows are a snapshot: commit applies what the user previewed,
 * regardless of later catalog changes.
 *
 * @author Lottery Back Office Team
 */
@Entity
@Table(name = "lottery_game_imports", indexes = {
    @Index(name = "idx_import_validation_token", columnList = "validation_token", unique = true),
    @Index(name = "idx_import_expires_at", columnList = "expires_at"),
    @Index(name = "idx_import_created_by", columnList = "created_by_user_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LotteryGameImport {

    @Id
    @Column(name = "import_id", nullable = false, length = 36)
    private String importId;

    @Column(name = "state_id", nullable = false, length = 36)
    private String stateId;

    @Column(name = "created_by_user_id", nullable = false, length = 36)
    private String createdByUserId;

    @Convert(converter = ValidatedRowListConverter.class)
    @Column(name = "validated_data", nullable = false, columnDefinition = "TEXT")
    @Builder.Default
    private List<ValidatedRow> validatedData = new ArrayList<>();

    @Convert(converter = ImportOptionsConverter.class)
    @Column(name = "import_options", columnDefinition = "TEXT")
    private ImportOptions importOptions;

    @Column(name = "total_rows", nullable = false)
    private int totalRows;

    @Column(name = "valid_rows", nullable = false)
    private int validRows;

    @Column(name = "error_rows", nullable = false)
    private int errorRows;

    @Column(name = "duplicate_rows", nullable = false)
    private int duplicateRows;

    /**
     * Single-use token handed to the client for the commit call.
     */
    @Column(name = "validation_token", nullable = false, unique = true, length = 36)
    private String validationToken;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    /**
     * Set once by the commit phase. Null while pending.
     */
    @Column(name = "committed_at")
    private Instant committedAt;

    @Convert(converter = CommitSummaryConverter.class)
    @Column(name = "commit_result", columnDefinition = "TEXT")
    private CommitSummary commitResult;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (importId == null) {
            importId = UUID.randomUUID().toString();
        }
        if (validationToken == null) {
            validationToken = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public boolean isCommitted() {
        return committedAt != null;
    }

    /**
     * Check if the validation token has expired.
     *
     * @param now Current time
     * @return true if now is at or after expiresAt
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
