package com.cred.freestyle.lottery.domain.model;

import com.cred.freestyle.lottery.domain.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit trail entry.
 *
 * @author Lottery Back Office Team
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_table_record", columnList = "table_name, record_id"),
    @Index(name = "idx_audit_user_created", columnList = "user_id, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLog {

    @Id
    @Column(name = "audit_log_id", nullable = false, length = 36)
    private String auditLogId;

    /**
     * Acting user. Null for system-initiated actions such as event-driven pack syncs.
     */
    @Column(name = "user_id", length = 36)
    private String userId;

    @Column(name = "action", nullable = false, length = 100)
    private String action;

    @Column(name = "table_name", nullable = false, length = 100)
    private String tableName;

    @Column(name = "record_id", nullable = false, length = 36)
    private String recordId;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "old_values", columnDefinition = "TEXT")
    private Map<String, Object> oldValues;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "new_values", columnDefinition = "TEXT")
    private Map<String, Object> newValues;

    @Column(name = "reason", length = 500)
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (auditLogId == null) {
            auditLogId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
    }
}
