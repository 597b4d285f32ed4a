package com.cred.freestyle.lottery.infrastructure.audit;

import com.cred.freestyle.lottery.domain.model.AuditLog;
import com.cred.freestyle.lottery.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Best-effort audit trail writer.
 * A failed write is logged and reported as false; it never fails the audited operation.
 *
 * @author Lottery Back Office Team
 */
@Service
public class AuditLogService {

    private static final Logger logger = LoggerFactory.getLogger(AuditLogService.class);

    // Actions
    public static final String PACK_UPC_POS_EXPORT_SUCCESS = "PACK_UPC_POS_EXPORT_SUCCESS";
    public static final String PACK_UPC_POS_EXPORT_FAILED = "PACK_UPC_POS_EXPORT_FAILED";
    public static final String PACK_UPC_POS_EXPORT_SKIPPED = "PACK_UPC_POS_EXPORT_SKIPPED";
    public static final String PACK_UPC_POS_DELETE = "PACK_UPC_POS_DELETE";
    public static final String LOTTERY_GAMES_IMPORT = "LOTTERY_GAMES_IMPORT";

    // Tables
    public static final String LOTTERY_PACKS_TABLE = "lottery_packs";
    public static final String LOTTERY_GAMES_TABLE = "lottery_games";

    private final AuditLogRepository auditLogRepository;

    public AuditLogService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    /**
     * Write an audit entry.
     *
     * @param userId Acting user, null for system actions
     * @param action Audit action
     * @param tableName Affected table
     * @param recordId Affected record
     * @param newValues Values to record
     * @param reason Human-readable reason
     * @return true if the entry was written
     */
    public boolean record(
            String userId,
            String action,
            String tableName,
            String recordId,
            Map<String, Object> newValues,
            String reason
    ) {
        try {
            AuditLog entry = AuditLog.builder()
                    .userId(userId)
                    .action(action)
                    .tableName(tableName)
                    .recordId(recordId)
                    .newValues(newValues)
                    .reason(reason)
                    .build();
            auditLogRepository.save(entry);
            logger.debug("Audit {} recorded for {}:{}", action, tableName, recordId);
            return true;
        } catch (Exception e) {
            logger.error("Failed to write audit log {} for {}:{}", action, tableName, recordId, e);
            return false;
        }
    }
}
