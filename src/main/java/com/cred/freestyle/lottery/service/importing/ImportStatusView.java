package com.cred.freestyle.lottery.service.importing;

import com.cred.freestyle.lottery.domain.importing.CommitSummary;
import com.cred.freestyle.lottery.domain.model.LotteryGameImport;

import java.time.Instant;

/**
 * Read-only view of a pending or committed import.
 *
 * @author Lottery Back Office Team
 */
public class ImportStatusView {

    private String importId;
    private String stateId;
    private int totalRows;
    private int validRows;
    private int errorRows;
    private int duplicateRows;
    private Instant expiresAt;
    private Instant committedAt;
    private CommitSummary commitResult;
    private Instant createdAt;
    private boolean expired;
    private boolean committed;

    public ImportStatusView() {
    }

    public static ImportStatusView fromImport(LotteryGameImport pendingImport, Instant now) {
        ImportStatusView view = new ImportStatusView();
        view.setImportId(pendingImport.getImportId());
        view.setStateId(pendingImport.getStateId());
        view.setTotalRows(pendingImport.getTotalRows());
        view.setValidRows(pendingImport.getValidRows());
        view.setErrorRows(pendingImport.getErrorRows());
        view.setDuplicateRows(pendingImport.getDuplicateRows());
        view.setExpiresAt(pendingImport.getExpiresAt());
        view.setCommittedAt(pendingImport.getCommittedAt());
        view.setCommitResult(pendingImport.getCommitResult());
        view.setCreatedAt(pendingImport.getCreatedAt());
        view.setExpired(pendingImport.isExpiredAt(now));
        view.setCommitted(pendingImport.isCommitted());
        return view;
    }

    // Getters and setters
    public String getImportId() {
        return importId;
    }

    public void setImportId(String importId) {
        this.importId = importId;
    }

    public String getStateId() {
        return stateId;
    }

    public void setStateId(String stateId) {
        this.stateId = stateId;
    }

    public int getTotalRows() {
        return totalRows;
    }

    public void setTotalRows(int totalRows) {
        this.totalRows = totalRows;
    }

    public int getValidRows() {
        return validRows;
    }

    public void setValidRows(int validRows) {
        this.validRows = validRows;
    }

    public int getErrorRows() {
        return errorRows;
    }

    public void setErrorRows(int errorRows) {
        this.errorRows = errorRows;
    }

    public int getDuplicateRows() {
        return duplicateRows;
    }

    public void setDuplicateRows(int duplicateRows) {
        this.duplicateRows = duplicateRows;
    }

    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
    }

    public Instant getCommittedAt() {
        return committedAt;
    }

    public void setCommittedAt(Instant committedAt) {
        this.committedAt = committedAt;
    }

    public CommitSummary getCommitResult() {
        return commitResult;
    }

    public void setCommitResult(CommitSummary commitResult) {
        this.commitResult = commitResult;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public boolean isExpired() {
        return expired;
    }

    public void setExpired(boolean expired) {
        this.expired = expired;
    }

    public boolean isCommitted() {
        return committed;
    }

    public void setCommitted(boolean committed) {
        this.committed = committed;
    }
}
