package com.cred.freestyle.lottery.infrastructure.pos;

/**
 * Outcome of a price book file export. Never thrown, always returned.
 *
 * @author Lottery Back Office Team
 */
public class PosExportResult {

    private final boolean success;
    private final String filePath;
    private final int itemCount;
    private final String error;

    private PosExportResult(boolean success, String filePath, int itemCount, String error) {
        this.success = success;
        this.filePath = filePath;
        this.itemCount = itemCount;
        this.error = error;
    }

    public static PosExportResult success(String filePath, int itemCount) {
        return new PosExportResult(true, filePath, itemCount, null);
    }

    public static PosExportResult failure(String error) {
        return new PosExportResult(false, null, 0, error);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getFilePath() {
        return filePath;
    }

    public int getItemCount() {
        return itemCount;
    }

    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "PosExportResult{success=" + success + ", filePath=" + filePath
                + ", itemCount=" + itemCount + ", error=" + error + "}";
    }
}
