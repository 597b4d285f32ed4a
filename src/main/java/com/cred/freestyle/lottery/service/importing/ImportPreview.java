package com.cred.freestyle.lottery.service.importing;

/**
 * Row counts shown before commit.
 *
 * @author Lottery Back Office Team
 */
public class ImportPreview {

    private final int totalRows;
    private final int validRows;
    private final int errorRows;
    private final int duplicateRows;
    private final int gamesToCreate;
    private final int gamesToUpdate;

    public ImportPreview(int totalRows, int validRows, int errorRows, int duplicateRows,
                         int gamesToCreate, int gamesToUpdate) {
        this.totalRows = totalRows;
        this.validRows = validRows;
        this.errorRows = errorRows;
        this.duplicateRows = duplicateRows;
        this.gamesToCreate = gamesToCreate;
        this.gamesToUpdate = gamesToUpdate;
    }

    public static ImportPreview empty() {
        return new ImportPreview(0, 0, 0, 0, 0, 0);
    }

    public int getTotalRows() {
        return totalRows;
    }

    public int getValidRows() {
        return validRows;
    }

    public int getErrorRows() {
        return errorRows;
    }

    public int getDuplicateRows() {
        return duplicateRows;
    }

    public int getGamesToCreate() {
        return gamesToCreate;
    }

    public int getGamesToUpdate() {
        return gamesToUpdate;
    }
}
