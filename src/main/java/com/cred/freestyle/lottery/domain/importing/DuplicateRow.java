package com.cred.freestyle.lottery.domain.importing;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Row whose game code already exists in the state's catalog and the caller
 * did not ask to update existing games. Skipped unless commit opts into updating duplicates.
 *
 * @author Lottery Back Office Team
 */
public class DuplicateRow extends ValidatedRow {

    private GameRowData data;
    private ExistingGameSnapshot existingGame;

    public DuplicateRow() {
    }

    public DuplicateRow(int rowNumber, GameRowData data, ExistingGameSnapshot existingGame) {
        super(rowNumber);
        this.data = data;
        this.existingGame = existingGame;
    }

    @Override
    public RowStatus getStatus() {
        return RowStatus.DUPLICATE;
    }

    @Override
    @JsonProperty(access = JsonProperty.Access.READ_ONLY)
    public RowAction getAction() {
        return RowAction.SKIP;
    }

    public GameRowData getData() {
        return data;
    }

    public void setData(GameRowData data) {
        this.data = data;
    }

    public ExistingGameSnapshot getExistingGame() {
        return existingGame;
    }

    public void setExistingGame(ExistingGameSnapshot existingGame) {
        this.existingGame = existingGame;
    }
}
