package com.cred.freestyle.lottery.domain.importing;

/**
 * Row that passed validation and will be created or updated on commit.
 * existingGame is present only for updates.
 *
 * @author Lottery Back Office Team
 */
public class ValidRow extends ValidatedRow {

    private GameRowData data;
    private RowAction action;
    private ExistingGameSnapshot existingGame;

    public ValidRow() {
    }

    private ValidRow(int rowNumber, GameRowData data, RowAction action, ExistingGameSnapshot existingGame) {
        super(rowNumber);
        this.data = data;
        this.action = action;
        this.existingGame = existingGame;
    }

    public static ValidRow create(int rowNumber, GameRowData data) {
        return new ValidRow(rowNumber, data, RowAction.CREATE, null);
    }

    public static ValidRow update(int rowNumber, GameRowData data, ExistingGameSnapshot existingGame) {
        return new ValidRow(rowNumber, data, RowAction.UPDATE, existingGame);
    }

    @Override
    public RowStatus getStatus() {
        return RowStatus.VALID;
    }

    @Override
    public RowAction getAction() {
        return action;
    }

    public void setAction(RowAction action) {
        this.action = action;
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
