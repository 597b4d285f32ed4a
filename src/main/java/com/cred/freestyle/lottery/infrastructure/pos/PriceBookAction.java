package com.cred.freestyle.lottery.infrastructure.pos;

/**
 * NAXML item maintenance action.
 *
 * @author Lottery Back Office Team
 */
public enum PriceBookAction {
    ADD_UPDATE("AddUpdate", "Y"),
    DELETE("Delete", "N");

    private final String naxmlValue;
    private final String activeFlag;

    PriceBookAction(String naxmlValue, String activeFlag) {
        this.naxmlValue = naxmlValue;
        this.activeFlag = activeFlag;
    }

    public String getNaxmlValue() {
        return naxmlValue;
    }

    /**
     * Value written to the item's IsActive element.
     */
    public String getActiveFlag() {
        return activeFlag;
    }
}
