package com.cred.freestyle.lottery.service.importing;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Tickets per pack of an imported game.
 * Validation and commit both call {@link #resolve} so the preview matches what gets written.
 *
 * @author Lottery Back Office Team
 */
public final class TicketsPerPack {

    public static final int MIN = 1;
    public static final int MAX = 999;

    private TicketsPerPack() {
    }

    /**
     * The explicit value when present, otherwise floor(packValue / price).
     *
     * @param explicit tickets_per_pack column, null when blank
     * @param packValue Pack value in dollars
     * @param price Ticket price in dollars, greater than zero
     * @return Effective tickets per pack
     */
    public static int resolve(Integer explicit, BigDecimal packValue, BigDecimal price) {
        if (explicit != null) {
            return explicit;
        }
        BigDecimal derived = packValue.divide(price, 0, RoundingMode.FLOOR);
        if (derived.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            return Integer.MAX_VALUE;
        }
        return derived.intValue();
    }

    public static boolean isInRange(int ticketsPerPack) {
        return ticketsPerPack >= MIN && ticketsPerPack <= MAX;
    }
}
