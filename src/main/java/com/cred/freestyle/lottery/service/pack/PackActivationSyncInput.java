package com.cred.freestyle.lottery.service.pack;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Pack being activated at a store.
 *
 * @author Lottery Back Office Team
 */
@Getter
@Builder
@ToString
public class PackActivationSyncInput {

    private final String packId;
    private final String packNumber;
    private final String gameCode;
    private final String gameName;
    private final Integer ticketsPerPack;
    private final BigDecimal ticketPrice;
    private final String storeId;

    @Builder.Default
    private final int startingSerial = 0;

    /**
     * Acting user for the audit trail, null when the sync is event driven.
     */
    private final String userId;
}
