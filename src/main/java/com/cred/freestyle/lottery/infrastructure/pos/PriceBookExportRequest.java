package com.cred.freestyle.lottery.infrastructure.pos;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * Everything needed to render one pack's UPCs into a price book file.
 *
 * @author Lottery Back Office Team
 */
@Getter
@Builder
public class PriceBookExportRequest {

    private final String packId;
    private final String storeId;
    private final String gameName;
    private final BigDecimal ticketPrice;
    private final List<String> upcs;
    private final PriceBookAction action;

    /**
     * Root of the store's XMLGateway share. Files land in its BOInbox folder.
     */
    private final String xmlGatewayPath;

    /**
     * NAXML version from the store's POS integration; null selects the configured default.
     */
    private final String naxmlVersion;
}
