package com.cred.freestyle.lottery.infrastructure.cache;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * UPC family of an activated pack, cached for the retry window.
 *
 * @author Lottery Back Office Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CachedPackUpcs {

    private String packId;
    private String storeId;
    private String gameCode;
    private String gameName;
    private String packNumber;
    private BigDecimal ticketPrice;

    @Builder.Default
    private List<String> upcs = new ArrayList<>();

    private Instant generatedAt;

    /**
     * End of the retry window. Entries past this instant are treated as absent.
     */
    private Instant expiresAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
