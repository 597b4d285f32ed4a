package com.cred.freestyle.lottery.service.upc;

import lombok.Builder;
import lombok.Getter;

/**
 * Input for {@link UpcGenerator#generate}.
 *
 * @author Lottery Back Office Team
 */
@Getter
@Builder
public class UpcGenerationRequest {

    /**
     * 4-digit state lottery game code.
     */
    private final String gameCode;

    /**
     * 7-digit pack number.
     */
    private final String packNumber;

    private final Integer ticketsPerPack;

    /**
     * First ticket serial in the pack. Defaults to 0.
     */
    @Builder.Default
    private final int startingSerial = 0;
}
