package com.cred.freestyle.lottery.service.importing;

import lombok.Builder;
import lombok.Getter;

/**
 * Request to commit a validated import.
 *
 * @author Lottery Back Office Team
 */
@Getter
@Builder
public class CommitImportCommand {

    private final String validationToken;
    private final String userId;

    /**
     * When false, any error row rejects the whole commit.
     */
    @Builder.Default
    private final boolean skipErrors = true;

    /**
     * When true, rows matching existing games are applied as updates instead of skipped.
     */
    @Builder.Default
    private final boolean updateDuplicates = false;
}
