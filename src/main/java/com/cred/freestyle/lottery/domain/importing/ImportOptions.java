package com.cred.freestyle.lottery.domain.importing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options given at validation time. Persisted with the pending import.
 *
 * @author Lottery Back Office Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportOptions {

    /**
     * When true, rows matching an existing game are tagged for update instead of skipped.
     */
    private boolean updateExisting;
}
