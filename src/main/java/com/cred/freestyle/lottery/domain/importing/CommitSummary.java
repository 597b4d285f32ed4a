package com.cred.freestyle.lottery.domain.importing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Row counts of a committed import.
 *
 * @author Lottery Back Office Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommitSummary {

    private int created;
    private int updated;
    private int skipped;
    private int failed;

    public int total() {
        return created + updated + skipped + failed;
    }
}
