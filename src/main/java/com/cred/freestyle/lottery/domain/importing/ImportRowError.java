package com.cred.freestyle.lottery.domain.importing;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A row that could not be committed, with its reason.
 *
 * @author Lottery Back Office Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportRowError {

    private int rowNumber;
    private String error;
}
