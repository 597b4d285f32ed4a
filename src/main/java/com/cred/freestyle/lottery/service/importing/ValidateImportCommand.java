package com.cred.freestyle.lottery.service.importing;

import com.cred.freestyle.lottery.domain.importing.ImportOptions;
import lombok.Builder;
import lombok.Getter;

/**
 * Request to validate an uploaded game file.
 *
 * @author Lottery Back Office Team
 */
@Getter
@Builder
public class ValidateImportCommand {

    private final byte[] fileBytes;
    private final String stateId;
    private final String userId;

    @Builder.Default
    private final ImportOptions options = new ImportOptions(false);
}
