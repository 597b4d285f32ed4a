package com.cred.freestyle.lottery.api.controller;

import com.cred.freestyle.lottery.api.dto.CommitImportRequest;
import com.cred.freestyle.lottery.domain.importing.ImportOptions;
import com.cred.freestyle.lottery.security.SecurityUtils;
import com.cred.freestyle.lottery.service.importing.CommitImportCommand;
import com.cred.freestyle.lottery.service.importing.ImportCommitResult;
import com.cred.freestyle.lottery.service.importing.ImportStatusView;
import com.cred.freestyle.lottery.service.importing.ImportValidationResult;
import com.cred.freestyle.lottery.service.importing.LotteryImportService;
import com.cred.freestyle.lottery.service.importing.ValidateImportCommand;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * REST controller for bulk lottery game import.
 *
 * Two-phase flow:
 * 1. POST /validate uploads a CSV file and returns a preview with a validation token
 * 2. POST /commit applies the previewed rows using the token
 *
 * @author Lottery Back Office Team
 */
@RestController
@RequestMapping("/api/lottery/games/import")
public class LotteryImportController {

    private static final Logger logger = LoggerFactory.getLogger(LotteryImportController.class);

    static final Set<String> ACCEPTED_CONTENT_TYPES = Set.of(
            "text/csv",
            "application/csv",
            "text/plain",
            "application/vnd.ms-excel"
    );

    static final String TEMPLATE_FILE_NAME = "lottery_games_import_template.csv";

    private final LotteryImportService lotteryImportService;

    public LotteryImportController(LotteryImportService lotteryImportService) {
        this.lotteryImportService = lotteryImportService;
    }

    /**
     * Validate an import file and preview its rows.
     *
     * @param file CSV file
     * @param stateId Target state
     * @param updateExisting Tag rows matching existing games for update
     * @return 200 with the preview and token when at least one row is valid, 400 otherwise
     */
    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @PreAuthorize("hasAnyRole('ADMIN', 'LOTTERY_MANAGER')")
    public ResponseEntity<ImportValidationResult> validateImport(
            @RequestParam("file") MultipartFile file,
            @RequestParam("state_id") String stateId,
            @RequestParam(value = "update_existing", defaultValue = "false") boolean updateExisting
    ) throws IOException {
        String userId = SecurityUtils.requireCurrentUserId();
        checkContentType(file);

        logger.info("Validating import file {} ({} bytes) for state {} by user {}",
                file.getOriginalFilename(), file.getSize(), stateId, userId);

        ImportValidationResult result = lotteryImportService.validateImport(ValidateImportCommand.builder()
                .fileBytes(file.getBytes())
                .stateId(stateId)
                .userId(userId)
                .options(new ImportOptions(updateExisting))
                .build());

        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(result);
    }

    /**
     * Commit a validated import.
     *
     * @param request Validation token and commit options
     * @return Commit result
     */
    @PostMapping("/commit")
    @PreAuthorize("hasAnyRole('ADMIN', 'LOTTERY_MANAGER')")
    public ResponseEntity<ImportCommitResult> commitImport(@Valid @RequestBody CommitImportRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();
        CommitImportRequest.Options options = request.getOptions() != null
                ? request.getOptions()
                : new CommitImportRequest.Options();

        logger.info("Committing import token {} by user {} (skipErrors={}, updateDuplicates={})",
                request.getValidationToken(), userId, options.isSkipErrors(), options.isUpdateDuplicates());

        ImportCommitResult result = lotteryImportService.commitImport(CommitImportCommand.builder()
                .validationToken(request.getValidationToken())
                .userId(userId)
                .skipErrors(options.isSkipErrors())
                .updateDuplicates(options.isUpdateDuplicates())
                .build());

        return ResponseEntity.ok(result);
    }

    /**
     * Download a sample import file.
     */
    @GetMapping("/template")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<byte[]> downloadTemplate() {
        byte[] body = lotteryImportService.generateImportTemplate().getBytes(StandardCharsets.UTF_8);
        return ResponseEntity.ok()
                .contentType(new MediaType("text", "csv", StandardCharsets.UTF_8))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + TEMPLATE_FILE_NAME + "\"")
                .body(body);
    }

    @GetMapping("/status/{token}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ImportStatusView> getImportStatus(@PathVariable String token) {
        return ResponseEntity.ok(lotteryImportService.getImportStatus(token));
    }

    /**
     * Recent imports of the calling user.
     *
     * @param limit Maximum entries (optional)
     * @return Imports, newest first
     */
    @GetMapping("/history")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<ImportStatusView>> getImportHistory(
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        String userId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(lotteryImportService.getUserImportHistory(userId, limit));
    }

    private static void checkContentType(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType == null) {
            return;
        }
        String baseType = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
        if (!ACCEPTED_CONTENT_TYPES.contains(baseType)) {
            throw new IllegalArgumentException("Invalid file type. Only CSV files are accepted.");
        }
    }
}
