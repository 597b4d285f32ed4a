package com.cred.freestyle.lottery.service.importing;

import com.cred.freestyle.lottery.domain.importing.CommitSummary;
import com.cred.freestyle.lottery.domain.importing.DuplicateRow;
import com.cred.freestyle.lottery.domain.importing.ErrorRow;
import com.cred.freestyle.lottery.domain.importing.ExistingGameSnapshot;
import com.cred.freestyle.lottery.domain.importing.GameRowData;
import com.cred.freestyle.lottery.domain.importing.ImportRowError;
import com.cred.freestyle.lottery.domain.importing.RowStatus;
import com.cred.freestyle.lottery.domain.importing.ValidRow;
import com.cred.freestyle.lottery.domain.importing.ValidatedRow;
import com.cred.freestyle.lottery.domain.model.LotteryGame;
import com.cred.freestyle.lottery.domain.model.LotteryGame.GameStatus;
import com.cred.freestyle.lottery.domain.model.LotteryGameImport;
import com.cred.freestyle.lottery.domain.model.UsState;
import com.cred.freestyle.lottery.exception.ImportAlreadyCommittedException;
import com.cred.freestyle.lottery.exception.ImportRowErrorsException;
import com.cred.freestyle.lottery.exception.ImportTokenExpiredException;
import com.cred.freestyle.lottery.exception.ImportTokenNotFoundException;
import com.cred.freestyle.lottery.exception.LotteryImportException;
import com.cred.freestyle.lottery.exception.ResourceNotFoundException;
import com.cred.freestyle.lottery.infrastructure.audit.AuditLogService;
import com.cred.freestyle.lottery.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.lottery.infrastructure.messaging.events.LotteryImportCommittedEvent;
import com.cred.freestyle.lottery.infrastructure.metrics.LotteryMetricsService;
import com.cred.freestyle.lottery.repository.LotteryGameImportRepository;
import com.cred.freestyle.lottery.repository.LotteryGameRepository;
import com.cred.freestyle.lottery.repository.UsStateRepository;
import com.cred.freestyle.lottery.service.csv.CsvParseError;
import com.cred.freestyle.lottery.service.csv.CsvParseOptions;
import com.cred.freestyle.lottery.service.csv.CsvParseResult;
import com.cred.freestyle.lottery.service.csv.CsvParser;
import com.cred.freestyle.lottery.service.csv.ParsedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Two-phase bulk import of lottery games: validate and preview, then commit.
 *
 * Validation parses the file, checks every row and stores the result as a pending
 * import behind a single-use validation token. Commit applies exactly the previewed
 * rows, so later catalog changes cannot alter what the user approved.
 *
 * @author Lottery Back Office Team
 */
@Service
public class LotteryImportService {

    private static final Logger logger = LoggerFactory.getLogger(LotteryImportService.class);

    private final UsStateRepository usStateRepository;
    private final LotteryGameRepository lotteryGameRepository;
    private final LotteryGameImportRepository lotteryGameImportRepository;
    private final CsvParser csvParser;
    private final GameRowValidator gameRowValidator;
    private final LotteryImportCommitProcessor commitProcessor;
    private final AuditLogService auditLogService;
    private final KafkaProducerService kafkaProducerService;
    private final LotteryMetricsService metricsService;

    @Value("${lottery.import.max-file-size:5242880}")
    private long maxFileSize = CsvParseOptions.DEFAULT_MAX_FILE_SIZE;

    @Value("${lottery.import.max-rows:1000}")
    private int maxRows = CsvParseOptions.DEFAULT_MAX_ROWS;

    @Value("${lottery.import.token-ttl-minutes:15}")
    private long tokenTtlMinutes = 15;

    @Value("${lottery.import.history-limit:20}")
    private int defaultHistoryLimit = 20;

    public LotteryImportService(
            UsStateRepository usStateRepository,
            LotteryGameRepository lotteryGameRepository,
            LotteryGameImportRepository lotteryGameImportRepository,
            CsvParser csvParser,
            GameRowValidator gameRowValidator,
            LotteryImportCommitProcessor commitProcessor,
            AuditLogService auditLogService,
            KafkaProducerService kafkaProducerService,
            LotteryMetricsService metricsService
    ) {
        this.usStateRepository = usStateRepository;
        this.lotteryGameRepository = lotteryGameRepository;
        this.lotteryGameImportRepository = lotteryGameImportRepository;
        this.csvParser = csvParser;
        this.gameRowValidator = gameRowValidator;
        this.commitProcessor = commitProcessor;
        this.auditLogService = auditLogService;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
    }

    /**
     * Validate an import file and, if any row is importable, issue a validation token.
     *
     * Checks in order: state exists, state active, lottery enabled, file parses with
     * the required columns, then each row (schema, repeated game code, existing game).
     *
     * @param command File, target state and options
     * @return Preview with per-row outcomes
     */
    public ImportValidationResult validateImport(ValidateImportCommand command) {
        long startTime = System.currentTimeMillis();
        String stateId = command.getStateId();

        UsState state = usStateRepository.findById(stateId).orElse(null);
        if (state == null) {
            return reject(stateId, ImportValidationResult.rejected("Invalid state ID. State not found."));
        }
        if (!state.isActive()) {
            return reject(stateId, ImportValidationResult.rejected(
                    String.format("State %s is not active.", state.getName())));
        }
        if (!state.isLotteryEnabled()) {
            return reject(stateId, ImportValidationResult.rejected(
                    String.format("Lottery operations are not enabled for %s.", state.getName())));
        }

        CsvParseResult parseResult = csvParser.parse(command.getFileBytes(), CsvParseOptions.builder()
                .maxFileSize(maxFileSize)
                .maxRows(maxRows)
                .headerNormalizer(GameRowValidator.HEADER_NORMALIZER)
                .requiredHeaders(GameRowValidator.REQUIRED_HEADERS)
                .skipEmptyRows(true)
                .trimValues(true)
                .build());

        if (!parseResult.isSuccess()) {
            List<String> errors = parseResult.getErrors().stream()
                    .map(CsvParseError::getMessage)
                    .collect(Collectors.toList());
            return reject(stateId, ImportValidationResult.rejected(
                    ImportPreview.empty(), List.of(), errors, parseResult.getWarnings()));
        }
        if (parseResult.getTotalRows() == 0) {
            return reject(stateId, ImportValidationResult.rejected(
                    ImportPreview.empty(), List.of(), List.of("CSV file contains no data rows."),
                    parseResult.getWarnings()));
        }

        Map<String, LotteryGame> existingByCode = lotteryGameRepository
                .findByStateIdAndStatusNot(stateId, GameStatus.DISCONTINUED)
                .stream()
                .collect(Collectors.toMap(LotteryGame::getGameCode, Function.identity(), (first, second) -> first));

        boolean updateExisting = command.getOptions() != null && command.getOptions().isUpdateExisting();
        List<ValidatedRow> validatedRows = new ArrayList<>();
        Map<String, Integer> seenGameCodes = new HashMap<>();
        int creates = 0;
        int updates = 0;

        for (ParsedRow parsedRow : parseResult.getRows()) {
            int rowNumber = parsedRow.getRowNumber();
            RowValidation validation = gameRowValidator.validate(parsedRow.getData());
            if (!validation.isValid()) {
                validatedRows.add(new ErrorRow(rowNumber, parsedRow.getData(), validation.getErrors()));
                continue;
            }

            GameRowData data = validation.getData();
            Integer previousRow = seenGameCodes.putIfAbsent(data.getGameCode(), rowNumber);
            if (previousRow != null) {
                validatedRows.add(new ErrorRow(rowNumber, parsedRow.getData(), List.of(String.format(
                        "Duplicate game_code %s (also on row %d)", data.getGameCode(), previousRow))));
                continue;
            }

            LotteryGame existing = existingByCode.get(data.getGameCode());
            if (existing == null) {
                validatedRows.add(ValidRow.create(rowNumber, data));
                creates++;
            } else if (updateExisting) {
                validatedRows.add(ValidRow.update(rowNumber, data, ExistingGameSnapshot.of(existing)));
                updates++;
            } else {
                validatedRows.add(new DuplicateRow(rowNumber, data, ExistingGameSnapshot.of(existing)));
            }
        }

        int validCount = creates + updates;
        int errorCount = countByStatus(validatedRows, RowStatus.ERROR);
        int duplicateCount = countByStatus(validatedRows, RowStatus.DUPLICATE);
        ImportPreview preview = new ImportPreview(
                parseResult.getTotalRows(), validCount, errorCount, duplicateCount, creates, updates);

        if (validCount == 0) {
            return reject(stateId, ImportValidationResult.rejected(preview, validatedRows,
                    List.of("No valid games to import. Please fix errors and try again."),
                    parseResult.getWarnings()));
        }

        LotteryGameImport pendingImport = LotteryGameImport.builder()
                .stateId(stateId)
                .createdByUserId(command.getUserId())
                .validatedData(validatedRows)
                .importOptions(command.getOptions())
                .totalRows(parseResult.getTotalRows())
                .validRows(validCount)
                .errorRows(errorCount)
                .duplicateRows(duplicateCount)
                .expiresAt(Instant.now().plus(Duration.ofMinutes(tokenTtlMinutes)))
                .build();
        pendingImport = lotteryGameImportRepository.save(pendingImport);

        metricsService.recordImportValidated(stateId, true);
        logger.info("Validated import {} for state {}: total={}, valid={}, errors={}, duplicates={} in {}ms",
                pendingImport.getImportId(), state.getCode(), preview.getTotalRows(), validCount,
                errorCount, duplicateCount, System.currentTimeMillis() - startTime);

        return ImportValidationResult.accepted(pendingImport.getValidationToken(), pendingImport.getExpiresAt(),
                preview, validatedRows, parseResult.getWarnings());
    }

    /**
     * Commit a validated import.
     *
     * @param command Validation token, acting user and commit options
     * @return Commit result with row counts
     * @throws ImportTokenNotFoundException if the token is unknown
     * @throws ImportAlreadyCommittedException if the import was already committed
     * @throws ImportTokenExpiredException if the token expired
     * @throws ImportRowErrorsException if errors are not skipped and some rows have errors
     */
    public ImportCommitResult commitImport(CommitImportCommand command) {
        try {
            LotteryGameImport pendingImport = lotteryGameImportRepository
                    .findByValidationToken(command.getValidationToken())
                    .orElseThrow(() -> new ImportTokenNotFoundException(command.getValidationToken()));

            if (pendingImport.isCommitted()) {
                throw new ImportAlreadyCommittedException(pendingImport.getImportId());
            }
            if (pendingImport.isExpiredAt(Instant.now())) {
                throw new ImportTokenExpiredException(pendingImport.getImportId(), pendingImport.getExpiresAt());
            }

            if (!command.isSkipErrors()) {
                List<ImportRowError> rowErrors = pendingImport.getValidatedData().stream()
                        .filter(row -> row.getStatus() == RowStatus.ERROR)
                        .map(row -> new ImportRowError(row.getRowNumber(),
                                String.join(", ", ((ErrorRow) row).getErrors())))
                        .collect(Collectors.toList());
                if (!rowErrors.isEmpty()) {
                    throw new ImportRowErrorsException(pendingImport.getImportId(), rowErrors);
                }
            }

            ImportCommitResult result = commitProcessor.process(pendingImport, command);
            afterCommit(pendingImport, command.getUserId(), result);
            return result;
        } catch (LotteryImportException e) {
            logger.warn("Import commit rejected ({}): {}", e.getErrorCode(), e.getMessage());
            metricsService.recordImportRejected(e.getErrorCode().name());
            throw e;
        }
    }

    /**
     * Get the status of an import by its validation token.
     *
     * @param validationToken Validation token
     * @return Import status
     * @throws ResourceNotFoundException if the token is unknown
     */
    @Transactional(readOnly = true)
    public ImportStatusView getImportStatus(String validationToken) {
        LotteryGameImport pendingImport = lotteryGameImportRepository.findByValidationToken(validationToken)
                .orElseThrow(() -> new ResourceNotFoundException("Import", validationToken));
        return ImportStatusView.fromImport(pendingImport, Instant.now());
    }

    /**
     * Get a user's most recent imports, newest first.
     *
     * @param userId User ID
     * @param limit Maximum entries, null for the configured default
     * @return Import history
     */
    @Transactional(readOnly = true)
    public List<ImportStatusView> getUserImportHistory(String userId, Integer limit) {
        int size = limit != null && limit > 0 ? limit : defaultHistoryLimit;
        Instant now = Instant.now();
        return lotteryGameImportRepository
                .findByCreatedByUserIdOrderByCreatedAtDesc(userId, PageRequest.of(0, size))
                .stream()
                .map(pendingImport -> ImportStatusView.fromImport(pendingImport, now))
                .collect(Collectors.toList());
    }

    /**
     * Sample import file with every supported column.
     *
     * @return CSV text
     */
    public String generateImportTemplate() {
        List<String> lines = new ArrayList<>();
        lines.add(String.join(",", GameRowValidator.TEMPLATE_HEADERS));
        lines.add("1234,Mega Cash,5.00,\"Win up to $50,000\",300.00,60,ACTIVE");
        lines.add("5678,Lucky 7s,2.00,Triple your money,300.00,150,ACTIVE");
        lines.add("9012,Golden Ticket,10.00,,500.00,50,ACTIVE");
        return String.join("\n", lines);
    }

    /**
     * Delete pending imports whose token expired without a commit.
     *
     * @return Number of imports deleted
     */
    @Transactional
    public int cleanupExpiredImports() {
        int deleted = lotteryGameImportRepository.deleteExpiredUncommitted(Instant.now());
        if (deleted > 0) {
            logger.info("Deleted {} expired pending imports", deleted);
        }
        metricsService.recordImportsCleanedUp(deleted);
        return deleted;
    }

    private void afterCommit(LotteryGameImport pendingImport, String userId, ImportCommitResult result) {
        CommitSummary summary = result.getSummary();

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("stateId", pendingImport.getStateId());
        values.put("totalRows", pendingImport.getTotalRows());
        values.put("created", summary.getCreated());
        values.put("updated", summary.getUpdated());
        values.put("skipped", summary.getSkipped());
        values.put("failed", summary.getFailed());
        auditLogService.record(userId, AuditLogService.LOTTERY_GAMES_IMPORT, AuditLogService.LOTTERY_GAMES_TABLE,
                pendingImport.getImportId(), values, "Bulk lottery game import");

        metricsService.recordImportCommitted(pendingImport.getStateId(),
                summary.getCreated(), summary.getUpdated(), summary.getFailed());

        kafkaProducerService.publishImportCommitted(new LotteryImportCommittedEvent(
                pendingImport.getImportId(),
                pendingImport.getStateId(),
                userId,
                summary.getCreated(),
                summary.getUpdated(),
                summary.getSkipped(),
                summary.getFailed()
        ));
    }

    private ImportValidationResult reject(String stateId, ImportValidationResult result) {
        logger.info("Import validation rejected for state {}: {}", stateId, result.getErrors());
        metricsService.recordImportValidated(stateId, false);
        return result;
    }

    private static int countByStatus(List<ValidatedRow> rows, RowStatus status) {
        return (int) rows.stream().filter(row -> row.getStatus() == status).count();
    }
}
