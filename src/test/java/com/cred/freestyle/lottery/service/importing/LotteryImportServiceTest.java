package com.cred.freestyle.lottery.service.importing;

import com.cred.freestyle.lottery.domain.importing.CommitSummary;
import com.cred.freestyle.lottery.domain.importing.DuplicateRow;
import com.cred.freestyle.lottery.domain.importing.ErrorRow;
import com.cred.freestyle.lottery.domain.importing.GameRowData;
import com.cred.freestyle.lottery.domain.importing.ImportOptions;
import com.cred.freestyle.lottery.domain.importing.RowAction;
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
import com.cred.freestyle.lottery.exception.ResourceNotFoundException;
import com.cred.freestyle.lottery.infrastructure.audit.AuditLogService;
import com.cred.freestyle.lottery.infrastructure.messaging.KafkaProducerService;
import com.cred.freestyle.lottery.infrastructure.messaging.events.LotteryImportCommittedEvent;
import com.cred.freestyle.lottery.infrastructure.metrics.LotteryMetricsService;
import com.cred.freestyle.lottery.repository.LotteryGameImportRepository;
import com.cred.freestyle.lottery.repository.LotteryGameRepository;
import com.cred.freestyle.lottery.repository.UsStateRepository;
import com.cred.freestyle.lottery.service.csv.CsvParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LotteryImportService.
 * Uses the real CSV parser and row validator with mocked repositories and side channels.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("LotteryImportService Unit Tests")
class LotteryImportServiceTest {

    @Mock
    private UsStateRepository usStateRepository;

    @Mock
    private LotteryGameRepository lotteryGameRepository;

    @Mock
    private LotteryGameImportRepository lotteryGameImportRepository;

    @Mock
    private LotteryImportCommitProcessor commitProcessor;

    @Mock
    private AuditLogService auditLogService;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @Mock
    private LotteryMetricsService metricsService;

    private LotteryImportService lotteryImportService;

    private static final String STATE_ID = "state-ga";
    private static final String USER_ID = "user-123";
    private static final String TOKEN = "6f1c2d7e-0000-4000-8000-000000000001";

    @BeforeEach
    void setUp() {
        lotteryImportService = new LotteryImportService(
                usStateRepository,
                lotteryGameRepository,
                lotteryGameImportRepository,
                new CsvParser(),
                new GameRowValidator(new BigDecimal("300")),
                commitProcessor,
                auditLogService,
                kafkaProducerService,
                metricsService
        );
    }

    private static UsState state(boolean active, boolean lotteryEnabled) {
        return UsState.builder()
                .stateId(STATE_ID)
                .code("GA")
                .name("Georgia")
                .active(active)
                .lotteryEnabled(lotteryEnabled)
                .build();
    }

    private static LotteryGame existingGame(String gameCode) {
        return LotteryGame.builder()
                .gameId("game-" + gameCode)
                .stateId(STATE_ID)
                .gameCode(gameCode)
                .name("Existing " + gameCode)
                .price(new BigDecimal("2.00"))
                .packValue(new BigDecimal("300"))
                .ticketsPerPack(150)
                .status(GameStatus.ACTIVE)
                .build();
    }

    private static ValidateImportCommand command(String csv, boolean updateExisting) {
        return ValidateImportCommand.builder()
                .fileBytes(csv.getBytes(StandardCharsets.UTF_8))
                .stateId(STATE_ID)
                .userId(USER_ID)
                .options(new ImportOptions(updateExisting))
                .build();
    }

    private void givenSaveAssignsToken() {
        when(lotteryGameImportRepository.save(any(LotteryGameImport.class))).thenAnswer(invocation -> {
            LotteryGameImport saved = invocation.getArgument(0);
            saved.setImportId("import-1");
            saved.setValidationToken(TOKEN);
            return saved;
        });
    }

    private static LotteryGameImport pendingImport(List<ValidatedRow> rows) {
        return LotteryGameImport.builder()
                .importId("import-1")
                .stateId(STATE_ID)
                .createdByUserId(USER_ID)
                .validatedData(rows)
                .totalRows(rows.size())
                .validationToken(TOKEN)
                .expiresAt(Instant.now().plus(10, ChronoUnit.MINUTES))
                .createdAt(Instant.now())
                .build();
    }

    private static GameRowData gameData(String gameCode) {
        return GameRowData.builder()
                .gameCode(gameCode)
                .name("Game " + gameCode)
                .price(new BigDecimal("5.00"))
                .packValue(new BigDecimal("300"))
                .build();
    }

    // ========================================
    // validateImport() Tests
    // ========================================

    @Test
    @DisplayName("validateImport - Unknown state: Should reject without parsing")
    void validateImport_UnknownState() {
        // Given
        when(usStateRepository.findById(STATE_ID)).thenReturn(Optional.empty());

        // When
        ImportValidationResult result = lotteryImportService.validateImport(command("game_code,name,price\n", false));

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getValidationToken()).isNull();
        assertThat(result.getErrors()).containsExactly("Invalid state ID. State not found.");
        verify(metricsService).recordImportValidated(STATE_ID, false);
        verifyNoInteractions(lotteryGameRepository, lotteryGameImportRepository);
    }

    @Test
    @DisplayName("validateImport - Inactive state or lottery disabled: Should reject with the state name")
    void validateImport_StateNotUsable() {
        // Given
        when(usStateRepository.findById(STATE_ID))
                .thenReturn(Optional.of(state(false, true)))
                .thenReturn(Optional.of(state(true, false)));

        // When
        ImportValidationResult inactive = lotteryImportService.validateImport(command("x", false));
        ImportValidationResult disabled = lotteryImportService.validateImport(command("x", false));

        // Then
        assertThat(inactive.getErrors()).containsExactly("State Georgia is not active.");
        assertThat(disabled.getErrors()).containsExactly("Lottery operations are not enabled for Georgia.");
        verify(lotteryGameImportRepository, never()).save(any());
    }

    @Test
    @DisplayName("validateImport - Missing columns: Should return the parser error")
    void validateImport_MissingColumns() {
        // Given
        when(usStateRepository.findById(STATE_ID)).thenReturn(Optional.of(state(true, true)));

        // When
        ImportValidationResult result = lotteryImportService.validateImport(
                command("game_code,name\n1234,Mega Cash\n", false));

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrors()).containsExactly("Missing required columns: price");
        assertThat(result.getPreview().getTotalRows()).isZero();
        verifyNoInteractions(lotteryGameRepository);
    }

    @Test
    @DisplayName("validateImport - Header only: Should reject a file without data rows")
    void validateImport_NoDataRows() {
        // Given
        when(usStateRepository.findById(STATE_ID)).thenReturn(Optional.of(state(true, true)));

        // When
        ImportValidationResult result = lotteryImportService.validateImport(
                command("game_code,name,price\n", false));

        // Then
        assertThat(result.getErrors()).containsExactly("CSV file contains no data rows.");
    }

    @Test
    @DisplayName("validateImport - Mixed file: Should classify create, duplicate, in-file repeat and invalid rows")
    void validateImport_MixedFile() {
        // Given
        String csv = "Game Code,Game Name,Ticket Price\n"
                + "1234,Mega Cash,5.00\n"
                + "5678,Lucky 7s,2.00\n"
                + "1234,Mega Cash Again,5.00\n"
                + "12,Bad,abc\n";
        when(usStateRepository.findById(STATE_ID)).thenReturn(Optional.of(state(true, true)));
        when(lotteryGameRepository.findByStateIdAndStatusNot(STATE_ID, GameStatus.DISCONTINUED))
                .thenReturn(List.of(existingGame("5678")));
        givenSaveAssignsToken();

        // When
        ImportValidationResult result = lotteryImportService.validateImport(command(csv, false));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValidationToken()).isEqualTo(TOKEN);
        assertThat(result.getExpiresAt()).isAfter(Instant.now().plus(14, ChronoUnit.MINUTES));

        ImportPreview preview = result.getPreview();
        assertThat(preview.getTotalRows()).isEqualTo(4);
        assertThat(preview.getValidRows()).isEqualTo(1);
        assertThat(preview.getErrorRows()).isEqualTo(2);
        assertThat(preview.getDuplicateRows()).isEqualTo(1);
        assertThat(preview.getGamesToCreate()).isEqualTo(1);
        assertThat(preview.getGamesToUpdate()).isZero();
        assertThat(preview.getValidRows() + preview.getErrorRows() + preview.getDuplicateRows())
                .isEqualTo(preview.getTotalRows());

        List<ValidatedRow> rows = result.getRows();
        assertThat(rows).extracting(ValidatedRow::getStatus).containsExactly(
                RowStatus.VALID, RowStatus.DUPLICATE, RowStatus.ERROR, RowStatus.ERROR);
        assertThat(rows.get(0).getAction()).isEqualTo(RowAction.CREATE);
        assertThat(((DuplicateRow) rows.get(1)).getExistingGame().getGameId()).isEqualTo("game-5678");
        assertThat(((ErrorRow) rows.get(2)).getErrors()).containsExactly("Duplicate game_code 1234 (also on row 1)");
        assertThat(((ErrorRow) rows.get(3)).getErrors())
                .containsExactly("game_code must be exactly 4 digits", "price must be a number");
        assertThat(((ErrorRow) rows.get(3)).getData()).containsEntry("game_code", "12");

        ArgumentCaptor<LotteryGameImport> captor = ArgumentCaptor.forClass(LotteryGameImport.class);
        verify(lotteryGameImportRepository).save(captor.capture());
        LotteryGameImport saved = captor.getValue();
        assertThat(saved.getStateId()).isEqualTo(STATE_ID);
        assertThat(saved.getCreatedByUserId()).isEqualTo(USER_ID);
        assertThat(saved.getValidatedData()).hasSize(4);
        assertThat(saved.getValidRows()).isEqualTo(1);
        assertThat(saved.getErrorRows()).isEqualTo(2);
        assertThat(saved.getDuplicateRows()).isEqualTo(1);
        assertThat(saved.getImportOptions().isUpdateExisting()).isFalse();

        verify(metricsService).recordImportValidated(STATE_ID, true);
    }

    @Test
    @DisplayName("validateImport - updateExisting: Should tag matching rows for update")
    void validateImport_UpdateExisting() {
        // Given
        when(usStateRepository.findById(STATE_ID)).thenReturn(Optional.of(state(true, true)));
        when(lotteryGameRepository.findByStateIdAndStatusNot(STATE_ID, GameStatus.DISCONTINUED))
                .thenReturn(List.of(existingGame("5678")));
        givenSaveAssignsToken();

        // When
        ImportValidationResult result = lotteryImportService.validateImport(
                command("game_code,name,price\n5678,Lucky 7s,3.00\n", true));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPreview().getGamesToUpdate()).isEqualTo(1);
        ValidRow row = (ValidRow) result.getRows().get(0);
        assertThat(row.getAction()).isEqualTo(RowAction.UPDATE);
        assertThat(row.getExistingGame().getGameId()).isEqualTo("game-5678");
        assertThat(row.getExistingGame().getPrice()).isEqualByComparingTo("2.00");
    }

    @Test
    @DisplayName("validateImport - Only duplicates and errors: Should reject without a token")
    void validateImport_NothingToImport() {
        // Given
        when(usStateRepository.findById(STATE_ID)).thenReturn(Optional.of(state(true, true)));
        when(lotteryGameRepository.findByStateIdAndStatusNot(STATE_ID, GameStatus.DISCONTINUED))
                .thenReturn(List.of(existingGame("5678")));

        // When
        ImportValidationResult result = lotteryImportService.validateImport(
                command("game_code,name,price\n5678,Lucky 7s,2.00\nabcd,,\n", false));

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getValidationToken()).isNull();
        assertThat(result.getErrors()).containsExactly("No valid games to import. Please fix errors and try again.");
        assertThat(result.getRows()).hasSize(2);
        assertThat(result.getPreview().getDuplicateRows()).isEqualTo(1);
        verify(lotteryGameImportRepository, never()).save(any());
    }

    // ========================================
    // commitImport() Tests
    // ========================================

    @Test
    @DisplayName("commitImport - Unknown token: Should throw TOKEN_NOT_FOUND")
    void commitImport_UnknownToken() {
        // Given
        when(lotteryGameImportRepository.findByValidationToken(TOKEN)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> lotteryImportService.commitImport(
                CommitImportCommand.builder().validationToken(TOKEN).userId(USER_ID).build()))
                .isInstanceOf(ImportTokenNotFoundException.class)
                .hasMessage("Invalid validation token");

        verify(metricsService).recordImportRejected("TOKEN_NOT_FOUND");
        verifyNoInteractions(commitProcessor);
    }

    @Test
    @DisplayName("commitImport - Committed import: Should throw ALREADY_COMMITTED")
    void commitImport_AlreadyCommitted() {
        // Given
        LotteryGameImport committed = pendingImport(List.of(ValidRow.create(1, gameData("1234"))));
        committed.setCommittedAt(Instant.now().minusSeconds(30));
        when(lotteryGameImportRepository.findByValidationToken(TOKEN)).thenReturn(Optional.of(committed));

        // When / Then
        assertThatThrownBy(() -> lotteryImportService.commitImport(
                CommitImportCommand.builder().validationToken(TOKEN).userId(USER_ID).build()))
                .isInstanceOf(ImportAlreadyCommittedException.class)
                .hasMessage("This import has already been committed");

        verify(metricsService).recordImportRejected("ALREADY_COMMITTED");
        verifyNoInteractions(commitProcessor);
    }

    @Test
    @DisplayName("commitImport - Expired token: Should throw EXPIRED_TOKEN")
    void commitImport_Expired() {
        // Given
        LotteryGameImport expired = pendingImport(List.of(ValidRow.create(1, gameData("1234"))));
        expired.setExpiresAt(Instant.now().minusSeconds(1));
        when(lotteryGameImportRepository.findByValidationToken(TOKEN)).thenReturn(Optional.of(expired));

        // When / Then
        assertThatThrownBy(() -> lotteryImportService.commitImport(
                CommitImportCommand.builder().validationToken(TOKEN).userId(USER_ID).build()))
                .isInstanceOf(ImportTokenExpiredException.class)
                .hasMessageContaining("Validation token expired at")
                .hasMessageContaining("Please re-upload and validate the file.");

        verify(metricsService).recordImportRejected("EXPIRED_TOKEN");
        verifyNoInteractions(commitProcessor);
    }

    @Test
    @DisplayName("commitImport - Error rows without skipErrors: Should reject before any write")
    void commitImport_RowErrorsNotSkipped() {
        // Given
        List<ValidatedRow> rows = new ArrayList<>();
        rows.add(ValidRow.create(1, gameData("1234")));
        rows.add(new ErrorRow(2, Map.of("game_code", "12"),
                List.of("game_code must be exactly 4 digits", "price is required")));
        when(lotteryGameImportRepository.findByValidationToken(TOKEN))
                .thenReturn(Optional.of(pendingImport(rows)));

        // When / Then
        assertThatThrownBy(() -> lotteryImportService.commitImport(CommitImportCommand.builder()
                .validationToken(TOKEN)
                .userId(USER_ID)
                .skipErrors(false)
                .build()))
                .isInstanceOfSatisfying(ImportRowErrorsException.class, ex -> {
                    assertThat(ex.getRowErrors()).hasSize(1);
                    assertThat(ex.getRowErrors().get(0).getRowNumber()).isEqualTo(2);
                    assertThat(ex.getRowErrors().get(0).getError())
                            .isEqualTo("game_code must be exactly 4 digits, price is required");
                });

        verify(metricsService).recordImportRejected("ROW_ERRORS");
        verifyNoInteractions(commitProcessor, auditLogService, kafkaProducerService);
    }

    @Test
    @DisplayName("commitImport - Success: Should apply rows, then audit, record metrics and publish the event")
    void commitImport_Success() {
        // Given
        LotteryGameImport pending = pendingImport(List.of(ValidRow.create(1, gameData("1234"))));
        when(lotteryGameImportRepository.findByValidationToken(TOKEN)).thenReturn(Optional.of(pending));

        CommitSummary summary = new CommitSummary();
        summary.setCreated(1);
        CommitImportCommand command = CommitImportCommand.builder().validationToken(TOKEN).userId(USER_ID).build();
        ImportCommitResult processed = new ImportCommitResult("import-1", STATE_ID, true, summary,
                List.of(new CreatedGame("game-new", "1234", "Game 1234", new BigDecimal("5.00"), 1)), List.of());
        when(commitProcessor.process(pending, command)).thenReturn(processed);

        // When
        ImportCommitResult result = lotteryImportService.commitImport(command);

        // Then
        assertThat(result).isSameAs(processed);
        assertThat(command.isSkipErrors()).isTrue();
        assertThat(command.isUpdateDuplicates()).isFalse();

        verify(auditLogService).record(eq(USER_ID), eq(AuditLogService.LOTTERY_GAMES_IMPORT),
                eq(AuditLogService.LOTTERY_GAMES_TABLE), eq("import-1"), anyMap(), anyString());
        verify(metricsService).recordImportCommitted(STATE_ID, 1, 0, 0);

        ArgumentCaptor<LotteryImportCommittedEvent> eventCaptor =
                ArgumentCaptor.forClass(LotteryImportCommittedEvent.class);
        verify(kafkaProducerService).publishImportCommitted(eventCaptor.capture());
        assertThat(eventCaptor.getValue().getImportId()).isEqualTo("import-1");
        assertThat(eventCaptor.getValue().getUserId()).isEqualTo(USER_ID);
        assertThat(eventCaptor.getValue().getCreated()).isEqualTo(1);
        verify(metricsService, never()).recordImportRejected(anyString());
    }

    @Test
    @DisplayName("commitImport - Same token twice: Should commit once and reject the second call with ALREADY_COMMITTED")
    void commitImport_TokenSingleUse() {
        // Given
        LotteryGameImport pending = pendingImport(List.of(ValidRow.create(1, gameData("1234"))));
        when(lotteryGameImportRepository.findByValidationToken(TOKEN)).thenReturn(Optional.of(pending));

        CommitSummary summary = new CommitSummary(1, 0, 0, 0);
        ImportCommitResult processed = new ImportCommitResult("import-1", STATE_ID, true, summary,
                List.of(new CreatedGame("game-new", "1234", "Game 1234", new BigDecimal("5.00"), 1)), List.of());
        when(commitProcessor.process(eq(pending), any(CommitImportCommand.class))).thenAnswer(invocation -> {
            pending.setCommittedAt(Instant.now());
            pending.setCommitResult(summary);
            return processed;
        });

        // When
        ImportCommitResult first = lotteryImportService.commitImport(
                CommitImportCommand.builder().validationToken(TOKEN).userId(USER_ID).build());

        // Then
        assertThat(first.isSuccess()).isTrue();
        assertThatThrownBy(() -> lotteryImportService.commitImport(
                CommitImportCommand.builder().validationToken(TOKEN).userId(USER_ID).build()))
                .isInstanceOf(ImportAlreadyCommittedException.class)
                .hasMessage("This import has already been committed");

        verify(commitProcessor, times(1)).process(eq(pending), any(CommitImportCommand.class));
        verify(auditLogService, times(1)).record(eq(USER_ID), eq(AuditLogService.LOTTERY_GAMES_IMPORT),
                eq(AuditLogService.LOTTERY_GAMES_TABLE), eq("import-1"), anyMap(), anyString());
        verify(kafkaProducerService, times(1)).publishImportCommitted(any(LotteryImportCommittedEvent.class));
        verify(metricsService).recordImportRejected("ALREADY_COMMITTED");
        assertThat(pending.getCommitResult()).isSameAs(summary);
    }

    @Test
    @DisplayName("commitImport - Concurrent commit detected by processor: Should record rejection and rethrow")
    void commitImport_ConcurrentCommit() {
        // Given
        LotteryGameImport pending = pendingImport(List.of(ValidRow.create(1, gameData("1234"))));
        when(lotteryGameImportRepository.findByValidationToken(TOKEN)).thenReturn(Optional.of(pending));
        when(commitProcessor.process(eq(pending), any(CommitImportCommand.class)))
                .thenThrow(new ImportAlreadyCommittedException("import-1"));

        // When / Then
        assertThatThrownBy(() -> lotteryImportService.commitImport(
                CommitImportCommand.builder().validationToken(TOKEN).userId(USER_ID).build()))
                .isInstanceOf(ImportAlreadyCommittedException.class);

        verify(metricsService).recordImportRejected("ALREADY_COMMITTED");
        verifyNoInteractions(auditLogService, kafkaProducerService);
    }

    // ========================================
    // Status, history, template and cleanup Tests
    // ========================================

    @Test
    @DisplayName("getImportStatus - Unknown token: Should throw ResourceNotFoundException")
    void getImportStatus_Unknown() {
        // Given
        when(lotteryGameImportRepository.findByValidationToken(TOKEN)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> lotteryImportService.getImportStatus(TOKEN))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessage("Import " + TOKEN + " not found");
    }

    @Test
    @DisplayName("getImportStatus - Pending import: Should report counts and flags")
    void getImportStatus_Pending() {
        // Given
        LotteryGameImport pending = pendingImport(List.of(ValidRow.create(1, gameData("1234"))));
        pending.setValidRows(1);
        when(lotteryGameImportRepository.findByValidationToken(TOKEN)).thenReturn(Optional.of(pending));

        // When
        ImportStatusView status = lotteryImportService.getImportStatus(TOKEN);

        // Then
        assertThat(status.getImportId()).isEqualTo("import-1");
        assertThat(status.getValidRows()).isEqualTo(1);
        assertThat(status.isExpired()).isFalse();
        assertThat(status.isCommitted()).isFalse();
        assertThat(status.getCommitResult()).isNull();
    }

    @Test
    @DisplayName("getUserImportHistory - No limit: Should use the default page size")
    void getUserImportHistory_DefaultLimit() {
        // Given
        when(lotteryGameImportRepository.findByCreatedByUserIdOrderByCreatedAtDesc(eq(USER_ID), any(Pageable.class)))
                .thenReturn(List.of(pendingImport(List.of())));

        // When
        List<ImportStatusView> history = lotteryImportService.getUserImportHistory(USER_ID, null);

        // Then
        assertThat(history).hasSize(1);
        verify(lotteryGameImportRepository).findByCreatedByUserIdOrderByCreatedAtDesc(USER_ID, PageRequest.of(0, 20));
    }

    @Test
    @DisplayName("getUserImportHistory - Explicit limit: Should be passed through")
    void getUserImportHistory_ExplicitLimit() {
        // Given
        when(lotteryGameImportRepository.findByCreatedByUserIdOrderByCreatedAtDesc(eq(USER_ID), any(Pageable.class)))
                .thenReturn(List.of());

        // When
        lotteryImportService.getUserImportHistory(USER_ID, 5);

        // Then
        verify(lotteryGameImportRepository).findByCreatedByUserIdOrderByCreatedAtDesc(USER_ID, PageRequest.of(0, 5));
    }

    @Test
    @DisplayName("generateImportTemplate - Should pass its own validation")
    void generateImportTemplate_IsImportable() {
        // Given
        String template = lotteryImportService.generateImportTemplate();
        when(usStateRepository.findById(STATE_ID)).thenReturn(Optional.of(state(true, true)));
        when(lotteryGameRepository.findByStateIdAndStatusNot(STATE_ID, GameStatus.DISCONTINUED)).thenReturn(List.of());
        givenSaveAssignsToken();

        // When
        ImportValidationResult result = lotteryImportService.validateImport(command(template, false));

        // Then
        assertThat(template.split("\n")[0])
                .isEqualTo("game_code,name,price,description,pack_value,tickets_per_pack,status");
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPreview().getGamesToCreate()).isEqualTo(3);
        assertThat(((ValidRow) result.getRows().get(0)).getData().getDescription()).isEqualTo("Win up to $50,000");
    }

    @Test
    @DisplayName("cleanupExpiredImports - Should delete expired uncommitted imports and record the count")
    void cleanupExpiredImports_Deletes() {
        // Given
        when(lotteryGameImportRepository.deleteExpiredUncommitted(any(Instant.class))).thenReturn(3);

        // When
        int deleted = lotteryImportService.cleanupExpiredImports();

        // Then
        assertThat(deleted).isEqualTo(3);
        verify(metricsService).recordImportsCleanedUp(3);
    }
}
