package com.cred.freestyle.lottery.api.controller;

import com.cred.freestyle.lottery.api.exception.GlobalExceptionHandler;
import com.cred.freestyle.lottery.domain.importing.CommitSummary;
import com.cred.freestyle.lottery.domain.importing.GameRowData;
import com.cred.freestyle.lottery.domain.importing.ImportRowError;
import com.cred.freestyle.lottery.domain.importing.ValidRow;
import com.cred.freestyle.lottery.exception.ImportAlreadyCommittedException;
import com.cred.freestyle.lottery.exception.ImportRowErrorsException;
import com.cred.freestyle.lottery.exception.ImportTokenExpiredException;
import com.cred.freestyle.lottery.exception.ImportTokenNotFoundException;
import com.cred.freestyle.lottery.exception.ResourceNotFoundException;
import com.cred.freestyle.lottery.service.importing.CommitImportCommand;
import com.cred.freestyle.lottery.service.importing.ImportCommitResult;
import com.cred.freestyle.lottery.service.importing.ImportPreview;
import com.cred.freestyle.lottery.service.importing.ImportStatusView;
import com.cred.freestyle.lottery.service.importing.ImportValidationResult;
import com.cred.freestyle.lottery.service.importing.LotteryImportService;
import com.cred.freestyle.lottery.service.importing.ValidateImportCommand;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for LotteryImportController using MockMvc.
 * The caller identity is placed in the security context directly.
 */
@WebMvcTest(LotteryImportController.class)
@ContextConfiguration(classes = {LotteryImportController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("LotteryImportController Tests")
class LotteryImportControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LotteryImportService lotteryImportService;

    private static final String BASE_URL = "/api/lottery/games/import";
    private static final String USER_ID = "user-123";
    private static final String TOKEN = "6f1c2d7e-0000-4000-8000-000000000001";

    @BeforeEach
    void authenticate() {
        SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                USER_ID, null, List.of(new SimpleGrantedAuthority("ROLE_LOTTERY_MANAGER"))));
    }

    @AfterEach
    void clearSecurityContext() {
        SecurityContextHolder.clearContext();
    }

    private static MockMultipartFile csv(String contentType) {
        return new MockMultipartFile("file", "games.csv", contentType,
                "game_code,name,price\n1234,Mega Cash,5.00\n".getBytes(StandardCharsets.UTF_8));
    }

    private static GameRowData rowData() {
        return GameRowData.builder()
                .gameCode("1234")
                .name("Mega Cash")
                .price(new BigDecimal("5.00"))
                .packValue(new BigDecimal("300"))
                .build();
    }

    // ========================================
    // POST /validate Tests
    // ========================================

    @Test
    @DisplayName("POST /validate - Valid file returns 200 with token and preview")
    void validateImport_Accepted_Returns200() throws Exception {
        // Given
        Instant expiresAt = Instant.now().plus(15, ChronoUnit.MINUTES);
        when(lotteryImportService.validateImport(any(ValidateImportCommand.class)))
                .thenReturn(ImportValidationResult.accepted(TOKEN, expiresAt,
                        new ImportPreview(1, 1, 0, 0, 1, 0), List.of(ValidRow.create(1, rowData())), List.of()));

        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/validate")
                        .file(csv("text/csv"))
                        .param("state_id", "state-ga")
                        .param("update_existing", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.validationToken").value(TOKEN))
                .andExpect(jsonPath("$.preview.totalRows").value(1))
                .andExpect(jsonPath("$.preview.gamesToCreate").value(1))
                .andExpect(jsonPath("$.rows[0].status").value("valid"))
                .andExpect(jsonPath("$.rows[0].action").value("create"))
                .andExpect(jsonPath("$.rows[0].data.gameCode").value("1234"));

        ArgumentCaptor<ValidateImportCommand> captor = ArgumentCaptor.forClass(ValidateImportCommand.class);
        verify(lotteryImportService).validateImport(captor.capture());
        assertThat(captor.getValue().getStateId()).isEqualTo("state-ga");
        assertThat(captor.getValue().getUserId()).isEqualTo(USER_ID);
        assertThat(captor.getValue().getOptions().isUpdateExisting()).isTrue();
        assertThat(new String(captor.getValue().getFileBytes(), StandardCharsets.UTF_8)).startsWith("game_code");
    }

    @Test
    @DisplayName("POST /validate - Rejected file returns 400 with errors")
    void validateImport_Rejected_Returns400() throws Exception {
        // Given
        when(lotteryImportService.validateImport(any(ValidateImportCommand.class)))
                .thenReturn(ImportValidationResult.rejected("Invalid state ID. State not found."));

        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/validate")
                        .file(csv("text/csv"))
                        .param("state_id", "state-xx"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errors[0]").value("Invalid state ID. State not found."));
    }

    @Test
    @DisplayName("POST /validate - Non-CSV upload returns 400 without calling the service")
    void validateImport_WrongContentType_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/validate")
                        .file(csv("application/pdf"))
                        .param("state_id", "state-ga"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid file type. Only CSV files are accepted."));

        verifyNoInteractions(lotteryImportService);
    }

    @Test
    @DisplayName("POST /validate - Missing file part returns 400")
    void validateImport_MissingFile_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/validate")
                        .param("state_id", "state-ga"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing Request Input"));

        verifyNoInteractions(lotteryImportService);
    }

    @Test
    @DisplayName("POST /validate - Unauthenticated caller returns 403")
    void validateImport_NoUser_Returns403() throws Exception {
        // Given
        SecurityContextHolder.clearContext();

        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/validate")
                        .file(csv("text/csv"))
                        .param("state_id", "state-ga"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("User not authenticated"));
    }

    // ========================================
    // POST /commit Tests
    // ========================================

    @Test
    @DisplayName("POST /commit - Valid token returns 200 with the summary")
    void commitImport_Returns200() throws Exception {
        // Given
        String requestBody = """
                {
                    "validationToken": "%s",
                    "options": {
                        "skipErrors": false,
                        "updateDuplicates": true
                    }
                }
                """.formatted(TOKEN);
        when(lotteryImportService.commitImport(any(CommitImportCommand.class)))
                .thenReturn(new ImportCommitResult("import-1", "state-ga", true,
                        new CommitSummary(2, 1, 0, 0), List.of(), List.of()));

        // When / Then
        mockMvc.perform(post(BASE_URL + "/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(requestBody))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.importId").value("import-1"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.summary.created").value(2))
                .andExpect(jsonPath("$.summary.updated").value(1));

        ArgumentCaptor<CommitImportCommand> captor = ArgumentCaptor.forClass(CommitImportCommand.class);
        verify(lotteryImportService).commitImport(captor.capture());
        assertThat(captor.getValue().getValidationToken()).isEqualTo(TOKEN);
        assertThat(captor.getValue().getUserId()).isEqualTo(USER_ID);
        assertThat(captor.getValue().isSkipErrors()).isFalse();
        assertThat(captor.getValue().isUpdateDuplicates()).isTrue();
    }

    @Test
    @DisplayName("POST /commit - No options: Should skip errors and not update duplicates")
    void commitImport_DefaultOptions() throws Exception {
        // Given
        when(lotteryImportService.commitImport(any(CommitImportCommand.class)))
                .thenReturn(new ImportCommitResult("import-1", "state-ga", true,
                        new CommitSummary(1, 0, 0, 0), List.of(), List.of()));

        // When
        mockMvc.perform(post(BASE_URL + "/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"validationToken\": \"" + TOKEN + "\"}"))
                .andExpect(status().isOk());

        // Then
        ArgumentCaptor<CommitImportCommand> captor = ArgumentCaptor.forClass(CommitImportCommand.class);
        verify(lotteryImportService).commitImport(captor.capture());
        assertThat(captor.getValue().isSkipErrors()).isTrue();
        assertThat(captor.getValue().isUpdateDuplicates()).isFalse();
    }

    @Test
    @DisplayName("POST /commit - Blank token returns 400 with field errors")
    void commitImport_BlankToken_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(post(BASE_URL + "/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"validationToken\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.validationToken").exists());

        verifyNoInteractions(lotteryImportService);
    }

    @Test
    @DisplayName("POST /commit - Unknown token returns 404")
    void commitImport_UnknownToken_Returns404() throws Exception {
        // Given
        when(lotteryImportService.commitImport(any(CommitImportCommand.class)))
                .thenThrow(new ImportTokenNotFoundException(TOKEN));

        // When / Then
        mockMvc.perform(post(BASE_URL + "/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"validationToken\": \"" + TOKEN + "\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Invalid validation token"))
                .andExpect(jsonPath("$.details.code").value("TOKEN_NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /commit - Committed import returns 409")
    void commitImport_AlreadyCommitted_Returns409() throws Exception {
        // Given
        when(lotteryImportService.commitImport(any(CommitImportCommand.class)))
                .thenThrow(new ImportAlreadyCommittedException("import-1"));

        // When / Then
        mockMvc.perform(post(BASE_URL + "/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"validationToken\": \"" + TOKEN + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.code").value("ALREADY_COMMITTED"))
                .andExpect(jsonPath("$.details.importId").value("import-1"));
    }

    @Test
    @DisplayName("POST /commit - Expired token returns 410")
    void commitImport_Expired_Returns410() throws Exception {
        // Given
        when(lotteryImportService.commitImport(any(CommitImportCommand.class)))
                .thenThrow(new ImportTokenExpiredException("import-1", Instant.now().minusSeconds(5)));

        // When / Then
        mockMvc.perform(post(BASE_URL + "/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"validationToken\": \"" + TOKEN + "\"}"))
                .andExpect(status().isGone())
                .andExpect(jsonPath("$.details.code").value("EXPIRED_TOKEN"))
                .andExpect(jsonPath("$.message", containsString("Please re-upload and validate the file.")));
    }

    @Test
    @DisplayName("POST /commit - Error rows without skipErrors returns 422 with row errors")
    void commitImport_RowErrors_Returns422() throws Exception {
        // Given
        when(lotteryImportService.commitImport(any(CommitImportCommand.class)))
                .thenThrow(new ImportRowErrorsException("import-1",
                        List.of(new ImportRowError(4, "price must be a number"))));

        // When / Then
        mockMvc.perform(post(BASE_URL + "/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"validationToken\": \"" + TOKEN + "\", \"options\": {\"skipErrors\": false}}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.details.code").value("ROW_ERRORS"))
                .andExpect(jsonPath("$.details.rowErrors", hasSize(1)))
                .andExpect(jsonPath("$.details.rowErrors[0].rowNumber").value(4))
                .andExpect(jsonPath("$.details.rowErrors[0].error").value("price must be a number"));
    }

    // ========================================
    // GET /template, /status, /history Tests
    // ========================================

    @Test
    @DisplayName("GET /template - Returns the CSV as an attachment")
    void downloadTemplate_ReturnsAttachment() throws Exception {
        // Given
        when(lotteryImportService.generateImportTemplate())
                .thenReturn("game_code,name,price\n1234,Mega Cash,5.00");

        // When / Then
        mockMvc.perform(get(BASE_URL + "/template"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"lottery_games_import_template.csv\""))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().string(startsWith("game_code,name,price")));
    }

    @Test
    @DisplayName("GET /status/{token} - Known token returns 200")
    void getImportStatus_Returns200() throws Exception {
        // Given
        ImportStatusView view = new ImportStatusView();
        view.setImportId("import-1");
        view.setTotalRows(3);
        view.setCommitted(true);
        view.setCommitResult(new CommitSummary(3, 0, 0, 0));
        when(lotteryImportService.getImportStatus(TOKEN)).thenReturn(view);

        // When / Then
        mockMvc.perform(get(BASE_URL + "/status/" + TOKEN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.importId").value("import-1"))
                .andExpect(jsonPath("$.committed").value(true))
                .andExpect(jsonPath("$.commitResult.created").value(3));
    }

    @Test
    @DisplayName("GET /status/{token} - Unknown token returns 404")
    void getImportStatus_Unknown_Returns404() throws Exception {
        // Given
        when(lotteryImportService.getImportStatus(TOKEN)).thenThrow(new ResourceNotFoundException("Import", TOKEN));

        // When / Then
        mockMvc.perform(get(BASE_URL + "/status/" + TOKEN))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.resourceType").value("Import"));
    }

    @Test
    @DisplayName("GET /history - Returns the caller's imports")
    void getImportHistory_Returns200() throws Exception {
        // Given
        ImportStatusView view = new ImportStatusView();
        view.setImportId("import-1");
        when(lotteryImportService.getUserImportHistory(USER_ID, 5)).thenReturn(List.of(view));

        // When / Then
        mockMvc.perform(get(BASE_URL + "/history").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].importId").value("import-1"));

        verify(lotteryImportService).getUserImportHistory(eq(USER_ID), eq(5));
    }
}
