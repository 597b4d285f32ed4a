package com.cred.freestyle.lottery.service.importing;

import com.cred.freestyle.lottery.domain.importing.CommitSummary;
import com.cred.freestyle.lottery.domain.importing.DuplicateRow;
import com.cred.freestyle.lottery.domain.importing.ErrorRow;
import com.cred.freestyle.lottery.domain.importing.GameRowData;
import com.cred.freestyle.lottery.domain.importing.ImportRowError;
import com.cred.freestyle.lottery.domain.importing.RowAction;
import com.cred.freestyle.lottery.domain.importing.ValidRow;
import com.cred.freestyle.lottery.domain.importing.ValidatedRow;
import com.cred.freestyle.lottery.domain.model.LotteryGame;
import com.cred.freestyle.lottery.domain.model.LotteryGame.GameStatus;
import com.cred.freestyle.lottery.domain.model.LotteryGameImport;
import com.cred.freestyle.lottery.exception.ImportAlreadyCommittedException;
import com.cred.freestyle.lottery.repository.LotteryGameImportRepository;
import com.cred.freestyle.lottery.repository.LotteryGameRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies a validated import to the game catalog in one transaction.
 *
 * Per row:
 * - valid create: insert unless the game code was taken since validation (row fails, commit continues)
 * - valid update, or duplicate with updateDuplicates: update the existing game
 * - duplicate without updateDuplicates: skipped
 * - error: counted failed (callers reject the commit earlier when errors are not skipped)
 *
 * The import is then marked committed with a conditional update. If another commit
 * marked it first, the whole transaction rolls back.
 *
 * @author Lottery Back Office Team
 */
@Service
public class LotteryImportCommitProcessor {

    private static final Logger logger = LoggerFactory.getLogger(LotteryImportCommitProcessor.class);

    private final LotteryGameRepository lotteryGameRepository;
    private final LotteryGameImportRepository lotteryGameImportRepository;

    public LotteryImportCommitProcessor(
            LotteryGameRepository lotteryGameRepository,
            LotteryGameImportRepository lotteryGameImportRepository
    ) {
        this.lotteryGameRepository = lotteryGameRepository;
        this.lotteryGameImportRepository = lotteryGameImportRepository;
    }

    /**
     * Apply the import's rows and mark it committed.
     *
     * @param pendingImport Pending import that passed the commit guards
     * @param command Commit options and acting user
     * @return Commit result
     * @throws ImportAlreadyCommittedException if a concurrent commit marked the import first
     */
    @Transactional
    public ImportCommitResult process(LotteryGameImport pendingImport, CommitImportCommand command) {
        Instant now = Instant.now();
        String stateId = pendingImport.getStateId();

        CommitSummary summary = new CommitSummary();
        List<CreatedGame> createdGames = new ArrayList<>();
        List<ImportRowError> rowErrors = new ArrayList<>();

        for (ValidatedRow row : pendingImport.getValidatedData()) {
            if (row instanceof ErrorRow) {
                summary.setFailed(summary.getFailed() + 1);
                continue;
            }

            if (row instanceof DuplicateRow) {
                DuplicateRow duplicate = (DuplicateRow) row;
                if (!command.isUpdateDuplicates()) {
                    summary.setSkipped(summary.getSkipped() + 1);
                    continue;
                }
                applyUpdate(row.getRowNumber(), duplicate.getData(), duplicate.getExistingGame().getGameId(),
                        summary, rowErrors);
                continue;
            }

            ValidRow valid = (ValidRow) row;
            if (valid.getAction() == RowAction.UPDATE && valid.getExistingGame() != null) {
                applyUpdate(row.getRowNumber(), valid.getData(), valid.getExistingGame().getGameId(),
                        summary, rowErrors);
            } else {
                applyCreate(stateId, command.getUserId(), row.getRowNumber(), valid.getData(), now,
                        summary, createdGames, rowErrors);
            }
        }

        int marked = lotteryGameImportRepository.markCommitted(pendingImport.getImportId(), now, summary);
        if (marked == 0) {
            logger.warn("Import {} was committed concurrently, rolling back", pendingImport.getImportId());
            throw new ImportAlreadyCommittedException(pendingImport.getImportId());
        }

        logger.info("Import {} committed: created={}, updated={}, skipped={}, failed={}",
                pendingImport.getImportId(), summary.getCreated(), summary.getUpdated(),
                summary.getSkipped(), summary.getFailed());

        return new ImportCommitResult(
                pendingImport.getImportId(),
                stateId,
                rowErrors.isEmpty(),
                summary,
                createdGames,
                rowErrors
        );
    }

    private void applyCreate(
            String stateId,
            String userId,
            int rowNumber,
            GameRowData data,
            Instant now,
            CommitSummary summary,
            List<CreatedGame> createdGames,
            List<ImportRowError> rowErrors
    ) {
        String gameId = UUID.randomUUID().toString();
        GameStatus status = data.getStatus() != null ? data.getStatus() : GameStatus.ACTIVE;
        int ticketsPerPack = TicketsPerPack.resolve(data.getTicketsPerPack(), data.getPackValue(), data.getPrice());

        int inserted = lotteryGameRepository.insertIfAbsent(
                gameId,
                stateId,
                data.getGameCode(),
                data.getName(),
                data.getDescription(),
                data.getPrice(),
                data.getPackValue(),
                ticketsPerPack,
                status.name(),
                userId,
                now
        );

        if (inserted == 0) {
            logger.warn("Game code {} was created by another writer after validation (row {})",
                    data.getGameCode(), rowNumber);
            rowErrors.add(new ImportRowError(rowNumber,
                    String.format("Game code %s already exists (possible race condition)", data.getGameCode())));
            summary.setFailed(summary.getFailed() + 1);
            return;
        }

        createdGames.add(new CreatedGame(gameId, data.getGameCode(), data.getName(), data.getPrice(), rowNumber));
        summary.setCreated(summary.getCreated() + 1);
    }

    private void applyUpdate(
            int rowNumber,
            GameRowData data,
            String gameId,
            CommitSummary summary,
            List<ImportRowError> rowErrors
    ) {
        Optional<LotteryGame> existing = lotteryGameRepository.findById(gameId);
        if (existing.isEmpty()) {
            logger.warn("Game {} for code {} was removed after validation (row {})", gameId, data.getGameCode(), rowNumber);
            rowErrors.add(new ImportRowError(rowNumber,
                    String.format("Game code %s no longer exists", data.getGameCode())));
            summary.setFailed(summary.getFailed() + 1);
            return;
        }

        LotteryGame game = existing.get();
        game.setName(data.getName());
        game.setDescription(data.getDescription());
        game.setPrice(data.getPrice());
        game.setPackValue(data.getPackValue());
        game.setTicketsPerPack(TicketsPerPack.resolve(data.getTicketsPerPack(), data.getPackValue(), data.getPrice()));
        if (data.getStatus() != null) {
            game.setStatus(data.getStatus());
        }
        lotteryGameRepository.save(game);
        summary.setUpdated(summary.getUpdated() + 1);
    }
}
