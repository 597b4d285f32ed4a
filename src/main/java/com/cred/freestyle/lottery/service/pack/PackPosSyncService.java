package com.cred.freestyle.lottery.service.pack;

import com.cred.freestyle.lottery.domain.model.PosIntegration;
import com.cred.freestyle.lottery.infrastructure.audit.AuditLogService;
import com.cred.freestyle.lottery.infrastructure.cache.CachedPackUpcs;
import com.cred.freestyle.lottery.infrastructure.cache.PackUpcCacheService;
import com.cred.freestyle.lottery.infrastructure.metrics.LotteryMetricsService;
import com.cred.freestyle.lottery.infrastructure.pos.PosExportResult;
import com.cred.freestyle.lottery.infrastructure.pos.PriceBookAction;
import com.cred.freestyle.lottery.infrastructure.pos.PriceBookExportRequest;
import com.cred.freestyle.lottery.infrastructure.pos.PriceBookFileExporter;
import com.cred.freestyle.lottery.repository.PosIntegrationRepository;
import com.cred.freestyle.lottery.service.upc.UpcGenerationRequest;
import com.cred.freestyle.lottery.service.upc.UpcGenerationResult;
import com.cred.freestyle.lottery.service.upc.UpcGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps a store's POS price book in step with its active lottery packs.
 *
 * Activation flow:
 * 1. Generate the pack's ticket UPCs (the only step whose failure fails the sync)
 * 2. Cache the UPCs for the retry window
 * 3. Export an AddUpdate price book file if the store has a file exchange POS
 * 4. Audit the export outcome
 *
 * Deactivation flow:
 * 1. Read and delete the cached UPCs
 * 2. Export a Delete price book file if the store has a file exchange POS and UPCs were cached
 * 3. Audit the removal
 *
 * Cache, export and audit outcomes are reported in the result flags and never thrown.
 *
 * @author Lottery Back Office Team
 */
@Service
public class PackPosSyncService {

    private static final Logger logger = LoggerFactory.getLogger(PackPosSyncService.class);

    static final Set<String> FILE_EXCHANGE_POS_TYPES = Set.of(
            "GILBARCO_PASSPORT",
            "GILBARCO_NAXML",
            "GILBARCO_COMMANDER"
    );

    static final String CACHE_STORE_FAILED = "Failed to store UPCs in cache";
    static final String POS_NOT_CONFIGURED = "POS not configured";

    private final UpcGenerator upcGenerator;
    private final PackUpcCacheService packUpcCacheService;
    private final PosIntegrationRepository posIntegrationRepository;
    private final PriceBookFileExporter priceBookFileExporter;
    private final AuditLogService auditLogService;
    private final LotteryMetricsService metricsService;

    public PackPosSyncService(
            UpcGenerator upcGenerator,
            PackUpcCacheService packUpcCacheService,
            PosIntegrationRepository posIntegrationRepository,
            PriceBookFileExporter priceBookFileExporter,
            AuditLogService auditLogService,
            LotteryMetricsService metricsService
    ) {
        this.upcGenerator = upcGenerator;
        this.packUpcCacheService = packUpcCacheService;
        this.posIntegrationRepository = posIntegrationRepository;
        this.priceBookFileExporter = priceBookFileExporter;
        this.auditLogService = auditLogService;
        this.metricsService = metricsService;
    }

    /**
     * Generate, cache and export the UPCs of a newly activated pack.
     *
     * @param input Activated pack
     * @return Sync result, successful whenever UPC generation succeeded
     */
    public PackActivationSyncResult syncPackActivation(PackActivationSyncInput input) {
        long startTime = System.currentTimeMillis();
        logger.info("Syncing activation of pack {} (game {}, pack number {}) for store {}",
                input.getPackId(), input.getGameCode(), input.getPackNumber(), input.getStoreId());

        UpcGenerationResult generation = upcGenerator.generate(UpcGenerationRequest.builder()
                .gameCode(input.getGameCode())
                .packNumber(input.getPackNumber())
                .ticketsPerPack(input.getTicketsPerPack())
                .startingSerial(input.getStartingSerial())
                .build());

        if (!generation.isSuccess()) {
            logger.warn("UPC generation failed for pack {}: {}", input.getPackId(), generation.getError());
            metricsService.recordError("UPC_GENERATION_ERROR", "syncPackActivation");
            return PackActivationSyncResult.generationFailed(generation.getError());
        }

        List<String> upcs = generation.getUpcs();
        String firstUpc = generation.getMetadata().getFirstUpc();
        String lastUpc = generation.getMetadata().getLastUpc();
        metricsService.recordUpcsGenerated(input.getGameCode(), upcs.size());

        String error = null;
        boolean redisStored = packUpcCacheService.store(CachedPackUpcs.builder()
                .packId(input.getPackId())
                .storeId(input.getStoreId())
                .gameCode(input.getGameCode())
                .gameName(input.getGameName())
                .packNumber(input.getPackNumber())
                .ticketPrice(input.getTicketPrice())
                .upcs(upcs)
                .build());
        if (!redisStored) {
            logger.warn("Pack {} UPCs were not cached; deactivation will not be able to remove them from the POS",
                    input.getPackId());
            metricsService.recordCacheWriteFailure();
            error = CACHE_STORE_FAILED;
        }

        boolean posExported = false;
        String exportFile = null;
        Optional<PosIntegration> integration = resolvePosIntegration(input.getStoreId());
        if (integration.isPresent()) {
            PosExportResult export = priceBookFileExporter.export(PriceBookExportRequest.builder()
                    .packId(input.getPackId())
                    .storeId(input.getStoreId())
                    .gameName(input.getGameName())
                    .ticketPrice(input.getTicketPrice())
                    .upcs(upcs)
                    .action(PriceBookAction.ADD_UPDATE)
                    .xmlGatewayPath(integration.get().getXmlGatewayPath())
                    .naxmlVersion(integration.get().getNaxmlVersion())
                    .build());
            metricsService.recordPosExport(PriceBookAction.ADD_UPDATE.getNaxmlValue(), export.isSuccess());

            if (export.isSuccess()) {
                posExported = true;
                exportFile = export.getFilePath();
                Map<String, Object> values = new LinkedHashMap<>();
                values.put("upcCount", upcs.size());
                values.put("firstUpc", firstUpc);
                values.put("lastUpc", lastUpc);
                values.put("exportFile", exportFile);
                auditLogService.record(input.getUserId(), AuditLogService.PACK_UPC_POS_EXPORT_SUCCESS,
                        AuditLogService.LOTTERY_PACKS_TABLE, input.getPackId(), values,
                        "Pack UPCs exported to POS on activation");
            } else {
                error = export.getError();
                Map<String, Object> values = new LinkedHashMap<>();
                values.put("upcCount", upcs.size());
                values.put("error", export.getError());
                auditLogService.record(input.getUserId(), AuditLogService.PACK_UPC_POS_EXPORT_FAILED,
                        AuditLogService.LOTTERY_PACKS_TABLE, input.getPackId(), values,
                        "Pack UPC export to POS failed on activation");
            }
        } else {
            logger.debug("No file exchange POS configured for store {}, skipping export", input.getStoreId());
            Map<String, Object> values = new LinkedHashMap<>();
            values.put("upcCount", upcs.size());
            values.put("firstUpc", firstUpc);
            values.put("lastUpc", lastUpc);
            values.put("reason", POS_NOT_CONFIGURED);
            auditLogService.record(input.getUserId(), AuditLogService.PACK_UPC_POS_EXPORT_SKIPPED,
                    AuditLogService.LOTTERY_PACKS_TABLE, input.getPackId(), values,
                    "Pack UPC export to POS skipped on activation");
        }

        metricsService.recordPackSyncLatency("activation", System.currentTimeMillis() - startTime);
        logger.info("Pack {} activation synced: upcs={}, cached={}, exported={}",
                input.getPackId(), upcs.size(), redisStored, posExported);

        return new PackActivationSyncResult(
                true,
                upcs.size(),
                redisStored,
                posExported,
                error,
                new PackActivationSyncResult.Details(upcs, firstUpc, lastUpc, exportFile)
        );
    }

    /**
     * Remove a deactivated pack's UPCs from the cache and the POS price book.
     *
     * @param packId Deactivated pack
     * @param storeId Store holding the pack
     * @return Sync result, always successful unless the POS lookup fails
     */
    public PackDeactivationSyncResult syncPackDeactivation(String packId, String storeId) {
        long startTime = System.currentTimeMillis();
        logger.info("Syncing deactivation of pack {} for store {}", packId, storeId);

        Optional<CachedPackUpcs> cached = packUpcCacheService.get(packId);
        boolean redisDeleted = packUpcCacheService.delete(packId);

        boolean posRemoved = false;
        String error = null;
        int upcCount = cached.map(entry -> entry.getUpcs().size()).orElse(0);

        Optional<PosIntegration> integration = resolvePosIntegration(storeId);
        if (integration.isPresent() && cached.isPresent()) {
            CachedPackUpcs entry = cached.get();
            PosExportResult export = priceBookFileExporter.export(PriceBookExportRequest.builder()
                    .packId(packId)
                    .storeId(storeId)
                    .gameName(entry.getGameName())
                    .ticketPrice(entry.getTicketPrice())
                    .upcs(entry.getUpcs())
                    .action(PriceBookAction.DELETE)
                    .xmlGatewayPath(integration.get().getXmlGatewayPath())
                    .naxmlVersion(integration.get().getNaxmlVersion())
                    .build());
            metricsService.recordPosExport(PriceBookAction.DELETE.getNaxmlValue(), export.isSuccess());
            posRemoved = export.isSuccess();
            if (!export.isSuccess()) {
                error = export.getError();
            }
        } else if (integration.isPresent()) {
            logger.warn("No cached UPCs for pack {}, cannot remove its items from the POS price book", packId);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("upcCount", upcCount);
        values.put("posRemoved", posRemoved);
        auditLogService.record(null, AuditLogService.PACK_UPC_POS_DELETE,
                AuditLogService.LOTTERY_PACKS_TABLE, packId, values,
                "Pack UPCs removed on deactivation");

        metricsService.recordPackSyncLatency("deactivation", System.currentTimeMillis() - startTime);
        logger.info("Pack {} deactivation synced: cacheDeleted={}, posRemoved={}", packId, redisDeleted, posRemoved);

        return new PackDeactivationSyncResult(true, redisDeleted, posRemoved, error);
    }

    /**
     * Find the store's POS integration if it can take price book files.
     * A repository failure propagates to the caller.
     *
     * @param storeId Store ID
     * @return Usable integration, empty when the store has none
     */
    Optional<PosIntegration> resolvePosIntegration(String storeId) {
        return posIntegrationRepository.findByStoreId(storeId)
                .filter(PackPosSyncService::isFileExchangeCapable);
    }

    static boolean isFileExchangeCapable(PosIntegration integration) {
        if (!integration.isActive()) {
            return false;
        }
        boolean naxmlCapable = FILE_EXCHANGE_POS_TYPES.contains(integration.getPosType())
                || integration.getConnectionMode() == PosIntegration.ConnectionMode.FILE_EXCHANGE;
        String path = integration.getXmlGatewayPath();
        return naxmlCapable && path != null && !path.isBlank();
    }
}
