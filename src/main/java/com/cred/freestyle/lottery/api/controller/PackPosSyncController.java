package com.cred.freestyle.lottery.api.controller;

import com.cred.freestyle.lottery.api.dto.PackActivationSyncRequest;
import com.cred.freestyle.lottery.security.SecurityUtils;
import com.cred.freestyle.lottery.service.pack.PackActivationSyncInput;
import com.cred.freestyle.lottery.service.pack.PackActivationSyncResult;
import com.cred.freestyle.lottery.service.pack.PackDeactivationSyncResult;
import com.cred.freestyle.lottery.service.pack.PackPosSyncService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * Manual re-sync of a pack's UPCs with the store POS.
 * Pack lifecycle events normally drive the same sync through Kafka.
 *
 * @author Lottery Back Office Team
 */
@RestController
@RequestMapping("/api/lottery/packs/{packId}/pos-sync")
public class PackPosSyncController {

    private static final Logger logger = LoggerFactory.getLogger(PackPosSyncController.class);

    private final PackPosSyncService packPosSyncService;

    public PackPosSyncController(PackPosSyncService packPosSyncService) {
        this.packPosSyncService = packPosSyncService;
    }

    /**
     * Generate, cache and export a pack's UPCs.
     *
     * @return 200 with the sync result, 400 when UPCs could not be generated
     */
    @PostMapping("/activate")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PackActivationSyncResult> activate(
            @PathVariable String packId,
            @Valid @RequestBody PackActivationSyncRequest request
    ) {
        String userId = SecurityUtils.requireCurrentUserId();
        logger.info("Manual activation sync for pack {} at store {} by user {}",
                packId, request.getStoreId(), userId);

        PackActivationSyncResult result = packPosSyncService.syncPackActivation(PackActivationSyncInput.builder()
                .packId(packId)
                .storeId(request.getStoreId())
                .packNumber(request.getPackNumber())
                .gameCode(request.getGameCode())
                .gameName(request.getGameName())
                .ticketsPerPack(request.getTicketsPerPack())
                .ticketPrice(request.getTicketPrice())
                .startingSerial(request.getStartingSerial() != null ? request.getStartingSerial() : 0)
                .userId(userId)
                .build());

        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(result);
    }

    /**
     * Remove a pack's UPCs from the cache and the POS price book.
     */
    @PostMapping("/deactivate")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PackDeactivationSyncResult> deactivate(
            @PathVariable String packId,
            @RequestParam("store_id") String storeId
    ) {
        logger.info("Manual deactivation sync for pack {} at store {} by user {}",
                packId, storeId, SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(packPosSyncService.syncPackDeactivation(packId, storeId));
    }
}
