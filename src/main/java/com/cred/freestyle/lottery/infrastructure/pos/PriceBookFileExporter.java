package com.cred.freestyle.lottery.infrastructure.pos;

import com.cred.freestyle.lottery.infrastructure.pos.naxml.NaxmlPriceBookMaintenance;
import com.cred.freestyle.lottery.infrastructure.pos.naxml.NaxmlPriceBookWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

/**
 * Drops NAXML price book files into a store's XMLGateway inbox.
 *
 * File layout:
 * - {xmlGatewayPath}/BOInbox/PBM_LOTTERY_{packId[0..8]}_{timestamp}.xml for AddUpdate
 * - {xmlGatewayPath}/BOInbox/PBM_LOTTERY_DEL_{packId[0..8]}_{timestamp}.xml for Delete
 *
 * The POS back office picks files up from BOInbox on its own schedule.
 * Failures are returned in {@link PosExportResult}; nothing is thrown.
 *
 * @author Lottery Back Office Team
 */
@Service
public class PriceBookFileExporter {

    private static final Logger logger = LoggerFactory.getLogger(PriceBookFileExporter.class);

    static final String INBOX_DIRECTORY = "BOInbox";
    private static final String FILE_PREFIX = "PBM_LOTTERY_";
    private static final String DELETE_MARKER = "DEL_";
    private static final int PACK_ID_PREFIX_LENGTH = 8;

    private final NaxmlPriceBookWriter priceBookWriter;

    public PriceBookFileExporter(NaxmlPriceBookWriter priceBookWriter) {
        this.priceBookWriter = priceBookWriter;
    }

    /**
     * Write one price book file for the pack's UPCs.
     *
     * @param request Export request
     * @return Export result with the written path, or the failure message
     */
    public PosExportResult export(PriceBookExportRequest request) {
        try {
            Path inbox = Paths.get(request.getXmlGatewayPath(), INBOX_DIRECTORY);
            Files.createDirectories(inbox);

            NaxmlPriceBookMaintenance document = priceBookWriter.buildDocument(
                    request.getStoreId(),
                    request.getGameName(),
                    request.getTicketPrice(),
                    request.getUpcs(),
                    request.getAction(),
                    request.getNaxmlVersion()
            );
            String xml = priceBookWriter.write(document);

            Path file = inbox.resolve(fileName(request.getPackId(), request.getAction(), Instant.now()));
            Files.writeString(file, xml, StandardCharsets.UTF_8);

            logger.info("Exported {} {} items for pack {} to {}",
                    request.getUpcs().size(), request.getAction().getNaxmlValue(), request.getPackId(), file);
            return PosExportResult.success(file.toString(), request.getUpcs().size());
        } catch (Exception e) {
            logger.error("Failed to export price book for pack {} to {}",
                    request.getPackId(), request.getXmlGatewayPath(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return PosExportResult.failure(message);
        }
    }

    static String fileName(String packId, PriceBookAction action, Instant now) {
        String timestamp = now.toString().replaceAll("[:.]", "-");
        if (timestamp.length() > 19) {
            timestamp = timestamp.substring(0, 19);
        }
        String packPrefix = packId.length() > PACK_ID_PREFIX_LENGTH
                ? packId.substring(0, PACK_ID_PREFIX_LENGTH)
                : packId;
        String marker = action == PriceBookAction.DELETE ? DELETE_MARKER : "";
        return FILE_PREFIX + marker + packPrefix + "_" + timestamp + ".xml";
    }
}
