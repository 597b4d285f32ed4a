package com.cred.freestyle.lottery.service.upc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Generates the UPC-A barcode family for a serialized lottery pack.
 *
 * UPC layout (12 digits):
 * - 1 digit: game code prefix (first digit of the 4-digit game code)
 * - 7 digits: pack number
 * - 3 digits: ticket serial, zero padded
 * - 1 digit: UPC-A mod-10 check digit over the preceding 11 digits
 *
 * Example: game 0033, pack 5633005, serial 014 -> 0 5633005 014 7 -> 056330050147
 *
 * Output is fully deterministic: regenerating a pack on retry yields the same codes.
 *
 * @author Lottery Back Office Team
 */
@Component
public class UpcGenerator {

    private static final Logger logger = LoggerFactory.getLogger(UpcGenerator.class);

    public static final int UPC_LENGTH = 12;
    public static final int MAX_TICKETS_PER_PACK = 999;

    static final int GAME_CODE_LENGTH = 4;
    static final int PACK_NUMBER_LENGTH = 7;
    static final int SERIAL_WIDTH = 3;
    static final int SERIAL_LIMIT = 1000;

    private static final Pattern GAME_CODE_PATTERN = Pattern.compile("\\d{" + GAME_CODE_LENGTH + "}");
    private static final Pattern PACK_NUMBER_PATTERN = Pattern.compile("\\d{" + PACK_NUMBER_LENGTH + "}");
    private static final Pattern UPC_PATTERN = Pattern.compile("\\d{" + UPC_LENGTH + "}");

    /**
     * Generate one UPC per ticket in the pack.
     *
     * @param request Game code, pack number, ticket count and starting serial
     * @return Result with UPCs in serial order, or an error when the input is invalid
     */
    public UpcGenerationResult generate(UpcGenerationRequest request) {
        String validationError = validate(request);
        if (validationError != null) {
            logger.warn("UPC generation rejected for pack {}: {}", request.getPackNumber(), validationError);
            return UpcGenerationResult.failure(validationError);
        }

        String prefix = request.getGameCode().substring(0, 1);
        String body = prefix + request.getPackNumber();
        int start = request.getStartingSerial();
        int count = request.getTicketsPerPack();

        List<String> upcs = new ArrayList<>(count);
        for (int serial = start; serial < start + count; serial++) {
            String base = body + padSerial(serial);
            upcs.add(base + calculateCheckDigit(base));
        }

        UpcGenerationResult.Metadata metadata = new UpcGenerationResult.Metadata(
                prefix,
                request.getPackNumber(),
                count,
                start,
                upcs.get(0),
                upcs.get(upcs.size() - 1)
        );

        logger.debug("Generated {} UPCs for game {} pack {}: {} .. {}",
                count, request.getGameCode(), request.getPackNumber(),
                metadata.getFirstUpc(), metadata.getLastUpc());

        return UpcGenerationResult.success(upcs, metadata);
    }

    /**
     * Compute the UPC-A check digit.
     * From the right, odd positions weigh 3 and even positions weigh 1.
     *
     * @param digits The 11 digits preceding the check digit
     * @return Check digit 0-9
     */
    public static int calculateCheckDigit(String digits) {
        int sum = 0;
        for (int i = 0; i < digits.length(); i++) {
            int digit = digits.charAt(digits.length() - 1 - i) - '0';
            sum += (i % 2 == 0) ? digit * 3 : digit;
        }
        return (10 - sum % 10) % 10;
    }

    /**
     * Check that a code is a 12-digit UPC-A with a correct check digit.
     *
     * @param upc Candidate code
     * @return true if valid
     */
    public static boolean isValidUpc(String upc) {
        if (upc == null || !UPC_PATTERN.matcher(upc).matches()) {
            return false;
        }
        int expected = calculateCheckDigit(upc.substring(0, UPC_LENGTH - 1));
        return expected == upc.charAt(UPC_LENGTH - 1) - '0';
    }

    /**
     * Split a valid lottery UPC into its components.
     *
     * @param upc 12-digit code
     * @return Parsed components, or empty if the code is not a valid UPC
     */
    public static Optional<ParsedUpc> parseUpc(String upc) {
        if (!isValidUpc(upc)) {
            return Optional.empty();
        }
        int packEnd = 1 + PACK_NUMBER_LENGTH;
        return Optional.of(new ParsedUpc(
                upc.substring(0, 1),
                upc.substring(1, packEnd),
                Integer.parseInt(upc.substring(packEnd, packEnd + SERIAL_WIDTH)),
                upc.charAt(UPC_LENGTH - 1) - '0'
        ));
    }

    private String validate(UpcGenerationRequest request) {
        String gameCode = request.getGameCode();
        if (gameCode == null || gameCode.isBlank()) {
            return "Game code is required";
        }
        if (!GAME_CODE_PATTERN.matcher(gameCode).matches()) {
            return "Game code must be exactly 4 digits";
        }

        String packNumber = request.getPackNumber();
        if (packNumber == null || packNumber.isBlank()) {
            return "Pack number is required";
        }
        if (!PACK_NUMBER_PATTERN.matcher(packNumber).matches()) {
            return "Pack number must be exactly 7 digits";
        }

        Integer tickets = request.getTicketsPerPack();
        if (tickets == null) {
            return "Tickets per pack is required";
        }
        if (tickets < 1) {
            return "Tickets per pack must be at least 1";
        }
        if (tickets > MAX_TICKETS_PER_PACK) {
            return "Tickets per pack cannot exceed " + MAX_TICKETS_PER_PACK;
        }

        int start = request.getStartingSerial();
        if (start < 0) {
            return "Starting serial cannot be negative";
        }
        if (start + tickets > SERIAL_LIMIT) {
            return String.format("Starting serial %d with %d tickets exceeds serial %d",
                    start, tickets, SERIAL_LIMIT - 1);
        }
        return null;
    }

    private static String padSerial(int serial) {
        return String.format("%0" + SERIAL_WIDTH + "d", serial);
    }
}
