package com.cred.freestyle.lottery.service.importing;

import com.cred.freestyle.lottery.domain.importing.GameRowData;
import com.cred.freestyle.lottery.domain.model.LotteryGame.GameStatus;
import com.cred.freestyle.lottery.service.csv.CsvParseOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * Schema of the lottery game import file.
 *
 * Columns:
 * - game_code (required): exactly 4 digits
 * - name (required): up to 100 characters
 * - price (required): greater than 0, at most 2 decimals, at most 1000
 * - description: up to 500 characters
 * - pack_value: greater than 0, at most 2 decimals, at most 99999999.99, defaults to lottery.import.default-pack-value
 *
 * Amounts are plain decimals: no sign, exponent or grouping.
 * - tickets_per_pack: whole number 1-999, derived from pack_value / price when blank
 * - status: ACTIVE, INACTIVE or DISCONTINUED, any case
 *
 * @author Lottery Back Office Team
 */
@Component
public class GameRowValidator {

    public static final String GAME_CODE = "game_code";
    public static final String NAME = "name";
    public static final String PRICE = "price";
    public static final String DESCRIPTION = "description";
    public static final String PACK_VALUE = "pack_value";
    public static final String TICKETS_PER_PACK = "tickets_per_pack";
    public static final String STATUS = "status";

    public static final List<String> REQUIRED_HEADERS = List.of(GAME_CODE, NAME, PRICE);
    public static final List<String> TEMPLATE_HEADERS =
            List.of(GAME_CODE, NAME, PRICE, DESCRIPTION, PACK_VALUE, TICKETS_PER_PACK, STATUS);

    private static final Map<String, String> HEADER_ALIASES = Map.of(
            "code", GAME_CODE,
            "gamecode", GAME_CODE,
            "game_name", NAME,
            "ticket_price", PRICE,
            "pack_size", TICKETS_PER_PACK
    );

    /**
     * Default CSV header normalization followed by alias resolution.
     */
    public static final UnaryOperator<String> HEADER_NORMALIZER = header -> {
        String normalized = CsvParseOptions.DEFAULT_HEADER_NORMALIZER.apply(header);
        return HEADER_ALIASES.getOrDefault(normalized, normalized);
    };

    private static final Pattern GAME_CODE_PATTERN = Pattern.compile("^\\d{4}$");
    private static final int MAX_NAME_LENGTH = 100;
    private static final int MAX_DESCRIPTION_LENGTH = 500;
    private static final Pattern AMOUNT_PATTERN = Pattern.compile("^\\d{1,12}(\\.\\d{1,12})?$");
    private static final BigDecimal MAX_PRICE = new BigDecimal("1000");
    // lottery_games.pack_value is NUMERIC(10,2)
    static final BigDecimal MAX_PACK_VALUE = new BigDecimal("99999999.99");
    private static final int MAX_DECIMALS = 2;

    private final BigDecimal defaultPackValue;

    public GameRowValidator(@Value("${lottery.import.default-pack-value:300}") BigDecimal defaultPackValue) {
        this.defaultPackValue = defaultPackValue;
    }

    /**
     * Validate one row's normalized cell values.
     *
     * @param values Cell values keyed by normalized header
     * @return Typed data, or every error found in the row
     */
    public RowValidation validate(Map<String, String> values) {
        List<String> errors = new ArrayList<>();

        String gameCode = value(values, GAME_CODE);
        if (gameCode.isEmpty()) {
            errors.add("game_code is required");
        } else if (!GAME_CODE_PATTERN.matcher(gameCode).matches()) {
            errors.add("game_code must be exactly 4 digits");
        }

        String name = value(values, NAME);
        if (name.isEmpty()) {
            errors.add("name is required");
        } else if (name.length() > MAX_NAME_LENGTH) {
            errors.add("name must be at most " + MAX_NAME_LENGTH + " characters");
        }

        BigDecimal price = null;
        String rawPrice = value(values, PRICE);
        if (rawPrice.isEmpty()) {
            errors.add("price is required");
        } else {
            price = parseAmount(PRICE, rawPrice, errors);
            if (price != null && price.compareTo(MAX_PRICE) > 0) {
                errors.add("price cannot exceed " + MAX_PRICE);
                price = null;
            }
        }

        String description = value(values, DESCRIPTION);
        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            errors.add("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }

        BigDecimal packValue = defaultPackValue;
        String rawPackValue = value(values, PACK_VALUE);
        if (!rawPackValue.isEmpty()) {
            packValue = parseAmount(PACK_VALUE, rawPackValue, errors);
            if (packValue != null && packValue.compareTo(MAX_PACK_VALUE) > 0) {
                errors.add("pack_value cannot exceed " + MAX_PACK_VALUE);
                packValue = null;
            }
        }

        Integer ticketsPerPack = null;
        String rawTickets = value(values, TICKETS_PER_PACK);
        if (!rawTickets.isEmpty()) {
            try {
                ticketsPerPack = Integer.valueOf(rawTickets);
                if (!TicketsPerPack.isInRange(ticketsPerPack)) {
                    errors.add("tickets_per_pack must be between " + TicketsPerPack.MIN + " and " + TicketsPerPack.MAX);
                }
            } catch (NumberFormatException e) {
                errors.add("tickets_per_pack must be a whole number");
            }
        }

        GameStatus status = null;
        String rawStatus = value(values, STATUS);
        if (!rawStatus.isEmpty()) {
            try {
                status = GameStatus.valueOf(rawStatus.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                errors.add("status must be one of ACTIVE, INACTIVE, DISCONTINUED");
            }
        }

        if (errors.isEmpty() && ticketsPerPack == null) {
            int derived = TicketsPerPack.resolve(null, packValue, price);
            if (!TicketsPerPack.isInRange(derived)) {
                errors.add(String.format("Derived tickets per pack (%d = pack_value %s / price %s) must be between %d and %d",
                        derived, packValue.toPlainString(), price.toPlainString(), TicketsPerPack.MIN, TicketsPerPack.MAX));
            }
        }

        if (!errors.isEmpty()) {
            return RowValidation.invalid(errors);
        }

        return RowValidation.valid(GameRowData.builder()
                .gameCode(gameCode)
                .name(name)
                .price(price)
                .description(description.isEmpty() ? null : description)
                .packValue(packValue)
                .ticketsPerPack(ticketsPerPack)
                .status(status)
                .build());
    }

    private static BigDecimal parseAmount(String column, String raw, List<String> errors) {
        if (raw.startsWith("-")) {
            errors.add(column + " must be greater than 0");
            return null;
        }
        if (!AMOUNT_PATTERN.matcher(raw).matches()) {
            errors.add(column + " must be a number");
            return null;
        }
        BigDecimal amount = new BigDecimal(raw);
        if (amount.signum() <= 0) {
            errors.add(column + " must be greater than 0");
            return null;
        }
        if (amount.stripTrailingZeros().scale() > MAX_DECIMALS) {
            errors.add(column + " must have at most " + MAX_DECIMALS + " decimal places");
            return null;
        }
        return amount;
    }

    private static String value(Map<String, String> values, String column) {
        String value = values.get(column);
        return value == null ? "" : value.trim();
    }
}
