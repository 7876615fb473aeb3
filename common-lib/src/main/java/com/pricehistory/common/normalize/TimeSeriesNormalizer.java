package com.pricehistory.common.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.pricehistory.common.exception.MalformedResponseException;
import com.pricehistory.common.model.AssetClass;
import com.pricehistory.common.model.Period;
import com.pricehistory.common.model.PricePoint;
import com.pricehistory.common.model.PriceQuery;
import com.pricehistory.common.model.PriceSeries;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Pure stateless extraction of one canonical {@link PriceSeries} from a raw Alpha Vantage
 * payload.
 *
 * <p>The data block is the single top-level key whose name contains {@code "Time Series"};
 * the exact key differs per function ({@code "Time Series (Daily)"},
 * {@code "Time Series (Digital Currency Daily)"}, {@code "Weekly Adjusted Time Series"}...).
 * Each entry maps a timestamp string to numbered OHLCV fields.
 *
 * <p>Column selection:
 * <ol>
 *   <li>CRYPTO                               → close</li>
 *   <li>EQUITY, adjusted, period != INTRADAY → adjusted close</li>
 *   <li>otherwise                            → close</li>
 * </ol>
 *
 * <p>Any unparseable row fails the whole payload. No logging. No side-effects.
 */
public final class TimeSeriesNormalizer {

    public static final String TIME_SERIES_MARKER = "Time Series";

    static final List<String> CLOSE_FIELDS          = List.of("4. close", "4a. close (USD)");
    static final List<String> ADJUSTED_CLOSE_FIELDS = List.of("5. adjusted close");

    private static final List<String> PROVIDER_MESSAGE_KEYS = List.of("Error Message", "Note", "Information");

    private static final DateTimeFormatter DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimeSeriesNormalizer() {}

    public static PriceSeries normalize(JsonNode payload, PriceQuery query, AssetClass assetClass) {
        if (payload == null || !payload.isObject()) {
            throw new MalformedResponseException("Payload is not a JSON object. symbol=" + symbolOf(query));
        }

        String key = locateTimeSeriesKey(payload, query);
        JsonNode block = payload.get(key);
        if (!block.isObject()) {
            throw new MalformedResponseException("'" + key + "' is not an object. symbol=" + query.symbol());
        }

        List<String> columns = priceColumns(query, assetClass);
        ZoneId zone = assetClass == AssetClass.CRYPTO ? ZoneOffset.UTC : null;

        List<PricePoint> points = new ArrayList<>(block.size());
        Map<LocalDateTime, String> seen = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> rows = block.fields();
        while (rows.hasNext()) {
            Map.Entry<String, JsonNode> row = rows.next();
            LocalDateTime ts = parseTimestamp(row.getKey(), query.symbol());
            String previous = seen.putIfAbsent(ts, row.getKey());
            if (previous != null) {
                throw new MalformedResponseException("Duplicate timestamp " + ts + " ('" + previous
                    + "' and '" + row.getKey() + "'). symbol=" + query.symbol());
            }
            points.add(new PricePoint(ts, parseValue(row.getKey(), row.getValue(), columns, query.symbol())));
        }

        // provider returns newest first
        points.sort(Comparator.comparing(PricePoint::timestamp));
        return new PriceSeries(query.symbol(), assetClass, zone, points);
    }

    /**
     * Field names to read, in preference order, for the given query.
     */
    static List<String> priceColumns(PriceQuery query, AssetClass assetClass) {
        if (assetClass == AssetClass.EQUITY && query.adjusted() && query.period() != Period.INTRADAY) {
            return ADJUSTED_CLOSE_FIELDS;
        }
        return CLOSE_FIELDS;
    }

    static String locateTimeSeriesKey(JsonNode payload, PriceQuery query) {
        List<String> matches = new ArrayList<>(1);
        payload.fieldNames().forEachRemaining(name -> {
            if (name.contains(TIME_SERIES_MARKER)) {
                matches.add(name);
            }
        });
        if (matches.isEmpty()) {
            throw new MalformedResponseException("No '" + TIME_SERIES_MARKER + "' block in response. symbol="
                + query.symbol() + providerMessage(payload));
        }
        if (matches.size() > 1) {
            throw new MalformedResponseException("Ambiguous response, several '" + TIME_SERIES_MARKER
                + "' blocks " + matches + ". symbol=" + query.symbol());
        }
        return matches.get(0);
    }

    static LocalDateTime parseTimestamp(String raw, String symbol) {
        String text = raw.strip();
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            return LocalDateTime.parse(text, DATE_TIME);
        } catch (DateTimeParseException e) {
            throw new MalformedResponseException("Unparseable timestamp '" + raw + "'. symbol=" + symbol, e);
        }
    }

    private static double parseValue(String rowKey, JsonNode fields, List<String> columns, String symbol) {
        if (fields == null || !fields.isObject()) {
            throw new MalformedResponseException("Row '" + rowKey + "' is not an object. symbol=" + symbol);
        }
        JsonNode cell = null;
        for (String column : columns) {
            cell = fields.get(column);
            if (cell != null && !cell.isNull()) {
                break;
            }
        }
        if (cell == null || cell.isNull()) {
            throw new MalformedResponseException("Row '" + rowKey + "' has no " + columns.get(0)
                + " field. symbol=" + symbol);
        }
        double value;
        try {
            value = cell.isNumber() ? cell.doubleValue() : Double.parseDouble(cell.asText().strip());
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("Row '" + rowKey + "' has non-numeric price '"
                + cell.asText() + "'. symbol=" + symbol, e);
        }
        if (!Double.isFinite(value)) {
            throw new MalformedResponseException("Row '" + rowKey + "' has non-finite price. symbol=" + symbol);
        }
        return value;
    }

    private static String providerMessage(JsonNode payload) {
        for (String key : PROVIDER_MESSAGE_KEYS) {
            JsonNode msg = payload.get(key);
            if (msg != null && msg.isTextual()) {
                return " provider" + key.replace(" ", "") + "=\"" + msg.asText() + "\"";
            }
        }
        return "";
    }

    private static String symbolOf(PriceQuery query) {
        return query == null ? "?" : query.symbol();
    }
}
