package com.opsdashboard.domain.service;

import com.opsdashboard.domain.exception.ValidationException;
import com.opsdashboard.domain.model.FilterSpecification;
import com.opsdashboard.domain.model.RecordSchema;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds a {@link FilterSpecification} from raw request parameters.
 *
 * Parsing is permissive: a malformed individual value is dropped and noted as
 * a warning instead of failing the request. Inverted ranges are the exception
 * and always fail with {@code INVALID_RANGE}.
 *
 * Recognized keys:
 * - date_from / start_date, date_to / end_date (ISO date or date-time, 'T' or space separated)
 * - compare_from, compare_to (comparison window for the trend)
 * - min_value, max_value
 * - every filterable field of the schema (comma-separated or repeated for membership)
 */
@Slf4j
@Component
public class FilterSpecificationParser {

    static final String DATE_FROM = "date_from";
    static final String DATE_TO = "date_to";
    static final String START_DATE = "start_date";
    static final String END_DATE = "end_date";
    static final String COMPARE_FROM = "compare_from";
    static final String COMPARE_TO = "compare_to";
    static final String MIN_VALUE = "min_value";
    static final String MAX_VALUE = "max_value";

    public FilterSpecification parse(RecordSchema schema, Map<String, ?> rawParams) {
        Map<String, ?> params = rawParams != null ? rawParams : Map.of();
        List<String> warnings = new ArrayList<>();

        LocalDateTime dateFrom = parseLowerBound(firstPresent(params, DATE_FROM, START_DATE), warnings);
        LocalDateTime dateTo = parseUpperBound(firstPresent(params, DATE_TO, END_DATE), warnings);
        requireOrdered(DATE_FROM, dateFrom, dateTo);

        LocalDateTime compareFrom = parseLowerBound(param(params, COMPARE_FROM), warnings);
        LocalDateTime compareTo = parseUpperBound(param(params, COMPARE_TO), warnings);
        requireOrdered(COMPARE_FROM, compareFrom, compareTo);
        if ((compareFrom == null) != (compareTo == null)) {
            warnings.add("Comparison window needs both compare_from and compare_to, ignoring it");
            compareFrom = null;
            compareTo = null;
        }

        Double minValue = parseNumber(MIN_VALUE, params.get(MIN_VALUE), warnings);
        Double maxValue = parseNumber(MAX_VALUE, params.get(MAX_VALUE), warnings);
        requireOrdered(MIN_VALUE, minValue, maxValue);

        Map<String, Set<String>> memberships = new TreeMap<>();
        for (String field : schema.filterableFields()) {
            SortedSet<String> values = parseValues(schema, field, params.get(field), warnings);
            if (!values.isEmpty()) {
                memberships.put(field, Collections.unmodifiableSortedSet(values));
            }
        }

        warnings.forEach(warning -> log.warn("Filter value dropped ({}): {}", schema.getDomain(), warning));

        return FilterSpecification.builder()
                .dateFrom(dateFrom)
                .dateTo(dateTo)
                .memberships(Collections.unmodifiableMap(memberships))
                .minValue(minValue)
                .maxValue(maxValue)
                .compareFrom(compareFrom)
                .compareTo(compareTo)
                .warnings(List.copyOf(warnings))
                .build();
    }

    private <T extends Comparable<? super T>> void requireOrdered(String field, T lower, T upper) {
        if (lower != null && upper != null && lower.compareTo(upper) > 0) {
            throw new ValidationException(ValidationException.Kind.INVALID_RANGE, field,
                    "Invalid range: " + lower + " is after " + upper);
        }
    }

    private LocalDateTime parseLowerBound(Param raw, List<String> warnings) {
        return parseDate(raw, false, warnings);
    }

    private LocalDateTime parseUpperBound(Param raw, List<String> warnings) {
        return parseDate(raw, true, warnings);
    }

    /**
     * A date-only upper bound covers that whole day. Upper bounds are cut to
     * microseconds, the finest timestamp precision of the store; finer bounds
     * get rounded up by the JDBC driver and would reach into the next day.
     * A space is accepted in place of the 'T' separator.
     */
    private LocalDateTime parseDate(Param raw, boolean upperBound, List<String> warnings) {
        if (raw == null) {
            return null;
        }
        String text = raw.text();
        if (text == null) {
            return null;
        }
        try {
            LocalDateTime parsed;
            if (text.length() == 10) {
                LocalDate date = LocalDate.parse(text);
                parsed = upperBound ? date.atTime(LocalTime.MAX) : date.atStartOfDay();
            } else {
                String isoText = text.length() > 10 && text.charAt(10) == ' '
                        ? text.substring(0, 10) + 'T' + text.substring(11)
                        : text;
                parsed = hasOffset(isoText)
                        ? OffsetDateTime.parse(isoText).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime()
                        : LocalDateTime.parse(isoText);
            }
            return upperBound ? parsed.truncatedTo(ChronoUnit.MICROS) : parsed;
        } catch (DateTimeParseException e) {
            warnings.add(raw.getKey() + ": not a valid ISO date '" + text + "'");
            return null;
        }
    }

    private boolean hasOffset(String text) {
        int timeStart = text.indexOf('T');
        if (timeStart < 0) {
            return false;
        }
        String time = text.substring(timeStart);
        return time.endsWith("Z") || time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }

    private Double parseNumber(String key, Object raw, List<String> warnings) {
        Object value = single(raw);
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            double parsed = ((Number) value).doubleValue();
            if (!Double.isFinite(parsed)) {
                warnings.add(key + ": not a finite number");
                return null;
            }
            return parsed;
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(text);
            if (!Double.isFinite(parsed)) {
                warnings.add(key + ": not a finite number '" + text + "'");
                return null;
            }
            return parsed;
        } catch (NumberFormatException e) {
            warnings.add(key + ": not a number '" + text + "'");
            return null;
        }
    }

    private SortedSet<String> parseValues(RecordSchema schema, String field, Object raw, List<String> warnings) {
        SortedSet<String> values = new TreeSet<>();
        boolean isStatus = field.equals(schema.getStatusField());
        for (String item : flatten(raw)) {
            for (String part : item.split(",")) {
                String value = part.trim();
                if (value.isEmpty()) {
                    continue;
                }
                if (isStatus) {
                    value = value.toLowerCase(Locale.ROOT);
                    if (!schema.getAllowedStatuses().contains(value)) {
                        warnings.add(field + ": unknown status '" + part.trim() + "'");
                        continue;
                    }
                }
                values.add(value);
            }
        }
        return values;
    }

    private Param firstPresent(Map<String, ?> params, String... keys) {
        for (String key : keys) {
            Param param = param(params, key);
            if (param != null && param.text() != null) {
                return param;
            }
        }
        return null;
    }

    private Param param(Map<String, ?> params, String key) {
        Object value = single(params.get(key));
        return value != null ? new Param(key, value.toString().trim()) : null;
    }

    // Multi-valued parameters: only the first value counts for scalar keys
    private Object single(Object raw) {
        if (raw instanceof Collection) {
            Collection<?> collection = (Collection<?>) raw;
            return collection.isEmpty() ? null : collection.iterator().next();
        }
        if (raw instanceof Object[]) {
            Object[] array = (Object[]) raw;
            return array.length == 0 ? null : array[0];
        }
        return raw;
    }

    private List<String> flatten(Object raw) {
        if (raw == null) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        if (raw instanceof Collection) {
            ((Collection<?>) raw).stream().filter(Objects::nonNull).forEach(item -> items.add(item.toString()));
        } else if (raw instanceof Object[]) {
            Arrays.stream((Object[]) raw).filter(Objects::nonNull).forEach(item -> items.add(item.toString()));
        } else {
            items.add(raw.toString());
        }
        return items;
    }

    @Value
    private static class Param {
        String key;
        String value;

        String text() {
            return value == null || value.isEmpty() ? null : value;
        }
    }
}
