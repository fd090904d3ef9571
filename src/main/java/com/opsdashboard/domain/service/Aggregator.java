package com.opsdashboard.domain.service;

import com.opsdashboard.domain.exception.ValidationException;
import com.opsdashboard.domain.model.AnalyticsRecord;
import com.opsdashboard.domain.model.BreakdownEntry;
import com.opsdashboard.domain.model.FilterOptions;
import com.opsdashboard.domain.model.Granularity;
import com.opsdashboard.domain.model.MetricResult;
import com.opsdashboard.domain.model.RecordSchema;
import com.opsdashboard.domain.model.RowSet;
import com.opsdashboard.domain.model.TimeSeriesPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Read-only computations over an already filtered row set.
 *
 * Every operation is a deterministic function of its arguments. Rows with a
 * missing timestamp or a non-finite value are skipped, never fatal.
 */
@Slf4j
@Component
public class Aggregator {

    public MetricResult metrics(RowSet rows) {
        return metrics(rows, null);
    }

    /**
     * Count, sum, average, min and max. When a comparison row set is given,
     * the trend against its sum is added; otherwise the trend is omitted.
     */
    public MetricResult metrics(RowSet rows, RowSet comparison) {
        Accumulator current = new Accumulator();
        aggregatable(rows).forEach(row -> current.add(row.getValue()));

        MetricResult.MetricResultBuilder result = MetricResult.builder()
                .count(current.count)
                .sum(current.sum)
                .average(current.average())
                .min(current.lowest())
                .max(current.highest());

        if (comparison != null) {
            double previousSum = aggregatable(comparison).mapToDouble(AnalyticsRecord::getValue).sum();
            result.previousSum(previousSum);
            if (previousSum != 0.0) {
                result.trendPercent((current.sum - previousSum) / Math.abs(previousSum) * 100.0);
            }
        }
        return result.build();
    }

    /**
     * Contiguous, ascending buckets over {@code [from, to]}, zero-filled where
     * no rows fall. A missing bound is taken from the rows themselves; with
     * no rows and no bounds the series is empty.
     */
    public List<TimeSeriesPoint> timeSeries(RowSet rows, Granularity granularity, LocalDate from, LocalDate to) {
        List<AnalyticsRecord> valid = aggregatable(rows).collect(Collectors.toList());

        LocalDate first = from;
        LocalDate last = to;
        if (first == null || last == null) {
            LocalDate dataMin = valid.stream().map(row -> row.getTimestamp().toLocalDate())
                    .min(Comparator.naturalOrder()).orElse(null);
            LocalDate dataMax = valid.stream().map(row -> row.getTimestamp().toLocalDate())
                    .max(Comparator.naturalOrder()).orElse(null);
            first = first != null ? first : dataMin;
            last = last != null ? last : dataMax;
        }
        if (first == null || last == null || first.isAfter(last)) {
            return List.of();
        }

        Map<LocalDate, Accumulator> buckets = new TreeMap<>();
        LocalDate end = granularity.bucketStart(last);
        for (LocalDate bucket = granularity.bucketStart(first); !bucket.isAfter(end); bucket = granularity.next(bucket)) {
            buckets.put(bucket, new Accumulator());
        }

        for (AnalyticsRecord row : valid) {
            Accumulator bucket = buckets.get(granularity.bucketStart(row.getTimestamp()));
            if (bucket != null) {
                bucket.add(row.getValue());
            }
        }

        List<TimeSeriesPoint> series = new ArrayList<>(buckets.size());
        buckets.forEach((start, acc) -> series.add(TimeSeriesPoint.builder()
                .bucketStart(start)
                .granularity(granularity)
                .sum(acc.sum)
                .count(acc.count)
                .average(acc.average())
                .min(acc.lowest())
                .max(acc.highest())
                .build()));
        return series;
    }

    /**
     * Groups by one filterable field. Entries are ordered by sum descending,
     * then by value ascending; percentages are shares of the total sum (of
     * the count when the sum is zero).
     */
    public List<BreakdownEntry> breakdown(RecordSchema schema, RowSet rows, String field) {
        if (!schema.isFilterable(field)) {
            throw new ValidationException(ValidationException.Kind.INVALID_DIMENSION, "dimension",
                    "Cannot break down " + schema.getDomain() + " by '" + field + "', expected one of "
                            + schema.filterableFields());
        }

        Map<String, Accumulator> groups = new HashMap<>();
        aggregatable(rows).forEach(row -> {
            String key = row.categoryValue(schema, field);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new Accumulator()).add(row.getValue());
            }
        });

        double totalSum = groups.values().stream().mapToDouble(acc -> acc.sum).sum();
        long totalCount = groups.values().stream().mapToLong(acc -> acc.count).sum();
        boolean bySum = totalSum != 0.0;

        return groups.entrySet().stream()
                .map(e -> BreakdownEntry.builder()
                        .value(e.getKey())
                        .count(e.getValue().count)
                        .sum(e.getValue().sum)
                        .average(e.getValue().average())
                        .percentage(bySum
                                ? e.getValue().sum / totalSum * 100.0
                                : (double) e.getValue().count / totalCount * 100.0)
                        .build())
                .sorted(Comparator.comparingDouble(BreakdownEntry::getSum).reversed()
                        .thenComparing(BreakdownEntry::getValue))
                .collect(Collectors.toList());
    }

    /**
     * Normalizes raw distinct values: nulls and blanks dropped, duplicates
     * removed, sorted ascending. Fields keep the schema's order.
     */
    public FilterOptions filterOptions(RecordSchema schema, Map<String, ? extends Collection<String>> distinctValues) {
        Map<String, List<String>> options = new LinkedHashMap<>();
        for (String field : schema.filterableFields()) {
            Collection<String> values = distinctValues.get(field);
            options.put(field, values == null ? List.of() : values.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(value -> !value.isEmpty())
                    .distinct()
                    .sorted()
                    .collect(Collectors.toList()));
        }
        return FilterOptions.builder()
                .domain(schema.getDomain())
                .options(options)
                .build();
    }

    private Stream<AnalyticsRecord> aggregatable(RowSet rows) {
        long skipped = rows.stream().filter(row -> !row.isAggregatable()).count();
        if (skipped > 0) {
            log.debug("Skipping {} {} rows with missing timestamp or non-finite value", skipped, rows.getDomain());
        }
        return rows.stream().filter(AnalyticsRecord::isAggregatable);
    }

    private static final class Accumulator {
        long count;
        double sum;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;

        void add(double value) {
            count++;
            sum += value;
            min = Math.min(min, value);
            max = Math.max(max, value);
        }

        double average() {
            return count == 0 ? 0.0 : sum / count;
        }

        double lowest() {
            return count == 0 ? 0.0 : min;
        }

        double highest() {
            return count == 0 ? 0.0 : max;
        }
    }
}
