package com.opsdashboard.api;

import com.opsdashboard.domain.model.BreakdownEntry;
import com.opsdashboard.domain.model.Domain;
import com.opsdashboard.domain.model.FilterOptions;
import com.opsdashboard.domain.model.Granularity;
import com.opsdashboard.domain.model.MetricResult;
import com.opsdashboard.domain.model.PageResult;
import com.opsdashboard.domain.model.ReportResponse;
import com.opsdashboard.domain.model.SortDirection;
import com.opsdashboard.domain.model.TimeSeriesPoint;
import com.opsdashboard.domain.service.ReportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for dashboard reports. {domain} is "transactions" or "equipment".
 *
 * Endpoints:
 * - GET /api/v1/{domain}/metrics - count, sum, average, min, max (+ trend with compare_from/compare_to)
 * - GET /api/v1/{domain}/time-series - gap-filled series, group_by=day|month
 * - GET /api/v1/{domain}/breakdown - grouped by one dimension (dimension=...)
 * - GET /api/v1/{domain}/list - sorted, paginated rows
 * - GET /api/v1/{domain}/filters - distinct values for the filter controls
 *
 * Filter Parameters (all optional, unknown ones ignored):
 * - date_from, date_to (or start_date, end_date): ISO date or date-time, inclusive
 * - category / equipment_id / metric_name / status: one value, comma list or repeated
 * - min_value, max_value: numeric range
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/{domain}")
@RequiredArgsConstructor
public class DashboardController {

    private final ReportService reportService;

    @GetMapping("/metrics")
    public ResponseEntity<ReportResponse<MetricResult>> metrics(
            @PathVariable String domain,
            @RequestParam MultiValueMap<String, String> params) {

        log.info("Metrics: domain={}, params={}", domain, params);

        return ResponseEntity.ok(reportService.metrics(Domain.fromPath(domain), params));
    }

    @GetMapping("/time-series")
    public ResponseEntity<ReportResponse<List<TimeSeriesPoint>>> timeSeries(
            @PathVariable String domain,
            @RequestParam(name = "group_by", required = false) String groupBy,
            @RequestParam MultiValueMap<String, String> params) {

        log.info("Time series: domain={}, groupBy={}, params={}", domain, groupBy, params);

        return ResponseEntity.ok(reportService.timeSeries(Domain.fromPath(domain), params, Granularity.from(groupBy)));
    }

    @GetMapping("/breakdown")
    public ResponseEntity<ReportResponse<List<BreakdownEntry>>> breakdown(
            @PathVariable String domain,
            @RequestParam(required = false) String dimension,
            @RequestParam MultiValueMap<String, String> params) {

        log.info("Breakdown: domain={}, dimension={}, params={}", domain, dimension, params);

        return ResponseEntity.ok(reportService.breakdown(Domain.fromPath(domain), params, dimension));
    }

    /**
     * Page size defaults to 100 and is capped at the configured maximum.
     * {@code limit} is accepted as an alias of {@code page_size}.
     */
    @GetMapping("/list")
    public ResponseEntity<ReportResponse<PageResult>> list(
            @PathVariable String domain,
            @RequestParam(required = false) String sort,
            @RequestParam(required = false) String direction,
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "page_size", required = false) Integer pageSize,
            @RequestParam(required = false) Integer limit,
            @RequestParam MultiValueMap<String, String> params) {

        log.info("List: domain={}, sort={}, direction={}, page={}, pageSize={}",
                domain, sort, direction, page, pageSize != null ? pageSize : limit);

        return ResponseEntity.ok(reportService.list(Domain.fromPath(domain), params, sort,
                SortDirection.from(direction), page, pageSize != null ? pageSize : limit));
    }

    @GetMapping("/filters")
    public ResponseEntity<ReportResponse<FilterOptions>> filters(@PathVariable String domain) {
        log.info("Filter options: domain={}", domain);

        return ResponseEntity.ok(reportService.filterOptions(Domain.fromPath(domain)));
    }
}
