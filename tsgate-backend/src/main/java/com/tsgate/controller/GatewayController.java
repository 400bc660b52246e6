package com.tsgate.controller;

import com.tsgate.api.ErrorResponse;
import com.tsgate.api.HealthResponse;
import com.tsgate.api.MetricDescriptor;
import com.tsgate.api.MetricsRequest;
import com.tsgate.api.QueryDataRequest;
import com.tsgate.api.QueryDataResponse;
import com.tsgate.service.HealthService;
import com.tsgate.service.QueryService;
import com.tsgate.service.SchemaDiscoveryService;
import com.tsgate.web.TraceIdFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1")
public class GatewayController {

    private static final Logger log = LoggerFactory.getLogger(GatewayController.class);

    static final String METRICS_RESOURCE = "metrics";

    private final QueryService queryService;
    private final SchemaDiscoveryService schemaDiscoveryService;
    private final HealthService healthService;

    public GatewayController(
            QueryService queryService,
            SchemaDiscoveryService schemaDiscoveryService,
            HealthService healthService
    ) {
        this.queryService = queryService;
        this.schemaDiscoveryService = schemaDiscoveryService;
        this.healthService = healthService;
    }

    /**
     * Answer a batch of panel queries.
     *
     * POST /v1/query
     *
     * @param request queries with their time windows and caps
     * @return one entry per refId; failed queries carry an error instead of frames
     */
    @PostMapping("/query")
    public ResponseEntity<QueryDataResponse> query(@Valid @RequestBody QueryDataRequest request) {
        log.debug("Query requested: queries={}, trace_id={}", request.getQueries().size(), MDC.get(TraceIdFilter.MDC_TRACE_ID));
        return ResponseEntity.ok(queryService.queryData(request));
    }

    /**
     * Resource calls made by the query editor.
     *
     * POST /v1/resources/{path}
     *
     * @param path resource name; only {@code metrics} exists
     * @param request metrics request body
     * @return metric descriptors, or 404 for unknown resources
     */
    @PostMapping("/resources/{path}")
    public ResponseEntity<?> resource(
            @PathVariable("path") String path,
            @RequestBody(required = false) MetricsRequest request
    ) {
        if (!METRICS_RESOURCE.equals(path)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                    .code("NOT_FOUND")
                    .message("requested non-existent resource " + path)
                    .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                    .build());
        }

        log.debug("handling metrics request: {}", request);
        List<MetricDescriptor> metrics = schemaDiscoveryService.discover(request != null ? request : new MetricsRequest());
        return ResponseEntity.ok(metrics);
    }

    /**
     * Ping the backing store.
     *
     * GET /v1/health
     */
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(healthService.check());
    }
}
