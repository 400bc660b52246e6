package com.tsgate.service;

import com.tsgate.api.DataFrame;
import com.tsgate.api.DataQuery;
import com.tsgate.api.DataResponse;
import com.tsgate.api.ErrorResponse;
import com.tsgate.api.QueryDataRequest;
import com.tsgate.api.QueryDataResponse;
import com.tsgate.model.CanonicalQuery;
import com.tsgate.model.ColumnPair;
import com.tsgate.model.StoreQuery;
import com.tsgate.model.TimeWindow;
import com.tsgate.store.MetricStore;
import com.tsgate.store.StoreUnavailableException;
import com.tsgate.web.TraceIdFilter;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs panel queries: normalize, build the ranged find, execute it and assemble columns.
 *
 * <p>Every query of a batch is answered on its own; a failure is reported in that query's entry.
 */
@Slf4j
@Service
public class QueryService {
    private final QueryNormalizer queryNormalizer;
    private final RangeQueryBuilder rangeQueryBuilder;
    private final ColumnarAssembler columnarAssembler;
    private final MetricStore metricStore;

    public QueryService(QueryNormalizer queryNormalizer,
                        RangeQueryBuilder rangeQueryBuilder,
                        ColumnarAssembler columnarAssembler,
                        MetricStore metricStore) {
        this.queryNormalizer = queryNormalizer;
        this.rangeQueryBuilder = rangeQueryBuilder;
        this.columnarAssembler = columnarAssembler;
        this.metricStore = metricStore;
    }

    public QueryDataResponse queryData(QueryDataRequest request) {
        QueryDataResponse response = new QueryDataResponse();
        for (DataQuery query : request.getQueries()) {
            log.debug("answering query request refId={}", query.getRefId());
            response.getResponses().put(query.getRefId(), query(query));
        }
        return response;
    }

    /**
     * Answer one query. Never throws for malformed input, missing data or store failures.
     */
    public DataResponse query(DataQuery query) {
        try {
            return DataResponse.ok(DataFrame.of(execute(query)));
        } catch (MalformedQueryException e) {
            return failure(HttpStatus.BAD_REQUEST, ErrorResponse.MALFORMED_QUERY, e.getMessage());
        } catch (NoDataException e) {
            return failure(HttpStatus.NOT_FOUND, ErrorResponse.NO_DATA, e.getMessage());
        } catch (StoreUnavailableException e) {
            log.warn("error running the find() query for refId={}: {}", query.getRefId(), e.getMessage());
            return failure(HttpStatus.BAD_GATEWAY, ErrorResponse.STORE_UNAVAILABLE, e.getMessage());
        }
    }

    /**
     * Run one query and return its columns.
     *
     * @throws MalformedQueryException if the descriptor or filter cannot be parsed, or a window bound is missing
     * @throws NoDataException if the find returned nothing usable
     * @throws StoreUnavailableException if the store call failed
     */
    public ColumnPair execute(DataQuery query) {
        CanonicalQuery canonical = queryNormalizer.normalize(query.getModel());
        TimeWindow window = query.getTimeRange();
        if (window == null || window.from() == null || window.to() == null) {
            throw new MalformedQueryException("query " + query.getRefId() + " has no complete time range", null);
        }
        long maxPoints = query.getMaxDataPoints() > 0 ? query.getMaxDataPoints() : canonical.maxPoints();

        StoreQuery storeQuery = rangeQueryBuilder.build(canonical, window, maxPoints);
        List<Document> rows = metricStore.find(canonical.collection(), storeQuery);
        log.debug("find on {} returned {} rows", canonical.collection(), rows.size());

        ColumnPair columns = columnarAssembler.assemble(rows, canonical.projectionField());
        log.debug("refId={} answered with {} points", query.getRefId(), columns.size());
        return columns;
    }

    private DataResponse failure(HttpStatus status, String code, String message) {
        return DataResponse.error(status.value(), ErrorResponse.builder()
                .code(code)
                .message(message)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build());
    }
}
