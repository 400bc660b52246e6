package com.tsgate.service;

import com.tsgate.api.HealthResponse;
import com.tsgate.store.MetricStore;
import com.tsgate.store.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class HealthService {

    private final MetricStore metricStore;

    public HealthService(MetricStore metricStore) {
        this.metricStore = metricStore;
    }

    public HealthResponse check() {
        log.debug("checking the health of the backing store");
        try {
            metricStore.ping();
        } catch (StoreUnavailableException e) {
            log.error("error trying to ping the database: {}", e.getMessage());
            return new HealthResponse(HealthResponse.Status.ERROR, "Error when pinging the database: " + e.getMessage());
        }
        return new HealthResponse(HealthResponse.Status.OK, "Data source is working!");
    }
}
