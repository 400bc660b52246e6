package com.tsgate.controller;

import com.tsgate.api.DataResponse;
import com.tsgate.api.ErrorResponse;
import com.tsgate.api.HealthResponse;
import com.tsgate.api.LabelValue;
import com.tsgate.api.MetricDescriptor;
import com.tsgate.api.MetricsRequest;
import com.tsgate.api.QueryDataRequest;
import com.tsgate.api.QueryDataResponse;
import com.tsgate.api.TagOption;
import com.tsgate.service.HealthService;
import com.tsgate.service.QueryService;
import com.tsgate.service.SchemaDiscoveryService;
import com.tsgate.store.StoreUnavailableException;
import com.tsgate.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class GatewayControllerTest {

    @Mock
    private QueryService queryService;

    @Mock
    private SchemaDiscoveryService schemaDiscoveryService;

    @Mock
    private HealthService healthService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        GatewayController controller = new GatewayController(queryService, schemaDiscoveryService, healthService);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void metricsResourceRendersPanelOptions() throws Exception {
        TagOption host = TagOption.builder()
                .key("host")
                .placeHolder("select a value")
                .valueOptions(List.of(LabelValue.of("web-1")))
                .build();
        when(schemaDiscoveryService.discover(any(MetricsRequest.class))).thenReturn(List.of(
                MetricDescriptor.builder().name("cpu").tagOptions(List.of(host)).build(),
                MetricDescriptor.builder().name("disk").build()));

        mockMvc.perform(post("/v1/resources/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metric\": \"\", \"payload\": {}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].label").value("cpu"))
                .andExpect(jsonPath("$[0].value").value("cpu"))
                .andExpect(jsonPath("$[0].payload[0].name").value("host"))
                .andExpect(jsonPath("$[0].payload[0].label").value("host"))
                .andExpect(jsonPath("$[0].payload[0].type").value("select"))
                .andExpect(jsonPath("$[0].payload[0].placeholder").value("select a value"))
                .andExpect(jsonPath("$[0].payload[0].options[0].value").value("web-1"))
                .andExpect(jsonPath("$[1].value").value("disk"))
                .andExpect(jsonPath("$[1].payload").doesNotExist());
    }

    @Test
    void unknownResourceIsNotFound() throws Exception {
        mockMvc.perform(post("/v1/resources/tag-values")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("requested non-existent resource tag-values"));

        verifyNoInteractions(schemaDiscoveryService);
    }

    @Test
    void discoveryStoreFailureIsBadGateway() throws Exception {
        when(schemaDiscoveryService.discover(any(MetricsRequest.class)))
                .thenThrow(new StoreUnavailableException("couldn't retrieve the collections: timeout", null));

        mockMvc.perform(post("/v1/resources/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value(ErrorResponse.STORE_UNAVAILABLE));
    }

    @Test
    void queryReturnsEntriesPerRefId() throws Exception {
        QueryDataResponse response = new QueryDataResponse();
        response.getResponses().put("A", DataResponse.error(404, ErrorResponse.builder()
                .code(ErrorResponse.NO_DATA)
                .message("got no fields back...")
                .build()));
        when(queryService.queryData(any(QueryDataRequest.class))).thenReturn(response);

        String body = """
                {"queries": [{
                  "refId": "A",
                  "timeRange": {"from": "2024-05-01T00:00:00Z", "to": "2024-05-01T01:00:00Z"},
                  "maxDataPoints": 100,
                  "model": {"editorMode": "builder", "target": "cpu", "payload": {"projection": "usage_user"}}
                }]}
                """;

        mockMvc.perform(post("/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.responses.A.status").value(404))
                .andExpect(jsonPath("$.responses.A.error.code").value(ErrorResponse.NO_DATA))
                .andExpect(jsonPath("$.responses.A.frames").doesNotExist());
    }

    @Test
    void emptyBatchFailsValidation() throws Exception {
        mockMvc.perform(post("/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"queries\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verifyNoInteractions(queryService);
    }

    @Test
    void windowWithoutBoundsFailsValidation() throws Exception {
        String body = """
                {"queries": [{
                  "refId": "A",
                  "timeRange": {},
                  "model": {"editorMode": "builder", "target": "cpu", "payload": {"projection": "usage_user"}}
                }]}
                """;

        mockMvc.perform(post("/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        verifyNoInteractions(queryService);
    }

    @Test
    void unreadableBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"queries\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ErrorResponse.MALFORMED_QUERY));
    }

    @Test
    void healthReportsStoreState() throws Exception {
        when(healthService.check()).thenReturn(
                new HealthResponse(HealthResponse.Status.ERROR, "Error when pinging the database: timeout"));

        mockMvc.perform(get("/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ERROR"))
                .andExpect(jsonPath("$.message").value("Error when pinging the database: timeout"));
    }
}
