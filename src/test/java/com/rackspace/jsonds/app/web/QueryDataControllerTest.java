/*
 * Copyright 2022 Rackspace US, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.rackspace.jsonds.app.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rackspace.jsonds.app.errors.DatasourceNotFoundException;
import com.rackspace.jsonds.app.model.DataResponse;
import com.rackspace.jsonds.app.model.Field;
import com.rackspace.jsonds.app.model.FieldType;
import com.rackspace.jsonds.app.model.Frame;
import com.rackspace.jsonds.app.model.QueryDataRequest;
import com.rackspace.jsonds.app.model.QueryDataResponse;
import com.rackspace.jsonds.app.services.QueryService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebFlux;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

@ActiveProfiles("test")
@SpringBootTest(classes = {QueryDataController.class, RestWebExceptionHandler.class,
    SimpleMeterRegistry.class})
@AutoConfigureWebTestClient
@AutoConfigureWebFlux
@DirtiesContext(classMode = ClassMode.BEFORE_EACH_TEST_METHOD)
public class QueryDataControllerTest {

  private static final String REQUEST_BODY = "{\"pluginContext\":{\"datasourceUid\":\"test-ds\"},"
      + "\"queries\":[{\"refId\":\"A\",\"target\":\"upper_50\","
      + "\"timeRange\":{\"from\":\"2016-10-31T06:33:44.866Z\",\"to\":\"2016-10-31T12:33:44.866Z\"},"
      + "\"intervalMs\":30000,\"maxDataPoints\":550},"
      + "{\"refId\":\"B\",\"target\":{\"target\":\"upper_75\",\"type\":\"timeserie\"},"
      + "\"timeRange\":{\"from\":\"1d-ago\",\"to\":\"1605094715\"}}]}";

  @MockBean
  QueryService queryService;

  @Autowired
  MeterRegistry meterRegistry;

  @Autowired
  private WebTestClient webTestClient;

  @Test
  public void testQueryData() {
    Field time = Field.of("time", FieldType.TIME);
    time.getValues().add(Instant.parse("2016-10-31T06:33:44.866Z"));
    Field value = Field.of("value", FieldType.NUMBER);
    value.getValues().add(622.0);
    Frame frame = new Frame().setName("upper_50").setRefId("A");
    frame.getFields().add(time);
    frame.getFields().add(value);

    DataResponse failed = DataResponse.upstreamStatus(500, "invalid status code. status: 500");
    Map<String, DataResponse> results = new LinkedHashMap<>();
    results.put("A", DataResponse.success(List.of(frame)));
    results.put("B", failed);
    when(queryService.queryData(any(QueryDataRequest.class)))
        .thenReturn(Mono.just(new QueryDataResponse(results)));

    webTestClient.post()
        .uri("/api/ds/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(REQUEST_BODY)
        .exchange()
        .expectStatus().isOk()
        .expectBody()
        .jsonPath("$.results.A.frames[0].name").isEqualTo("upper_50")
        .jsonPath("$.results.A.frames[0].refId").isEqualTo("A")
        .jsonPath("$.results.A.frames[0].fields[0].type").isEqualTo("time")
        .jsonPath("$.results.A.frames[0].fields[1].type").isEqualTo("number")
        .jsonPath("$.results.A.frames[0].fields[1].values[0]").isEqualTo(622.0)
        .jsonPath("$.results.A.error").doesNotExist()
        .jsonPath("$.results.B.errorType").isEqualTo("UPSTREAM_STATUS")
        .jsonPath("$.results.B.status").isEqualTo(500)
        .jsonPath("$.results.B.error").isEqualTo("invalid status code. status: 500")
        .jsonPath("$.results.B.frames").doesNotExist();

    ArgumentCaptor<QueryDataRequest> captor = ArgumentCaptor.forClass(QueryDataRequest.class);
    verify(queryService).queryData(captor.capture());
    QueryDataRequest request = captor.getValue();
    assertThat(request.getPluginContext().getDatasourceUid()).isEqualTo("test-ds");
    assertThat(request.getQueries()).hasSize(2);
    assertThat(request.getQueries().get(0).getTarget().asText()).isEqualTo("upper_50");
    assertThat(request.getQueries().get(0).getIntervalMs()).isEqualTo(30000L);
    assertThat(request.getQueries().get(0).getMaxDataPoints()).isEqualTo(550);
    assertThat(request.getQueries().get(1).getTarget().path("type").asText()).isEqualTo("timeserie");
    assertThat(request.getQueries().get(1).getTimeRange().getFrom()).isEqualTo("1d-ago");

    assertThat(meterRegistry.get("jsonds.query.batches").counter().count()).isEqualTo(1.0);
  }

  @Test
  public void testQueryData_unknownDatasource() {
    when(queryService.queryData(any(QueryDataRequest.class)))
        .thenReturn(Mono.error(new DatasourceNotFoundException("test-ds")));

    webTestClient.post()
        .uri("/api/ds/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(REQUEST_BODY)
        .exchange()
        .expectStatus().isNotFound()
        .expectBody()
        .jsonPath("$.status").isEqualTo(404)
        .jsonPath("$.message").isEqualTo("No datasource configured with uid test-ds");
  }

  @Test
  public void testQueryData_invalidBatch() {
    when(queryService.queryData(any(QueryDataRequest.class)))
        .thenReturn(Mono.error(new IllegalArgumentException("refId A is used by more than one query")));

    webTestClient.post()
        .uri("/api/ds/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(REQUEST_BODY)
        .exchange()
        .expectStatus().isBadRequest()
        .expectBody()
        .jsonPath("$.status").isEqualTo(400)
        .jsonPath("$.message").isEqualTo("refId A is used by more than one query");
  }

  @Test
  public void testQueryData_unreadableBody() {
    webTestClient.post()
        .uri("/api/ds/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue("{\"queries\": [")
        .exchange()
        .expectStatus().isBadRequest();

    verifyNoInteractions(queryService);
  }

  @Test
  public void testQueryData_unexpectedFailure() {
    when(queryService.queryData(any(QueryDataRequest.class)))
        .thenReturn(Mono.error(new IllegalStateException("registry is broken")));

    webTestClient.post()
        .uri("/api/ds/query")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(REQUEST_BODY)
        .exchange()
        .expectStatus().is5xxServerError()
        .expectBody()
        .jsonPath("$.status").isEqualTo(500)
        .jsonPath("$.message").isEqualTo("Service encountered an unexpected "
            + "condition which prevented it from fulfilling the request.");
  }
}
