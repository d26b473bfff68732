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

package com.rackspace.jsonds.app.services;

import com.rackspace.jsonds.app.errors.QueryCancelledException;
import com.rackspace.jsonds.app.errors.QueryException;
import com.rackspace.jsonds.app.errors.UpstreamStatusException;
import com.rackspace.jsonds.app.model.DataQuery;
import com.rackspace.jsonds.app.model.DataResponse;
import com.rackspace.jsonds.app.model.DatasourceSettings;
import com.rackspace.jsonds.app.model.QueryDataRequest;
import com.rackspace.jsonds.app.model.QueryDataResponse;
import com.rackspace.jsonds.app.model.QueryErrorType;
import com.rackspace.jsonds.app.services.QueryUnit.State;
import com.rackspace.jsonds.app.validation.QueryRequestValidator;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

/**
 * Runs every query of a batch concurrently and joins their results into one response keyed by
 * refId. A query that fails only fills its own slot with an error; the batch itself fails only
 * when its datasource cannot be resolved.
 */
@Service
@Slf4j
public class QueryService {

  private final QueryRequestValidator queryRequestValidator;
  private final DatasourceRegistry datasourceRegistry;
  private final RequestTranslator requestTranslator;
  private final UpstreamClient upstreamClient;
  private final ResponseDecoder responseDecoder;
  private final MeterRegistry meterRegistry;

  @Autowired
  public QueryService(QueryRequestValidator queryRequestValidator,
                      DatasourceRegistry datasourceRegistry,
                      RequestTranslator requestTranslator,
                      UpstreamClient upstreamClient,
                      ResponseDecoder responseDecoder,
                      MeterRegistry meterRegistry) {
    this.queryRequestValidator = queryRequestValidator;
    this.datasourceRegistry = datasourceRegistry;
    this.requestTranslator = requestTranslator;
    this.upstreamClient = upstreamClient;
    this.responseDecoder = responseDecoder;
    this.meterRegistry = meterRegistry;
  }

  public Mono<QueryDataResponse> queryData(QueryDataRequest request) {
    return queryData(request, Mono.never());
  }

  /**
   * @param cancellation when this emits or completes, queries still waiting on the upstream are
   * aborted and resolve to {@link QueryErrorType#CANCELLED}
   */
  public Mono<QueryDataResponse> queryData(QueryDataRequest request, Publisher<?> cancellation) {
    return Mono.fromCallable(() -> {
          queryRequestValidator.validate(request);
          return datasourceRegistry.resolve(request.getPluginContext());
        })
        .flatMap(settings -> executeBatch(request.getQueries(), settings, cancellation));
  }

  /**
   * Expects the refIds of the queries to be present and unique, as checked by
   * {@link QueryRequestValidator}.
   */
  public Mono<QueryDataResponse> executeBatch(List<DataQuery> queries,
                                              DatasourceSettings settings,
                                              Publisher<?> cancellation) {
    if (queries == null || queries.isEmpty()) {
      return Mono.just(QueryDataResponse.empty());
    }
    log.debug("Executing {} queries against datasource {}", queries.size(), settings.getUid());
    Mono<Object> cancelled = Mono.<Object>from(cancellation).cache();

    return Flux.fromIterable(queries)
        // one inner subscription per query so that every call is in flight at once
        .flatMap(query -> executeQuery(query, settings, cancelled)
            .map(response -> Tuples.of(query.getRefId(), response)), queries.size())
        .collectMap(Tuple2::getT1, Tuple2::getT2, LinkedHashMap::new)
        .map(QueryDataResponse::new);
  }

  private Mono<DataResponse> executeQuery(DataQuery query, DatasourceSettings settings,
                                          Mono<Object> cancelled) {
    QueryUnit unit = new QueryUnit(query.getRefId());
    return Mono.fromCallable(() -> {
          unit.advance(State.TRANSLATING);
          return requestTranslator.translate(query, settings);
        })
        .flatMap(request -> {
          unit.advance(State.CALLING);
          return upstreamClient.execute(request)
              .takeUntilOther(cancelled)
              .switchIfEmpty(Mono.error(() -> new QueryCancelledException(query.getRefId())));
        })
        .map(body -> {
          unit.advance(State.DECODING);
          return responseDecoder.decode(query, body);
        })
        .doOnNext(response -> unit.advance(State.SUCCEEDED))
        .onErrorResume(e -> Mono.just(toFailure(unit, e)))
        .doOnNext(this::recordOutcome);
  }

  private DataResponse toFailure(QueryUnit unit, Throwable e) {
    State failedIn = unit.fail();
    if (e instanceof QueryException) {
      log.warn("Query {} failed while {}: {}", unit.getRefId(), failedIn, e.getMessage());
      if (e instanceof UpstreamStatusException) {
        return DataResponse.upstreamStatus(((UpstreamStatusException) e).getStatus(), e.getMessage());
      }
      return DataResponse.failure(((QueryException) e).getErrorType(), e.getMessage());
    }
    log.warn("Query {} failed unexpectedly while {}", unit.getRefId(), failedIn, e);
    return DataResponse.failure(QueryErrorType.INTERNAL, e.toString());
  }

  private void recordOutcome(DataResponse response) {
    String result = response.isSuccess() ? "success" : response.getErrorType().name().toLowerCase(Locale.ROOT);
    meterRegistry.counter("jsonds.query.results", "result", result).increment();
  }
}
