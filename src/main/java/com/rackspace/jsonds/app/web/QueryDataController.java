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

import com.rackspace.jsonds.app.model.QueryDataRequest;
import com.rackspace.jsonds.app.model.QueryDataResponse;
import com.rackspace.jsonds.app.services.QueryService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Receives query batches from the dashboard. The response is always 200 when the datasource
 * resolves, with failed queries reported in their own result.
 */
@RestController
@RequestMapping("/api/ds/query")
public class QueryDataController {

  private final QueryService queryService;
  private final Counter batchCounter;

  @Autowired
  public QueryDataController(QueryService queryService, MeterRegistry meterRegistry) {
    this.queryService = queryService;
    this.batchCounter = meterRegistry.counter("jsonds.query.batches");
  }

  @PostMapping
  public Mono<QueryDataResponse> queryData(@RequestBody QueryDataRequest request) {
    batchCounter.increment();
    return queryService.queryData(request);
  }
}
