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

import com.rackspace.jsonds.app.config.UpstreamClientProperties;
import com.rackspace.jsonds.app.errors.QueryException;
import com.rackspace.jsonds.app.errors.TransportException;
import com.rackspace.jsonds.app.errors.UpstreamStatusException;
import com.rackspace.jsonds.app.model.UpstreamRequest;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Performs exactly one upstream call per request, without retries. Cancelling the subscription
 * aborts the exchange and releases its pooled connection.
 */
@Component
@Slf4j
public class UpstreamClient {

  private static final byte[] EMPTY_BODY = new byte[0];

  private final WebClient webClient;
  private final Duration requestTimeout;

  @Autowired
  public UpstreamClient(WebClient upstreamWebClient, UpstreamClientProperties properties) {
    this.webClient = upstreamWebClient;
    this.requestTimeout = properties.getRequestTimeout();
  }

  /**
   * @return the response body, empty array if the upstream sent none. Fails with
   * {@link UpstreamStatusException} for any status but 200 and {@link TransportException} when the
   * upstream could not be reached in time.
   */
  public Mono<byte[]> execute(UpstreamRequest request) {
    return Mono.defer(() -> webClient.post()
            .uri(request.getUri())
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(request.getBody())
            .exchangeToMono(this::readBody))
        .timeout(requestTimeout)
        .onErrorMap(e -> !(e instanceof QueryException),
            e -> new TransportException(request.getUri(), e))
        .doOnSubscribe(s -> log.debug("Calling {} for query {}", request.getUri(), request.getRefId()))
        .doOnNext(body -> log.debug("Query {} received {} bytes", request.getRefId(), body.length));
  }

  private Mono<byte[]> readBody(ClientResponse response) {
    if (response.rawStatusCode() != HttpStatus.OK.value()) {
      return response.releaseBody()
          .then(Mono.error(new UpstreamStatusException(response.rawStatusCode())));
    }
    return response.bodyToMono(byte[].class)
        .defaultIfEmpty(EMPTY_BODY);
  }
}
