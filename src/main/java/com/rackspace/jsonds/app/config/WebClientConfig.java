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

package com.rackspace.jsonds.app.config;

import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.Http11SslContextSpec;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

/**
 * Builds the single HTTP client used for all upstream calls. Its connection pool is the only
 * state shared between concurrently running queries.
 */
@Configuration
public class WebClientConfig {

  public static final String POOL_NAME = "jsonds-upstream";

  @Bean(destroyMethod = "dispose")
  public ConnectionProvider upstreamConnectionProvider(UpstreamClientProperties properties) {
    return connectionProvider(properties);
  }

  @Bean
  public WebClient upstreamWebClient(WebClient.Builder webClientBuilder,
                                     ConnectionProvider upstreamConnectionProvider,
                                     UpstreamClientProperties properties) {
    return webClientBuilder
        .clientConnector(new ReactorClientHttpConnector(
            httpClient(upstreamConnectionProvider, properties)))
        .codecs(configurer -> configurer.defaultCodecs()
            .maxInMemorySize((int) properties.getMaxInMemorySize().toBytes()))
        .build();
  }

  public static ConnectionProvider connectionProvider(UpstreamClientProperties properties) {
    return ConnectionProvider.builder(POOL_NAME)
        .maxConnections(properties.getMaxConnections())
        .pendingAcquireMaxCount(-1)
        .maxIdleTime(properties.getMaxIdleTime())
        .evictInBackground(properties.getMaxIdleTime())
        .build();
  }

  public static HttpClient httpClient(ConnectionProvider connectionProvider,
                                      UpstreamClientProperties properties) {
    HttpClient httpClient = HttpClient.create(connectionProvider)
        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS,
            (int) properties.getConnectTimeout().toMillis())
        .responseTimeout(properties.getRequestTimeout())
        // only applied to https URLs
        .secure(spec -> spec.sslContext(Http11SslContextSpec.forClient())
            .handshakeTimeout(properties.getTlsHandshakeTimeout()));
    if (properties.isUseSystemProxy()) {
      httpClient = httpClient.proxyWithSystemProperties();
    }
    return httpClient;
  }
}
