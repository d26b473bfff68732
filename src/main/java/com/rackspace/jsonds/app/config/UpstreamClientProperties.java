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

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties("jsonds.upstream")
@Component
@Data
@Validated
public class UpstreamClientProperties {

  /**
   * Upper bound on a whole upstream exchange, from connect through reading the body.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration requestTimeout = Duration.ofSeconds(30);

  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration connectTimeout = Duration.ofSeconds(30);

  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration tlsHandshakeTimeout = Duration.ofSeconds(10);

  /**
   * Upper bound on open upstream connections across every batch. Unbounded by default so that
   * every query of a batch can be in flight at once; calls over a configured bound wait for a
   * free connection without a limit on how many may wait.
   */
  @Min(1)
  int maxConnections = Integer.MAX_VALUE;

  /**
   * Pooled connections idle for longer than this are closed.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration maxIdleTime = Duration.ofSeconds(90);

  /**
   * Largest upstream response body that will be buffered for decoding.
   */
  @NotNull
  DataSize maxInMemorySize = DataSize.ofMegabytes(16);

  /**
   * Route upstream calls through the proxy given by the standard <code>http.proxyHost</code>
   * style system properties.
   */
  boolean useSystemProxy = true;
}
