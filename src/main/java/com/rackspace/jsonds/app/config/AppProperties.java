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

import java.util.LinkedHashMap;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("jsonds")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * The datasource instances this bridge serves, keyed by the uid the dashboard sends in the
   * plugin context of each batch.
   */
  @NotNull
  @Valid
  Map<String, Datasource> datasources = new LinkedHashMap<>();

  /**
   * Path appended to a datasource's base URL to reach its query endpoint.
   */
  @NotBlank
  String queryPath = "/query";

  @Data
  public static class Datasource {

    /**
     * Display name, defaults to the uid.
     */
    String name;

    /**
     * Base URL of the upstream JSON service, for example: http://metrics:3030
     */
    @NotBlank
    String url;
  }
}
