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

import com.rackspace.jsonds.app.config.AppProperties;
import com.rackspace.jsonds.app.config.AppProperties.Datasource;
import com.rackspace.jsonds.app.errors.DatasourceNotFoundException;
import com.rackspace.jsonds.app.model.DatasourceSettings;
import com.rackspace.jsonds.app.model.PluginContext;
import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Resolves the plugin context of a batch into the settings of a configured datasource.
 */
@Service
@Slf4j
public class DatasourceRegistry {

  private final Map<String, DatasourceSettings> datasources;

  @Autowired
  public DatasourceRegistry(AppProperties appProperties) {
    Map<String, DatasourceSettings> settings = new LinkedHashMap<>();
    for (Entry<String, Datasource> entry : appProperties.getDatasources().entrySet()) {
      String uid = entry.getKey();
      Datasource datasource = entry.getValue();
      validateUrl(uid, datasource.getUrl());
      settings.put(uid, new DatasourceSettings()
          .setUid(uid)
          .setName(StringUtils.defaultIfBlank(datasource.getName(), uid))
          .setUrl(datasource.getUrl()));
      log.info("Configured datasource {} at {}", uid, datasource.getUrl());
    }
    this.datasources = Collections.unmodifiableMap(settings);
  }

  /**
   * @throws IllegalArgumentException if the context does not name a datasource
   * @throws DatasourceNotFoundException if no datasource is configured with that uid
   */
  public DatasourceSettings resolve(PluginContext pluginContext) {
    if (pluginContext == null || StringUtils.isBlank(pluginContext.getDatasourceUid())) {
      throw new IllegalArgumentException("pluginContext.datasourceUid is required");
    }
    DatasourceSettings settings = datasources.get(pluginContext.getDatasourceUid());
    if (settings == null) {
      throw new DatasourceNotFoundException(pluginContext.getDatasourceUid());
    }
    return settings;
  }

  public Map<String, DatasourceSettings> getDatasources() {
    return datasources;
  }

  private static void validateUrl(String uid, String url) {
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new IllegalStateException("Datasource " + uid + " has an invalid url " + url, e);
    }
    if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
      throw new IllegalStateException("Datasource " + uid + " url must be http or https: " + url);
    }
  }
}
