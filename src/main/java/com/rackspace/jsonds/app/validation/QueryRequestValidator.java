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

package com.rackspace.jsonds.app.validation;

import com.rackspace.jsonds.app.model.DataQuery;
import com.rackspace.jsonds.app.model.QueryDataRequest;
import java.util.HashSet;
import java.util.Set;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Checks the batch envelope. Problems with the content of a single query are left to that query
 * and reported in its result instead.
 */
@Component
public class QueryRequestValidator {

  public void validate(QueryDataRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("request body is required");
    }
    if (request.getPluginContext() == null) {
      throw new IllegalArgumentException("pluginContext is required");
    }
    if (request.getQueries() == null) {
      throw new IllegalArgumentException("queries is required");
    }

    Set<String> refIds = new HashSet<>();
    for (DataQuery query : request.getQueries()) {
      if (query == null || StringUtils.isBlank(query.getRefId())) {
        throw new IllegalArgumentException("every query requires a refId");
      }
      if (!refIds.add(query.getRefId())) {
        throw new IllegalArgumentException("refId " + query.getRefId() + " is used by more than one query");
      }
    }
  }
}
