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

import static com.rackspace.jsonds.app.utils.DateTimeUtils.formatInstant;
import static com.rackspace.jsonds.app.utils.DateTimeUtils.parseInstant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.rackspace.jsonds.app.config.AppProperties;
import com.rackspace.jsonds.app.errors.MalformedQueryException;
import com.rackspace.jsonds.app.model.DataQuery;
import com.rackspace.jsonds.app.model.DatasourceSettings;
import com.rackspace.jsonds.app.model.TimeRange;
import com.rackspace.jsonds.app.model.UpstreamRequest;
import java.net.URI;
import java.time.Instant;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Converts one dashboard query into the body of a <code>POST &lt;url&gt;/query</code> call:
 * <pre>
 * {"range": {"from": "...", "to": "..."}, "targets": [...]}
 * </pre>
 * Holds no state, so it is safe to use from any number of concurrent queries.
 */
@Component
@Slf4j
public class RequestTranslator {

  private final ObjectMapper objectMapper;
  private final AppProperties appProperties;

  @Autowired
  public RequestTranslator(ObjectMapper objectMapper, AppProperties appProperties) {
    this.objectMapper = objectMapper;
    this.appProperties = appProperties;
  }

  public UpstreamRequest translate(DataQuery query, DatasourceSettings settings) {
    if (StringUtils.isBlank(query.getRefId())) {
      throw new MalformedQueryException("refId is required");
    }

    ObjectNode payload = objectMapper.createObjectNode();
    ObjectNode range = payload.putObject("range");
    Instant[] bounds = parseRange(query);
    range.put("from", formatInstant(bounds[0]));
    range.put("to", formatInstant(bounds[1]));
    if (query.getIntervalMs() != null && query.getIntervalMs() > 0) {
      payload.put("intervalMs", query.getIntervalMs());
    }
    if (query.getMaxDataPoints() != null && query.getMaxDataPoints() > 0) {
      payload.put("maxDataPoints", query.getMaxDataPoints());
    }
    payload.set("targets", buildTargets(query));

    UpstreamRequest request = new UpstreamRequest()
        .setRefId(query.getRefId())
        .setUri(queryUri(settings))
        .setBody(serialize(query, payload));
    log.debug("Translated query {} into request for {}", query.getRefId(), request.getUri());
    return request;
  }

  private Instant[] parseRange(DataQuery query) {
    TimeRange timeRange = query.getTimeRange();
    if (timeRange == null) {
      throw new MalformedQueryException("query " + query.getRefId() + " has no time range");
    }
    Instant from;
    Instant to;
    try {
      from = parseInstant(timeRange.getFrom());
      to = parseInstant(timeRange.getTo());
    } catch (IllegalArgumentException e) {
      throw new MalformedQueryException(
          "query " + query.getRefId() + " has an invalid time range: " + e.getMessage(), e);
    }
    if (from.isAfter(to)) {
      throw new MalformedQueryException(
          "query " + query.getRefId() + " has a time range that ends before it starts");
    }
    return new Instant[]{from, to};
  }

  private ArrayNode buildTargets(DataQuery query) {
    JsonNode target = query.getTarget();
    if (target == null || target.isMissingNode() || target.isNull()) {
      throw new MalformedQueryException("query " + query.getRefId() + " has no target");
    }
    if (target.isArray()) {
      return (ArrayNode) target;
    }

    ArrayNode targets = objectMapper.createArrayNode();
    if (target.isTextual()) {
      targets.addObject()
          .put("target", target.asText())
          .put("refId", query.getRefId());
    } else if (target.isObject()) {
      ObjectNode copy = ((ObjectNode) target).deepCopy();
      if (!copy.has("refId")) {
        copy.put("refId", query.getRefId());
      }
      targets.add(copy);
    } else {
      throw new MalformedQueryException(
          "query " + query.getRefId() + " has an unsupported target of type " + target.getNodeType());
    }
    return targets;
  }

  private URI queryUri(DatasourceSettings settings) {
    try {
      return URI.create(StringUtils.stripEnd(settings.getUrl(), "/") + appProperties.getQueryPath());
    } catch (IllegalArgumentException e) {
      throw new MalformedQueryException("invalid datasource url " + settings.getUrl(), e);
    }
  }

  private byte[] serialize(DataQuery query, JsonNode payload) {
    try {
      return objectMapper.writeValueAsBytes(payload);
    } catch (JsonProcessingException e) {
      throw new MalformedQueryException("unable to serialize query " + query.getRefId(), e);
    }
  }
}
