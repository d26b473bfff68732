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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.jsonds.app.errors.DecodeException;
import com.rackspace.jsonds.app.model.ColumnDTO;
import com.rackspace.jsonds.app.model.DataQuery;
import com.rackspace.jsonds.app.model.DataResponse;
import com.rackspace.jsonds.app.model.Field;
import com.rackspace.jsonds.app.model.FieldType;
import com.rackspace.jsonds.app.model.Frame;
import com.rackspace.jsonds.app.model.TargetResponseDTO;
import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Decodes the upstream's array of series and/or tables into frames. Series become a frame with
 * a <code>time</code> and a <code>value</code> field, tables a frame with one field per column.
 * Any deviation from the expected shape fails the whole query; a partially decoded response is
 * never returned.
 */
@Component
@Slf4j
public class ResponseDecoder {

  static final String TIME_FIELD = "time";
  static final String VALUE_FIELD = "value";

  private final ObjectMapper objectMapper;

  @Autowired
  public ResponseDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public DataResponse decode(DataQuery query, byte[] body) {
    JsonNode root = readTree(body);
    if (root == null || !root.isArray()) {
      throw new DecodeException("expected a JSON array of series or tables");
    }

    List<Frame> frames = new ArrayList<>(root.size());
    for (JsonNode element : root) {
      TargetResponseDTO target = toTarget(element);
      Frame frame = target.isTable() ?
          decodeTable(target) : decodeSeries(target);
      frame.setRefId(query.getRefId());
      verifyFrame(frame);
      frames.add(frame);
    }
    log.debug("Decoded {} frames for query {}", frames.size(), query.getRefId());
    return DataResponse.success(frames);
  }

  private JsonNode readTree(byte[] body) {
    if (body == null || body.length == 0) {
      throw new DecodeException("upstream returned an empty body");
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new DecodeException("upstream returned invalid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new DecodeException("upstream body could not be read: " + e.getMessage(), e);
    }
  }

  private TargetResponseDTO toTarget(JsonNode element) {
    if (!element.isObject()) {
      throw new DecodeException("expected a series or table object but got " + element.getNodeType());
    }
    try {
      return objectMapper.treeToValue(element, TargetResponseDTO.class);
    } catch (JsonProcessingException e) {
      throw new DecodeException("unexpected response element: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Datapoints are <code>[value, epochMillis]</code> pairs.
   */
  private Frame decodeSeries(TargetResponseDTO series) {
    if (series.getDatapoints() == null) {
      throw new DecodeException("series " + series.getTarget() + " has no datapoints");
    }
    Field time = Field.of(TIME_FIELD, FieldType.TIME);
    Field value = Field.of(VALUE_FIELD, FieldType.NUMBER);
    for (JsonNode point : series.getDatapoints()) {
      if (point == null || !point.isArray() || point.size() != 2) {
        throw new DecodeException("series " + series.getTarget()
            + " has a datapoint that is not a [value, time] pair: " + point);
      }
      value.getValues().add(toNumber(point.get(0)));
      time.getValues().add(toTime(point.get(1)));
    }
    Frame frame = new Frame().setName(series.getTarget());
    frame.getFields().add(time);
    frame.getFields().add(value);
    return frame;
  }

  private Frame decodeTable(TargetResponseDTO table) {
    List<ColumnDTO> columns = table.getColumns();
    if (columns == null || columns.isEmpty()) {
      throw new DecodeException("table has no columns");
    }

    Frame frame = new Frame().setName(StringUtils.defaultIfBlank(table.getTarget(), "table"));
    for (int i = 0; i < columns.size(); i++) {
      ColumnDTO column = columns.get(i);
      if (column == null) {
        throw new DecodeException("table column " + i + " is null");
      }
      FieldType type = FieldType.fromColumnType(column.getType());
      if (!type.getText().equalsIgnoreCase(column.getType())) {
        log.debug("Column {} has unknown type {}, decoding as string", column.getText(), column.getType());
      }
      frame.getFields().add(Field.of(
          StringUtils.defaultIfBlank(column.getText(), "Field " + (i + 1)), type));
    }

    if (table.getRows() != null) {
      int rowIndex = 0;
      for (JsonNode row : table.getRows()) {
        if (row == null || !row.isArray()) {
          throw new DecodeException("table row " + rowIndex + " is not an array");
        }
        if (row.size() != columns.size()) {
          throw new DecodeException(String.format(
              "table row %d has %d values but the table has %d columns",
              rowIndex, row.size(), columns.size()));
        }
        for (int i = 0; i < columns.size(); i++) {
          Field field = frame.getFields().get(i);
          field.getValues().add(convertCell(field, row.get(i)));
        }
        rowIndex++;
      }
    }
    return frame;
  }

  private Object convertCell(Field field, JsonNode cell) {
    return switch (field.getType()) {
      case TIME -> toTime(cell);
      case NUMBER -> toNumber(cell);
      case STRING -> toText(field, cell);
    };
  }

  private Instant toTime(JsonNode node) {
    if (node != null && node.isNumber()) {
      return Instant.ofEpochMilli(node.asLong());
    }
    if (node != null && node.isTextual()) {
      try {
        return Instant.parse(node.asText());
      } catch (DateTimeParseException e) {
        throw new DecodeException("invalid timestamp " + node, e);
      }
    }
    throw new DecodeException("invalid timestamp " + node);
  }

  private Double toNumber(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (!node.isNumber()) {
      throw new DecodeException("expected a number but got " + node);
    }
    return node.doubleValue();
  }

  private String toText(Field field, JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    }
    if (node.isContainerNode()) {
      throw new DecodeException("column " + field.getName() + " contains a nested value " + node);
    }
    return node.asText();
  }

  private void verifyFrame(Frame frame) {
    List<Field> fields = frame.getFields();
    if (fields.stream().noneMatch(field -> field.getType() == FieldType.TIME)) {
      throw new DecodeException("frame " + frame.getName() + " has no time column");
    }
    int length = fields.get(0).length();
    for (Field field : fields) {
      if (field.length() != length) {
        throw new DecodeException(String.format("field %s has %d values but field %s has %d",
            field.getName(), field.length(), fields.get(0).getName(), length));
      }
    }
  }
}
