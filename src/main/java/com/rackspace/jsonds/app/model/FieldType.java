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

package com.rackspace.jsonds.app.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FieldType {
  TIME("time"),
  NUMBER("number"),
  STRING("string");

  private final String text;

  FieldType(String text) {
    this.text = text;
  }

  @JsonValue
  public String getText() {
    return text;
  }

  /**
   * Maps the column type declared by the upstream, falling back to {@link #STRING} for types it
   * does not know about.
   */
  public static FieldType fromColumnType(String columnType) {
    for (FieldType type : values()) {
      if (type.text.equalsIgnoreCase(columnType)) {
        return type;
      }
    }
    return STRING;
  }
}
