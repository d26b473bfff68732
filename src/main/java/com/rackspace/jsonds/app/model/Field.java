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

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * One named, typed column of a {@link Frame}.
 */
@Data
public class Field {
  String name;
  FieldType type;
  List<Object> values = new ArrayList<>();

  public static Field of(String name, FieldType type) {
    return new Field().setName(name).setType(type);
  }

  public int length() {
    return values.size();
  }
}
