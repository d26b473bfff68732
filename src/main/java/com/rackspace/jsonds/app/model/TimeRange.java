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

import lombok.Data;

/**
 * Query time range as sent by the dashboard. Both bounds are inclusive and accept ISO-8601
 * instants, epoch seconds, epoch millis or relative times such as <code>6h-ago</code>.
 */
@Data
public class TimeRange {
  String from;
  String to;
}
