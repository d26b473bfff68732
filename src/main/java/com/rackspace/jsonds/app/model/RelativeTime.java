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

import java.time.temporal.ChronoUnit;

/**
 * Unit suffixes accepted in relative times such as <code>15m-ago</code>.
 */
public enum RelativeTime {
  ms(ChronoUnit.MILLIS),
  s(ChronoUnit.SECONDS),
  m(ChronoUnit.MINUTES),
  h(ChronoUnit.HOURS),
  d(ChronoUnit.DAYS),
  w(ChronoUnit.WEEKS),
  n(ChronoUnit.MONTHS),
  y(ChronoUnit.YEARS);

  final ChronoUnit value;

  RelativeTime(ChronoUnit unit) {
    this.value = unit;
  }

  public ChronoUnit getValue() {
    return value;
  }
}
