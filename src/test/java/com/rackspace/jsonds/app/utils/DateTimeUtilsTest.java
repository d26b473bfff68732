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

package com.rackspace.jsonds.app.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import org.junit.jupiter.api.Test;

public class DateTimeUtilsTest {

  @Test
  public void getAbsoluteTimeFromRelativeTimeTest() {
    Instant actual = DateTimeUtils.getAbsoluteTimeFromRelativeTime("1s-ago");
    Instant expected = Instant.now().minus(1, ChronoUnit.SECONDS);
    assertThat(Duration.between(actual, expected).getSeconds()).isLessThanOrEqualTo(1);
  }

  @Test
  public void getAbsoluteTimeFromRelativeTimeTest_Weeks() {
    Instant actual = DateTimeUtils.getAbsoluteTimeFromRelativeTime("2w-ago");
    Instant expected = Instant.now().minus(14, ChronoUnit.DAYS);
    assertThat(Duration.between(actual, expected).getSeconds()).isLessThanOrEqualTo(1);
  }

  @Test
  public void getAbsoluteTimeFromRelativeTimeTest_Invalid() {
    assertThatThrownBy(() -> DateTimeUtils.getAbsoluteTimeFromRelativeTime("1ss-ago"))
        .isInstanceOf(IllegalArgumentException.class).hasMessage("Invalid relative time format");
  }

  @Test
  public void getAbsoluteTimeFromRelativeTimeTest_OutOfRange() {
    assertThatThrownBy(() -> DateTimeUtils.getAbsoluteTimeFromRelativeTime("9999999999999y-ago"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasCauseInstanceOf(ArithmeticException.class);
    assertThatThrownBy(() -> DateTimeUtils.parseInstant("2000000000y-ago"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasCauseInstanceOf(DateTimeException.class);
  }

  @Test
  public void isValidInstantInstanceTest() {
    assertThat(DateTimeUtils.isValidInstantInstance("2020-11-10T14:24:35Z")).isTrue();
    assertThat(DateTimeUtils.isValidInstantInstance("13:03:15.454+0530Z")).isFalse();
  }

  @Test
  public void isValidEpochMillisTest() {
    assertThat(DateTimeUtils.isValidEpochMillis("1605094715000")).isTrue();
    assertThat(DateTimeUtils.isValidEpochMillis("1605094715")).isFalse();
  }

  @Test
  public void isValidEpochSecondsTest() {
    assertThat(DateTimeUtils.isValidEpochSeconds("1605094715")).isTrue();
    assertThat(DateTimeUtils.isValidEpochSeconds("1605094715000")).isFalse();
  }

  @Test
  public void parseInstantTestWithBlank() {
    assertThatThrownBy(() -> DateTimeUtils.parseInstant(null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> DateTimeUtils.parseInstant(""))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  public void parseInstantTestWithEpochMillis() {
    assertThat(DateTimeUtils.parseInstant("1605094715000"))
        .isEqualTo(Instant.ofEpochMilli(1605094715000L));
  }

  @Test
  public void parseInstantTestWithEpochSeconds() {
    assertThat(DateTimeUtils.parseInstant("1605094715"))
        .isEqualTo(Instant.ofEpochSecond(1605094715));
  }

  @Test
  public void parseInstantTestWithUTCTime() {
    assertThat(DateTimeUtils.parseInstant("2020-11-10T14:24:35Z"))
        .isEqualTo(Instant.parse("2020-11-10T14:24:35Z"));
  }

  @Test
  public void formatInstantTest() {
    assertThat(DateTimeUtils.formatInstant(Instant.parse("2016-10-31T06:33:44.866Z")))
        .isEqualTo("2016-10-31T06:33:44.866Z");
    assertThat(DateTimeUtils.formatInstant(Instant.ofEpochSecond(1605094715)))
        .isEqualTo("2020-11-11T11:38:35Z");
  }
}
