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

import com.rackspace.jsonds.app.model.RelativeTime;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;

public class DateTimeUtils {

  public static final String RELATIVE_TIME_PATTERN = "([0-9]+)(ms|s|m|h|d|w|n|y)-ago";
  public static final String EPOCH_MILLIS_PATTERN = "\\d{13,}";
  public static final String EPOCH_SECONDS_PATTERN = "\\d{1,12}";

  private static final Pattern RELATIVE_TIME = Pattern.compile(RELATIVE_TIME_PATTERN);
  private static final Pattern EPOCH_MILLIS = Pattern.compile(EPOCH_MILLIS_PATTERN);
  private static final Pattern EPOCH_SECONDS = Pattern.compile(EPOCH_SECONDS_PATTERN);

  private DateTimeUtils() {
  }

  /**
   * Gets the absolute Instant instance for relativeTime. Weeks, months and years use their
   * estimated durations.
   */
  public static Instant getAbsoluteTimeFromRelativeTime(String relativeTime) {
    Matcher match = RELATIVE_TIME.matcher(relativeTime);
    if (match.matches()) {
      try {
        return Instant.now().minus(RelativeTime.valueOf(match.group(2)).getValue().getDuration()
            .multipliedBy(Long.parseLong(match.group(1))));
      } catch (ArithmeticException | DateTimeException e) {
        throw new IllegalArgumentException("Relative time " + relativeTime + " is out of range", e);
      }
    } else {
      throw new IllegalArgumentException("Invalid relative time format");
    }
  }

  /**
   * Checks if the string time is valid Instant in UTC.
   */
  public static boolean isValidInstantInstance(String time) {
    try {
      Instant.parse(time);
      return true;
    } catch (DateTimeParseException dateTimeParseException) {
      return false;
    }
  }

  public static boolean isValidEpochMillis(String time) {
    return EPOCH_MILLIS.matcher(time).matches();
  }

  public static boolean isValidEpochSeconds(String time) {
    return EPOCH_SECONDS.matcher(time).matches();
  }

  /**
   * Gets the instance of Instant based on the format of argument.
   *
   * @throws IllegalArgumentException if the value is blank or in none of the accepted formats
   */
  public static Instant parseInstant(String instant) {
    if (StringUtils.isBlank(instant)) {
      throw new IllegalArgumentException("Time value is required");
    }
    if (isValidInstantInstance(instant)) {
      return Instant.parse(instant);
    } else if (isValidEpochMillis(instant)) {
      return Instant.ofEpochMilli(Long.parseLong(instant));
    } else if (isValidEpochSeconds(instant)) {
      return Instant.ofEpochSecond(Long.parseLong(instant));
    } else {
      return getAbsoluteTimeFromRelativeTime(instant);
    }
  }

  /**
   * Formats the instant the way the upstream expects range bounds, e.g.
   * <code>2016-10-31T06:33:44.866Z</code>.
   */
  public static String formatInstant(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant);
  }
}
