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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * The outcome of a single query: either the decoded frames or an error, never both.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(Include.NON_NULL)
public class DataResponse {
  List<Frame> frames;
  String error;
  QueryErrorType errorType;

  /**
   * HTTP status returned by the upstream, only set for {@link QueryErrorType#UPSTREAM_STATUS}.
   */
  Integer status;

  public static DataResponse success(List<Frame> frames) {
    return new DataResponse(List.copyOf(frames), null, null, null);
  }

  public static DataResponse failure(QueryErrorType errorType, String error) {
    return new DataResponse(null, error, errorType, null);
  }

  public static DataResponse upstreamStatus(int status, String error) {
    return new DataResponse(null, error, QueryErrorType.UPSTREAM_STATUS, status);
  }

  @JsonIgnore
  public boolean isSuccess() {
    return errorType == null;
  }
}
