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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryDataResponseTest {

  @Test
  void testResultsCannotBeReplacedOrModified() {
    Map<String, DataResponse> results = new LinkedHashMap<>();
    results.put("A", DataResponse.success(List.of()));
    QueryDataResponse response = new QueryDataResponse(results);

    results.put("B", DataResponse.failure(QueryErrorType.DECODE, "bad body"));

    assertThat(response.getResults()).containsOnlyKeys("A");
    assertThatThrownBy(() -> response.getResults().put("C", DataResponse.success(List.of())))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void testEmpty() {
    assertThat(QueryDataResponse.empty().getResults()).isEmpty();
  }

  @Test
  void testSuccessHoldsOnlyFrames() {
    List<Frame> frames = new ArrayList<>();
    frames.add(new Frame().setName("upper_50"));
    DataResponse response = DataResponse.success(frames);

    frames.clear();

    assertThat(response.isSuccess()).isTrue();
    assertThat(response.getFrames()).extracting(Frame::getName).containsExactly("upper_50");
    assertThat(response.getError()).isNull();
    assertThat(response.getErrorType()).isNull();
    assertThat(response.getStatus()).isNull();
    assertThatThrownBy(() -> response.getFrames().add(new Frame()))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void testFailureHoldsOnlyError() {
    DataResponse response = DataResponse.upstreamStatus(503, "invalid status code. status: 503");

    assertThat(response.isSuccess()).isFalse();
    assertThat(response.getFrames()).isNull();
    assertThat(response.getErrorType()).isEqualTo(QueryErrorType.UPSTREAM_STATUS);
    assertThat(response.getStatus()).isEqualTo(503);
    assertThat(response.getError()).isEqualTo("invalid status code. status: 503");
  }
}
