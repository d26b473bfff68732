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

/**
 * Tracks the progress of one query through translate, call and decode. States only move
 * forward; {@link State#FAILED} can be entered from any working state.
 */
class QueryUnit {

  enum State {
    CREATED,
    TRANSLATING,
    CALLING,
    DECODING,
    SUCCEEDED,
    FAILED;

    boolean isTerminal() {
      return this == SUCCEEDED || this == FAILED;
    }
  }

  private final String refId;
  private volatile State state = State.CREATED;

  QueryUnit(String refId) {
    this.refId = refId;
  }

  String getRefId() {
    return refId;
  }

  State getState() {
    return state;
  }

  void advance(State next) {
    if (!canMove(state, next)) {
      throw new IllegalStateException(
          String.format("query %s cannot move from %s to %s", refId, state, next));
    }
    state = next;
  }

  /**
   * @return the working state the unit failed in
   */
  State fail() {
    State failedIn = state;
    advance(State.FAILED);
    return failedIn;
  }

  private static boolean canMove(State from, State to) {
    return switch (from) {
      case CREATED -> to == State.TRANSLATING;
      case TRANSLATING -> to == State.CALLING || to == State.FAILED;
      case CALLING -> to == State.DECODING || to == State.FAILED;
      case DECODING -> to == State.SUCCEEDED || to == State.FAILED;
      case SUCCEEDED, FAILED -> false;
    };
  }
}
