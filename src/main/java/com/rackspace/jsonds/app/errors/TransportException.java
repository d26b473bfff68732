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

package com.rackspace.jsonds.app.errors;

import com.rackspace.jsonds.app.model.QueryErrorType;
import java.net.URI;

public class TransportException extends QueryException {

  public TransportException(URI uri, Throwable cause) {
    super(String.format("request to %s failed: %s", uri, cause.getMessage() != null ?
        cause.getMessage() : cause.getClass().getSimpleName()), cause);
  }

  @Override
  public QueryErrorType getErrorType() {
    return QueryErrorType.TRANSPORT;
  }
}
