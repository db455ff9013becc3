/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.weatherdemand.etl;

import java.io.IOException;

/**
 * Base class for failures raised while acquiring data from a remote source.
 *
 * <p>Subclasses describe the three failure classes a data source can produce:
 * <ul>
 *   <li>{@link FetchException} - network or API failure, possibly transient</li>
 *   <li>{@link AuthException} - credentials rejected or missing, never retried</li>
 *   <li>{@link SchemaException} - payload is not in the expected shape, never retried</li>
 * </ul>
 *
 * @see RetryExecutor
 */
public abstract class SourceException extends IOException {

  private static final long serialVersionUID = 1L;

  protected SourceException(String message) {
    super(message);
  }

  protected SourceException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Returns whether the operation that raised this exception may succeed if
   * it is attempted again.
   *
   * @return true for transient failures
   */
  public abstract boolean isTransient();

  /**
   * Short label for the failure class, used in run summaries.
   *
   * @return e.g. "fetch", "auth", "schema"
   */
  public abstract String getKind();
}
