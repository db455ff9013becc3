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
import java.time.Duration;
import java.util.Map;

/**
 * Sends a single HTTP GET and returns status and body. No retries, no
 * status interpretation; {@link HttpSource} layers those on top.
 *
 * @see JdkHttpTransport
 */
public interface HttpTransport {

  /**
   * Performs a GET request.
   *
   * @param url fully built URL including query string
   * @param headers request headers
   * @param timeout request timeout
   * @return status code and body
   * @throws IOException on connection or read failure
   * @throws InterruptedException if the calling thread is interrupted
   */
  Response get(String url, Map<String, String> headers, Duration timeout)
      throws IOException, InterruptedException;

  /**
   * Status and body of an HTTP response.
   */
  final class Response {
    private final int statusCode;
    private final String body;

    public Response(int statusCode, String body) {
      this.statusCode = statusCode;
      this.body = body == null ? "" : body;
    }

    public int getStatusCode() {
      return statusCode;
    }

    public String getBody() {
      return body;
    }

    public boolean isSuccess() {
      return statusCode >= 200 && statusCode < 300;
    }
  }
}
