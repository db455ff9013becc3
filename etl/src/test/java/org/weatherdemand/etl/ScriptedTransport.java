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
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * HttpTransport that replays a fixed script of responses and I/O failures,
 * recording every request it receives.
 */
class ScriptedTransport implements HttpTransport {
  private final Deque<Object> script = new ArrayDeque<Object>();
  private final List<String> urls = new ArrayList<String>();
  private final List<Map<String, String>> headers = new ArrayList<Map<String, String>>();

  ScriptedTransport respond(int status, String body) {
    script.add(new Response(status, body));
    return this;
  }

  ScriptedTransport fail(IOException e) {
    script.add(e);
    return this;
  }

  @Override public Response get(String url, Map<String, String> requestHeaders,
      Duration timeout) throws IOException {
    urls.add(url);
    headers.add(new LinkedHashMap<String, String>(requestHeaders));
    Object next = script.poll();
    if (next == null) {
      throw new AssertionError("Unexpected request: " + url);
    }
    if (next instanceof IOException) {
      throw (IOException) next;
    }
    return (Response) next;
  }

  List<String> getUrls() {
    return urls;
  }

  List<Map<String, String>> getHeaders() {
    return headers;
  }

  int requestCount() {
    return urls.size();
  }
}
