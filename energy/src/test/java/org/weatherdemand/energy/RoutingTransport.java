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
package org.weatherdemand.energy;

import org.weatherdemand.etl.HttpTransport;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Thread-safe HttpTransport that answers each request from the first route
 * whose URL prefix and fragment both match. Unrouted requests get a 404.
 */
public class RoutingTransport implements HttpTransport {
  private final List<Route> routes = new CopyOnWriteArrayList<Route>();
  private final List<String> urls = new CopyOnWriteArrayList<String>();
  private volatile Consumer<String> onRequest = url -> { };

  public RoutingTransport route(String urlPrefix, String fragment, int status, String body) {
    routes.add(new Route(urlPrefix, fragment, new Response(status, body)));
    return this;
  }

  /** Runs the given action with each request URL before answering it. */
  public RoutingTransport onRequest(Consumer<String> action) {
    this.onRequest = action;
    return this;
  }

  @Override public Response get(String url, Map<String, String> headers, Duration timeout)
      throws IOException {
    urls.add(url);
    onRequest.accept(url);
    for (Route route : routes) {
      if (url.startsWith(route.urlPrefix) && url.contains(route.fragment)) {
        return route.response;
      }
    }
    return new Response(404, "{\"error\":\"not found\"}");
  }

  public List<String> getUrls() {
    return new ArrayList<String>(urls);
  }

  public int requestCount() {
    return urls.size();
  }

  /** One canned answer. */
  private static class Route {
    final String urlPrefix;
    final String fragment;
    final Response response;

    Route(String urlPrefix, String fragment, Response response) {
      this.urlPrefix = urlPrefix;
      this.fragment = fragment;
      this.response = response;
    }
  }
}
