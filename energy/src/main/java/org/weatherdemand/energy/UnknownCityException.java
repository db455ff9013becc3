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

/**
 * Thrown when a city name does not resolve to a configured city. This is a
 * configuration error and is never retried.
 */
public class UnknownCityException extends WeatherDemandException {

  private static final long serialVersionUID = 1L;

  private final String city;

  public UnknownCityException(String city) {
    super("Unknown city: '" + city + "'");
    this.city = city;
  }

  public String getCity() {
    return city;
  }
}
