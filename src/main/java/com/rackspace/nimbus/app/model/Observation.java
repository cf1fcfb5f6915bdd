/*
 * Copyright 2024 Rackspace US, Inc.
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

package com.rackspace.nimbus.app.model;

import java.time.Instant;
import lombok.Data;

/**
 * A single timestamped metric reading for a location. The combination of
 * location, capture time and metric name identifies the point in the time-series store.
 */
@Data
public class Observation {

  String locationId;

  Instant capturedAt;

  String metricName;

  double value;
}
