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

import lombok.Data;

/**
 * Result of collecting one location within a cycle.
 */
@Data
public class LocationOutcome {

  String locationId;

  int written;

  boolean deduplicated;

  /**
   * Null when the location was collected successfully.
   */
  String error;

  public boolean isSuccess() {
    return error == null;
  }

  public static LocationOutcome failed(String locationId, String error) {
    return new LocationOutcome()
        .setLocationId(locationId)
        .setError(error);
  }
}
