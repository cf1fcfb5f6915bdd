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
package com.rackspace.nimbus.app.services;

import org.springframework.stereotype.Component;

/**
 * Provides a consolidated declaration of the CQL statements that execute against the
 * observations table.
 */
@Component
public class ObservationStatements {

  public static final String TABLE_NAME = "observations";

  public static final String LOCATION_ID = "location_id";
  public static final String TIME_PARTITION_SLOT = "time_slot";
  public static final String METRIC_NAME = "metric_name";
  public static final String CAPTURED_AT = "captured_at";
  public static final String VALUE = "value";

  private static final String INSERT = String.format(
      "INSERT INTO %s (%s) VALUES (?, ?, ?, ?, ?)",
      TABLE_NAME,
      String.join(",", LOCATION_ID, TIME_PARTITION_SLOT, METRIC_NAME, CAPTURED_AT, VALUE));

  private static final String QUERY = String.format(
      "SELECT %s FROM %s WHERE " + LOCATION_ID + " = ? AND " + TIME_PARTITION_SLOT + " = ?"
          + " AND " + METRIC_NAME + " = ?",
      String.join(",", CAPTURED_AT, VALUE), TABLE_NAME);

  /**
   * @return INSERT CQL statement with placeholders locationId, timeSlot, metricName, capturedAt,
   * value. Inserting an existing key overwrites its value.
   */
  public String insert() {
    return INSERT;
  }

  /**
   * @return a SELECT CQL statement with placeholders locationId, timeSlot, metricName and returns
   * capturedAt, value
   */
  public String query() {
    return QUERY;
  }
}
