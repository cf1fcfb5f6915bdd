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
package com.rackspace.nimbus.app.utils;

import java.time.Duration;
import java.time.Instant;

public class TimeBuckets {

  private TimeBuckets() {
  }

  /**
   * Rounds the instant down to a multiple of the width, counted from the epoch.
   */
  public static Instant normalize(Instant instant, Duration width) {
    final long widthSeconds = width.getSeconds();
    if (widthSeconds <= 0) {
      throw new IllegalArgumentException("Bucket width must be at least one second: " + width);
    }
    final long seconds = instant.getEpochSecond();
    return Instant.ofEpochSecond(seconds - Math.floorMod(seconds, widthSeconds));
  }

  public static long bucketOf(Instant instant, Duration width) {
    return normalize(instant, width).getEpochSecond();
  }
}
