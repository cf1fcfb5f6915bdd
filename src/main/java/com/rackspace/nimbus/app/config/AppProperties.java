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
package com.rackspace.nimbus.app.config;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("nimbus")
@Component
@Data
@Validated
public class AppProperties {

  /**
   * The locations, identified by provider station key, collected on each cycle.
   */
  @Valid
  List<LocationProperties> locations = new ArrayList<>();

  /**
   * When false, cycles only run on demand through the <code>weather</code> command.
   */
  boolean scheduleEnabled = true;

  @NotNull
  @DurationUnit(ChronoUnit.MINUTES)
  Duration collectionInterval = Duration.ofMinutes(30);

  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration initialDelay = Duration.ofSeconds(5);

  /**
   * How far back from the cycle start the upstream source is asked for observations.
   */
  @NotNull
  @DurationUnit(ChronoUnit.MINUTES)
  Duration lookback = Duration.ofHours(1);

  /**
   * Width of the time buckets used in cache keys. Cycles triggered within the same bucket
   * deduplicate against each other.
   */
  @NotNull
  @DurationUnit(ChronoUnit.MINUTES)
  Duration cacheBucketWidth = Duration.ofMinutes(30);

  @NotNull
  @DurationUnit(ChronoUnit.MINUTES)
  Duration cacheTtl = Duration.ofHours(2);

  /**
   * Maximum number of locations fetched or persisted concurrently within a cycle.
   */
  @Min(1)
  int workerPoolSize = 4;

  /**
   * How long shutdown waits for an in-flight cycle to finish.
   */
  @NotNull
  @DurationUnit(ChronoUnit.SECONDS)
  Duration shutdownGracePeriod = Duration.ofSeconds(30);

  /**
   * The width of time slots used for partitioning observations in Cassandra.
   */
  @NotNull
  Duration observationPartitionWidth = Duration.ofDays(1);

  @NotNull
  @DurationUnit(ChronoUnit.DAYS)
  Duration observationTtl = Duration.ofDays(400);

  @Min(60)
  int dataTableGcGraceSeconds = 86400;

  /**
   * Maximum size of the cache that tracks locations already stored in the relational store.
   */
  @Min(0)
  long knownLocationCacheSize = 10000;

  @NotNull
  @Valid
  RetryPolicy retryFetch = new RetryPolicy();

  @NotNull
  @Valid
  RetryPolicy retryInsertObservations = new RetryPolicy();

  @NotNull
  @Valid
  RetryPolicy retryInsertMetadata = new RetryPolicy();

  @NotNull
  @Valid
  RetryPolicy retryRecordRun = new RetryPolicy();

  @Data
  public static class LocationProperties {

    @NotBlank
    String id;

    /**
     * Overrides the station name reported by the provider.
     */
    String displayName;

    Double latitude;

    Double longitude;
  }
}
