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

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.rackspace.nimbus.app.config.AppProperties;
import com.rackspace.nimbus.app.model.CollectionRun;
import com.rackspace.nimbus.app.model.Location;
import com.rackspace.nimbus.app.model.RunStatus;
import com.rackspace.nimbus.app.utils.ReactiveRetries;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Writes location metadata and collection run audit records into PostgreSQL. JDBC calls block,
 * so each one is moved onto the bounded elastic scheduler.
 */
@Service
@Slf4j
public class MetadataWriteService {

  static final String UPSERT_LOCATION = "INSERT INTO locations"
      + " (location_id, display_name, latitude, longitude) VALUES (?, ?, ?, ?)"
      + " ON CONFLICT (location_id) DO UPDATE"
      + " SET display_name = COALESCE(EXCLUDED.display_name, locations.display_name),"
      + " latitude = COALESCE(locations.latitude, EXCLUDED.latitude),"
      + " longitude = COALESCE(locations.longitude, EXCLUDED.longitude)";

  static final String UPSERT_RUN = "INSERT INTO collection_runs"
      + " (run_id, started_at, finished_at, status, observation_count, error_detail)"
      + " VALUES (?, ?, ?, ?, ?, ?)"
      + " ON CONFLICT (run_id) DO UPDATE"
      + " SET finished_at = EXCLUDED.finished_at,"
      + " status = EXCLUDED.status,"
      + " observation_count = EXCLUDED.observation_count,"
      + " error_detail = EXCLUDED.error_detail";

  static final String SELECT_RUN = "SELECT run_id, started_at, finished_at, status,"
      + " observation_count, error_detail FROM collection_runs WHERE run_id = ?";

  static final String COUNT_RUNS = "SELECT COUNT(*) FROM collection_runs";

  private final JdbcTemplate jdbcTemplate;
  private final TransactionTemplate transactionTemplate;
  private final AsyncCache<Location, Boolean> knownLocationCache;
  private final AppProperties appProperties;
  private final Counter dbOperationErrorsCounter;

  @Autowired
  public MetadataWriteService(JdbcTemplate jdbcTemplate,
                              TransactionTemplate transactionTemplate,
                              AsyncCache<Location, Boolean> knownLocationCache,
                              AppProperties appProperties,
                              MeterRegistry meterRegistry) {
    this.jdbcTemplate = jdbcTemplate;
    this.transactionTemplate = transactionTemplate;
    this.knownLocationCache = knownLocationCache;
    this.appProperties = appProperties;
    dbOperationErrorsCounter = meterRegistry.counter("nimbus.db.operation.errors",
        "type", "metadata");
  }

  /**
   * Creates the location when unknown. An existing location only has its display name updated
   * and any coordinates it was missing filled in.
   */
  public Mono<Void> ensureLocation(Location location) {
    return Mono.defer(() -> Mono.fromFuture(knownLocationCache.get(location, this::insertLocation)))
        .then();
  }

  private CompletableFuture<Boolean> insertLocation(Location location, Executor executor) {
    return ReactiveRetries.withPolicy(
            Mono.fromCallable(() -> jdbcTemplate.update(UPSERT_LOCATION,
                    location.getLocationId(),
                    location.getDisplayName(),
                    location.getLatitude(),
                    location.getLongitude()))
                .subscribeOn(Schedulers.boundedElastic()),
            appProperties.getRetryInsertMetadata(),
            "location upsert of " + location.getLocationId()
        )
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .doOnSuccess(updated -> log.debug("Stored location={}", location.getLocationId()))
        .thenReturn(true)
        .toFuture();
  }

  /**
   * Inserts or replaces the run record within a single transaction.
   */
  public Mono<Void> recordRun(CollectionRun run) {
    return ReactiveRetries.withPolicy(
            Mono.fromRunnable(() -> transactionTemplate.executeWithoutResult(status ->
                    jdbcTemplate.update(UPSERT_RUN, ps -> {
                      ps.setObject(1, run.getRunId());
                      ps.setTimestamp(2, Timestamp.from(run.getStartedAt()));
                      ps.setTimestamp(3, run.getFinishedAt() == null ?
                          null : Timestamp.from(run.getFinishedAt()));
                      ps.setString(4, run.getStatus().columnValue());
                      ps.setInt(5, run.getObservationCount());
                      ps.setString(6, run.getErrorDetail());
                    })))
                .subscribeOn(Schedulers.boundedElastic()),
            appProperties.getRetryRecordRun(),
            "record of run " + run.getRunId()
        )
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .then();
  }

  public Mono<CollectionRun> findRun(UUID runId) {
    return Mono.fromCallable(() -> {
          final List<CollectionRun> runs = jdbcTemplate.query(SELECT_RUN,
              (rs, rowNum) -> mapRun(rs), runId);
          return runs.isEmpty() ? null : runs.get(0);
        })
        .subscribeOn(Schedulers.boundedElastic());
  }

  public Mono<Long> countRuns() {
    return Mono.fromCallable(() -> jdbcTemplate.queryForObject(COUNT_RUNS, Long.class))
        .subscribeOn(Schedulers.boundedElastic());
  }

  private static CollectionRun mapRun(ResultSet rs) throws SQLException {
    final Timestamp finishedAt = rs.getTimestamp("finished_at");
    return new CollectionRun()
        .setRunId(rs.getObject("run_id", UUID.class))
        .setStartedAt(rs.getTimestamp("started_at").toInstant())
        .setFinishedAt(finishedAt == null ? null : finishedAt.toInstant())
        .setStatus(RunStatus.fromColumnValue(rs.getString("status")))
        .setObservationCount(rs.getInt("observation_count"))
        .setErrorDetail(rs.getString("error_detail"));
  }
}
