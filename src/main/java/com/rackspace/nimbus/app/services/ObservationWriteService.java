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

import com.datastax.oss.driver.api.core.cql.BatchStatementBuilder;
import com.datastax.oss.driver.api.core.cql.BatchType;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.cql.SimpleStatementBuilder;
import com.rackspace.nimbus.app.config.AppProperties;
import com.rackspace.nimbus.app.model.Observation;
import com.rackspace.nimbus.app.model.UpsertResult;
import com.rackspace.nimbus.app.utils.ReactiveRetries;
import com.rackspace.nimbus.app.utils.TimeBuckets;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Writes observations into the Cassandra time-series table. Since a CQL insert of an existing
 * primary key overwrites the row, re-submitting an observation is a no-op and a changed value
 * replaces the previous one.
 */
@Service
@Slf4j
public class ObservationWriteService {

  private final ReactiveCqlTemplate cqlTemplate;
  private final ObservationStatements statements;
  private final AppProperties appProperties;
  private final Counter dbOperationErrorsCounter;
  private final Counter rejectedCounter;

  @Autowired
  public ObservationWriteService(ReactiveCqlTemplate cqlTemplate,
                                 ObservationStatements statements,
                                 AppProperties appProperties,
                                 MeterRegistry meterRegistry) {
    this.cqlTemplate = cqlTemplate;
    this.statements = statements;
    this.appProperties = appProperties;
    dbOperationErrorsCounter = meterRegistry.counter("nimbus.db.operation.errors",
        "type", "observations");
    rejectedCounter = meterRegistry.counter("nimbus.observations.rejected");
  }

  /**
   * Stores a batch of observations. Malformed observations are left out and reported in the
   * result, the rest is written as a single logged batch.
   *
   * @return a mono of the number written and the rejected observations
   */
  public Mono<UpsertResult> upsert(List<Observation> observations) {
    final List<Observation> valid = new ArrayList<>(observations.size());
    final List<Observation> rejected = new ArrayList<>();
    for (Observation observation : observations) {
      if (isValid(observation)) {
        valid.add(observation);
      } else {
        rejected.add(observation);
      }
    }
    if (!rejected.isEmpty()) {
      rejectedCounter.increment(rejected.size());
      log.warn("Rejected {} malformed observations: {}", rejected.size(), rejected);
    }
    if (valid.isEmpty()) {
      return Mono.just(new UpsertResult(0, rejected));
    }

    final BatchStatementBuilder batch = new BatchStatementBuilder(BatchType.LOGGED);
    valid.stream()
        .map(this::toInsert)
        .forEach(batch::addStatement);

    return ReactiveRetries.withPolicy(
            cqlTemplate.execute(batch.build()),
            appProperties.getRetryInsertObservations(),
            "observation batch insert"
        )
        .doOnError(e -> dbOperationErrorsCounter.increment())
        .thenReturn(new UpsertResult(valid.size(), rejected))
        .doOnNext(result -> log.trace("Wrote {} observations for locations={}", result.getWritten(),
            valid.stream().map(Observation::getLocationId).distinct().collect(Collectors.toList())));
  }

  static boolean isValid(Observation observation) {
    return StringUtils.hasText(observation.getLocationId())
        && StringUtils.hasText(observation.getMetricName())
        && observation.getCapturedAt() != null
        && Double.isFinite(observation.getValue());
  }

  private SimpleStatement toInsert(Observation observation) {
    return new SimpleStatementBuilder(statements.insert())
        .addPositionalValues(
            // LOCATION_ID, TIME_PARTITION_SLOT, METRIC_NAME, CAPTURED_AT, VALUE
            observation.getLocationId(),
            TimeBuckets.normalize(observation.getCapturedAt(),
                appProperties.getObservationPartitionWidth()),
            observation.getMetricName(),
            observation.getCapturedAt(),
            observation.getValue()
        )
        .build();
  }
}
