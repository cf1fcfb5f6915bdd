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

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.cql.BatchStatement;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.datastax.oss.driver.api.core.cql.Statement;
import com.rackspace.nimbus.app.config.AppProperties;
import com.rackspace.nimbus.app.config.RetryPolicy;
import com.rackspace.nimbus.app.exceptions.TransientCollectorException;
import com.rackspace.nimbus.app.model.Observation;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

class ObservationWriteServiceTest {

  private ReactiveCqlTemplate cqlTemplate;
  private MeterRegistry meterRegistry;
  private ObservationWriteService writeService;

  @BeforeEach
  void setUp() {
    cqlTemplate = mock(ReactiveCqlTemplate.class);
    meterRegistry = new SimpleMeterRegistry();
    final AppProperties appProperties = new AppProperties()
        .setObservationPartitionWidth(Duration.ofDays(1))
        .setRetryInsertObservations(new RetryPolicy()
            .setMaxAttempts(2)
            .setBaseDelay(Duration.ofMillis(1))
            .setAttemptTimeout(Duration.ofSeconds(1)));
    writeService = new ObservationWriteService(cqlTemplate, new ObservationStatements(),
        appProperties, meterRegistry);
  }

  private static Observation observation(String locationId, String metricName, double value) {
    return new Observation()
        .setLocationId(locationId)
        .setCapturedAt(Instant.parse("2024-01-01T10:15:00Z"))
        .setMetricName(metricName)
        .setValue(value);
  }

  @Test
  void writesOneBatchWithPartitionSlot() {
    when(cqlTemplate.execute(any(Statement.class))).thenReturn(Mono.just(true));

    StepVerifier.create(writeService.upsert(List.of(
            observation("loc-1", "temperature", 21.5),
            observation("loc-1", "humidity", 80))))
        .assertNext(result -> {
          assertThat(result.getWritten()).isEqualTo(2);
          assertThat(result.hasRejections()).isFalse();
        })
        .verifyComplete();

    final ArgumentCaptor<Statement> captor = ArgumentCaptor.forClass(Statement.class);
    verify(cqlTemplate).execute(captor.capture());
    assertThat(captor.getValue()).isInstanceOf(BatchStatement.class);
    final List<SimpleStatement> inserts = StreamSupport
        .stream(((BatchStatement) captor.getValue()).spliterator(), false)
        .map(SimpleStatement.class::cast)
        .collect(Collectors.toList());
    assertThat(inserts).hasSize(2);
    assertThat(inserts.get(0).getQuery()).startsWith("INSERT INTO observations");
    assertThat(inserts.get(0).getPositionalValues()).containsExactly(
        "loc-1",
        Instant.parse("2024-01-01T00:00:00Z"),
        "temperature",
        Instant.parse("2024-01-01T10:15:00Z"),
        21.5);
  }

  @Test
  void rejectsMalformedObservations() {
    when(cqlTemplate.execute(any(Statement.class))).thenReturn(Mono.just(true));

    StepVerifier.create(writeService.upsert(List.of(
            observation("loc-1", "temperature", 21.5),
            observation("loc-1", "temperature", Double.NaN),
            observation("", "temperature", 1),
            observation("loc-1", null, 1),
            observation("loc-1", "temperature", 2).setCapturedAt(null))))
        .assertNext(result -> {
          assertThat(result.getWritten()).isEqualTo(1);
          assertThat(result.getRejected()).hasSize(4);
        })
        .verifyComplete();

    assertThat(meterRegistry.counter("nimbus.observations.rejected").count()).isEqualTo(4);
  }

  @Test
  void allRejectedSkipsTheStore() {
    StepVerifier.create(writeService.upsert(List.of(
            observation("loc-1", "temperature", Double.POSITIVE_INFINITY))))
        .assertNext(result -> assertThat(result.getWritten()).isZero())
        .verifyComplete();

    verify(cqlTemplate, never()).execute(any(Statement.class));
  }

  @Test
  void emptyBatchWritesNothing() {
    StepVerifier.create(writeService.upsert(List.of()))
        .assertNext(result -> {
          assertThat(result.getWritten()).isZero();
          assertThat(result.hasRejections()).isFalse();
        })
        .verifyComplete();
  }

  @Test
  void retriesTransientStoreFailures() {
    final AtomicInteger attempts = new AtomicInteger();
    when(cqlTemplate.execute(any(Statement.class))).thenReturn(Mono.defer(() ->
        attempts.incrementAndGet() == 1 ?
            Mono.error(new QueryTimeoutException("slow")) : Mono.just(true)));

    StepVerifier.create(writeService.upsert(List.of(observation("loc-1", "temperature", 1))))
        .assertNext(result -> assertThat(result.getWritten()).isEqualTo(1))
        .verifyComplete();
    assertThat(attempts).hasValue(2);
  }

  @Test
  void exhaustedRetriesAreCounted() {
    final AtomicInteger attempts = new AtomicInteger();
    when(cqlTemplate.execute(any(Statement.class))).thenReturn(Mono.defer(() -> {
      attempts.incrementAndGet();
      return Mono.error(new DriverTimeoutException("slow"));
    }));

    StepVerifier.create(writeService.upsert(List.of(observation("loc-1", "temperature", 1))))
        .expectError(TransientCollectorException.class)
        .verify(Duration.ofSeconds(5));

    verify(cqlTemplate, times(1)).execute(any(Statement.class));
    assertThat(attempts).hasValue(2);
    assertThat(meterRegistry.counter("nimbus.db.operation.errors", "type", "observations")
        .count()).isEqualTo(1);
  }
}
