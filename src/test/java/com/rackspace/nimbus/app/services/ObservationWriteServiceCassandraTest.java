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

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.cql.Row;
import com.datastax.oss.driver.api.core.cql.SimpleStatement;
import com.rackspace.nimbus.app.config.AppProperties;
import com.rackspace.nimbus.app.config.ObservationTablesPopulator;
import com.rackspace.nimbus.app.model.Observation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.apache.commons.lang3.RandomStringUtils;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.data.cassandra.core.cql.session.DefaultBridgedReactiveSession;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;

/**
 * Runs the observation writes against a real Cassandra node, with the table created by
 * {@link ObservationTablesPopulator}.
 */
@Testcontainers(disabledWithoutDocker = true)
class ObservationWriteServiceCassandraTest {

  private static final String KEYSPACE = "nimbus";

  @Container
  public static CassandraContainer<?> cassandraContainer = new CassandraContainer<>("cassandra:3.11");

  private static CqlSession session;

  private final AppProperties appProperties = new AppProperties();
  private final ObservationStatements statements = new ObservationStatements();
  private ObservationWriteService writeService;

  @BeforeAll
  static void createSchema() {
    try (CqlSession setup = CqlSession.builder()
        .addContactPoint(cassandraContainer.getContactPoint())
        .withLocalDatacenter(cassandraContainer.getLocalDatacenter())
        .build()) {
      setup.execute("CREATE KEYSPACE IF NOT EXISTS " + KEYSPACE
          + " WITH replication = {'class': 'SimpleStrategy', 'replication_factor': 1}");
    }
    session = CqlSession.builder()
        .addContactPoint(cassandraContainer.getContactPoint())
        .withLocalDatacenter(cassandraContainer.getLocalDatacenter())
        .withKeyspace(KEYSPACE)
        .build();
    new ObservationTablesPopulator(new AppProperties()).populate(session);
  }

  @AfterAll
  static void closeSession() {
    if (session != null) {
      session.close();
    }
  }

  @BeforeEach
  void setUp() {
    writeService = new ObservationWriteService(
        new ReactiveCqlTemplate(new DefaultBridgedReactiveSession(session)),
        statements, appProperties, new SimpleMeterRegistry());
  }

  private List<Row> stored(String locationId, Instant timeSlot, String metricName) {
    return session.execute(
        SimpleStatement.newInstance(statements.query(), locationId, timeSlot, metricName)).all();
  }

  private static Observation observation(String locationId, Instant capturedAt, double value) {
    return new Observation()
        .setLocationId(locationId)
        .setCapturedAt(capturedAt)
        .setMetricName("temperature")
        .setValue(value);
  }

  @Test
  void singleObservation() {
    final String locationId = RandomStringUtils.randomAlphanumeric(10);
    final Instant capturedAt = Instant.parse("2024-01-01T00:00:00Z");

    StepVerifier.create(writeService.upsert(List.of(observation(locationId, capturedAt, 21.5))))
        .assertNext(result -> assertThat(result.getWritten()).isEqualTo(1))
        .verifyComplete();

    final List<Row> rows = stored(locationId, capturedAt, "temperature");
    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getInstant(ObservationStatements.CAPTURED_AT)).isEqualTo(capturedAt);
    assertThat(rows.get(0).getDouble(ObservationStatements.VALUE)).isEqualTo(21.5);
  }

  @Test
  void repeatedWriteIsIdempotent() {
    final String locationId = RandomStringUtils.randomAlphanumeric(10);
    final Instant capturedAt = Instant.parse("2024-01-01T06:00:00Z");
    final List<Observation> batch = List.of(
        observation(locationId, capturedAt, 3.5),
        observation(locationId, capturedAt.plus(Duration.ofMinutes(10)), 3.7));

    StepVerifier.create(writeService.upsert(batch).then(writeService.upsert(batch)))
        .assertNext(result -> assertThat(result.getWritten()).isEqualTo(2))
        .verifyComplete();

    assertThat(stored(locationId, Instant.parse("2024-01-01T00:00:00Z"), "temperature"))
        .hasSize(2);
  }

  @Test
  void laterWriteWins() {
    final String locationId = RandomStringUtils.randomAlphanumeric(10);
    final Instant capturedAt = Instant.parse("2024-01-02T12:00:00Z");

    StepVerifier.create(writeService.upsert(List.of(observation(locationId, capturedAt, 10.0)))
            .then(writeService.upsert(List.of(observation(locationId, capturedAt, 11.0)))))
        .expectNextCount(1)
        .verifyComplete();

    final List<Row> rows = stored(locationId, Instant.parse("2024-01-02T00:00:00Z"), "temperature");
    assertThat(rows).hasSize(1);
    assertThat(rows.get(0).getDouble(ObservationStatements.VALUE)).isEqualTo(11.0);
  }
}
