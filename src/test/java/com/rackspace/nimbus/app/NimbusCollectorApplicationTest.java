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
package com.rackspace.nimbus.app;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.datastax.oss.driver.api.core.cql.Row;
import com.rackspace.nimbus.app.model.CycleReport;
import com.rackspace.nimbus.app.model.Location;
import com.rackspace.nimbus.app.model.Observation;
import com.rackspace.nimbus.app.model.ObservationBatch;
import com.rackspace.nimbus.app.model.RunStatus;
import com.rackspace.nimbus.app.services.CollectorScheduler;
import com.rackspace.nimbus.app.services.ObservationSource;
import com.rackspace.nimbus.app.services.ObservationStatements;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.cassandra.core.cql.ReactiveCqlTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.core.publisher.Mono;

/**
 * Runs collection cycles through the whole application against real stores, with only the
 * upstream provider replaced.
 */
@SpringBootTest(properties = {
    "nimbus.schedule-enabled=false",
    "nimbus.locations[0].id=loc-1",
    "nimbus.cache-bucket-width=1440"
})
@Testcontainers(disabledWithoutDocker = true)
class NimbusCollectorApplicationTest {

  @Container
  public static CassandraContainer<?> cassandraContainer = new CassandraContainer<>(
      CassandraContainerSetup.DOCKER_IMAGE);

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine");

  @Container
  static final GenericContainer<?> REDIS = new GenericContainer<>("redis:6.0")
      .withExposedPorts(6379);

  @TestConfiguration
  @Import(CassandraContainerSetup.class)
  public static class TestConfig {
    @Bean
    CassandraContainer<?> cassandraContainer() {
      return cassandraContainer;
    }
  }

  @DynamicPropertySource
  static void configureStores(DynamicPropertyRegistry registry) {
    registry.add("spring.data.cassandra.contact-points", () ->
        cassandraContainer.getHost() + ":" + cassandraContainer.getMappedPort(9042));
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.redis.host", REDIS::getHost);
    registry.add("spring.redis.port", () -> REDIS.getFirstMappedPort().toString());
  }

  @MockBean
  ObservationSource observationSource;

  @Autowired
  CollectorScheduler scheduler;

  @Autowired
  ReactiveCqlTemplate cqlTemplate;

  @Autowired
  ObservationStatements statements;

  @Autowired
  JdbcTemplate jdbcTemplate;

  @Test
  void cycleStoresObservationLocationAndRun() {
    final Instant capturedAt = Instant.parse("2024-01-01T00:00:00Z");
    when(observationSource.fetch(eq("loc-1"), any())).thenReturn(Mono.just(new ObservationBatch(
        new Location().setLocationId("loc-1").setDisplayName("First"),
        List.of(new Observation()
            .setLocationId("loc-1")
            .setCapturedAt(capturedAt)
            .setMetricName("temperature")
            .setValue(21.5)))));

    final CycleReport first = scheduler.runOnce().orElseThrow();
    assertThat(first.getStatus()).isEqualTo(RunStatus.SUCCESS);
    assertThat(first.getRun().getObservationCount()).isEqualTo(1);

    final List<Row> points = cqlTemplate.queryForRows(statements.query(),
            "loc-1", capturedAt, "temperature")
        .collectList()
        .block();
    assertThat(points).hasSize(1);
    assertThat(points.get(0).getDouble(ObservationStatements.VALUE)).isEqualTo(21.5);

    assertThat(jdbcTemplate.queryForObject(
        "SELECT display_name FROM locations WHERE location_id = ?", String.class, "loc-1"))
        .isEqualTo("First");
    assertThat(jdbcTemplate.queryForObject(
        "SELECT status FROM collection_runs WHERE run_id = ?", String.class,
        first.getRun().getRunId()))
        .isEqualTo("success");

    // same payload within the same cache bucket
    final CycleReport second = scheduler.runOnce().orElseThrow();
    assertThat(second.getStatus()).isEqualTo(RunStatus.SUCCESS);
    assertThat(second.getRun().getObservationCount()).isZero();
    assertThat(second.getOutcomes()).allMatch(outcome -> outcome.isDeduplicated());
  }
}
