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

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.type.DataTypes;
import com.rackspace.nimbus.app.services.ObservationStatements;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.cassandra.core.cql.generator.CreateTableCqlGenerator;
import org.springframework.data.cassandra.core.cql.keyspace.CreateTableSpecification;
import org.springframework.data.cassandra.core.cql.keyspace.DefaultOption;
import org.springframework.data.cassandra.core.cql.keyspace.Option;
import org.springframework.data.cassandra.core.cql.keyspace.TableOption;
import org.springframework.data.cassandra.core.cql.keyspace.TableOption.CompactionOption;
import org.springframework.data.cassandra.core.cql.session.init.KeyspacePopulator;
import org.springframework.data.cassandra.core.cql.session.init.ScriptException;
import org.springframework.stereotype.Component;

/**
 * Creates the observations table, when missing, with the configured default TTL and a
 * time-window compaction strategy sized from that TTL.
 * @see ObservationStatements
 */
@Component
@Slf4j
public class ObservationTablesPopulator implements KeyspacePopulator {

  private static final DefaultOption COMPACTION_WINDOW_UNIT = new DefaultOption("compaction_window_unit", String.class, true, false, true);
  /**
   * value is number of the compaction_window_unit increments.
   */
  private static final DefaultOption COMPACTION_WINDOW_SIZE = new DefaultOption("compaction_window_size", Long.class, true, false, false);
  private static final String DEFAULT_TIME_TO_LIVE = "default_time_to_live";

  private final AppProperties appProperties;

  @Autowired
  public ObservationTablesPopulator(AppProperties appProperties) {
    this.appProperties = appProperties;
  }

  @Override
  public void populate(CqlSession session) throws ScriptException {
    final String cql = CreateTableCqlGenerator.toCql(observationsTableSpec(appProperties.getObservationTtl()));
    log.debug("Ensuring observations table: {}", cql);
    // Cassandra doesn't like reactive version of create table
    session.execute(cql);
  }

  CreateTableSpecification observationsTableSpec(Duration ttl) {
    return CreateTableSpecification
        .createTable(ObservationStatements.TABLE_NAME)
        .ifNotExists()
        .partitionKeyColumn(ObservationStatements.LOCATION_ID, DataTypes.TEXT)
        .partitionKeyColumn(ObservationStatements.TIME_PARTITION_SLOT, DataTypes.TIMESTAMP)
        .clusteredKeyColumn(ObservationStatements.METRIC_NAME, DataTypes.TEXT)
        .clusteredKeyColumn(ObservationStatements.CAPTURED_AT, DataTypes.TIMESTAMP)
        .column(ObservationStatements.VALUE, DataTypes.DOUBLE)
        .with(DEFAULT_TIME_TO_LIVE, ttl.getSeconds(), false, false)
        .with(TableOption.COMPACTION, compactionOptions(ttl))
        .with(TableOption.GC_GRACE_SECONDS, appProperties.getDataTableGcGraceSeconds());
  }

  private Map<Option, Object> compactionOptions(Duration ttl) {
    // Docs recommend 20 - 30 windows
    final Duration calculatedWindowSize = ttl.dividedBy(30);

    final TimeUnit windowUnit;
    final long windowSize;
    if (calculatedWindowSize.compareTo(Duration.ofDays(1)) > 0) {
      windowUnit = TimeUnit.DAYS;
      windowSize = calculatedWindowSize.toDays();
    } else if (calculatedWindowSize.compareTo(Duration.ofHours(1)) > 0) {
      windowUnit = TimeUnit.HOURS;
      windowSize = calculatedWindowSize.toHours();
    } else {
      windowUnit = TimeUnit.MINUTES;
      windowSize = Math.max(1, calculatedWindowSize.toMinutes());
    }

    return Map.of(
        CompactionOption.CLASS, "TimeWindowCompactionStrategy",
        COMPACTION_WINDOW_UNIT, windowUnit,
        COMPACTION_WINDOW_SIZE, windowSize
    );
  }
}
