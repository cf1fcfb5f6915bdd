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

import com.rackspace.nimbus.app.config.AppProperties;
import com.rackspace.nimbus.app.config.SmhiProperties;
import com.rackspace.nimbus.app.model.Location;
import com.rackspace.nimbus.app.utils.ReactiveRetries;
import java.util.List;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Determines which locations a cycle collects: the configured ones or, when none are configured
 * and discovery is enabled, every station the provider reports as active.
 */
@Service
@Slf4j
public class LocationResolver {

  private final ObservationSource observationSource;
  private final AppProperties appProperties;
  private final SmhiProperties smhiProperties;

  @Autowired
  public LocationResolver(ObservationSource observationSource,
                          AppProperties appProperties,
                          SmhiProperties smhiProperties) {
    this.observationSource = observationSource;
    this.appProperties = appProperties;
    this.smhiProperties = smhiProperties;
  }

  public Mono<List<Location>> resolve() {
    if (!appProperties.getLocations().isEmpty() || !smhiProperties.isDiscoverActiveStations()) {
      return Mono.just(appProperties.getLocations().stream()
          .map(configured -> new Location()
              .setLocationId(configured.getId())
              .setDisplayName(configured.getDisplayName())
              .setLatitude(configured.getLatitude())
              .setLongitude(configured.getLongitude()))
          .collect(Collectors.toList()));
    }

    return ReactiveRetries.withPolicy(
            observationSource.listActiveStations().collectList(),
            appProperties.getRetryFetch(),
            "discovery of active stations"
        )
        .doOnNext(locations -> log.info("Discovered {} active stations", locations.size()));
  }

  /**
   * Combines what the provider reported about a location with the configured values, which win.
   */
  static Location merge(Location configured, Location reported) {
    final Location merged = new Location()
        .setLocationId(configured.getLocationId())
        .setDisplayName(configured.getDisplayName())
        .setLatitude(configured.getLatitude())
        .setLongitude(configured.getLongitude());
    if (reported != null) {
      if (merged.getDisplayName() == null) {
        merged.setDisplayName(reported.getDisplayName());
      }
      if (merged.getLatitude() == null || merged.getLongitude() == null) {
        merged.setLatitude(reported.getLatitude());
        merged.setLongitude(reported.getLongitude());
      }
    }
    return merged;
  }
}
