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

import com.rackspace.nimbus.app.config.SmhiProperties;
import com.rackspace.nimbus.app.exceptions.FailureClassifier;
import com.rackspace.nimbus.app.model.Location;
import com.rackspace.nimbus.app.model.Observation;
import com.rackspace.nimbus.app.model.ObservationBatch;
import com.rackspace.nimbus.app.model.TimeWindow;
import com.rackspace.nimbus.app.model.smhi.SmhiDataResponse;
import com.rackspace.nimbus.app.model.smhi.SmhiStationListResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Reads observations from the SMHI open data meteorological observations API.
 * One request is issued per configured metric, each mapped to an SMHI parameter id.
 */
@Service
@Slf4j
public class SmhiObservationSource implements ObservationSource {

  static final String DATA_URI =
      "/api/version/1.0/parameter/{parameter}/station/{station}/period/{period}/data.json";
  static final String STATIONS_URI = "/api/version/1.0/parameter/{parameter}.json";

  /**
   * Periods offered by the API, shortest first, with the window length each one covers.
   */
  private static final Map<String, Duration> PERIODS = new LinkedHashMap<>();

  static {
    PERIODS.put("latest-hour", Duration.ofHours(1));
    PERIODS.put("latest-day", Duration.ofDays(1));
    PERIODS.put("latest-months", Duration.ofDays(120));
  }

  private final WebClient webClient;
  private final SmhiProperties properties;

  @Autowired
  public SmhiObservationSource(@Qualifier("smhiWebClient") WebClient webClient,
                               SmhiProperties properties) {
    this.webClient = webClient;
    this.properties = properties;
  }

  @Override
  public Mono<ObservationBatch> fetch(String locationId, TimeWindow window) {
    final String period = periodCovering(window);
    log.trace("Fetching location={} period={} window={}", locationId, period, window);

    return Flux.fromIterable(properties.getParameters().entrySet())
        .concatMap(parameter -> fetchParameter(locationId, parameter.getValue(), period)
            .map(response -> new ParameterData(parameter.getKey(), response)))
        .collectList()
        .map(responses -> toBatch(locationId, window, responses))
        .onErrorMap(e -> FailureClassifier.classify(e, "fetch of location " + locationId));
  }

  @Override
  public Flux<Location> listActiveStations() {
    return webClient.get()
        .uri(STATIONS_URI, properties.getDiscoveryParameter())
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(SmhiStationListResponse.class)
        .flatMapIterable(response -> response.getStation() == null ?
            List.of() : response.getStation())
        .filter(SmhiStationListResponse.Station::isActive)
        .map(station -> new Location()
            .setLocationId(station.getKey())
            .setDisplayName(station.getName())
            .setLatitude(station.getLatitude())
            .setLongitude(station.getLongitude()))
        .onErrorMap(e -> FailureClassifier.classify(e, "listing of active stations"));
  }

  static String periodCovering(TimeWindow window) {
    final Duration length = window.length();
    String chosen = null;
    for (Map.Entry<String, Duration> entry : PERIODS.entrySet()) {
      chosen = entry.getKey();
      if (length.compareTo(entry.getValue()) <= 0) {
        break;
      }
    }
    return chosen;
  }

  private Mono<SmhiDataResponse> fetchParameter(String locationId, int parameter, String period) {
    return webClient.get()
        .uri(DATA_URI, parameter, locationId, period)
        .accept(MediaType.APPLICATION_JSON)
        .retrieve()
        .bodyToMono(SmhiDataResponse.class);
  }

  private ObservationBatch toBatch(String locationId, TimeWindow window,
                                   List<ParameterData> responses) {
    final Location location = new Location().setLocationId(locationId);
    final List<Observation> observations = new ArrayList<>();

    for (ParameterData data : responses) {
      final SmhiDataResponse response = data.response;
      if (response.getStation() != null && location.getDisplayName() == null) {
        location.setDisplayName(response.getStation().getName());
      }
      if (response.getPosition() != null && !response.getPosition().isEmpty()) {
        // positions are ordered oldest first
        final SmhiDataResponse.Position position =
            response.getPosition().get(response.getPosition().size() - 1);
        location.setLatitude(position.getLatitude());
        location.setLongitude(position.getLongitude());
      }
      if (response.getValue() == null) {
        continue;
      }
      for (SmhiDataResponse.Value value : response.getValue()) {
        // a malformed point is passed on as is and rejected by the writer
        final Instant capturedAt =
            value.getDate() == null ? null : Instant.ofEpochMilli(value.getDate());
        if (capturedAt == null || window.contains(capturedAt)) {
          observations.add(new Observation()
              .setLocationId(locationId)
              .setCapturedAt(capturedAt)
              .setMetricName(data.metricName)
              .setValue(parseValue(locationId, data.metricName, value.getValue())));
        }
      }
    }

    log.debug("Fetched {} observations for location={}", observations.size(), locationId);
    return new ObservationBatch(location, observations);
  }

  private static double parseValue(String locationId, String metricName, String raw) {
    if (raw == null) {
      log.warn("Missing value for location={} metric={}", locationId, metricName);
      return Double.NaN;
    }
    try {
      return Double.parseDouble(raw);
    } catch (NumberFormatException e) {
      log.warn("Unparseable value '{}' for location={} metric={}", raw, locationId, metricName);
      return Double.NaN;
    }
  }

  private static class ParameterData {

    final String metricName;
    final SmhiDataResponse response;

    private ParameterData(String metricName, SmhiDataResponse response) {
      this.metricName = metricName;
      this.response = response;
    }
  }
}
