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
import com.rackspace.nimbus.app.model.CachedBatch;
import com.rackspace.nimbus.app.model.CollectionRun;
import com.rackspace.nimbus.app.model.CollectorState;
import com.rackspace.nimbus.app.model.CycleReport;
import com.rackspace.nimbus.app.model.Location;
import com.rackspace.nimbus.app.model.LocationOutcome;
import com.rackspace.nimbus.app.model.Observation;
import com.rackspace.nimbus.app.model.ObservationBatch;
import com.rackspace.nimbus.app.model.RunStatus;
import com.rackspace.nimbus.app.model.TimeWindow;
import com.rackspace.nimbus.app.utils.ReactiveRetries;
import com.rackspace.nimbus.app.utils.TimeBuckets;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs one collection cycle: fetch every location, persist what was fetched, then record the
 * outcome. A failure of one location never stops the others; it only shows up in the run's
 * status and error detail.
 */
@Service
@Slf4j
public class CollectionCycle {

  private final ObservationSource observationSource;
  private final ObservationCacheService cacheService;
  private final ObservationWriteService observationWriteService;
  private final MetadataWriteService metadataWriteService;
  private final FingerprintService fingerprintService;
  private final LocationResolver locationResolver;
  private final AppProperties appProperties;
  private final MeterRegistry meterRegistry;
  private final Counter auditFailuresCounter;

  @Autowired
  public CollectionCycle(ObservationSource observationSource,
                         ObservationCacheService cacheService,
                         ObservationWriteService observationWriteService,
                         MetadataWriteService metadataWriteService,
                         FingerprintService fingerprintService,
                         LocationResolver locationResolver,
                         AppProperties appProperties,
                         MeterRegistry meterRegistry) {
    this.observationSource = observationSource;
    this.cacheService = cacheService;
    this.observationWriteService = observationWriteService;
    this.metadataWriteService = metadataWriteService;
    this.fingerprintService = fingerprintService;
    this.locationResolver = locationResolver;
    this.appProperties = appProperties;
    this.meterRegistry = meterRegistry;
    auditFailuresCounter = meterRegistry.counter("nimbus.audit.failures");
  }

  /**
   * Expects the state machine to be in {@link CollectorState#FETCHING} and leaves it in
   * {@link CollectorState#FINALIZING} or {@link CollectorState#FAILED}.
   */
  public Mono<CycleReport> run(CycleStateMachine stateMachine) {
    final Instant startedAt = Instant.now();
    final UUID runId = UUID.randomUUID();
    final TimeWindow window = TimeWindow.endingAt(startedAt, appProperties.getLookback());
    final long bucket = TimeBuckets.bucketOf(startedAt, appProperties.getCacheBucketWidth());
    log.info("Starting collection run={} window={}", runId, window);

    final CollectionRun pending = new CollectionRun()
        .setRunId(runId)
        .setStartedAt(startedAt)
        .setStatus(RunStatus.PENDING);

    return metadataWriteService.recordRun(pending)
        .onErrorResume(e -> {
          // the final record is an upsert and still creates the row
          log.warn("Unable to record start of run={}, continuing: {}", runId, e.getMessage());
          return Mono.empty();
        })
        .then(Mono.defer(locationResolver::resolve)
            .map(Resolution::resolved)
            .onErrorResume(e -> {
              log.error("Collection run={} could not resolve its locations", runId, e);
              return Mono.just(Resolution.failed("unable to resolve locations: " + e.getMessage()));
            }))
        .flatMap(resolution -> {
          if (resolution.error != null) {
            stateMachine.advance(CollectorState.FINALIZING);
            return finalizeRun(pending, List.of(), resolution.error, stateMachine);
          }
          return fetchAll(resolution.locations, window)
              .flatMap(fetched -> {
                stateMachine.advance(CollectorState.PERSISTING);
                return persistAll(fetched, bucket);
              })
              .flatMap(outcomes -> {
                stateMachine.advance(CollectorState.FINALIZING);
                return finalizeRun(pending, outcomes, null, stateMachine);
              });
        });
  }

  private Mono<List<FetchResult>> fetchAll(List<Location> locations, TimeWindow window) {
    return Flux.fromIterable(locations)
        .flatMap(location -> fetchOne(location, window), appProperties.getWorkerPoolSize())
        .collectList();
  }

  private Mono<FetchResult> fetchOne(Location target, TimeWindow window) {
    final String locationId = target.getLocationId();
    return ReactiveRetries.withPolicy(
            observationSource.fetch(locationId, window),
            appProperties.getRetryFetch(),
            "fetch of location " + locationId
        )
        .map(batch -> new FetchResult(target, batch, null))
        .onErrorResume(e -> {
          log.warn("Skipping location={}: {}", locationId, e.getMessage());
          return Mono.just(new FetchResult(target, null,
              LocationOutcome.failed(locationId, e.getMessage())));
        });
  }

  private Mono<List<LocationOutcome>> persistAll(List<FetchResult> fetched, long bucket) {
    return Flux.fromIterable(fetched)
        .flatMap(result -> result.failure != null ?
                Mono.just(result.failure) : persistOne(result.target, result.batch, bucket),
            appProperties.getWorkerPoolSize())
        .collectList();
  }

  private Mono<LocationOutcome> persistOne(Location target, ObservationBatch batch, long bucket) {
    final String locationId = target.getLocationId();
    final List<Observation> observations = batch.getObservations();

    return Mono.fromCallable(() -> fingerprintService.fingerprint(locationId, observations))
        .flatMap(fingerprint -> cacheService.findBatch(locationId, bucket)
            .map(cached -> fingerprint.equals(cached.getFingerprint()))
            .defaultIfEmpty(false)
            .flatMap(duplicate -> {
              if (duplicate) {
                log.debug("Skipping writes of location={}, batch already stored in bucket={}",
                    locationId, bucket);
                return Mono.just(new LocationOutcome()
                    .setLocationId(locationId)
                    .setDeduplicated(true));
              }
              return write(LocationResolver.merge(target, batch.getLocation()), observations,
                  fingerprint, bucket);
            }))
        .onErrorResume(e -> {
          log.warn("Failed to persist location={}: {}", locationId, e.getMessage());
          return Mono.just(LocationOutcome.failed(locationId, e.getMessage()));
        });
  }

  private Mono<LocationOutcome> write(Location location, List<Observation> observations,
                                      String fingerprint, long bucket) {
    final String locationId = location.getLocationId();
    return metadataWriteService.ensureLocation(location)
        .then(Mono.defer(() -> observationWriteService.upsert(observations)))
        .flatMap(result -> {
          final LocationOutcome outcome = new LocationOutcome()
              .setLocationId(locationId)
              .setWritten(result.getWritten());
          if (result.hasRejections()) {
            // not cached so the next cycle retries the whole batch
            return Mono.just(outcome.setError(
                String.format("rejected %d malformed observations", result.getRejected().size())));
          }
          return cacheService.storeBatch(locationId, bucket,
                  new CachedBatch()
                      .setFingerprint(fingerprint)
                      .setObservations(observations))
              .thenReturn(outcome);
        });
  }

  private Mono<CycleReport> finalizeRun(CollectionRun pending, List<LocationOutcome> outcomes,
                                        String fatalError, CycleStateMachine stateMachine) {
    final List<LocationOutcome> failures = outcomes.stream()
        .filter(outcome -> !outcome.isSuccess())
        .collect(Collectors.toList());

    final RunStatus status;
    final String errorDetail;
    if (fatalError != null) {
      status = RunStatus.FAILED;
      errorDetail = fatalError;
    } else if (outcomes.isEmpty()) {
      status = RunStatus.FAILED;
      errorDetail = "no locations to collect";
    } else {
      status = failures.isEmpty() ? RunStatus.SUCCESS
          : failures.size() == outcomes.size() ? RunStatus.FAILED : RunStatus.PARTIAL;
      errorDetail = failures.isEmpty() ? null : failures.stream()
          .map(outcome -> outcome.getLocationId() + ": " + outcome.getError())
          .collect(Collectors.joining("; "));
    }

    final CollectionRun completed = new CollectionRun()
        .setRunId(pending.getRunId())
        .setStartedAt(pending.getStartedAt())
        .setFinishedAt(Instant.now())
        .setStatus(status)
        .setObservationCount(outcomes.stream().mapToInt(LocationOutcome::getWritten).sum())
        .setErrorDetail(errorDetail);

    return metadataWriteService.recordRun(completed)
        .thenReturn(new CycleReport()
            .setRun(completed)
            .setOutcomes(outcomes)
            .setAuditRecorded(true))
        .onErrorResume(e -> {
          // observations already written stay in place
          auditFailuresCounter.increment();
          log.error("Unable to record outcome {} of run={}", status, completed.getRunId(), e);
          final String auditError = "audit record not written: " + e.getMessage();
          completed
              .setStatus(RunStatus.FAILED)
              .setErrorDetail(errorDetail == null ? auditError : errorDetail + "; " + auditError);
          return Mono.just(new CycleReport()
              .setRun(completed)
              .setOutcomes(outcomes)
              .setAuditRecorded(false));
        })
        .doOnNext(report -> {
          if (report.getStatus() == RunStatus.FAILED) {
            stateMachine.advance(CollectorState.FAILED);
          }
          meterRegistry.counter("nimbus.cycles", "status", report.getStatus().columnValue())
              .increment();
          log.info("Finished collection run={} status={} observations={} error={}",
              completed.getRunId(), report.getStatus(), completed.getObservationCount(),
              completed.getErrorDetail());
        });
  }

  private static class FetchResult {

    final Location target;
    final ObservationBatch batch;
    final LocationOutcome failure;

    private FetchResult(Location target, ObservationBatch batch, LocationOutcome failure) {
      this.target = target;
      this.batch = batch;
      this.failure = failure;
    }
  }

  private static class Resolution {

    final List<Location> locations;
    final String error;

    private Resolution(List<Location> locations, String error) {
      this.locations = locations;
      this.error = error;
    }

    static Resolution resolved(List<Location> locations) {
      return new Resolution(locations, null);
    }

    static Resolution failed(String error) {
      return new Resolution(List.of(), error);
    }
  }
}
