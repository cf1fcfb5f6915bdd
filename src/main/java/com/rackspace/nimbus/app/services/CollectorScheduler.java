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
import com.rackspace.nimbus.app.model.CycleReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Triggers collection cycles, either on a fixed interval or on demand, and makes sure at most one
 * cycle is active at any time. A trigger that arrives while a cycle is active is dropped.
 */
@Service
@Slf4j
public class CollectorScheduler {

  private final CollectionCycle collectionCycle;
  private final AppProperties appProperties;
  private final ScheduledExecutorService timer;
  private final CycleStateMachine stateMachine = new CycleStateMachine();
  private final Counter droppedCounter;

  @Autowired
  public CollectorScheduler(CollectionCycle collectionCycle,
                            AppProperties appProperties,
                            @Qualifier("collectionTimer") ScheduledExecutorService timer,
                            MeterRegistry meterRegistry) {
    this.collectionCycle = collectionCycle;
    this.appProperties = appProperties;
    this.timer = timer;
    droppedCounter = meterRegistry.counter("nimbus.cycles.dropped");
  }

  /**
   * Starts the fixed-interval timer, unless scheduling is disabled.
   */
  public void start() {
    if (!appProperties.isScheduleEnabled()) {
      log.info("Scheduled collection is disabled");
      return;
    }
    final Duration interval = appProperties.getCollectionInterval();
    log.info("Scheduling collection every {} after {}", interval, appProperties.getInitialDelay());
    timer.scheduleAtFixedRate(this::scheduledTrigger,
        appProperties.getInitialDelay().toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Completes empty when the trigger was rejected because a cycle is already active or the
   * scheduler is shutting down.
   */
  public Mono<CycleReport> trigger() {
    return Mono.defer(() -> {
      final OptionalLong started = stateMachine.tryStart();
      if (started.isEmpty()) {
        droppedCounter.increment();
        log.warn("Dropping collection trigger, collector is {}{}", stateMachine.current(),
            stateMachine.isClosed() ? " and shutting down" : "");
        return Mono.empty();
      }
      final long cycle = started.getAsLong();
      // only this cycle's number can release the gate
      return collectionCycle.run(stateMachine)
          .doOnTerminate(() -> stateMachine.finish(cycle))
          .doOnCancel(() -> stateMachine.finish(cycle));
    });
  }

  /**
   * Runs one cycle and waits for it.
   *
   * @return empty if the trigger was rejected
   */
  public Optional<CycleReport> runOnce() {
    return trigger().blockOptional();
  }

  public CycleStateMachine getStateMachine() {
    return stateMachine;
  }

  private void scheduledTrigger() {
    // an exception escaping here would cancel every later execution
    try {
      trigger().block();
    } catch (RuntimeException e) {
      log.error("Scheduled collection failed", e);
    }
  }

  @PreDestroy
  public void stop() {
    stateMachine.close();
    timer.shutdown();
    final Duration gracePeriod = appProperties.getShutdownGracePeriod();
    try {
      if (!stateMachine.awaitIdle(gracePeriod)) {
        log.warn("Collection cycle still {} after waiting {}, shutting down anyway",
            stateMachine.current(), gracePeriod);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the active collection cycle");
    }
  }
}
