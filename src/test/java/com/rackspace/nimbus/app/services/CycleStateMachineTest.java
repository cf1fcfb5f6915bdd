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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.rackspace.nimbus.app.model.CollectorState;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CycleStateMachineTest {

  @Test
  void fullCycle() {
    final CycleStateMachine stateMachine = new CycleStateMachine();
    assertThat(stateMachine.current()).isEqualTo(CollectorState.IDLE);

    assertThat(stateMachine.tryStart()).hasValue(1L);
    assertThat(stateMachine.current()).isEqualTo(CollectorState.FETCHING);
    stateMachine.advance(CollectorState.PERSISTING);
    stateMachine.advance(CollectorState.FINALIZING);
    stateMachine.advance(CollectorState.IDLE);
    assertThat(stateMachine.current()).isEqualTo(CollectorState.IDLE);
  }

  @Test
  void secondStartIsRejectedWhileActive() {
    final CycleStateMachine stateMachine = new CycleStateMachine();

    assertThat(stateMachine.tryStart()).hasValue(1L);
    assertThat(stateMachine.tryStart()).isEmpty();

    stateMachine.finish(1L);
    assertThat(stateMachine.tryStart()).hasValue(2L);
  }

  @Test
  void finishOfEarlierCycleKeepsLaterCycleActive() {
    final CycleStateMachine stateMachine = new CycleStateMachine();
    final long first = stateMachine.tryStart().getAsLong();
    stateMachine.finish(first);
    final long second = stateMachine.tryStart().getAsLong();
    stateMachine.advance(CollectorState.PERSISTING);

    stateMachine.finish(first);

    assertThat(stateMachine.current()).isEqualTo(CollectorState.PERSISTING);
    assertThat(stateMachine.tryStart()).isEmpty();
    stateMachine.finish(second);
    assertThat(stateMachine.current()).isEqualTo(CollectorState.IDLE);
  }

  @Test
  void invalidTransitionsAreRejected() {
    final CycleStateMachine stateMachine = new CycleStateMachine();

    assertThatThrownBy(() -> stateMachine.advance(CollectorState.PERSISTING))
        .isInstanceOf(IllegalStateException.class)
        .hasMessage("Invalid collector transition IDLE -> PERSISTING");

    stateMachine.tryStart();
    assertThatThrownBy(() -> stateMachine.advance(CollectorState.FAILED))
        .isInstanceOf(IllegalStateException.class);
    assertThat(stateMachine.current()).isEqualTo(CollectorState.FETCHING);
  }

  @Test
  void failedReturnsToIdle() {
    final CycleStateMachine stateMachine = new CycleStateMachine();
    final long cycle = stateMachine.tryStart().getAsLong();
    stateMachine.advance(CollectorState.FINALIZING);
    stateMachine.advance(CollectorState.FAILED);

    assertThat(stateMachine.tryStart()).isEmpty();
    stateMachine.finish(cycle);
    assertThat(stateMachine.current()).isEqualTo(CollectorState.IDLE);
  }

  @Test
  void closedMachineRejectsStart() {
    final CycleStateMachine stateMachine = new CycleStateMachine();
    stateMachine.close();

    assertThat(stateMachine.isClosed()).isTrue();
    assertThat(stateMachine.tryStart()).isEmpty();
    assertThat(stateMachine.current()).isEqualTo(CollectorState.IDLE);
  }

  @Test
  void awaitIdleTimesOutWhileActive() throws InterruptedException {
    final CycleStateMachine stateMachine = new CycleStateMachine();
    stateMachine.tryStart();

    assertThat(stateMachine.awaitIdle(Duration.ofMillis(50))).isFalse();
  }

  @Test
  void awaitIdleReturnsWhenCycleFinishes() throws Exception {
    final CycleStateMachine stateMachine = new CycleStateMachine();
    final long cycle = stateMachine.tryStart().getAsLong();

    final CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
      try {
        return stateMachine.awaitIdle(Duration.ofSeconds(5));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    });
    stateMachine.finish(cycle);

    assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
  }
}
