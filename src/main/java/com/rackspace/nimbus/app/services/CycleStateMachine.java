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

import com.rackspace.nimbus.app.model.CollectorState;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * State of the collector, owned by a single {@link CollectorScheduler}. One lock guards every
 * transition, which makes {@link #tryStart()} the single-flight gate for collection cycles. Each
 * started cycle gets a number, and only the holder of the current number can release the gate.
 */
@Slf4j
public class CycleStateMachine {

  private static final Map<CollectorState, Set<CollectorState>> TRANSITIONS = Map.of(
      CollectorState.IDLE, EnumSet.of(CollectorState.FETCHING),
      CollectorState.FETCHING, EnumSet.of(CollectorState.PERSISTING, CollectorState.FINALIZING),
      CollectorState.PERSISTING, EnumSet.of(CollectorState.FINALIZING, CollectorState.FAILED),
      CollectorState.FINALIZING, EnumSet.of(CollectorState.IDLE, CollectorState.FAILED),
      CollectorState.FAILED, EnumSet.of(CollectorState.IDLE)
  );

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition idle = lock.newCondition();
  private CollectorState state = CollectorState.IDLE;
  private long cycle;
  private boolean closed;

  /**
   * Moves from idle to fetching.
   *
   * @return the number of the started cycle, to be passed to {@link #finish(long)}, or empty when
   * a cycle is already active or the machine was closed
   */
  public OptionalLong tryStart() {
    lock.lock();
    try {
      if (closed || state != CollectorState.IDLE) {
        return OptionalLong.empty();
      }
      state = CollectorState.FETCHING;
      return OptionalLong.of(++cycle);
    } finally {
      lock.unlock();
    }
  }

  public void advance(CollectorState next) {
    lock.lock();
    try {
      if (!TRANSITIONS.get(state).contains(next)) {
        throw new IllegalStateException(
            String.format("Invalid collector transition %s -> %s", state, next));
      }
      log.trace("Collector state {} -> {}", state, next);
      state = next;
      if (state == CollectorState.IDLE) {
        idle.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns to idle from whatever state the given cycle ended in, including an aborted one. Does
   * nothing once a later cycle has started.
   *
   * @param startedCycle the number returned by {@link #tryStart()}
   */
  public void finish(long startedCycle) {
    lock.lock();
    try {
      if (startedCycle != cycle) {
        log.debug("Ignoring finish of cycle {}, cycle {} is current", startedCycle, cycle);
        return;
      }
      if (state != CollectorState.IDLE) {
        log.trace("Collector state {} -> {}", state, CollectorState.IDLE);
      }
      state = CollectorState.IDLE;
      idle.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public CollectorState current() {
    lock.lock();
    try {
      return state;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Rejects every later {@link #tryStart()}.
   */
  public void close() {
    lock.lock();
    try {
      closed = true;
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return true if the machine was idle, or became idle, within the timeout
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    lock.lock();
    try {
      while (state != CollectorState.IDLE) {
        if (remaining <= 0) {
          return false;
        }
        remaining = idle.awaitNanos(remaining);
      }
      return true;
    } finally {
      lock.unlock();
    }
  }
}
