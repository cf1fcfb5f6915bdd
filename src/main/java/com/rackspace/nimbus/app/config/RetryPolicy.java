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

import com.rackspace.nimbus.app.exceptions.CollectorException;
import java.time.Duration;
import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Bounded exponential backoff applied to one kind of remote operation. Only retryable
 * {@link CollectorException}s are retried, every other failure propagates immediately.
 */
@Data
@Slf4j
public class RetryPolicy {

  /**
   * Total number of attempts, including the first one.
   */
  @Min(1)
  int maxAttempts = 5;

  @NotNull
  Duration baseDelay = Duration.ofSeconds(1);

  @DecimalMin("1.0")
  double multiplier = 2;

  @NotNull
  Duration maxDelay = Duration.ofSeconds(60);

  /**
   * Applies to each attempt on its own, not to the sum of all attempts.
   */
  @NotNull
  Duration attemptTimeout = Duration.ofSeconds(10);

  /**
   * @param retryIndex zero for the delay before the first retry
   * @return the delay before the given retry, capped at {@link #maxDelay}
   */
  public Duration backoff(long retryIndex) {
    final double delayMillis = baseDelay.toMillis() * Math.pow(multiplier, retryIndex);
    if (delayMillis >= maxDelay.toMillis()) {
      return maxDelay;
    }
    return Duration.ofMillis((long) delayMillis);
  }

  /**
   * @return the longest time a fully retried operation can take
   */
  public Duration worstCaseDuration() {
    Duration total = attemptTimeout.multipliedBy(maxAttempts);
    for (int retry = 0; retry < maxAttempts - 1; retry++) {
      total = total.plus(backoff(retry));
    }
    return total;
  }

  public Retry build(String description) {
    return Retry.from(signals -> signals.concatMap(signal -> {
      final Throwable failure = signal.failure();
      final long attempt = signal.totalRetries() + 1;
      if (!(failure instanceof CollectorException)
          || !((CollectorException) failure).isRetryable()
          || attempt >= maxAttempts) {
        return Mono.<Long>error(failure);
      }
      final Duration delay = backoff(signal.totalRetries());
      log.debug("Retrying {} in {} after attempt {} of {} failed: {}",
          description, delay, attempt, maxAttempts, failure.getMessage());
      return Mono.delay(delay);
    }));
  }
}
