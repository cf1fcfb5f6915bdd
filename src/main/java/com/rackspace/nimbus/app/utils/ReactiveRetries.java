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
package com.rackspace.nimbus.app.utils;

import com.rackspace.nimbus.app.config.RetryPolicy;
import com.rackspace.nimbus.app.exceptions.CollectorException;
import com.rackspace.nimbus.app.exceptions.FailureClassifier;
import reactor.core.publisher.Mono;

public class ReactiveRetries {

  private ReactiveRetries() {
  }

  /**
   * Subscribes to the given operation once per attempt, bounding each attempt with the policy's
   * timeout and classifying failures before deciding whether to retry.
   *
   * @param operation a cold publisher that performs the remote call on each subscription
   * @param policy the retry policy to apply
   * @param description used in log and exception messages
   * @return a mono that fails with the last {@link CollectorException} when retries are exhausted
   */
  public static <T> Mono<T> withPolicy(Mono<T> operation, RetryPolicy policy, String description) {
    return Mono.defer(() -> operation)
        .timeout(policy.getAttemptTimeout())
        .onErrorMap(e -> !(e instanceof CollectorException),
            e -> FailureClassifier.classify(e, description))
        .retryWhen(policy.build(description));
  }
}
