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
package com.rackspace.nimbus.app.exceptions;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.servererrors.OverloadedException;
import com.datastax.oss.driver.api.core.servererrors.ReadTimeoutException;
import com.datastax.oss.driver.api.core.servererrors.UnavailableException;
import com.datastax.oss.driver.api.core.servererrors.WriteTimeoutException;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import org.springframework.core.codec.CodecException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Maps the exceptions raised by WebClient, the Cassandra driver and Spring's data access layer
 * onto {@link TransientCollectorException} or {@link PermanentCollectorException}.
 */
public final class FailureClassifier {

  private FailureClassifier() {
  }

  public static CollectorException classify(Throwable throwable, String description) {
    if (throwable instanceof CollectorException) {
      return (CollectorException) throwable;
    }
    final String message = String.format("%s failed: %s", description, describe(throwable));
    if (isTransient(throwable)) {
      return new TransientCollectorException(message, throwable);
    }
    return new PermanentCollectorException(message, throwable);
  }

  static boolean isTransient(Throwable throwable) {
    if (throwable instanceof WebClientResponseException) {
      final int status = ((WebClientResponseException) throwable).getRawStatusCode();
      return status >= 500 || status == HttpStatus.TOO_MANY_REQUESTS.value();
    }
    if (throwable instanceof CodecException) {
      // malformed payload
      return false;
    }
    return throwable instanceof TimeoutException
        || throwable instanceof WebClientRequestException
        || throwable instanceof IOException
        || throwable instanceof DriverTimeoutException
        || throwable instanceof AllNodesFailedException
        || throwable instanceof UnavailableException
        || throwable instanceof WriteTimeoutException
        || throwable instanceof ReadTimeoutException
        || throwable instanceof OverloadedException
        || throwable instanceof TransientDataAccessException
        || throwable instanceof RecoverableDataAccessException
        || throwable instanceof DataAccessResourceFailureException;
  }

  private static String describe(Throwable throwable) {
    if (throwable instanceof WebClientResponseException) {
      return "HTTP " + ((WebClientResponseException) throwable).getRawStatusCode();
    }
    if (throwable instanceof TimeoutException) {
      return "timed out";
    }
    return throwable.getMessage() != null ?
        throwable.getMessage() : throwable.getClass().getSimpleName();
  }
}
