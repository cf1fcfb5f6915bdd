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

import com.rackspace.nimbus.app.exceptions.PermanentCollectorException;
import com.rackspace.nimbus.app.exceptions.TransientCollectorException;
import com.rackspace.nimbus.app.model.Location;
import com.rackspace.nimbus.app.model.ObservationBatch;
import com.rackspace.nimbus.app.model.TimeWindow;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Upstream provider of weather observations. Implementations keep the provider's request and
 * response shapes to themselves and never mutate shared state.
 */
public interface ObservationSource {

  /**
   * Performs one attempt at fetching a location's observations. Retrying is left to the caller.
   *
   * @return the observations captured within the window along with the provider's metadata for
   * the location. Fails with {@link TransientCollectorException} or
   * {@link PermanentCollectorException}.
   */
  Mono<ObservationBatch> fetch(String locationId, TimeWindow window);

  /**
   * @return the locations the provider currently reports as active
   */
  Flux<Location> listActiveStations();
}
