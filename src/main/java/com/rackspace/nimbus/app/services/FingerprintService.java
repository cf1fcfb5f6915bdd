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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.rackspace.nimbus.app.model.Observation;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Computes content fingerprints of observation batches, independent of the order in which the
 * provider returned the observations.
 */
@Service
public class FingerprintService {

  private static final Charset HASHING_CHARSET = StandardCharsets.UTF_8;
  private static final Comparator<Observation> CANONICAL_ORDER = Comparator
      .comparing(Observation::getMetricName, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparing(Observation::getCapturedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
      .thenComparingDouble(Observation::getValue);

  private final HashFunction hashFunction = Hashing.murmur3_128();

  public String fingerprint(String locationId, List<Observation> observations) {
    final Hasher hasher = hashFunction.newHasher()
        .putString(locationId, HASHING_CHARSET)
        .putInt(observations.size());
    observations.stream()
        .sorted(CANONICAL_ORDER)
        .forEach(observation -> hasher
            .putString(String.valueOf(observation.getMetricName()), HASHING_CHARSET)
            .putLong(observation.getCapturedAt() == null
                ? Long.MIN_VALUE : observation.getCapturedAt().toEpochMilli())
            .putDouble(observation.getValue()));
    return hasher.hash().toString();
  }
}
