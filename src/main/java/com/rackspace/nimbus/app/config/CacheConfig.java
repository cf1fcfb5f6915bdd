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

import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.rackspace.nimbus.app.model.Location;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

  private final MeterRegistry meterRegistry;
  private final AppProperties appProperties;

  @Autowired
  public CacheConfig(MeterRegistry meterRegistry, AppProperties appProperties) {
    this.meterRegistry = meterRegistry;
    this.appProperties = appProperties;
  }

  /**
   * Tracks location values already written to the relational store by this process.
   */
  @Bean
  public AsyncCache<Location, Boolean/*stored*/> knownLocationCache() {
    final AsyncCache<Location, Boolean> cache = Caffeine
        .newBuilder()
        .maximumSize(appProperties.getKnownLocationCacheSize())
        .recordStats()
        .buildAsync();
    CaffeineCacheMetrics.monitor(meterRegistry, cache, "knownLocation");
    return cache;
  }
}
