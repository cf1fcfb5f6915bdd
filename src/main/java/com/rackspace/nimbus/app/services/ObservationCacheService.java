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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rackspace.nimbus.app.config.AppProperties;
import com.rackspace.nimbus.app.model.CachedBatch;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import javax.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Best-effort client of the Redis cache layer. Every Redis failure is logged and swallowed so
 * that an unavailable or empty cache only costs extra writes, never a failed cycle.
 */
@Service
@Slf4j
public class ObservationCacheService {

  private final ReactiveStringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final AppProperties appProperties;
  private final Counter cacheErrorsCounter;

  @Autowired
  public ObservationCacheService(ReactiveStringRedisTemplate redisTemplate,
                                 ObjectMapper objectMapper,
                                 AppProperties appProperties,
                                 MeterRegistry meterRegistry) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.appProperties = appProperties;
    cacheErrorsCounter = meterRegistry.counter("nimbus.cache.errors");
  }

  @PostConstruct
  public void printConfigurations() {
    log.info("cache-bucket-width: {}", appProperties.getCacheBucketWidth());
    log.info("cache-ttl: {}", appProperties.getCacheTtl());
  }

  /**
   * @return the cached value or empty when absent or when Redis could not be reached
   */
  public Mono<String> get(String key) {
    return redisTemplate.opsForValue().get(key)
        .onErrorResume(e -> swallow("get", key, e));
  }

  public Mono<Void> set(String key, String value, Duration ttl) {
    return redisTemplate.opsForValue().set(key, value, ttl)
        .then()
        .onErrorResume(e -> swallow("set", key, e));
  }

  public Mono<Void> invalidate(String key) {
    return redisTemplate.delete(key)
        .then()
        .onErrorResume(e -> swallow("invalidate", key, e));
  }

  public Mono<CachedBatch> findBatch(String locationId, long bucket) {
    final String key = encodeKey(locationId, bucket);
    return get(key)
        .flatMap(json -> {
          try {
            return Mono.just(objectMapper.readValue(json, CachedBatch.class));
          } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry key={}", key, e);
            return invalidate(key).then(Mono.empty());
          }
        });
  }

  public Mono<Void> storeBatch(String locationId, long bucket, CachedBatch batch) {
    final String key = encodeKey(locationId, bucket);
    final String json;
    try {
      json = objectMapper.writeValueAsString(batch);
    } catch (JsonProcessingException e) {
      log.warn("Unable to serialize batch for cache key={}", key, e);
      return Mono.empty();
    }
    return set(key, json, appProperties.getCacheTtl());
  }

  public static String encodeKey(String locationId, long bucket) {
    return String.format("loc:%s:bucket:%d", locationId, bucket);
  }

  private <T> Mono<T> swallow(String operation, String key, Throwable e) {
    cacheErrorsCounter.increment();
    log.warn("Cache {} failed for key={}, continuing without cache: {}",
        operation, key, e.getMessage());
    return Mono.empty();
  }
}
