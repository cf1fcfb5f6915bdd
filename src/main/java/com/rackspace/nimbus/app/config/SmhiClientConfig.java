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

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class SmhiClientConfig {

  /**
   * The latest-months period of a station can be several megabytes.
   */
  private static final DataSize MAX_RESPONSE_SIZE = DataSize.ofMegabytes(16);

  private final SmhiProperties properties;

  @Autowired
  public SmhiClientConfig(SmhiProperties properties) {
    this.properties = properties;
  }

  @Bean
  public WebClient smhiWebClient(WebClient.Builder webClientBuilder) {
    return webClientBuilder
        .baseUrl(properties.getBaseUrl())
        .codecs(codecs -> codecs.defaultCodecs()
            .maxInMemorySize((int) MAX_RESPONSE_SIZE.toBytes()))
        .build();
  }
}
