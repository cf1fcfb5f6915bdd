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

import java.util.LinkedHashMap;
import java.util.Map;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties("nimbus.smhi")
@Component
@Data
@Validated
public class SmhiProperties {

  @NotBlank
  String baseUrl = "https://opendata-download-metobs.smhi.se";

  /**
   * Maps the stored metric name to the SMHI parameter id it is read from.
   * Parameter 1 is the momentary air temperature in celsius.
   */
  @NotEmpty
  Map<String, Integer> parameters = new LinkedHashMap<>(Map.of("temperature", 1));

  /**
   * When enabled and no locations are configured, every station reported active for
   * <code>discovery-parameter</code> is collected.
   */
  boolean discoverActiveStations;

  @Min(1)
  int discoveryParameter = 1;
}
