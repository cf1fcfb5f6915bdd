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
package com.rackspace.nimbus.app.model.smhi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import lombok.Data;

/**
 * Response of the SMHI metobs "data.json" resource for one station, parameter and period.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SmhiDataResponse {

  List<Value> value;

  Long updated;

  Parameter parameter;

  Station station;

  List<Position> position;

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Value {
    /**
     * Epoch milliseconds.
     */
    Long date;
    String value;
    String quality;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Parameter {
    String key;
    String name;
    String unit;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Station {
    String key;
    String name;
    Double height;
  }

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Position {
    Long from;
    Long to;
    Double latitude;
    Double longitude;
  }
}
