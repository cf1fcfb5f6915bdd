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
 * Response of the SMHI metobs parameter resource, which lists the stations measuring it.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SmhiStationListResponse {

  String key;

  String title;

  List<Station> station;

  @Data
  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class Station {
    String key;
    String name;
    Double latitude;
    Double longitude;
    boolean active;
  }
}
