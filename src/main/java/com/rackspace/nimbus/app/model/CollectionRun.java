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

package com.rackspace.nimbus.app.model;

import java.time.Instant;
import java.util.UUID;
import lombok.Data;

/**
 * Audit record of one collection cycle. Created as {@link RunStatus#PENDING} when the cycle
 * starts and updated once when it finishes.
 */
@Data
public class CollectionRun {

  UUID runId;

  Instant startedAt;

  Instant finishedAt;

  RunStatus status;

  int observationCount;

  String errorDetail;
}
