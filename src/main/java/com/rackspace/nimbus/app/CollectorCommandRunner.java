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
package com.rackspace.nimbus.app;

import com.rackspace.nimbus.app.model.CycleReport;
import com.rackspace.nimbus.app.model.RunStatus;
import com.rackspace.nimbus.app.services.CollectorScheduler;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Either runs one collection cycle for the <code>weather</code> command or starts the
 * fixed-interval schedule.
 */
@Component
@Slf4j
public class CollectorCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  public static final String WEATHER_COMMAND = "weather";

  static final int EXIT_FAILED = 1;
  static final int EXIT_REJECTED = 2;

  private final CollectorScheduler scheduler;
  private int exitCode;

  @Autowired
  public CollectorCommandRunner(CollectorScheduler scheduler) {
    this.scheduler = scheduler;
  }

  public static boolean isWeatherCommand(String[] args) {
    for (String arg : args) {
      if (WEATHER_COMMAND.equals(arg)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public void run(ApplicationArguments args) {
    final List<String> commands = args.getNonOptionArgs();
    if (!commands.contains(WEATHER_COMMAND)) {
      scheduler.start();
      return;
    }

    final Optional<CycleReport> report = scheduler.runOnce();
    if (report.isEmpty()) {
      log.error("Collection cycle was not started");
      exitCode = EXIT_REJECTED;
    } else if (report.get().getStatus() == RunStatus.FAILED) {
      log.error("Collection cycle failed: {}", report.get().getRun().getErrorDetail());
      exitCode = EXIT_FAILED;
    } else {
      log.info("Collection cycle finished with status {}", report.get().getStatus());
      exitCode = 0;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
