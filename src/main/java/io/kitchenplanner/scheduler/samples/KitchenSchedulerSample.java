// Copyright 2010-2025 Google LLC
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

// [START program]
package io.kitchenplanner.scheduler.samples;
// [START import]
import io.kitchenplanner.scheduler.KitchenScheduler;
import io.kitchenplanner.scheduler.domain.StaffingRequirements;
import io.kitchenplanner.scheduler.domain.Worker;
import io.kitchenplanner.scheduler.sat.SolverOptions;
import io.kitchenplanner.scheduler.schedule.ScheduleFormatter;
import io.kitchenplanner.scheduler.schedule.ScheduleResult;
import io.kitchenplanner.scheduler.schedule.WeeklySchedule;
import java.util.List;
import java.util.logging.Logger;
// [END import]

/**
 * Schedules the default kitchen team for one week.
 *
 * <p>Usage: {@code KitchenSchedulerSample [num_workers] [sat_parameters]}, where the optional
 * parameters are CP-SAT parameters in text format, e.g. {@code "max_time_in_seconds: 5"}.
 */
public class KitchenSchedulerSample {
  private static final Logger logger = Logger.getLogger(KitchenSchedulerSample.class.getName());

  public static void main(String[] args) {
    // [START data]
    int numWorkers = args.length > 0 ? Integer.parseInt(args[0]) : SampleData.DEFAULT_WORKERS;
    List<Worker> workers = SampleData.defaultRoster(numWorkers);
    StaffingRequirements requirements = SampleData.defaultRequirements();
    // [END data]

    // [START parameters]
    SolverOptions.Builder options = SolverOptions.newBuilder();
    if (args.length > 1) {
      options.mergeParameters(args[1]);
    }
    // [END parameters]

    // [START solve]
    KitchenScheduler scheduler = new KitchenScheduler(options.build());
    ScheduleResult result = scheduler.schedule(workers, requirements);
    // [END solve]

    // [START print_solution]
    logger.info("Status: " + result.getStatus());
    if (!result.getSchedule().isPresent()) {
      logger.warning(result.getMessage());
      return;
    }
    WeeklySchedule schedule = result.getSchedule().get();
    logger.info("Weekly schedule:\n" + ScheduleFormatter.formatSchedule(schedule));
    logger.info("Summary per employee:\n" + ScheduleFormatter.formatSummaries(schedule));
    // [END print_solution]
  }

  private KitchenSchedulerSample() {}
}
// [END program]
