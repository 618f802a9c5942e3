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

package io.kitchenplanner.scheduler;

import com.google.ortools.Loader;
import io.kitchenplanner.scheduler.domain.ScheduleInputException;
import io.kitchenplanner.scheduler.domain.StaffingRequirements;
import io.kitchenplanner.scheduler.domain.Worker;
import io.kitchenplanner.scheduler.sat.ShiftModel;
import io.kitchenplanner.scheduler.sat.ShiftModelBuilder;
import io.kitchenplanner.scheduler.sat.ShiftSolver;
import io.kitchenplanner.scheduler.sat.SolveOutcome;
import io.kitchenplanner.scheduler.sat.SolverOptions;
import io.kitchenplanner.scheduler.schedule.ScheduleDecoder;
import io.kitchenplanner.scheduler.schedule.ScheduleResult;
import io.kitchenplanner.scheduler.schedule.ScheduleValidator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Entry point of the scheduling core: builds the model, solves it and decodes the result.
 *
 * <p>Each call of {@link #schedule} works on its own model; nothing is kept between calls.
 */
public final class KitchenScheduler {
  private static final Logger logger = Logger.getLogger(KitchenScheduler.class.getName());

  private final ShiftSolver solver;

  public KitchenScheduler() {
    this(SolverOptions.defaults());
  }

  public KitchenScheduler(SolverOptions options) {
    Loader.loadNativeLibraries();
    this.solver = new ShiftSolver(options);
  }

  /**
   * Computes a weekly schedule.
   *
   * <p>Infeasible problems and time-outs come back as unsuccessful results, never as partial
   * schedules.
   *
   * @throws ScheduleInputException if the roster or the requirements are malformed
   */
  public ScheduleResult schedule(List<Worker> workers, StaffingRequirements requirements) {
    ShiftModel model = new ShiftModelBuilder(workers, requirements).build();
    logger.info(
        "Scheduling " + workers.size() + " workers for " + requirements.totalHours()
            + " required hours");
    SolveOutcome outcome = solver.solve(model);

    if (outcome.hasSolution()) {
      List<String> violations =
          new ScheduleValidator(workers, requirements).validate(outcome.getAssignment());
      for (String violation : violations) {
        logger.severe("Schedule violates a rule: " + violation);
      }
    }
    ScheduleResult result =
        ScheduleDecoder.decode(outcome.getStatus(), workers, outcome.getAssignment());
    if (result.isSuccess()) {
      logger.info(result.getMessage());
    } else {
      logger.warning(result.getMessage());
    }
    return result;
  }
}
