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

package io.kitchenplanner.scheduler.sat;

import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverSolutionCallback;
import com.google.ortools.sat.CpSolverStatus;
import io.kitchenplanner.scheduler.schedule.AssignmentMatrix;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Solves a {@link ShiftModel} with CP-SAT under a wall-clock limit.
 *
 * <p>When the limit is hit, the best status reached is returned: FEASIBLE if a schedule was found
 * without an optimality proof, UNKNOWN if none was found. A new solver is created for every call,
 * so one instance can serve concurrent requests as long as each passes its own model.
 */
public final class ShiftSolver {
  private static final Logger logger = Logger.getLogger(ShiftSolver.class.getName());

  private final SolverOptions options;

  public ShiftSolver(SolverOptions options) {
    this.options = options;
  }

  public SolverOptions getOptions() {
    return options;
  }

  /** Counts and logs improving solutions. */
  static class SolutionLogger extends CpSolverSolutionCallback {
    @Override
    public void onSolutionCallback() {
      solutionCount++;
      logger.fine(
          String.format(
              "Solution #%d: %.0f assigned hours at %.2fs", solutionCount, objectiveValue(),
              wallTime()));
    }

    public int getSolutionCount() {
      return solutionCount;
    }

    private int solutionCount;
  }

  public SolveOutcome solve(ShiftModel shiftModel) {
    final CpSolver solver = new CpSolver();
    options.applyTo(solver.getParameters());
    if (options.isLogSearchProgress()) {
      solver.setLogCallback(line -> logger.info(line));
    }

    final SolutionLogger cb = new SolutionLogger();
    final CpSolverStatus status = solver.solve(shiftModel.getModel(), cb);

    AssignmentMatrix assignment = null;
    if (status == CpSolverStatus.OPTIMAL || status == CpSolverStatus.FEASIBLE) {
      assignment = shiftModel.readAssignment(solver::booleanValue);
    } else if (status == CpSolverStatus.MODEL_INVALID) {
      logger.severe("Invalid model: " + shiftModel.getModel().validate());
    }
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(solver.responseStats());
    }
    SolveOutcome outcome =
        new SolveOutcome(
            status,
            assignment,
            solver.objectiveValue(),
            solver.wallTime(),
            cb.getSolutionCount(),
            solver.getSolutionInfo());
    logger.info("Solve finished: " + outcome);
    return outcome;
  }
}
