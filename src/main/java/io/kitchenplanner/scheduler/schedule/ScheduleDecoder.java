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

package io.kitchenplanner.scheduler.schedule;

import com.google.ortools.sat.CpSolverStatus;
import io.kitchenplanner.scheduler.domain.Horizon;
import io.kitchenplanner.scheduler.domain.Role;
import io.kitchenplanner.scheduler.domain.Worker;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Turns a solver status and assignment into a {@link ScheduleResult}.
 *
 * <p>Only OPTIMAL and FEASIBLE statuses produce a schedule. Every other status is a failure and
 * the assignment, if any, is ignored.
 */
public final class ScheduleDecoder {
  private static final Logger logger = Logger.getLogger(ScheduleDecoder.class.getName());

  public static final String OPTIMAL_MESSAGE = "Schedule generated successfully.";
  public static final String FEASIBLE_MESSAGE =
      "Schedule generated; the time limit was reached before optimality was proven.";
  public static final String INFEASIBLE_MESSAGE =
      "No solution found. Try adjusting employee constraints or staffing needs.";
  public static final String UNKNOWN_MESSAGE =
      "No schedule found within the time limit. Try a longer time limit or looser constraints.";
  public static final String MODEL_INVALID_MESSAGE = "The solver rejected the scheduling model.";

  /**
   * Interprets a solve.
   *
   * @param status status returned by the solver
   * @param workers the roster, in the order used to build the model
   * @param assignment assignment values; required when {@code status} is OPTIMAL or FEASIBLE
   */
  public static ScheduleResult decode(
      CpSolverStatus status, List<Worker> workers, AssignmentMatrix assignment) {
    switch (status) {
      case OPTIMAL:
        return new ScheduleResult(
            status, OPTIMAL_MESSAGE, decodeAssignment(workers, assignment), assignment);
      case FEASIBLE:
        return new ScheduleResult(
            status, FEASIBLE_MESSAGE, decodeAssignment(workers, assignment), assignment);
      case INFEASIBLE:
        return new ScheduleResult(status, INFEASIBLE_MESSAGE, null, null);
      case MODEL_INVALID:
        return new ScheduleResult(status, MODEL_INVALID_MESSAGE, null, null);
      default:
        return new ScheduleResult(status, UNKNOWN_MESSAGE, null, null);
    }
  }

  /** Rebuilds the per-day roles and the per-worker statistics from assignment values. */
  public static WeeklySchedule decodeAssignment(List<Worker> workers, AssignmentMatrix assignment) {
    if (assignment == null) {
      throw new IllegalArgumentException("a feasible status needs assignment values");
    }
    if (assignment.getNumWorkers() != workers.size()) {
      throw new IllegalArgumentException(
          "assignment has " + assignment.getNumWorkers() + " workers, roster has "
              + workers.size());
    }
    List<DaySchedule> days = new ArrayList<>();
    List<WorkerSummary> summaries = new ArrayList<>();
    for (int w = 0; w < workers.size(); ++w) {
      String name = workers.get(w).getName();
      int totalHours = 0;
      int workingDays = 0;
      int breaks = 0;
      int longestOffStreak = 0;
      int currentOffStreak = 0;
      for (int d = 0; d < Horizon.DAYS; ++d) {
        Role[] roles = new Role[Horizon.HOURS_PER_DAY];
        for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
          int slot = Horizon.slot(d, h);
          if (assignment.rolesAt(w, slot) > 1) {
            logger.warning(
                name + " holds several roles on " + Horizon.dayName(d) + " at "
                    + Horizon.hourLabel(h) + ", keeping the last one");
          }
          // Last role in enum order wins.
          for (Role role : Role.values()) {
            if (assignment.isAssigned(w, role, slot)) {
              roles[h] = role;
            }
          }
        }
        DaySchedule day = new DaySchedule(name, d, roles);
        days.add(day);

        int worked = day.workedHours();
        if (worked > 0) {
          workingDays++;
          totalHours += worked;
          if (day.hasBreak()) {
            breaks++;
          }
          currentOffStreak = 0;
        } else {
          currentOffStreak++;
          longestOffStreak = Math.max(longestOffStreak, currentOffStreak);
        }
      }
      double average =
          workingDays == 0 ? 0.0 : Math.round(100.0 * totalHours / workingDays) / 100.0;
      summaries.add(
          new WorkerSummary(name, totalHours, workingDays, breaks, longestOffStreak, average));
    }
    return new WeeklySchedule(days, summaries);
  }

  private ScheduleDecoder() {}
}
