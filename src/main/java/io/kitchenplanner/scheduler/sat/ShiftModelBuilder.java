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

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.Literal;
import io.kitchenplanner.scheduler.domain.Horizon;
import io.kitchenplanner.scheduler.domain.Role;
import io.kitchenplanner.scheduler.domain.ScheduleInputException;
import io.kitchenplanner.scheduler.domain.StaffingRequirements;
import io.kitchenplanner.scheduler.domain.Worker;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the CP-SAT model of a weekly kitchen schedule.
 *
 * <p>The decision variables are one boolean per (worker, role, slot). Day-off and block-start
 * booleans are derived from them. The constraint groups are added in this order:
 *
 * <ol>
 *   <li>at most one role per worker and hour;
 *   <li>no role change between two adjacent hours of a day;
 *   <li>a day is off iff nothing is worked, otherwise at least 3 hours are worked;
 *   <li>at most 10 hours per day;
 *   <li>every work block lasts at least 3 hours, at most {@code maxBreaks + 1} blocks per day;
 *   <li>two consecutive days off in the week;
 *   <li>weekly hours cap;
 *   <li>roles restricted to the worker's skills;
 *   <li>exact coverage of the staffing requirements.
 * </ol>
 *
 * <p>The objective minimizes the number of assigned hours.
 */
public final class ShiftModelBuilder {
  private static final Logger logger = Logger.getLogger(ShiftModelBuilder.class.getName());

  private final List<Worker> workers;
  private final StaffingRequirements requirements;

  private CpModel model;
  private BoolVar[][][] shifts;
  private BoolVar[][] dayOff;
  private BoolVar[][][] blockStarts;

  /**
   * @throws ScheduleInputException if the roster is empty, has duplicate names, or the
   *     requirements are missing
   */
  public ShiftModelBuilder(List<Worker> workers, StaffingRequirements requirements) {
    Worker.checkRoster(workers);
    if (requirements == null) {
      throw new ScheduleInputException("ShiftModelBuilder", "staffing requirements are missing");
    }
    this.workers = new ArrayList<>(workers);
    this.requirements = requirements;
  }

  /** Creates a fresh model. Each call returns new, independent variables. */
  public ShiftModel build() {
    model = new CpModel();
    final int numWorkers = workers.size();

    shifts = new BoolVar[numWorkers][Role.COUNT][Horizon.SLOTS];
    for (int w = 0; w < numWorkers; ++w) {
      for (Role role : Role.values()) {
        for (int t = 0; t < Horizon.SLOTS; ++t) {
          shifts[w][role.ordinal()][t] =
              model.newBoolVar("w" + w + "_" + role.getLabel() + "_" + t);
        }
      }
    }
    dayOff = new BoolVar[numWorkers][Horizon.DAYS];
    blockStarts = new BoolVar[numWorkers][Horizon.DAYS][Horizon.HOURS_PER_DAY];

    addSingleRolePerHour();
    addNoRoleSwitch();
    addDayOffLinks();
    addDailyCap();
    addBlockStarts();
    addTwoConsecutiveDaysOff();
    addWeeklyCap();
    addSkills();
    addCoverage();
    model.minimize(LinearExpr.sum(allShifts()));

    if (logger.isLoggable(Level.FINE)) {
      logger.fine(model.modelStats());
    }
    ShiftModel shiftModel =
        new ShiftModel(model, workers, requirements, shifts, dayOff, blockStarts);
    model = null;
    shifts = null;
    dayOff = null;
    blockStarts = null;
    return shiftModel;
  }

  private void addSingleRolePerHour() {
    for (int w = 0; w < workers.size(); ++w) {
      for (int t = 0; t < Horizon.SLOTS; ++t) {
        model.addAtMostOne(rolesAt(w, t));
      }
    }
  }

  private void addNoRoleSwitch() {
    for (int w = 0; w < workers.size(); ++w) {
      for (int d = 0; d < Horizon.DAYS; ++d) {
        for (int h = 0; h < Horizon.HOURS_PER_DAY - 1; ++h) {
          int t = Horizon.slot(d, h);
          int next = Horizon.slot(d, h + 1);
          for (Role r1 : Role.values()) {
            for (Role r2 : Role.values()) {
              if (r1 != r2) {
                model.addLessOrEqual(
                    LinearExpr.newBuilder()
                        .add(shifts[w][r1.ordinal()][t])
                        .add(shifts[w][r2.ordinal()][next]),
                    1);
              }
            }
          }
        }
      }
    }
  }

  private void addDayOffLinks() {
    for (int w = 0; w < workers.size(); ++w) {
      for (int d = 0; d < Horizon.DAYS; ++d) {
        BoolVar off = model.newBoolVar("off_" + w + "_" + d);
        LinearExpr total = hoursOn(w, d);
        model.addEquality(total, 0).onlyEnforceIf(off);
        model.addGreaterOrEqual(total, Horizon.MIN_BLOCK_HOURS).onlyEnforceIf(off.not());
        dayOff[w][d] = off;
      }
    }
  }

  private void addDailyCap() {
    for (int w = 0; w < workers.size(); ++w) {
      for (int d = 0; d < Horizon.DAYS; ++d) {
        model.addLessOrEqual(hoursOn(w, d), Horizon.MAX_DAILY_HOURS);
      }
    }
  }

  private void addBlockStarts() {
    for (int w = 0; w < workers.size(); ++w) {
      int maxBlocks = workers.get(w).getMaxBlocksPerDay();
      for (int d = 0; d < Horizon.DAYS; ++d) {
        BoolVar[] starts = new BoolVar[Horizon.HOURS_PER_DAY];
        for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
          LinearExpr current = workedAt(w, Horizon.slot(d, h));
          BoolVar start = model.newBoolVar("start_" + w + "_" + d + "_" + h);

          if (h == 0) {
            // The first hour of the day starts a block whenever it is worked.
            model.addEquality(current, 1).onlyEnforceIf(start);
            model.addDifferent(current, 1).onlyEnforceIf(start.not());
          } else {
            // A block starts on a transition from not working to working.
            LinearExpr change =
                LinearExpr.newBuilder()
                    .add(current)
                    .addTerm(workedAt(w, Horizon.slot(d, h - 1)), -1)
                    .build();
            model.addEquality(change, 1).onlyEnforceIf(start);
            model.addDifferent(change, 1).onlyEnforceIf(start.not());
          }

          if (h <= Horizon.HOURS_PER_DAY - Horizon.MIN_BLOCK_HOURS) {
            LinearExprBuilder window = LinearExpr.newBuilder();
            for (int hh = h; hh < h + Horizon.MIN_BLOCK_HOURS; ++hh) {
              window.add(workedAt(w, Horizon.slot(d, hh)));
            }
            model.addGreaterOrEqual(window, Horizon.MIN_BLOCK_HOURS).onlyEnforceIf(start);
          } else {
            // Too late in the day for a full block.
            model.addEquality(start, 0);
          }
          starts[h] = start;
        }
        // N blocks mean N - 1 breaks.
        model.addLessOrEqual(LinearExpr.sum(starts), maxBlocks);
        blockStarts[w][d] = starts;
      }
    }
  }

  private void addTwoConsecutiveDaysOff() {
    for (int w = 0; w < workers.size(); ++w) {
      List<Literal> pairs = new ArrayList<>();
      for (int d = 0; d < Horizon.DAYS - 1; ++d) {
        BoolVar pair = model.newBoolVar("2off_" + w + "_" + d);
        model.addBoolAnd(new Literal[] {dayOff[w][d], dayOff[w][d + 1]}).onlyEnforceIf(pair);
        model
            .addBoolOr(new Literal[] {dayOff[w][d].not(), dayOff[w][d + 1].not()})
            .onlyEnforceIf(pair.not());
        pairs.add(pair);
      }
      model.addAtLeastOne(pairs);
    }
  }

  private void addWeeklyCap() {
    for (int w = 0; w < workers.size(); ++w) {
      LinearExprBuilder total = LinearExpr.newBuilder();
      for (Role role : Role.values()) {
        total.addSum(shifts[w][role.ordinal()]);
      }
      model.addLessOrEqual(total, workers.get(w).getMaxWeeklyHours());
    }
  }

  private void addSkills() {
    for (int w = 0; w < workers.size(); ++w) {
      Worker worker = workers.get(w);
      for (Role role : Role.values()) {
        if (!worker.isEligible(role)) {
          for (int t = 0; t < Horizon.SLOTS; ++t) {
            model.addEquality(shifts[w][role.ordinal()][t], 0);
          }
        }
      }
    }
  }

  private void addCoverage() {
    for (int d = 0; d < Horizon.DAYS; ++d) {
      for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
        int t = Horizon.slot(d, h);
        for (Role role : Role.values()) {
          BoolVar[] assigned = new BoolVar[workers.size()];
          for (int w = 0; w < workers.size(); ++w) {
            assigned[w] = shifts[w][role.ordinal()][t];
          }
          model.addEquality(LinearExpr.sum(assigned), requirements.get(role, d, h));
        }
      }
    }
  }

  private BoolVar[] rolesAt(int w, int t) {
    BoolVar[] roles = new BoolVar[Role.COUNT];
    for (Role role : Role.values()) {
      roles[role.ordinal()] = shifts[w][role.ordinal()][t];
    }
    return roles;
  }

  // 1 if the worker holds some role at slot t, given at most one role per slot.
  private LinearExpr workedAt(int w, int t) {
    return LinearExpr.sum(rolesAt(w, t));
  }

  private LinearExpr hoursOn(int w, int d) {
    LinearExprBuilder total = LinearExpr.newBuilder();
    for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
      total.addSum(rolesAt(w, Horizon.slot(d, h)));
    }
    return total.build();
  }

  private BoolVar[] allShifts() {
    List<BoolVar> all = new ArrayList<>();
    for (BoolVar[][] perWorker : shifts) {
      for (BoolVar[] perRole : perWorker) {
        for (BoolVar shift : perRole) {
          all.add(shift);
        }
      }
    }
    return all.toArray(new BoolVar[0]);
  }
}
