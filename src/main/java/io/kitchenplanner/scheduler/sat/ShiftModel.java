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
import com.google.ortools.sat.Literal;
import io.kitchenplanner.scheduler.domain.Horizon;
import io.kitchenplanner.scheduler.domain.Role;
import io.kitchenplanner.scheduler.domain.StaffingRequirements;
import io.kitchenplanner.scheduler.domain.Worker;
import io.kitchenplanner.scheduler.schedule.AssignmentMatrix;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * A CP-SAT model of one scheduling problem, together with its variables.
 *
 * <p>Instances are built by {@link ShiftModelBuilder} and are meant for a single solve.
 */
public final class ShiftModel {
  private final CpModel model;
  private final List<Worker> workers;
  private final StaffingRequirements requirements;
  // shifts[w][r][t]: worker w performs role r at slot t.
  private final BoolVar[][][] shifts;
  // dayOff[w][d]: worker w does not work on day d.
  private final BoolVar[][] dayOff;
  // blockStarts[w][d][h]: a work block of worker w starts at hour h of day d.
  private final BoolVar[][][] blockStarts;

  ShiftModel(
      CpModel model,
      List<Worker> workers,
      StaffingRequirements requirements,
      BoolVar[][][] shifts,
      BoolVar[][] dayOff,
      BoolVar[][][] blockStarts) {
    this.model = model;
    this.workers = Collections.unmodifiableList(workers);
    this.requirements = requirements;
    this.shifts = shifts;
    this.dayOff = dayOff;
    this.blockStarts = blockStarts;
  }

  public CpModel getModel() {
    return model;
  }

  public List<Worker> getWorkers() {
    return workers;
  }

  public StaffingRequirements getRequirements() {
    return requirements;
  }

  public BoolVar getShift(int worker, Role role, int slot) {
    return shifts[worker][role.ordinal()][slot];
  }

  public BoolVar getDayOff(int worker, int day) {
    return dayOff[worker][day];
  }

  public BoolVar getBlockStart(int worker, int day, int hour) {
    return blockStarts[worker][day][hour];
  }

  /**
   * Reads the assignment variables of a solution.
   *
   * @param value gives the value of a literal, e.g. {@code solver::booleanValue}
   */
  public AssignmentMatrix readAssignment(Predicate<Literal> value) {
    AssignmentMatrix assignment = new AssignmentMatrix(workers.size());
    for (int w = 0; w < workers.size(); ++w) {
      for (Role role : Role.values()) {
        for (int t = 0; t < Horizon.SLOTS; ++t) {
          if (value.test(shifts[w][role.ordinal()][t])) {
            assignment.set(w, role, t, true);
          }
        }
      }
    }
    return assignment;
  }
}
