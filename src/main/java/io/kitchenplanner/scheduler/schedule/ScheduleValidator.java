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

import io.kitchenplanner.scheduler.domain.Horizon;
import io.kitchenplanner.scheduler.domain.Role;
import io.kitchenplanner.scheduler.domain.StaffingRequirements;
import io.kitchenplanner.scheduler.domain.Worker;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks an assignment against the labor rules and the staffing requirements, independently of
 * the solver. An empty result means the assignment is acceptable.
 */
public final class ScheduleValidator {
  private final List<Worker> workers;
  private final StaffingRequirements requirements;

  public ScheduleValidator(List<Worker> workers, StaffingRequirements requirements) {
    this.workers = workers;
    this.requirements = requirements;
  }

  /** Returns one message per violated rule occurrence. */
  public List<String> validate(AssignmentMatrix assignment) {
    List<String> violations = new ArrayList<>();
    for (int w = 0; w < workers.size(); ++w) {
      checkWorker(w, assignment, violations);
    }
    checkCoverage(assignment, violations);
    return violations;
  }

  private void checkWorker(int w, AssignmentMatrix assignment, List<String> violations) {
    Worker worker = workers.get(w);
    String name = worker.getName();
    int weeklyHours = 0;
    boolean[] off = new boolean[Horizon.DAYS];

    for (int d = 0; d < Horizon.DAYS; ++d) {
      String day = Horizon.dayName(d);
      int dayHours = 0;
      int blocks = 0;
      int blockLength = 0;
      Role previousRole = null;
      for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
        int slot = Horizon.slot(d, h);
        if (assignment.rolesAt(w, slot) > 1) {
          violations.add(name + " holds several roles on " + day + " at " + Horizon.hourLabel(h));
        }
        Role role = null;
        for (Role r : Role.values()) {
          if (assignment.isAssigned(w, r, slot)) {
            role = r;
            if (!worker.isEligible(r)) {
              violations.add(
                  name + " is not eligible for " + r.getLabel() + " on " + day + " at "
                      + Horizon.hourLabel(h));
            }
          }
        }
        if (role != null) {
          dayHours++;
          if (previousRole == null) {
            blocks++;
            blockLength = 0;
          } else if (previousRole != role) {
            violations.add(
                name + " switches from " + previousRole.getLabel() + " to " + role.getLabel()
                    + " on " + day + " at " + Horizon.hourLabel(h));
          }
          blockLength++;
        } else if (previousRole != null) {
          checkBlockLength(name, day, blockLength, violations);
        }
        previousRole = role;
      }
      if (previousRole != null) {
        checkBlockLength(name, day, blockLength, violations);
      }

      off[d] = dayHours == 0;
      if (!off[d] && dayHours < Horizon.MIN_BLOCK_HOURS) {
        violations.add(name + " works only " + dayHours + "h on " + day);
      }
      if (dayHours > Horizon.MAX_DAILY_HOURS) {
        violations.add(name + " works " + dayHours + "h on " + day);
      }
      if (blocks > worker.getMaxBlocksPerDay()) {
        violations.add(
            name + " has " + blocks + " work blocks on " + day + ", at most "
                + worker.getMaxBlocksPerDay() + " allowed");
      }
      weeklyHours += dayHours;
    }

    boolean twoDaysOff = false;
    for (int d = 0; d + 1 < Horizon.DAYS; ++d) {
      twoDaysOff |= off[d] && off[d + 1];
    }
    if (!twoDaysOff) {
      violations.add(name + " has no two consecutive days off");
    }
    if (weeklyHours > worker.getMaxWeeklyHours()) {
      violations.add(
          name + " works " + weeklyHours + "h, above the cap of " + worker.getMaxWeeklyHours()
              + "h");
    }
  }

  private static void checkBlockLength(
      String name, String day, int blockLength, List<String> violations) {
    if (blockLength < Horizon.MIN_BLOCK_HOURS) {
      violations.add(name + " has a " + blockLength + "h work block on " + day);
    }
  }

  private void checkCoverage(AssignmentMatrix assignment, List<String> violations) {
    for (Role role : Role.values()) {
      for (int slot = 0; slot < Horizon.SLOTS; ++slot) {
        int assigned = assignment.headcount(role, slot);
        int required = requirements.get(role, slot);
        if (assigned != required) {
          violations.add(
              role.getLabel() + " on " + Horizon.dayName(Horizon.dayOf(slot)) + " at "
                  + Horizon.hourLabel(Horizon.hourOf(slot)) + ": " + assigned + " assigned, "
                  + required + " required");
        }
      }
    }
  }
}
