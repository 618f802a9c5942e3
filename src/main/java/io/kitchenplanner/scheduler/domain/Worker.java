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

package io.kitchenplanner.scheduler.domain;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/** A member of the kitchen team, with the roles they may take and their weekly limits. */
public final class Worker {
  private static final Logger logger = Logger.getLogger(Worker.class.getName());

  private final String name;
  private final Set<Role> eligibleRoles;
  private final int maxWeeklyHours;
  private final int maxBreaks;

  private Worker(String name, Set<Role> eligibleRoles, int maxWeeklyHours, int maxBreaks) {
    this.name = name;
    this.eligibleRoles = Collections.unmodifiableSet(eligibleRoles);
    this.maxWeeklyHours = maxWeeklyHours;
    this.maxBreaks = maxBreaks;
  }

  /**
   * Creates a worker.
   *
   * @throws ScheduleInputException if the name is blank or a limit is negative
   */
  public static Worker of(
      String name, Collection<Role> eligibleRoles, int maxWeeklyHours, int maxBreaks) {
    if (name == null || name.trim().isEmpty()) {
      throw new ScheduleInputException("Worker.of", "worker name is missing");
    }
    if (eligibleRoles == null) {
      throw new ScheduleInputException("Worker.of", "eligible roles of '" + name + "' are missing");
    }
    if (maxWeeklyHours < 0) {
      throw new ScheduleInputException(
          "Worker.of", "max weekly hours of '" + name + "' is negative: " + maxWeeklyHours);
    }
    if (maxBreaks < 0) {
      throw new ScheduleInputException(
          "Worker.of", "max breaks of '" + name + "' is negative: " + maxBreaks);
    }
    EnumSet<Role> roles = EnumSet.noneOf(Role.class);
    for (Role role : eligibleRoles) {
      if (role == null) {
        throw new ScheduleInputException("Worker.of", "'" + name + "' has an empty role entry");
      }
      roles.add(role);
    }
    return new Worker(name.trim(), roles, maxWeeklyHours, maxBreaks);
  }

  /**
   * Creates a worker from one row of the roster table, where each role has a skill checkbox.
   *
   * <p>A role whose flag is absent or null is treated as ineligible; this is reported on the log.
   * Missing numeric fields are errors.
   */
  public static Worker fromSkillFlags(
      String name, Map<Role, Boolean> skillFlags, Integer maxWeeklyHours, Integer maxBreaks) {
    if (maxWeeklyHours == null) {
      throw new ScheduleInputException(
          "Worker.fromSkillFlags", "max weekly hours of '" + name + "' is missing");
    }
    if (maxBreaks == null) {
      throw new ScheduleInputException(
          "Worker.fromSkillFlags", "max breaks of '" + name + "' is missing");
    }
    EnumSet<Role> roles = EnumSet.noneOf(Role.class);
    for (Role role : Role.values()) {
      Boolean flag = skillFlags == null ? null : skillFlags.get(role);
      if (flag == null) {
        logger.warning(
            "Skill " + role.getLabel() + " unspecified for worker '" + name
                + "', treating as ineligible");
      } else if (flag) {
        roles.add(role);
      }
    }
    return of(name, roles, maxWeeklyHours, maxBreaks);
  }

  /**
   * Checks a whole roster: it must not be empty and names must be unique.
   *
   * @throws ScheduleInputException otherwise
   */
  public static void checkRoster(List<Worker> workers) {
    if (workers == null || workers.isEmpty()) {
      throw new ScheduleInputException("Worker.checkRoster", "the roster is empty");
    }
    Set<String> names = new HashSet<>();
    for (Worker worker : workers) {
      if (worker == null) {
        throw new ScheduleInputException("Worker.checkRoster", "the roster has an empty row");
      }
      if (!names.add(worker.getName())) {
        throw new ScheduleInputException(
            "Worker.checkRoster", "duplicate worker name '" + worker.getName() + "'");
      }
    }
  }

  public String getName() {
    return name;
  }

  public Set<Role> getEligibleRoles() {
    return eligibleRoles;
  }

  public boolean isEligible(Role role) {
    return eligibleRoles.contains(role);
  }

  public int getMaxWeeklyHours() {
    return maxWeeklyHours;
  }

  public int getMaxBreaks() {
    return maxBreaks;
  }

  /** Work blocks allowed in one day: one more than the breaks, bounded by the hours of a day. */
  public int getMaxBlocksPerDay() {
    return Math.min(maxBreaks, Horizon.HOURS_PER_DAY) + 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Worker)) {
      return false;
    }
    Worker other = (Worker) o;
    return maxWeeklyHours == other.maxWeeklyHours
        && maxBreaks == other.maxBreaks
        && name.equals(other.name)
        && eligibleRoles.equals(other.eligibleRoles);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, eligibleRoles, maxWeeklyHours, maxBreaks);
  }

  @Override
  public String toString() {
    return name + eligibleRoles + "(max " + maxWeeklyHours + "h, " + maxBreaks + " breaks)";
  }
}
