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

import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Number of workers required per role at every hour of the week. Immutable.
 *
 * <p>Coverage is exact: a solution assigns precisely this many workers to the role at that hour.
 */
public final class StaffingRequirements {
  // required[role][slot]
  private final int[][] required;

  private StaffingRequirements(int[][] required) {
    this.required = required;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Reads the table form: for each role, a mapping from day name ("Monday" ... "Sunday", any case)
   * to the 14 hourly headcounts from 10:00 to 23:00.
   *
   * @throws ScheduleInputException if a role or day is missing, a day name is unknown, or a
   *     sequence has a missing, negative or extra value
   */
  public static StaffingRequirements fromTable(Map<Role, Map<String, List<Integer>>> table) {
    if (table == null) {
      throw new ScheduleInputException("StaffingRequirements.fromTable", "table is missing");
    }
    Builder builder = newBuilder();
    for (Map.Entry<Role, Map<String, List<Integer>>> roleEntry : table.entrySet()) {
      Role role = roleEntry.getKey();
      if (role == null || roleEntry.getValue() == null) {
        throw new ScheduleInputException(
            "StaffingRequirements.fromTable", "incomplete entry for role " + role);
      }
      Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
      for (Map.Entry<String, List<Integer>> dayEntry : roleEntry.getValue().entrySet()) {
        DayOfWeek day = parseDay(dayEntry.getKey());
        if (!days.add(day)) {
          throw new ScheduleInputException(
              "StaffingRequirements.fromTable",
              "day '" + dayEntry.getKey() + "' given twice for " + role.getLabel());
        }
        List<Integer> hourly = dayEntry.getValue();
        if (hourly == null) {
          throw new ScheduleInputException(
              "StaffingRequirements.fromTable",
              "no hourly values for " + role.getLabel() + " on " + day);
        }
        int[] values = new int[hourly.size()];
        for (int h = 0; h < values.length; ++h) {
          Integer value = hourly.get(h);
          if (value == null) {
            throw new ScheduleInputException(
                "StaffingRequirements.fromTable",
                "missing value for " + role.getLabel() + " on " + day + " at "
                    + (h < Horizon.HOURS_PER_DAY ? Horizon.hourLabel(h) : "index " + h));
          }
          values[h] = value;
        }
        builder.set(role, day, values);
      }
    }
    return builder.build();
  }

  private static DayOfWeek parseDay(String dayName) {
    if (dayName == null) {
      throw new ScheduleInputException("StaffingRequirements.fromTable", "day name is missing");
    }
    try {
      return DayOfWeek.valueOf(dayName.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ScheduleInputException(
          "StaffingRequirements.fromTable", "unknown day name '" + dayName + "'");
    }
  }

  /** Workers required for {@code role} at day index {@code day} and hour index {@code hour}. */
  public int get(Role role, int day, int hour) {
    return required[role.ordinal()][Horizon.slot(day, hour)];
  }

  public int get(Role role, int slot) {
    return required[role.ordinal()][slot];
  }

  /** Sum of required worker-hours over the whole week, all roles included. */
  public int totalHours() {
    int total = 0;
    for (int[] perRole : required) {
      for (int value : perRole) {
        total += value;
      }
    }
    return total;
  }

  /** Sum of required hours for one role over the week. */
  public int totalHours(Role role) {
    int total = 0;
    for (int value : required[role.ordinal()]) {
      total += value;
    }
    return total;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof StaffingRequirements
        && Arrays.deepEquals(required, ((StaffingRequirements) o).required);
  }

  @Override
  public int hashCode() {
    return Arrays.deepHashCode(required);
  }

  /** Collects hourly headcounts; every (role, day) must be set before {@link #build()}. */
  public static final class Builder {
    private final int[][] required = new int[Role.COUNT][Horizon.SLOTS];
    private final boolean[][] seen = new boolean[Role.COUNT][Horizon.DAYS];

    private Builder() {}

    /** Sets the 14 hourly headcounts of a role on a day. */
    public Builder set(Role role, DayOfWeek day, int... hourly) {
      if (role == null || day == null) {
        throw new ScheduleInputException("StaffingRequirements.set", "role and day are required");
      }
      if (hourly == null || hourly.length != Horizon.HOURS_PER_DAY) {
        throw new ScheduleInputException(
            "StaffingRequirements.set",
            role.getLabel() + " on " + day + " needs " + Horizon.HOURS_PER_DAY
                + " hourly values, got " + (hourly == null ? 0 : hourly.length));
      }
      int d = day.getValue() - 1;
      for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
        if (hourly[h] < 0) {
          throw new ScheduleInputException(
              "StaffingRequirements.set",
              "negative requirement " + hourly[h] + " for " + role.getLabel() + " on " + day
                  + " at " + Horizon.hourLabel(h));
        }
        required[role.ordinal()][Horizon.slot(d, h)] = hourly[h];
      }
      seen[role.ordinal()][d] = true;
      return this;
    }

    /** Sets the same hourly headcounts of a role on every day of the week. */
    public Builder setEveryDay(Role role, int... hourly) {
      for (DayOfWeek day : DayOfWeek.values()) {
        set(role, day, hourly);
      }
      return this;
    }

    /** Sets a single (role, day, hour) headcount, marking the day as provided. */
    public Builder setHour(Role role, DayOfWeek day, int hour, int count) {
      if (role == null || day == null) {
        throw new ScheduleInputException(
            "StaffingRequirements.setHour", "role and day are required");
      }
      if (hour < 0 || hour >= Horizon.HOURS_PER_DAY) {
        throw new ScheduleInputException(
            "StaffingRequirements.setHour",
            "hour index " + hour + " is outside 0.." + (Horizon.HOURS_PER_DAY - 1));
      }
      int d = day.getValue() - 1;
      int[] hourly = new int[Horizon.HOURS_PER_DAY];
      for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
        hourly[h] = required[role.ordinal()][Horizon.slot(d, h)];
      }
      hourly[hour] = count;
      return set(role, day, hourly);
    }

    /** Sets every role to zero on every day; later calls override individual entries. */
    public Builder clear() {
      for (Role role : Role.values()) {
        setEveryDay(role, new int[Horizon.HOURS_PER_DAY]);
      }
      return this;
    }

    public StaffingRequirements build() {
      for (Role role : Role.values()) {
        for (int d = 0; d < Horizon.DAYS; ++d) {
          if (!seen[role.ordinal()][d]) {
            throw new ScheduleInputException(
                "StaffingRequirements.build",
                "no requirement for " + role.getLabel() + " on " + Horizon.dayName(d));
          }
        }
      }
      int[][] copy = new int[Role.COUNT][];
      for (int r = 0; r < Role.COUNT; ++r) {
        copy[r] = required[r].clone();
      }
      return new StaffingRequirements(copy);
    }
  }
}
