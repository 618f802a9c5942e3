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
import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** The roles one worker holds at each hour of one day. */
public final class DaySchedule {
  public static final String EMPLOYEE_FIELD = "Employee";
  public static final String DAY_FIELD = "Day";

  private final String workerName;
  private final int day;
  // null where the worker is not scheduled.
  private final Role[] roles;

  DaySchedule(String workerName, int day, Role[] roles) {
    this.workerName = workerName;
    this.day = day;
    this.roles = roles;
  }

  public String getWorkerName() {
    return workerName;
  }

  /** Day index, 0 for Monday. */
  public int getDay() {
    return day;
  }

  public DayOfWeek getDayOfWeek() {
    return Horizon.dayOfWeek(day);
  }

  /** Role held at an hour index, or null. */
  public Role roleAt(int hour) {
    return roles[hour];
  }

  /** Label of the role held at an hour index, or the empty string. */
  public String roleLabelAt(int hour) {
    return roles[hour] == null ? "" : roles[hour].getLabel();
  }

  public int workedHours() {
    int hours = 0;
    for (Role role : roles) {
      if (role != null) {
        hours++;
      }
    }
    return hours;
  }

  public boolean isOff() {
    return workedHours() == 0;
  }

  /** Number of maximal runs of consecutive worked hours. */
  public int blockCount() {
    int blocks = 0;
    boolean previous = false;
    for (Role role : roles) {
      boolean current = role != null;
      if (current && !previous) {
        blocks++;
      }
      previous = current;
    }
    return blocks;
  }

  /** True if the worked hours are fewer than the span from the first to the last worked hour. */
  public boolean hasBreak() {
    int first = -1;
    int last = -1;
    for (int h = 0; h < roles.length; ++h) {
      if (roles[h] != null) {
        if (first < 0) {
          first = h;
        }
        last = h;
      }
    }
    return first >= 0 && workedHours() < last - first + 1;
  }

  /** One record of the weekly schedule: employee, day, then one field per hour label. */
  public Map<String, String> toRecord() {
    Map<String, String> record = new LinkedHashMap<>();
    record.put(EMPLOYEE_FIELD, workerName);
    record.put(DAY_FIELD, Horizon.dayName(day));
    for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
      record.put(Horizon.hourLabel(h), roleLabelAt(h));
    }
    return Collections.unmodifiableMap(record);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof DaySchedule)) {
      return false;
    }
    DaySchedule other = (DaySchedule) o;
    return day == other.day
        && workerName.equals(other.workerName)
        && Arrays.equals(roles, other.roles);
  }

  @Override
  public int hashCode() {
    return (workerName.hashCode() * 31 + day) * 31 + Arrays.hashCode(roles);
  }

  @Override
  public String toString() {
    return toRecord().toString();
  }
}
