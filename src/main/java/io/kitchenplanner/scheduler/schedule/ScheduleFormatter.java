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

/** Renders a {@link WeeklySchedule} as fixed-width text tables. */
public final class ScheduleFormatter {
  private static final String NAME_FORMAT = "%-12s";
  private static final String DAY_FORMAT = "%-10s";
  private static final String CELL_FORMAT = "%-11s";

  /** One line per (worker, day), one column per hour. */
  public static String formatSchedule(WeeklySchedule schedule) {
    StringBuilder sb = new StringBuilder();
    sb.append(String.format(NAME_FORMAT, DaySchedule.EMPLOYEE_FIELD));
    sb.append(String.format(DAY_FORMAT, DaySchedule.DAY_FIELD));
    for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
      sb.append(String.format(CELL_FORMAT, Horizon.hourLabel(h)));
    }
    sb.append('\n');
    for (DaySchedule day : schedule.getDays()) {
      sb.append(String.format(NAME_FORMAT, day.getWorkerName()));
      sb.append(String.format(DAY_FORMAT, Horizon.dayName(day.getDay())));
      for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
        sb.append(String.format(CELL_FORMAT, day.isOff() ? "" : cell(day, h)));
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static String cell(DaySchedule day, int hour) {
    String label = day.roleLabelAt(hour);
    return label.isEmpty() ? "-" : label;
  }

  /** One line per worker with the weekly statistics. */
  public static String formatSummaries(WeeklySchedule schedule) {
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "%-12s%8s%8s%8s%10s%10s%n", DaySchedule.EMPLOYEE_FIELD, "Hours", "Days", "Breaks",
            "MaxOff", "Avg/day"));
    for (WorkerSummary summary : schedule.getSummaries()) {
      sb.append(
          String.format(
              "%-12s%8d%8d%8d%10d%10.2f%n",
              summary.getWorkerName(),
              summary.getTotalHours(),
              summary.getWorkingDays(),
              summary.getBreaks(),
              summary.getLongestOffStreak(),
              summary.getAverageDailyHours()));
    }
    return sb.toString();
  }

  private ScheduleFormatter() {}
}
