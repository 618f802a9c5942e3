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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** Weekly statistics of one worker. */
public final class WorkerSummary {
  private final String workerName;
  private final int totalHours;
  private final int workingDays;
  private final int breaks;
  private final int longestOffStreak;
  private final double averageDailyHours;

  WorkerSummary(
      String workerName,
      int totalHours,
      int workingDays,
      int breaks,
      int longestOffStreak,
      double averageDailyHours) {
    this.workerName = workerName;
    this.totalHours = totalHours;
    this.workingDays = workingDays;
    this.breaks = breaks;
    this.longestOffStreak = longestOffStreak;
    this.averageDailyHours = averageDailyHours;
  }

  public String getWorkerName() {
    return workerName;
  }

  public int getTotalHours() {
    return totalHours;
  }

  public int getWorkingDays() {
    return workingDays;
  }

  /** Number of days with a gap between the first and the last worked hour. */
  public int getBreaks() {
    return breaks;
  }

  /** Longest run of consecutive days off within the week. */
  public int getLongestOffStreak() {
    return longestOffStreak;
  }

  /** Hours per working day, rounded to 2 decimals; 0 for a worker who never works. */
  public double getAverageDailyHours() {
    return averageDailyHours;
  }

  public Map<String, Object> toRecord() {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put(DaySchedule.EMPLOYEE_FIELD, workerName);
    record.put("Hours/week", totalHours);
    record.put("Working days", workingDays);
    record.put("Breaks/week", breaks);
    record.put("Max consecutive days off", longestOffStreak);
    record.put("Average hours/day", averageDailyHours);
    return Collections.unmodifiableMap(record);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof WorkerSummary)) {
      return false;
    }
    WorkerSummary other = (WorkerSummary) o;
    return totalHours == other.totalHours
        && workingDays == other.workingDays
        && breaks == other.breaks
        && longestOffStreak == other.longestOffStreak
        && Double.compare(averageDailyHours, other.averageDailyHours) == 0
        && workerName.equals(other.workerName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        workerName, totalHours, workingDays, breaks, longestOffStreak, averageDailyHours);
  }

  @Override
  public String toString() {
    return toRecord().toString();
  }
}
