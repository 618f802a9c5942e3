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

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * A decoded week: one {@link DaySchedule} per (worker, day), in roster then day order, and one
 * {@link WorkerSummary} per worker.
 */
public final class WeeklySchedule {
  private final List<DaySchedule> days;
  private final List<WorkerSummary> summaries;

  WeeklySchedule(List<DaySchedule> days, List<WorkerSummary> summaries) {
    this.days = Collections.unmodifiableList(days);
    this.summaries = Collections.unmodifiableList(summaries);
  }

  public List<DaySchedule> getDays() {
    return days;
  }

  public List<WorkerSummary> getSummaries() {
    return summaries;
  }

  /** Returns the schedule of a worker on a day, or null if the worker is unknown. */
  public DaySchedule getDay(String workerName, DayOfWeek dayOfWeek) {
    for (DaySchedule day : days) {
      if (day.getWorkerName().equals(workerName) && day.getDayOfWeek() == dayOfWeek) {
        return day;
      }
    }
    return null;
  }

  /** Returns the summary of a worker, or null if the worker is unknown. */
  public WorkerSummary getSummary(String workerName) {
    for (WorkerSummary summary : summaries) {
      if (summary.getWorkerName().equals(workerName)) {
        return summary;
      }
    }
    return null;
  }

  /** The schedule as flat records, as consumed by a table view. */
  public List<Map<String, String>> toRecords() {
    List<Map<String, String>> records = new ArrayList<>();
    for (DaySchedule day : days) {
      records.add(day.toRecord());
    }
    return records;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof WeeklySchedule)) {
      return false;
    }
    WeeklySchedule other = (WeeklySchedule) o;
    return days.equals(other.days) && summaries.equals(other.summaries);
  }

  @Override
  public int hashCode() {
    return days.hashCode() * 31 + summaries.hashCode();
  }
}
