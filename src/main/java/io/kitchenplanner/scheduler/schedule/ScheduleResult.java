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
import java.util.Optional;

/**
 * Outcome of one scheduling run: a success or failure signal, a message for the user and, on
 * success only, the decoded week.
 */
public final class ScheduleResult {
  private final CpSolverStatus status;
  private final String message;
  private final WeeklySchedule schedule;
  private final AssignmentMatrix assignment;

  ScheduleResult(
      CpSolverStatus status,
      String message,
      WeeklySchedule schedule,
      AssignmentMatrix assignment) {
    this.status = status;
    this.message = message;
    this.schedule = schedule;
    this.assignment = assignment;
  }

  public CpSolverStatus getStatus() {
    return status;
  }

  public boolean isSuccess() {
    return schedule != null;
  }

  /** True only when the solver proved the schedule optimal before its time limit. */
  public boolean isOptimal() {
    return status == CpSolverStatus.OPTIMAL;
  }

  public String getMessage() {
    return message;
  }

  /** The decoded week; empty on failure. */
  public Optional<WeeklySchedule> getSchedule() {
    return Optional.ofNullable(schedule);
  }

  /** The raw assignment values the schedule was decoded from; empty on failure. */
  public Optional<AssignmentMatrix> getAssignment() {
    return Optional.ofNullable(assignment);
  }

  @Override
  public String toString() {
    return status + ": " + message;
  }
}
