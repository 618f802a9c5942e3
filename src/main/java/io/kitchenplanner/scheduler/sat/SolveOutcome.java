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

import com.google.ortools.sat.CpSolverStatus;
import io.kitchenplanner.scheduler.schedule.AssignmentMatrix;

/** What a solve returned. The assignment is set only for OPTIMAL and FEASIBLE statuses. */
public final class SolveOutcome {
  private final CpSolverStatus status;
  private final AssignmentMatrix assignment;
  private final double objectiveValue;
  private final double wallTime;
  private final int numSolutions;
  private final String solutionInfo;

  SolveOutcome(
      CpSolverStatus status,
      AssignmentMatrix assignment,
      double objectiveValue,
      double wallTime,
      int numSolutions,
      String solutionInfo) {
    this.status = status;
    this.assignment = assignment;
    this.objectiveValue = objectiveValue;
    this.wallTime = wallTime;
    this.numSolutions = numSolutions;
    this.solutionInfo = solutionInfo;
  }

  public CpSolverStatus getStatus() {
    return status;
  }

  public boolean hasSolution() {
    return assignment != null;
  }

  public AssignmentMatrix getAssignment() {
    return assignment;
  }

  /** Number of assigned hours in the returned solution. */
  public double getObjectiveValue() {
    return objectiveValue;
  }

  /** Wall time of the solve, in seconds. */
  public double getWallTime() {
    return wallTime;
  }

  /** Number of improving solutions reported during the search. */
  public int getNumSolutions() {
    return numSolutions;
  }

  public String getSolutionInfo() {
    return solutionInfo;
  }

  @Override
  public String toString() {
    return String.format(
        "%s after %.2fs, %d solution(s), objective %.0f", status, wallTime, numSolutions,
        objectiveValue);
  }
}
