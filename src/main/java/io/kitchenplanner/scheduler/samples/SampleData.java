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

package io.kitchenplanner.scheduler.samples;

import io.kitchenplanner.scheduler.domain.Horizon;
import io.kitchenplanner.scheduler.domain.Role;
import io.kitchenplanner.scheduler.domain.StaffingRequirements;
import io.kitchenplanner.scheduler.domain.Worker;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/** Default roster and staffing needs of a small restaurant kitchen. */
public final class SampleData {
  public static final int DEFAULT_WORKERS = 6;
  public static final int DEFAULT_MAX_WEEKLY_HOURS = 42;
  public static final int DEFAULT_MAX_BREAKS = 3;

  /** Workers Emp1..EmpN, skilled in every role, with the default limits. */
  public static List<Worker> defaultRoster(int numWorkers) {
    List<Worker> workers = new ArrayList<>();
    for (int i = 0; i < numWorkers; ++i) {
      workers.add(
          Worker.of(
              "Emp" + (i + 1),
              EnumSet.allOf(Role.class),
              DEFAULT_MAX_WEEKLY_HOURS,
              DEFAULT_MAX_BREAKS));
    }
    return workers;
  }

  /**
   * Same needs every day: one worker per role during the peaks (10:00-15:00 and 18:00-22:00), a
   * single cook from 16:00 to 17:00, nobody at 23:00.
   */
  public static StaffingRequirements defaultRequirements() {
    StaffingRequirements.Builder builder = StaffingRequirements.newBuilder();
    for (Role role : Role.values()) {
      int[] daily = new int[Horizon.HOURS_PER_DAY];
      for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
        if (h <= 5 || (h >= 8 && h <= 12)) {
          daily[h] = 1;
        } else if (h <= 7) {
          daily[h] = role == Role.COOK ? 1 : 0;
        }
      }
      builder.setEveryDay(role, daily);
    }
    return builder.build();
  }

  private SampleData() {}
}
