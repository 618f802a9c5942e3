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

import static com.google.common.truth.Truth.assertThat;

import io.kitchenplanner.scheduler.domain.Horizon;
import io.kitchenplanner.scheduler.domain.Role;
import io.kitchenplanner.scheduler.domain.StaffingRequirements;
import io.kitchenplanner.scheduler.domain.Worker;
import java.time.DayOfWeek;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests the independent rule checker. */
public final class ScheduleValidatorTest {
  private static final List<Worker> WORKERS =
      Arrays.asList(
          Worker.of("Ana", EnumSet.of(Role.COOK, Role.PIZZA_MAKER), 20, 1),
          Worker.of("Ben", EnumSet.of(Role.DISHWASHER), 20, 0));

  // Cook 10:00-15:59 on Monday, dishwasher 18:00-21:59 on Tuesday.
  private static StaffingRequirements requirements() {
    StaffingRequirements.Builder builder = StaffingRequirements.newBuilder().clear();
    for (int h = 0; h < 6; ++h) {
      builder.setHour(Role.COOK, DayOfWeek.MONDAY, h, 1);
    }
    for (int h = 8; h < 12; ++h) {
      builder.setHour(Role.DISHWASHER, DayOfWeek.TUESDAY, h, 1);
    }
    return builder.build();
  }

  private static AssignmentMatrix validAssignment() {
    return new AssignmentMatrix(2)
        .assign(0, Role.COOK, 0, 0, 6)
        .assign(1, Role.DISHWASHER, 1, 8, 12);
  }

  @Test
  public void testValidator_acceptsValidSchedule() {
    final ScheduleValidator validator = new ScheduleValidator(WORKERS, requirements());
    assertThat(validator.validate(validAssignment())).isEmpty();
  }

  @Test
  public void testValidator_coverage() {
    final ScheduleValidator validator = new ScheduleValidator(WORKERS, requirements());
    final AssignmentMatrix assignment = validAssignment();
    assignment.set(0, Role.COOK, Horizon.slot(0, 5), false);

    final List<String> violations = validator.validate(assignment);
    assertThat(violations).contains("Cook on Monday at 15:00: 0 assigned, 1 required");
  }

  @Test
  public void testValidator_eligibilityAndRoleSwitch() {
    final ScheduleValidator validator = new ScheduleValidator(WORKERS, requirements());
    final AssignmentMatrix assignment = validAssignment();
    // Ana moves to the pizza oven at 15:00; Ben washes dishes as a cook.
    assignment.set(0, Role.COOK, Horizon.slot(0, 5), false);
    assignment.set(0, Role.PIZZA_MAKER, Horizon.slot(0, 5), true);
    assignment.set(1, Role.COOK, Horizon.slot(1, 8), true);

    final List<String> violations = validator.validate(assignment);
    assertThat(violations).contains("Ana switches from Cook to PizzaMaker on Monday at 15:00");
    assertThat(violations).contains("Ben is not eligible for Cook on Tuesday at 18:00");
    assertThat(violations).contains("Ben holds several roles on Tuesday at 18:00");
  }

  @Test
  public void testValidator_blocksAndLimits() {
    final List<Worker> workers =
        Arrays.asList(
            Worker.of("Ana", EnumSet.of(Role.COOK, Role.PIZZA_MAKER), 10, 0),
            Worker.of("Ben", EnumSet.of(Role.DISHWASHER), 20, 0));
    final StaffingRequirements none = StaffingRequirements.newBuilder().clear().build();
    final ScheduleValidator validator = new ScheduleValidator(workers, none);
    final AssignmentMatrix assignment =
        new AssignmentMatrix(2)
            // Two blocks on Monday with no break allowed.
            .assign(0, Role.COOK, 0, 0, 3)
            .assign(0, Role.COOK, 0, 5, 8)
            // Two hours only on Wednesday.
            .assign(0, Role.COOK, 2, 0, 2)
            // Eleven hours on Friday.
            .assign(0, Role.COOK, 4, 0, 11)
            // Ben works every other day, never two days off in a row.
            .assign(1, Role.DISHWASHER, 0, 0, 3)
            .assign(1, Role.DISHWASHER, 2, 0, 3)
            .assign(1, Role.DISHWASHER, 4, 0, 3)
            .assign(1, Role.DISHWASHER, 6, 0, 3);

    final List<String> violations = validator.validate(assignment);
    assertThat(violations).contains("Ana has 2 work blocks on Monday, at most 1 allowed");
    assertThat(violations).contains("Ana has a 2h work block on Wednesday");
    assertThat(violations).contains("Ana works only 2h on Wednesday");
    assertThat(violations).contains("Ana works 11h on Friday");
    assertThat(violations).contains("Ana works 19h, above the cap of 10h");
    assertThat(violations).contains("Ben has no two consecutive days off");
    assertThat(violations).doesNotContain("Ana has no two consecutive days off");
    assertThat(violations).contains("Cook on Monday at 10:00: 1 assigned, 0 required");
  }

  @Test
  public void testValidator_unboundedBreaks() {
    final List<Worker> workers =
        Arrays.asList(Worker.of("Ana", EnumSet.of(Role.COOK), 42, Integer.MAX_VALUE));
    final StaffingRequirements.Builder builder = StaffingRequirements.newBuilder().clear();
    for (int h : new int[] {0, 1, 2, 5, 6, 7}) {
      builder.setHour(Role.COOK, DayOfWeek.MONDAY, h, 1);
    }
    final ScheduleValidator validator = new ScheduleValidator(workers, builder.build());
    final AssignmentMatrix assignment =
        new AssignmentMatrix(1).assign(0, Role.COOK, 0, 0, 3).assign(0, Role.COOK, 0, 5, 8);

    assertThat(validator.validate(assignment)).isEmpty();
  }
}
