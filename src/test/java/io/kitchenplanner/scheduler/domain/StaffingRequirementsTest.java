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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests building and checking staffing requirements. */
public final class StaffingRequirementsTest {
  private static List<Integer> hours(Integer... values) {
    return new ArrayList<>(Arrays.asList(values));
  }

  private static Map<Role, Map<String, List<Integer>>> table(List<Integer> hourly) {
    Map<Role, Map<String, List<Integer>>> table = new EnumMap<>(Role.class);
    for (Role role : Role.values()) {
      Map<String, List<Integer>> days = new LinkedHashMap<>();
      for (int d = 0; d < Horizon.DAYS; ++d) {
        days.put(Horizon.dayName(d), hourly);
      }
      table.put(role, days);
    }
    return table;
  }

  @Test
  public void testRequirements_builder() {
    final StaffingRequirements requirements =
        StaffingRequirements.newBuilder()
            .clear()
            .setHour(Role.COOK, DayOfWeek.TUESDAY, 3, 2)
            .setHour(Role.DISHWASHER, DayOfWeek.SUNDAY, 13, 1)
            .build();

    assertThat(requirements.get(Role.COOK, 1, 3)).isEqualTo(2);
    assertThat(requirements.get(Role.COOK, Horizon.slot(1, 3))).isEqualTo(2);
    assertThat(requirements.get(Role.DISHWASHER, 6, 13)).isEqualTo(1);
    assertThat(requirements.get(Role.PIZZA_MAKER, 1, 3)).isEqualTo(0);
    assertThat(requirements.totalHours()).isEqualTo(3);
    assertThat(requirements.totalHours(Role.COOK)).isEqualTo(2);
  }

  @Test
  public void testRequirements_missingDay() {
    final StaffingRequirements.Builder builder = StaffingRequirements.newBuilder();
    for (Role role : Role.values()) {
      for (DayOfWeek day : DayOfWeek.values()) {
        if (!(role == Role.PIZZA_MAKER && day == DayOfWeek.FRIDAY)) {
          builder.set(role, day, new int[Horizon.HOURS_PER_DAY]);
        }
      }
    }
    ScheduleInputException e = assertThrows(ScheduleInputException.class, builder::build);
    assertThat(e).hasMessageThat().contains("PizzaMaker on Friday");
  }

  @Test
  public void testRequirements_negativeValue() {
    final int[] hourly = new int[Horizon.HOURS_PER_DAY];
    hourly[4] = -1;
    ScheduleInputException e =
        assertThrows(
            ScheduleInputException.class,
            () -> StaffingRequirements.newBuilder().set(Role.COOK, DayOfWeek.MONDAY, hourly));
    assertThat(e).hasMessageThat().contains("14:00");
  }

  @Test
  public void testRequirements_wrongLength() {
    assertThrows(
        ScheduleInputException.class,
        () -> StaffingRequirements.newBuilder().set(Role.COOK, DayOfWeek.MONDAY, 1, 1, 1));
  }

  @Test
  public void testRequirements_fromTable() {
    final List<Integer> hourly = hours(1, 1, 1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 2);
    final Map<Role, Map<String, List<Integer>>> table = table(hourly);
    table.get(Role.COOK).remove("Wednesday");
    table.get(Role.COOK).put("wednesday", hours(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0));

    final StaffingRequirements requirements = StaffingRequirements.fromTable(table);

    assertThat(requirements.get(Role.COOK, 0, 0)).isEqualTo(1);
    assertThat(requirements.get(Role.COOK, 2, 0)).isEqualTo(0);
    assertThat(requirements.get(Role.PIZZA_MAKER, 6, 13)).isEqualTo(2);
    assertThat(requirements.totalHours(Role.DISHWASHER)).isEqualTo(7 * 5);
  }

  @Test
  public void testRequirements_fromTableRejectsMalformedInput() {
    final List<Integer> hourly = hours(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

    final Map<Role, Map<String, List<Integer>>> unknownDay = table(hourly);
    unknownDay.get(Role.COOK).put("Funday", hourly);
    assertThrows(ScheduleInputException.class, () -> StaffingRequirements.fromTable(unknownDay));

    final Map<Role, Map<String, List<Integer>>> missingValue = table(hourly);
    final List<Integer> withHole = hours(0, 0, 0, 0, 0, null, 0, 0, 0, 0, 0, 0, 0, 0);
    missingValue.get(Role.DISHWASHER).put("Monday", withHole);
    ScheduleInputException e =
        assertThrows(
            ScheduleInputException.class, () -> StaffingRequirements.fromTable(missingValue));
    assertThat(e).hasMessageThat().contains("missing value");

    final Map<Role, Map<String, List<Integer>>> missingRole = table(hourly);
    missingRole.remove(Role.PIZZA_MAKER);
    assertThrows(ScheduleInputException.class, () -> StaffingRequirements.fromTable(missingRole));

    final Map<Role, Map<String, List<Integer>>> noValues = table(hourly);
    noValues.put(Role.COOK, Collections.singletonMap("Monday", null));
    assertThrows(ScheduleInputException.class, () -> StaffingRequirements.fromTable(noValues));

    assertThrows(ScheduleInputException.class, () -> StaffingRequirements.fromTable(null));
  }

  @Test
  public void testRequirements_fromTableRejectsRepeatedDay() {
    final List<Integer> hourly = hours(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    final Map<Role, Map<String, List<Integer>>> table = table(hourly);
    table.get(Role.COOK).put("monday", hours(1, 1, 1, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0));

    ScheduleInputException e =
        assertThrows(ScheduleInputException.class, () -> StaffingRequirements.fromTable(table));
    assertThat(e).hasMessageThat().contains("day 'monday' given twice for Cook");
  }

  @Test
  public void testRequirements_setHourRejectsMalformedInput() {
    final StaffingRequirements.Builder builder = StaffingRequirements.newBuilder().clear();

    ScheduleInputException e =
        assertThrows(
            ScheduleInputException.class,
            () -> builder.setHour(Role.COOK, DayOfWeek.MONDAY, 14, 1));
    assertThat(e).hasMessageThat().contains("hour index 14");
    assertThrows(
        ScheduleInputException.class, () -> builder.setHour(Role.COOK, DayOfWeek.MONDAY, -1, 1));
    assertThrows(
        ScheduleInputException.class, () -> builder.setHour(null, DayOfWeek.MONDAY, 0, 1));
    assertThrows(ScheduleInputException.class, () -> builder.setHour(Role.COOK, null, 0, 1));
    assertThrows(
        ScheduleInputException.class, () -> builder.setHour(Role.COOK, DayOfWeek.MONDAY, 0, -1));
  }

  @Test
  public void testHorizon_slots() {
    assertThat(Horizon.SLOTS).isEqualTo(98);
    assertThat(Horizon.slot(0, 0)).isEqualTo(0);
    assertThat(Horizon.slot(6, 13)).isEqualTo(97);
    assertThat(Horizon.dayOf(Horizon.slot(3, 7))).isEqualTo(3);
    assertThat(Horizon.hourOf(Horizon.slot(3, 7))).isEqualTo(7);
    assertThat(Horizon.hourLabel(0)).isEqualTo("10:00");
    assertThat(Horizon.hourLabel(13)).isEqualTo("23:00");
    assertThat(Horizon.dayName(0)).isEqualTo("Monday");
    assertThat(Horizon.dayOfWeek(6)).isEqualTo(DayOfWeek.SUNDAY);
    assertThrows(IndexOutOfBoundsException.class, () -> Horizon.slot(7, 0));
    assertThrows(IndexOutOfBoundsException.class, () -> Horizon.slot(0, 14));
  }

  @Test
  public void testHorizon_dayNamesIgnoreDefaultLocale() {
    final Locale saved = Locale.getDefault();
    try {
      Locale.setDefault(new Locale("tr", "TR"));
      assertThat(Horizon.dayName(4)).isEqualTo("Friday");
      assertThat(Horizon.dayName(2)).isEqualTo("Wednesday");
    } finally {
      Locale.setDefault(saved);
    }
  }
}
