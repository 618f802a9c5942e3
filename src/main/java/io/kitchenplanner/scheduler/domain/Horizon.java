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
import java.util.Locale;

/**
 * The weekly planning horizon: 7 days of 14 hourly slots, from 10:00 to 23:59.
 *
 * <p>Slots are addressed by (day, hour) and flattened to {@code day * HOURS_PER_DAY + hour}.
 */
public final class Horizon {
  public static final int DAYS = 7;
  public static final int HOURS_PER_DAY = 14;
  public static final int START_HOUR = 10;
  public static final int SLOTS = DAYS * HOURS_PER_DAY;

  /** Minimum length of a working block, and of a working day. */
  public static final int MIN_BLOCK_HOURS = 3;
  /** Maximum number of hours worked in one day. */
  public static final int MAX_DAILY_HOURS = 10;

  private static final String[] HOUR_LABELS = new String[HOURS_PER_DAY];

  static {
    for (int h = 0; h < HOURS_PER_DAY; ++h) {
      HOUR_LABELS[h] = ((START_HOUR + h) % 24) + ":00";
    }
  }

  public static int slot(int day, int hour) {
    if (day < 0 || day >= DAYS || hour < 0 || hour >= HOURS_PER_DAY) {
      throw new IndexOutOfBoundsException("no slot for day " + day + ", hour " + hour);
    }
    return day * HOURS_PER_DAY + hour;
  }

  public static int dayOf(int slot) {
    return slot / HOURS_PER_DAY;
  }

  public static int hourOf(int slot) {
    return slot % HOURS_PER_DAY;
  }

  /** Clock label of an hour index, e.g. "10:00" for hour 0. */
  public static String hourLabel(int hour) {
    return HOUR_LABELS[hour];
  }

  /** Day of week of a day index; day 0 is Monday. */
  public static DayOfWeek dayOfWeek(int day) {
    return DayOfWeek.of(day + 1);
  }

  /** Display name of a day index, e.g. "Monday". */
  public static String dayName(int day) {
    String name = dayOfWeek(day).name();
    return name.charAt(0) + name.substring(1).toLowerCase(Locale.ROOT);
  }

  private Horizon() {}
}
