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

/** Kitchen roles a worker can be scheduled for. The set is fixed. */
public enum Role {
  COOK("Cook"),
  PIZZA_MAKER("PizzaMaker"),
  DISHWASHER("Dishwasher");

  /** Number of roles, used to size the dense assignment index. */
  public static final int COUNT = values().length;

  private final String label;

  Role(String label) {
    this.label = label;
  }

  /** Name shown in schedule records. */
  public String getLabel() {
    return label;
  }

  /**
   * Returns the role with the given label or enum name, ignoring case.
   *
   * @throws ScheduleInputException if no role matches
   */
  public static Role fromLabel(String label) {
    if (label != null) {
      for (Role role : values()) {
        if (role.label.equalsIgnoreCase(label) || role.name().equalsIgnoreCase(label)) {
          return role;
        }
      }
    }
    throw new ScheduleInputException("Role.fromLabel", "unknown role '" + label + "'");
  }
}
