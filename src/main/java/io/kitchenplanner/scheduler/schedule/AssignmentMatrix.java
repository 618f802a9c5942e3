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
import io.kitchenplanner.scheduler.domain.Role;
import java.util.BitSet;

/**
 * Values of the (worker, role, slot) assignment booleans of one solution.
 *
 * <p>The bits are stored densely at index {@code (worker * Role.COUNT + role) * Horizon.SLOTS +
 * slot}.
 */
public final class AssignmentMatrix {
  private final int numWorkers;
  private final BitSet bits;

  public AssignmentMatrix(int numWorkers) {
    if (numWorkers < 0) {
      throw new IllegalArgumentException("negative number of workers: " + numWorkers);
    }
    this.numWorkers = numWorkers;
    this.bits = new BitSet(numWorkers * Role.COUNT * Horizon.SLOTS);
  }

  private int index(int worker, Role role, int slot) {
    if (worker < 0 || worker >= numWorkers) {
      throw new IndexOutOfBoundsException("wrong worker index: " + worker);
    }
    if (slot < 0 || slot >= Horizon.SLOTS) {
      throw new IndexOutOfBoundsException("wrong slot index: " + slot);
    }
    return (worker * Role.COUNT + role.ordinal()) * Horizon.SLOTS + slot;
  }

  public int getNumWorkers() {
    return numWorkers;
  }

  public boolean isAssigned(int worker, Role role, int slot) {
    return bits.get(index(worker, role, slot));
  }

  public void set(int worker, Role role, int slot, boolean value) {
    bits.set(index(worker, role, slot), value);
  }

  /** Marks {@code worker} as doing {@code role} for hours [fromHour, toHour) of {@code day}. */
  public AssignmentMatrix assign(int worker, Role role, int day, int fromHour, int toHour) {
    for (int h = fromHour; h < toHour; ++h) {
      set(worker, role, Horizon.slot(day, h), true);
    }
    return this;
  }

  /** Number of roles assigned to a worker at a slot. At most one in any valid solution. */
  public int rolesAt(int worker, int slot) {
    int count = 0;
    for (Role role : Role.values()) {
      if (isAssigned(worker, role, slot)) {
        count++;
      }
    }
    return count;
  }

  public boolean isWorking(int worker, int slot) {
    return rolesAt(worker, slot) > 0;
  }

  /** Number of slots of {@code day} where the worker holds at least one role. */
  public int hoursOn(int worker, int day) {
    int hours = 0;
    for (int h = 0; h < Horizon.HOURS_PER_DAY; ++h) {
      if (isWorking(worker, Horizon.slot(day, h))) {
        hours++;
      }
    }
    return hours;
  }

  /** Number of workers assigned {@code role} at {@code slot}. */
  public int headcount(Role role, int slot) {
    int count = 0;
    for (int w = 0; w < numWorkers; ++w) {
      if (isAssigned(w, role, slot)) {
        count++;
      }
    }
    return count;
  }

  /** Total number of true assignment booleans. */
  public int cardinality() {
    return bits.cardinality();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof AssignmentMatrix)) {
      return false;
    }
    AssignmentMatrix other = (AssignmentMatrix) o;
    return numWorkers == other.numWorkers && bits.equals(other.bits);
  }

  @Override
  public int hashCode() {
    return 31 * numWorkers + bits.hashCode();
  }
}
