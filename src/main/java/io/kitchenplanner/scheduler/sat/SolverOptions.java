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

import com.google.ortools.sat.SatParameters;
import com.google.protobuf.TextFormat;

/**
 * Solver settings of a scheduling run.
 *
 * <p>The dedicated fields cover the usual knobs. Any other CP-SAT parameter can be passed in
 * protobuf text format, e.g. {@code "num_workers: 4 linearization_level: 0"}; those overrides are
 * applied last.
 */
public final class SolverOptions {
  public static final double DEFAULT_MAX_TIME_IN_SECONDS = 20.0;

  private final double maxTimeInSeconds;
  private final int numWorkers;
  private final int randomSeed;
  private final boolean logSearchProgress;
  private final SatParameters overrides;

  private SolverOptions(Builder builder) {
    this.maxTimeInSeconds = builder.maxTimeInSeconds;
    this.numWorkers = builder.numWorkers;
    this.randomSeed = builder.randomSeed;
    this.logSearchProgress = builder.logSearchProgress;
    this.overrides = builder.overrides.build();
  }

  public static SolverOptions defaults() {
    return newBuilder().build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public double getMaxTimeInSeconds() {
    return maxTimeInSeconds;
  }

  /** Number of parallel search workers; 0 lets the solver decide. */
  public int getNumWorkers() {
    return numWorkers;
  }

  public int getRandomSeed() {
    return randomSeed;
  }

  public boolean isLogSearchProgress() {
    return logSearchProgress;
  }

  public SatParameters getOverrides() {
    return overrides;
  }

  /** Copies these settings into the parameters of a solver. */
  public void applyTo(SatParameters.Builder parameters) {
    parameters.setMaxTimeInSeconds(maxTimeInSeconds);
    if (numWorkers > 0) {
      parameters.setNumWorkers(numWorkers);
    }
    parameters.setRandomSeed(randomSeed);
    parameters.setLogSearchProgress(logSearchProgress);
    parameters.setLogToStdout(false);
    parameters.mergeFrom(overrides);
  }

  @Override
  public String toString() {
    return "max_time_in_seconds: " + maxTimeInSeconds
        + " num_workers: " + numWorkers
        + " random_seed: " + randomSeed
        + " log_search_progress: " + logSearchProgress
        + (overrides.equals(SatParameters.getDefaultInstance())
            ? ""
            : " " + overrides.toString().replace('\n', ' ').trim());
  }

  /** Builder of {@link SolverOptions}. */
  public static final class Builder {
    private double maxTimeInSeconds = DEFAULT_MAX_TIME_IN_SECONDS;
    private int numWorkers = 0;
    private int randomSeed = 0;
    private boolean logSearchProgress = false;
    private final SatParameters.Builder overrides = SatParameters.newBuilder();

    private Builder() {}

    public Builder setMaxTimeInSeconds(double maxTimeInSeconds) {
      if (!(maxTimeInSeconds > 0)) {
        throw new IllegalArgumentException("time limit must be positive: " + maxTimeInSeconds);
      }
      this.maxTimeInSeconds = maxTimeInSeconds;
      return this;
    }

    public Builder setNumWorkers(int numWorkers) {
      if (numWorkers < 0) {
        throw new IllegalArgumentException("negative number of workers: " + numWorkers);
      }
      this.numWorkers = numWorkers;
      return this;
    }

    public Builder setRandomSeed(int randomSeed) {
      this.randomSeed = randomSeed;
      return this;
    }

    public Builder setLogSearchProgress(boolean logSearchProgress) {
      this.logSearchProgress = logSearchProgress;
      return this;
    }

    /**
     * Merges CP-SAT parameters written in protobuf text format.
     *
     * @throws IllegalArgumentException if the text does not parse
     */
    public Builder mergeParameters(String text) {
      try {
        TextFormat.merge(text, overrides);
      } catch (TextFormat.ParseException e) {
        throw new IllegalArgumentException("invalid solver parameters '" + text + "'", e);
      }
      return this;
    }

    public SolverOptions build() {
      return new SolverOptions(this);
    }
  }
}
