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

package org.optmodel.session;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * The part of an engine response produced by one {@code solve} or {@code print} statement.
 *
 * <p>A solve block carries the solution and problem summaries and the primal and dual tables; a
 * print block carries the printed text.
 */
public final class ResultBlock {
  public static final String SOLUTION_STATUS = "Solution Status";
  public static final String OBJECTIVE_VALUE = "Objective Value";

  /** Builder for {@link ResultBlock}. */
  public static final class Builder {
    private final ImmutableMap.Builder<String, String> solutionSummary = ImmutableMap.builder();
    private final ImmutableMap.Builder<String, String> problemSummary = ImmutableMap.builder();
    private final ImmutableList.Builder<SolutionRow> primalRows = ImmutableList.builder();
    private final ImmutableList.Builder<SolutionRow> dualRows = ImmutableList.builder();
    private String printOutput = "";

    private Builder() {}

    public Builder putSolutionSummary(String key, String value) {
      solutionSummary.put(key, value);
      return this;
    }

    public Builder putAllSolutionSummary(Map<String, String> entries) {
      solutionSummary.putAll(entries);
      return this;
    }

    public Builder putProblemSummary(String key, String value) {
      problemSummary.put(key, value);
      return this;
    }

    public Builder addPrimalRow(SolutionRow row) {
      primalRows.add(row);
      return this;
    }

    public Builder addDualRow(SolutionRow row) {
      dualRows.add(row);
      return this;
    }

    public Builder setPrintOutput(String printOutput) {
      this.printOutput = printOutput;
      return this;
    }

    public ResultBlock build() {
      return new ResultBlock(this);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private ResultBlock(Builder builder) {
    this.solutionSummary = builder.solutionSummary.buildKeepingLast();
    this.problemSummary = builder.problemSummary.buildKeepingLast();
    this.primalRows = builder.primalRows.build();
    this.dualRows = builder.dualRows.build();
    this.printOutput = builder.printOutput;
  }

  public ImmutableMap<String, String> getSolutionSummary() {
    return solutionSummary;
  }

  public ImmutableMap<String, String> getProblemSummary() {
    return problemSummary;
  }

  public ImmutableList<SolutionRow> getPrimalRows() {
    return primalRows;
  }

  public ImmutableList<SolutionRow> getDualRows() {
    return dualRows;
  }

  public String getPrintOutput() {
    return printOutput;
  }

  /** Returns the solution status, e.g. {@code OPTIMAL}, or null if not reported. */
  public String getSolutionStatus() {
    return solutionSummary.get(SOLUTION_STATUS);
  }

  /** Returns the objective value, or NaN if not reported or not numeric. */
  public double getObjectiveValue() {
    String value = solutionSummary.get(OBJECTIVE_VALUE);
    if (value == null) {
      return Double.NaN;
    }
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      return Double.NaN;
    }
  }

  private final ImmutableMap<String, String> solutionSummary;
  private final ImmutableMap<String, String> problemSummary;
  private final ImmutableList<SolutionRow> primalRows;
  private final ImmutableList<SolutionRow> dualRows;
  private final String printOutput;
}
