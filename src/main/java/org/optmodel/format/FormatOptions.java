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

package org.optmodel.format;

import org.optmodel.statement.SolveOptions;

/** Controls what {@link OptmodelFormat} writes around the model declarations. */
public final class FormatOptions {
  private static final FormatOptions DEFAULT = newBuilder().build();

  /** Builder for {@link FormatOptions}. */
  public static final class Builder {
    private boolean header = true;
    private boolean solve = true;
    private SolveOptions solveOptions = SolveOptions.getDefault();
    private boolean parseResults = false;

    private Builder() {}

    /** Wraps the program in {@code proc optmodel;} and {@code quit;}. */
    public Builder setHeader(boolean header) {
      this.header = header;
      return this;
    }

    /** Writes a {@code solve} statement after the declarations. */
    public Builder setSolve(boolean solve) {
      this.solve = solve;
      return this;
    }

    public Builder setSolveOptions(SolveOptions solveOptions) {
      this.solveOptions = solveOptions;
      return this;
    }

    /** Writes the statements creating the primal and dual result tables after the solve. */
    public Builder setParseResults(boolean parseResults) {
      this.parseResults = parseResults;
      return this;
    }

    public FormatOptions build() {
      return new FormatOptions(this);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Header, solve statement with default options, no result tables. */
  public static FormatOptions getDefault() {
    return DEFAULT;
  }

  private FormatOptions(Builder builder) {
    this.header = builder.header;
    this.solve = builder.solve;
    this.solveOptions = builder.solveOptions;
    this.parseResults = builder.parseResults;
  }

  public boolean hasHeader() {
    return header;
  }

  public boolean hasSolve() {
    return solve;
  }

  public SolveOptions getSolveOptions() {
    return solveOptions;
  }

  public boolean parsesResults() {
    return parseResults;
  }

  private final boolean header;
  private final boolean solve;
  private final SolveOptions solveOptions;
  private final boolean parseResults;
}
