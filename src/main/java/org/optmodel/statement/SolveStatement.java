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

package org.optmodel.statement;

import org.optmodel.ProgramWriter;
import org.optmodel.session.ResultBlock;

/**
 * A {@code solve} statement inside a workspace. After submission it holds the result block the
 * engine produced for it.
 */
public final class SolveStatement implements Statement {
  public SolveStatement(SolveOptions options) {
    this(options, null);
  }

  /** Creates a solve of the named problem, preceded by {@code use problem name;}. */
  public SolveStatement(SolveOptions options, String problemName) {
    this.options = options;
    this.problemName = problemName;
  }

  public SolveOptions getOptions() {
    return options;
  }

  /** Returns the problem made current before solving, or null for the current one. */
  public String getProblemName() {
    return problemName;
  }

  /** Returns the result of this solve, or null before the workspace is submitted. */
  public ResultBlock getResult() {
    return result;
  }

  public void setResult(ResultBlock result) {
    this.result = result;
  }

  /** Returns the reported solution status, or null before the workspace is submitted. */
  public String getSolutionStatus() {
    return result == null ? null : result.getSolutionStatus();
  }

  /** Returns the reported objective value, NaN before the workspace is submitted. */
  public double getObjectiveValue() {
    return result == null ? Double.NaN : result.getObjectiveValue();
  }

  @Override
  public void writeTo(ProgramWriter out) {
    if (problemName != null) {
      UseProblemStatement.of(problemName).writeTo(out);
    }
    out.line(options.toSolveText(out.getFormatter()));
  }

  private final SolveOptions options;
  private final String problemName;
  private ResultBlock result;
}
