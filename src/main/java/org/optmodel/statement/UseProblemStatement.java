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

/** Switches the current problem on the engine: {@code use problem knapsack;}. */
public final class UseProblemStatement implements Statement {
  public static UseProblemStatement of(String problemName) {
    return new UseProblemStatement(problemName);
  }

  private UseProblemStatement(String problemName) {
    this.problemName = problemName;
  }

  public String getProblemName() {
    return problemName;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    out.line("use problem " + problemName + ";");
  }

  private final String problemName;
}
