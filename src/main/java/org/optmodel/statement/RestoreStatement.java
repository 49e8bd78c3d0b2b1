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

import com.google.common.collect.ImmutableList;
import org.optmodel.ModelingException;
import org.optmodel.ProgramWriter;
import org.optmodel.core.Declaration;

/** Puts dropped constraints back into the current problem: {@code restore c1;}. */
public final class RestoreStatement implements Statement {
  public static RestoreStatement of(Declaration... constraints) {
    if (constraints.length == 0) {
      throw new ModelingException("RestoreStatement.of", "no constraint given");
    }
    return new RestoreStatement(ImmutableList.copyOf(constraints));
  }

  private RestoreStatement(ImmutableList<Declaration> constraints) {
    this.constraints = constraints;
  }

  public ImmutableList<Declaration> getConstraints() {
    return constraints;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    out.line(DropStatement.renderNames("restore", constraints));
  }

  private final ImmutableList<Declaration> constraints;
}
