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
import java.util.stream.Collectors;
import org.optmodel.ModelingException;
import org.optmodel.ProgramWriter;
import org.optmodel.core.Declaration;

/** Removes constraints from the current problem on the engine: {@code drop c1 c2_0;}. */
public final class DropStatement implements Statement {
  public static DropStatement of(Declaration... constraints) {
    if (constraints.length == 0) {
      throw new ModelingException("DropStatement.of", "no constraint given");
    }
    return new DropStatement(ImmutableList.copyOf(constraints));
  }

  private DropStatement(ImmutableList<Declaration> constraints) {
    this.constraints = constraints;
  }

  public ImmutableList<Declaration> getConstraints() {
    return constraints;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    out.line(renderNames("drop", constraints));
  }

  static String renderNames(String keyword, ImmutableList<Declaration> constraints) {
    return constraints.stream()
        .map(Declaration::getName)
        .collect(Collectors.joining(" ", keyword + " ", ";"));
  }

  private final ImmutableList<Declaration> constraints;
}
