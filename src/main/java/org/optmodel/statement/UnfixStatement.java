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

/** Releases fixed variables: {@code unfix x y[i];}. */
public final class UnfixStatement implements Statement {
  public static UnfixStatement of(Object... targets) {
    if (targets.length == 0) {
      throw new ModelingException("UnfixStatement.of", "nothing to unfix");
    }
    return new UnfixStatement(ImmutableList.copyOf(targets));
  }

  private UnfixStatement(ImmutableList<Object> targets) {
    this.targets = targets;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    out.line(targets.stream()
        .map(target -> Operands.target(target, out.getFormatter()))
        .collect(Collectors.joining(" ", "unfix ", ";")));
  }

  private final ImmutableList<Object> targets;
}
