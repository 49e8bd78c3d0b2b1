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
import org.optmodel.session.ResultBlock;

/**
 * A {@code print} statement: {@code print x y 'total:' (x + y);}. After submission it holds the
 * printed output.
 */
public final class PrintStatement implements Statement {
  /**
   * Creates a print statement.
   *
   * @param items declarations (printed whole), terms, expressions, numbers or string literals
   */
  public static PrintStatement of(Object... items) {
    if (items.length == 0) {
      throw new ModelingException("PrintStatement.of", "nothing to print");
    }
    return new PrintStatement(ImmutableList.copyOf(items));
  }

  private PrintStatement(ImmutableList<Object> items) {
    this.items = items;
  }

  public ImmutableList<Object> getItems() {
    return items;
  }

  /** Returns the printed text, or null before the workspace is submitted. */
  public String getOutput() {
    return result == null ? null : result.getPrintOutput();
  }

  public ResultBlock getResult() {
    return result;
  }

  public void setResult(ResultBlock result) {
    this.result = result;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    out.line(items.stream()
        .map(item -> Operands.item(item, out.getFormatter()))
        .collect(Collectors.joining(" ", "print ", ";")));
  }

  private final ImmutableList<Object> items;
  private ResultBlock result;
}
