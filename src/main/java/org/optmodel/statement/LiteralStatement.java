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

/** Program text passed through unchanged, one line per line of the text. */
public final class LiteralStatement implements Statement {
  public static LiteralStatement of(String text) {
    return new LiteralStatement(text);
  }

  private LiteralStatement(String text) {
    this.text = text;
  }

  public String getText() {
    return text;
  }

  @Override
  public void writeTo(ProgramWriter out) {
    out.lines(text);
  }

  private final String text;
}
