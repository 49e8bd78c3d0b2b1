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

package org.optmodel;

import com.google.common.base.Strings;

/** Accumulates indented lines of generated code. */
public final class ProgramWriter {
  public ProgramWriter(NumberFormatter formatter, int indentWidth) {
    this.formatter = formatter;
    this.indentWidth = indentWidth;
    this.builder = new StringBuilder();
  }

  public NumberFormatter getFormatter() {
    return formatter;
  }

  /** Appends one line at the current indentation. */
  public ProgramWriter line(String text) {
    builder.append(Strings.repeat(" ", depth * indentWidth)).append(text).append('\n');
    return this;
  }

  /** Appends every line of {@code text}, each at the current indentation. */
  public ProgramWriter lines(String text) {
    if (text.isEmpty()) {
      return this;
    }
    for (String line : text.split("\n", -1)) {
      if (!line.isEmpty()) {
        line(line);
      }
    }
    return this;
  }

  public ProgramWriter indent() {
    depth++;
    return this;
  }

  public ProgramWriter dedent() {
    if (depth == 0) {
      throw new IllegalStateException("ProgramWriter.dedent: already at top level");
    }
    depth--;
    return this;
  }

  public int getDepth() {
    return depth;
  }

  @Override
  public String toString() {
    return builder.toString();
  }

  private final NumberFormatter formatter;
  private final int indentWidth;
  private final StringBuilder builder;
  private int depth = 0;
}
