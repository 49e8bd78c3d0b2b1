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

import org.optmodel.NumberFormatter;
import org.optmodel.ProgramWriter;
import org.optmodel.core.ProgramElement;

/** An executable statement of a generated program, as opposed to a declaration. */
public interface Statement extends ProgramElement {
  /** Returns the statement text at top-level indentation, without a trailing newline. */
  default String toText(NumberFormatter formatter) {
    ProgramWriter out = new ProgramWriter(formatter, 3);
    writeTo(out);
    String text = out.toString();
    return text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
  }

  /** Refuses further additions to the nested bodies of this statement, if any. */
  default void seal() {}
}
