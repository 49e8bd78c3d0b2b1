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

package org.optmodel.core;

import org.optmodel.NumberFormatter;
import org.optmodel.ProgramWriter;

/** A named component emitted as a declaration in generated code. */
public interface Declaration extends ProgramElement {
  String getName();

  /** Returns the declaration text, one statement per line. */
  String toDeclaration(NumberFormatter formatter);

  @Override
  default void writeTo(ProgramWriter out) {
    out.lines(toDeclaration(out.getFormatter()));
  }
}
