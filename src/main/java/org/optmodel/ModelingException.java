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

/**
 * Thrown when an expression, variable, constraint or objective cannot be built.
 *
 * <p>Raised synchronously at construction time, never deferred to rendering.
 */
public class ModelingException extends RuntimeException {
  public ModelingException(String methodName, String msg) {
    super(methodName + ": " + msg);
  }

  public ModelingException(String methodName, String msg, Throwable cause) {
    super(methodName + ": " + msg, cause);
  }
}
