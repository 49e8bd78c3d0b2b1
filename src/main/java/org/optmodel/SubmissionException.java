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

/** Exception raised when the remote engine rejects or fails a submission. */
public class SubmissionException extends RuntimeException {
  public SubmissionException(String methodName, String diagnostic) {
    super(methodName + ": " + diagnostic);
    this.diagnostic = diagnostic;
  }

  public SubmissionException(String methodName, String diagnostic, Throwable cause) {
    super(methodName + ": " + diagnostic, cause);
    this.diagnostic = diagnostic;
  }

  /** Returns the raw diagnostic reported by the engine or the transport. */
  public String getDiagnostic() {
    return diagnostic;
  }

  private final String diagnostic;
}
