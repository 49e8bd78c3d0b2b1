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

package org.optmodel.session;

/**
 * Connection to the remote optimization engine.
 *
 * <p>The modeling layer does not manage the connection lifecycle, authentication or retries: it
 * hands over one submission and blocks until the response arrives. Implementations report
 * transport failures by throwing or by returning an unsuccessful {@link EngineResponse}.
 */
public interface Session {
  /** Runs {@code submission} on the engine and returns its response. */
  EngineResponse submit(Submission submission);
}
