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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * The single response of the engine to a submission: a success flag, the raw diagnostic and one
 * result block per {@code solve} or {@code print} statement, in program order.
 */
public final class EngineResponse {
  public static EngineResponse success(List<ResultBlock> blocks) {
    return new EngineResponse(true, "", ImmutableList.copyOf(blocks));
  }

  public static EngineResponse success(ResultBlock... blocks) {
    return new EngineResponse(true, "", ImmutableList.copyOf(blocks));
  }

  public static EngineResponse failure(String diagnostic) {
    return new EngineResponse(false, diagnostic, ImmutableList.of());
  }

  private EngineResponse(boolean successful, String diagnostic,
      ImmutableList<ResultBlock> blocks) {
    this.successful = successful;
    this.diagnostic = diagnostic;
    this.blocks = blocks;
  }

  public boolean isSuccessful() {
    return successful;
  }

  /** Returns the raw engine diagnostic, empty on success. */
  public String getDiagnostic() {
    return diagnostic;
  }

  public ImmutableList<ResultBlock> getBlocks() {
    return blocks;
  }

  private final boolean successful;
  private final String diagnostic;
  private final ImmutableList<ResultBlock> blocks;
}
