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

import java.util.Objects;
import org.optmodel.NumberFormatter;
import org.optmodel.UnsupportedModelException;

/**
 * A reference to a member of an indexed family whose members are resolved on the remote engine,
 * e.g. {@code x[i]} for an abstract variable group or {@code cap[i, 'a']} for a parameter group.
 */
public final class IndexedReference implements Term, ExpressionArgument {
  public IndexedReference(Declaration owner, Key key) {
    this.owner = owner;
    this.key = key;
  }

  public Declaration getOwner() {
    return owner;
  }

  public Key getKey() {
    return key;
  }

  @Override
  public String render(NumberFormatter formatter) {
    return owner.getName() + "[" + key.render(formatter) + "]";
  }

  @Override
  public double evaluate() {
    throw new UnsupportedModelException(
        "IndexedReference.evaluate",
        owner.getName() + "[" + key.toName() + "] is only known on the engine");
  }

  @Override
  public boolean isSymbolic() {
    return true;
  }

  @Override
  public Expression toExpression() {
    return Expression.of(this);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof IndexedReference)) {
      return false;
    }
    IndexedReference other = (IndexedReference) o;
    return owner == other.owner && key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(owner), key);
  }

  @Override
  public String toString() {
    return owner.getName() + "[" + key.toName() + "]";
  }

  private final Declaration owner;
  private final Key key;
}
