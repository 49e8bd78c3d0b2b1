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

package org.optmodel.symbolic;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.optmodel.NumberFormatter;
import org.optmodel.core.Key;

/** A set written out member by member: {@code {1,2}} or {@code {<1,'a'>,<2,'b'>}}. */
public final class LiteralSet implements SetDomain {
  public static LiteralSet of(List<Key> members) {
    if (members.isEmpty()) {
      return new LiteralSet(ImmutableList.of(), 1);
    }
    int dimension = members.get(0).size();
    for (Key key : members) {
      if (key.size() != dimension) {
        throw new IllegalArgumentException(
            "LiteralSet.of: members have different dimensions: " + members);
      }
    }
    return new LiteralSet(ImmutableList.copyOf(members), dimension);
  }

  /** Returns a one-dimensional set of the given values. */
  public static LiteralSet ofValues(Iterable<?> values) {
    List<Key> keys = new ArrayList<>();
    for (Object value : values) {
      keys.add(Key.from(value));
    }
    return of(keys);
  }

  private LiteralSet(ImmutableList<Key> members, int dimension) {
    this.members = members;
    this.dimension = dimension;
  }

  public ImmutableList<Key> getMembers() {
    return members;
  }

  @Override
  public String renderDomain(NumberFormatter formatter) {
    List<String> rendered = new ArrayList<>();
    for (Key key : members) {
      rendered.add(key.size() == 1 ? key.render(formatter) : "<" + key.render(formatter) + ">");
    }
    return "{" + String.join(",", rendered) + "}";
  }

  @Override
  public int getDimension() {
    return dimension;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof LiteralSet && members.equals(((LiteralSet) o).members);
  }

  @Override
  public int hashCode() {
    return members.hashCode();
  }

  private final ImmutableList<Key> members;
  private final int dimension;
}
