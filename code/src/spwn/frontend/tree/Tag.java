/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package spwn.frontend.tree;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

import spwn.common.util.Pair;

/**
 * Native properties attached with #[name(args), ...].  An ordered list
 * rather than a map: names may repeat and the first one wins on lookup.
 */
public class Tag {
  public static final String DESC = "desc";

  public static final Tag EMPTY =
      new Tag(ImmutableList.<Pair<String, ImmutableList<Argument>>>of());

  private final ImmutableList<Pair<String, ImmutableList<Argument>>> tags;

  public Tag(List<Pair<String, ImmutableList<Argument>>> tags) {
    this.tags = ImmutableList.copyOf(tags);
  }

  public List<Pair<String, ImmutableList<Argument>>> getTags() {
    return tags;
  }

  public boolean isEmpty() {
    return tags.isEmpty();
  }

  /**
   * @return arguments of first property with name, or null if absent
   */
  public List<Argument> get(String name) {
    for (Pair<String, ImmutableList<Argument>> tag: tags) {
      if (tag.val1.equals(name)) {
        return tag.val2;
      }
    }
    return null;
  }

  /**
   * Description from #[desc("...")].  If the first argument isn't a
   * string literal, its value's debug rendering is returned instead.
   * @return the description, or null if no desc property or it has
   *        no arguments
   */
  public String getDesc() {
    List<Argument> args = get(DESC);
    if (args == null || args.isEmpty()) {
      return null;
    }
    ValueLiteral first = args.get(0).getValue().getValues().get(0).getValue();
    if (first.getKind() == ValueLiteral.Kind.STRING) {
      return first.getString();
    }
    return first.toString();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Tag && tags.equals(((Tag)obj).tags);
  }

  @Override
  public int hashCode() {
    return tags.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("#[");
    boolean first = true;
    for (Pair<String, ImmutableList<Argument>> tag: tags) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(tag.val1).append('(');
      Joiner.on(", ").appendTo(sb, tag.val2);
      sb.append(')');
    }
    return sb.append(']').toString();
  }
}
