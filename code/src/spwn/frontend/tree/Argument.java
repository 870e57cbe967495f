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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * Call or tag argument: positional, or keyword if it has a name
 */
public class Argument {
  private final String name;
  private final Expression value;

  public Argument(String name, Expression value) {
    Preconditions.checkNotNull(value);
    this.name = name;
    this.value = value;
  }

  public static Argument positional(Expression value) {
    return new Argument(null, value);
  }

  public static Argument keyword(String name, Expression value) {
    Preconditions.checkNotNull(name);
    return new Argument(name, value);
  }

  /**
   * @return keyword, or null if positional
   */
  public String getName() {
    return name;
  }

  public Expression getValue() {
    return value;
  }

  public boolean isKeyword() {
    return name != null;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Argument)) {
      return false;
    }
    Argument other = (Argument)obj;
    return Objects.equal(name, other.name) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, value);
  }

  @Override
  public String toString() {
    return name == null ? value.toString() : name + " = " + value;
  }
}
