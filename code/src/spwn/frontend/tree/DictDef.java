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

import spwn.common.exceptions.SPWNRuntimeError;

/**
 * Dictionary entry: name: value, or ..value to copy in the entries
 * of another dictionary
 */
public class DictDef {
  public static enum Kind {
    DEF,
    EXTRACT,
  }

  private final Kind kind;
  private final String name;
  private final Expression value;

  private DictDef(Kind kind, String name, Expression value) {
    Preconditions.checkNotNull(value);
    this.kind = kind;
    this.name = name;
    this.value = value;
  }

  public static DictDef def(String name, Expression value) {
    Preconditions.checkNotNull(name);
    return new DictDef(Kind.DEF, name, value);
  }

  public static DictDef extract(Expression value) {
    return new DictDef(Kind.EXTRACT, null, value);
  }

  public Kind getKind() {
    return kind;
  }

  public String getName() {
    if (kind != Kind.DEF) {
      throw new SPWNRuntimeError("extract entry has no name");
    }
    return name;
  }

  public Expression getValue() {
    return value;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DictDef)) {
      return false;
    }
    DictDef other = (DictDef)obj;
    return kind == other.kind && Objects.equal(name, other.name) &&
           value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, name, value);
  }

  @Override
  public String toString() {
    return kind == Kind.DEF ? name + ": " + value : ".." + value;
  }
}
