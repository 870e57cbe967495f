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
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import spwn.common.exceptions.SPWNRuntimeError;

/**
 * Postfix operation on a value: .member, [index] or (arguments)
 */
public class Path {
  public static enum Kind {
    MEMBER,
    INDEX,
    CALL,
  }

  private final Kind kind;
  private final String member;
  private final Expression index;
  private final ImmutableList<Argument> arguments;

  private Path(Kind kind, String member, Expression index,
               ImmutableList<Argument> arguments) {
    this.kind = kind;
    this.member = member;
    this.index = index;
    this.arguments = arguments;
  }

  public static Path member(String name) {
    Preconditions.checkNotNull(name);
    return new Path(Kind.MEMBER, name, null, null);
  }

  public static Path index(Expression index) {
    Preconditions.checkNotNull(index);
    return new Path(Kind.INDEX, null, index, null);
  }

  public static Path call(List<Argument> arguments) {
    return new Path(Kind.CALL, null, null, ImmutableList.copyOf(arguments));
  }

  public Kind getKind() {
    return kind;
  }

  public String getMember() {
    if (kind != Kind.MEMBER) {
      throw new SPWNRuntimeError("getMember() called on " + kind);
    }
    return member;
  }

  public Expression getIndex() {
    if (kind != Kind.INDEX) {
      throw new SPWNRuntimeError("getIndex() called on " + kind);
    }
    return index;
  }

  public List<Argument> getArguments() {
    if (kind != Kind.CALL) {
      throw new SPWNRuntimeError("getArguments() called on " + kind);
    }
    return arguments;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Path)) {
      return false;
    }
    Path other = (Path)obj;
    return kind == other.kind && Objects.equal(member, other.member) &&
           Objects.equal(index, other.index) &&
           Objects.equal(arguments, other.arguments);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(kind, member, index, arguments);
  }

  @Override
  public String toString() {
    switch (kind) {
      case MEMBER:
        return "." + member;
      case INDEX:
        return "[" + index + "]";
      case CALL:
        return "(" + Joiner.on(", ").join(arguments) + ")";
      default:
        throw new SPWNRuntimeError("Unknown path kind " + kind);
    }
  }
}
