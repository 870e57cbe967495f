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
import com.google.common.collect.ImmutableList;

import spwn.ast.SpwnAST;
import spwn.common.exceptions.SPWNRuntimeError;
import spwn.common.exceptions.UserException;
import spwn.frontend.TreeBuilder;

/**
 * impl @type { members }: adds members to a type
 */
public class Implementation {
  private final Variable symbol;
  private final ImmutableList<DictDef> members;

  public Implementation(Variable symbol, List<DictDef> members) {
    this.symbol = symbol;
    this.members = ImmutableList.copyOf(members);
  }

  public Variable getSymbol() {
    return symbol;
  }

  public List<DictDef> getMembers() {
    return members;
  }

  public static Implementation fromAST(TreeBuilder builder, SpwnAST tree)
      throws UserException {
    if (tree.getChildCount() != 2) {
      throw new SPWNRuntimeError("impl: expected 2 children but got " +
                                 tree.getChildCount());
    }
    Variable symbol = builder.variable(tree.child(0));
    List<DictDef> members = builder.dictionary(tree.child(1));
    return new Implementation(symbol, members);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Implementation)) {
      return false;
    }
    Implementation other = (Implementation)obj;
    return symbol.equals(other.symbol) && members.equals(other.members);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(symbol, members);
  }

  @Override
  public String toString() {
    return "impl " + symbol + " {" + Joiner.on(", ").join(members) + "}";
  }
}
