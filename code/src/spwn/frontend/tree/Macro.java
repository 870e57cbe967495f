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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import spwn.ast.SpwnAST;
import spwn.common.exceptions.SPWNRuntimeError;
import spwn.common.exceptions.UserException;
import spwn.frontend.RuleKind;
import spwn.frontend.TreeBuilder;

/**
 * Macro literal: (args) { body }
 */
public class Macro {
  private final ImmutableList<ArgDef> args;
  private final CompoundStatement body;
  private final Tag properties;

  public Macro(List<ArgDef> args, CompoundStatement body, Tag properties) {
    this.args = ImmutableList.copyOf(args);
    this.body = body;
    this.properties = properties;
  }

  public List<ArgDef> getArgs() {
    return args;
  }

  public CompoundStatement getBody() {
    return body;
  }

  public Tag getProperties() {
    return properties;
  }

  public static Macro fromAST(TreeBuilder builder, SpwnAST tree)
      throws UserException {
    int count = tree.getChildCount();
    if (count < 2 || RuleKind.of(tree.child(0)) != RuleKind.ARG_DEFS) {
      throw new SPWNRuntimeError("macro: expected argument list and body");
    }
    List<ArgDef> args = new ArrayList<ArgDef>();
    for (SpwnAST argTree: tree.child(0).children()) {
      args.add(ArgDef.fromAST(builder, argTree));
    }
    CompoundStatement body = new CompoundStatement(
                          builder.statements(tree.child(1).children()));
    Tag properties = builder.tags(tree.children(2));
    return new Macro(args, body, properties);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Macro)) {
      return false;
    }
    Macro other = (Macro)obj;
    return args.equals(other.args) && body.equals(other.body) &&
           properties.equals(other.properties);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(args, body, properties);
  }

  @Override
  public String toString() {
    return "(" + Joiner.on(", ").join(args) + ") " + body;
  }
}
