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

public class If {

  private final Expression condition;
  private final ImmutableList<Statement> ifBody;
  private final ImmutableList<Statement> elseBody;

  public If(Expression condition, List<Statement> ifBody,
            List<Statement> elseBody) {
    this.condition = condition;
    this.ifBody = ImmutableList.copyOf(ifBody);
    this.elseBody = elseBody == null ? null : ImmutableList.copyOf(elseBody);
  }

  public Expression getCondition() {
    return condition;
  }

  public List<Statement> getIfBody() {
    return ifBody;
  }

  /**
   * @return else statements, or null if no else.  An else if is a
   *          single If statement.
   */
  public List<Statement> getElseBody() {
    return elseBody;
  }

  public boolean hasElse() {
    return elseBody != null;
  }

  public static If fromAST(TreeBuilder builder, SpwnAST tree)
      throws UserException {
    int count = tree.getChildCount();
    if (count < 2 || count > 3)
      throw new SPWNRuntimeError("if: child count > 3 or < 2");
    Expression condition = builder.expression(tree.child(0));
    List<Statement> ifBody = builder.statements(tree.child(1).children());

    boolean hasElse = (count == 3);
    List<Statement> elseBody = hasElse ?
              builder.statements(tree.child(2).children()) : null;

    return new If(condition, ifBody, elseBody);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof If)) {
      return false;
    }
    If other = (If)obj;
    return condition.equals(other.condition) && ifBody.equals(other.ifBody)
        && Objects.equal(elseBody, other.elseBody);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(condition, ifBody, elseBody);
  }

  @Override
  public String toString() {
    String s = "if " + condition + " {" + Joiner.on("; ").join(ifBody) + "}";
    if (elseBody != null) {
      s += " else {" + Joiner.on("; ").join(elseBody) + "}";
    }
    return s;
  }
}
