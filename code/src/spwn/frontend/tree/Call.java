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

import spwn.ast.SpwnAST;
import spwn.common.exceptions.SPWNRuntimeError;
import spwn.common.exceptions.UserException;
import spwn.frontend.TreeBuilder;

public class Call {
  private final Variable function;

  public Call(Variable function) {
    if (!function.endsWithCall()) {
      throw new SPWNRuntimeError("call statement must end with arguments: " +
                                 function);
    }
    this.function = function;
  }

  public Variable getFunction() {
    return function;
  }

  public static Call fromAST(TreeBuilder builder, SpwnAST tree)
      throws UserException {
    if (tree.getChildCount() != 1) {
      throw new SPWNRuntimeError("call: expected one child but got " +
                                 tree.getChildCount());
    }
    return new Call(builder.variable(tree.child(0)));
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Call && function.equals(((Call)obj).function);
  }

  @Override
  public int hashCode() {
    return function.hashCode();
  }

  @Override
  public String toString() {
    return function.toString();
  }
}
