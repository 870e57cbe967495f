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

import java.util.HashMap;
import java.util.Map;

/**
 * Binary and assignment operators.  Which operators share an
 * Expression is decided by the grammar's precedence tiers.
 */
public enum Operator {
  OR("||"),
  AND("&&"),
  EQUAL("=="),
  NOT_EQUAL("!="),
  RANGE(".."),
  MORE_OR_EQUAL(">="),
  LESS_OR_EQUAL("<="),
  MORE(">"),
  LESS("<"),
  DIVIDE("/"),
  MULTIPLY("*"),
  POWER("^"),
  PLUS("+"),
  MINUS("-"),
  MODULO("%"),
  ASSIGN("="),
  ADD_ASSIGN("+="),
  SUBTRACT_ASSIGN("-="),
  MULTIPLY_ASSIGN("*="),
  DIVIDE_ASSIGN("/="),
  ;

  private static final Map<String, Operator> byToken =
                                      new HashMap<String, Operator>();
  static {
    for (Operator op: values()) {
      byToken.put(op.token, op);
    }
  }

  private final String token;

  private Operator(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  public boolean isAssignment() {
    switch (this) {
      case ASSIGN:
      case ADD_ASSIGN:
      case SUBTRACT_ASSIGN:
      case MULTIPLY_ASSIGN:
      case DIVIDE_ASSIGN:
        return true;
      default:
        return false;
    }
  }

  /**
   * @param token source text of operator
   * @return the operator, or null if not an operator
   */
  public static Operator fromToken(String token) {
    return byToken.get(token);
  }
}
