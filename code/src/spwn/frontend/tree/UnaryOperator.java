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

/**
 * Prefix operators on a single operand
 */
public enum UnaryOperator {
  NOT("!"),
  NEGATE("-"),
  /** ..x: range from the start */
  RANGE_FROM(".."),
  ;

  private final String token;

  private UnaryOperator(String token) {
    this.token = token;
  }

  public String token() {
    return token;
  }

  /**
   * @return the operator, or null if not a prefix operator
   */
  public static UnaryOperator fromToken(String token) {
    for (UnaryOperator op: values()) {
      if (op.token.equals(token)) {
        return op;
      }
    }
    return null;
  }
}
