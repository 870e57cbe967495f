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
package spwn.frontend;

import spwn.ast.FilePosition;

/**
 * Non-fatal problem found while building the tree.  The builder
 * substitutes a placeholder and carries on.
 */
public class Diagnostic {
  public static enum Kind {
    /** Node type the builder has no handling for */
    UNSUPPORTED_CONSTRUCT,
    /** Well-formed literal with an unusable value */
    INVALID_LITERAL,
  }

  public final Kind kind;
  /** Grammar name of the node type */
  public final String ruleName;
  public final FilePosition position;
  public final String message;

  public Diagnostic(Kind kind, String ruleName, FilePosition position,
                    String message) {
    this.kind = kind;
    this.ruleName = ruleName;
    this.position = position;
    this.message = message;
  }

  @Override
  public String toString() {
    return position + ": " + message + " [" + ruleName + "]";
  }
}
