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

import com.google.common.base.Preconditions;

/**
 * error expr: reports the message when the program runs
 */
public class ErrorRaise {
  private final Expression message;

  public ErrorRaise(Expression message) {
    this.message = Preconditions.checkNotNull(message);
  }

  public Expression getMessage() {
    return message;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ErrorRaise &&
           message.equals(((ErrorRaise)obj).message);
  }

  @Override
  public int hashCode() {
    return message.hashCode();
  }

  @Override
  public String toString() {
    return "error " + message;
  }
}
