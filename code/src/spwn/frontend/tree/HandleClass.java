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
 * Categories of addressable handles, written as a suffix on
 * a handle literal, e.g. 10g or ?c
 */
public enum HandleClass {
  GROUP("g"),
  COLOR("c"),
  ITEM("i"),
  BLOCK("b"),
  ;

  private final String suffix;

  private HandleClass(String suffix) {
    this.suffix = suffix;
  }

  public String suffix() {
    return suffix;
  }

  /**
   * @return the class, or null if not a known suffix
   */
  public static HandleClass fromSuffix(String suffix) {
    for (HandleClass c: values()) {
      if (c.suffix.equals(suffix)) {
        return c;
      }
    }
    return null;
  }
}
