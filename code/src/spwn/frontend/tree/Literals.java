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

import org.apache.commons.lang3.StringUtils;

/**
 * Conversion of literal token text to values
 */
public class Literals {

  /**
   * Contents of a string literal.  Every double quote character in the
   * token is deleted, including escaped ones; other escape sequences are
   * kept as written.  E.g. "say \"hi\"" becomes say \hi\
   */
  public static String strContent(String text) {
    return StringUtils.remove(text, '"');
  }

  /**
   * @throws NumberFormatException if not a decimal number
   */
  public static double parseNumber(String text) {
    return Double.parseDouble(text);
  }

  /**
   * Parse the number part of a handle literal
   * @return the number, or null if invalid or out of range
   */
  public static Integer parseHandleNumber(String text) {
    if (!StringUtils.isNumeric(text)) {
      return null;
    }
    try {
      int number = Integer.parseInt(text);
      if (number > HandleID.MAX_NUMBER) {
        return null;
      }
      return number;
    } catch (NumberFormatException e) {
      // Too long for int
      return null;
    }
  }

  public static boolean parseBool(String text) {
    return "true".equals(text);
  }
}
