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
package spwn.common.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The lexer or parser rejected the source text.  Holds every message
 * ANTLR reported; the exception message is positioned at the first one.
 */
public class InvalidSyntaxException extends UserException {

  private static final long serialVersionUID = 1060914609057739598L;

  private final ImmutableList<String> parserMessages;

  public InvalidSyntaxException(String file, int line, int col,
                                List<String> parserMessages) {
    super(file, line, col, summarize(parserMessages));
    this.parserMessages = ImmutableList.copyOf(parserMessages);
  }

  public List<String> getParserMessages() {
    return parserMessages;
  }

  private static String summarize(List<String> messages) {
    if (messages.isEmpty()) {
      return "syntax error";
    } else if (messages.size() == 1) {
      return "syntax error: " + messages.get(0);
    } else {
      return "syntax error: " + messages.get(0) + " (and " +
              (messages.size() - 1) + " more)";
    }
  }
}
