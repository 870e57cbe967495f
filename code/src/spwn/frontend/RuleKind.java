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

import java.util.HashMap;
import java.util.Map;

import spwn.ast.SpwnAST;
import spwn.ast.antlr.SPWNParser;

/**
 * Parse tree node types understood by the tree builder.  Any other
 * token type maps to UNKNOWN.
 */
public enum RuleKind {
  PROGRAM(SPWNParser.PROGRAM),
  BLOCK(SPWNParser.BLOCK),
  CONTEXT_FORK(SPWNParser.CONTEXT_FORK),

  // Statements
  DEFINITION(SPWNParser.DEFINITION),
  CALL(SPWNParser.CALL),
  IF_STMT(SPWNParser.IF_STMT),
  FOR_LOOP(SPWNParser.FOR_LOOP),
  RETURN_STMT(SPWNParser.RETURN_STMT),
  IMPLEMENT(SPWNParser.IMPLEMENT),
  ADD_OBJECT(SPWNParser.ADD_OBJECT),
  ERROR_STMT(SPWNParser.ERROR_STMT),
  EXTRACT_STMT(SPWNParser.EXTRACT_STMT),
  TYPE_DEF(SPWNParser.TYPE_DEF),
  END_OF_INPUT(SPWNParser.END_OF_INPUT),

  // Expressions
  EXPRESSION(SPWNParser.EXPRESSION),
  OPERATOR(SPWNParser.OPERATOR),
  UNARY_OP(SPWNParser.UNARY_OP),
  VARIABLE(SPWNParser.VARIABLE),

  // Values
  VALUE_LITERAL(SPWNParser.VALUE_LITERAL),
  HANDLE_ID(SPWNParser.HANDLE_ID),
  NUMBER_LIT(SPWNParser.NUMBER_LIT),
  BOOL_LIT(SPWNParser.BOOL_LIT),
  STRING_LIT(SPWNParser.STRING_LIT),
  NULL_LIT(SPWNParser.NULL_LIT),
  SYMBOL(SPWNParser.SYMBOL),
  TYPE_INDICATOR(SPWNParser.TYPE_INDICATOR),
  IMPORT_LIT(SPWNParser.IMPORT_LIT),
  ARRAY(SPWNParser.ARRAY),
  OBJECT(SPWNParser.OBJECT),
  OBJECT_PROP(SPWNParser.OBJECT_PROP),
  DICTIONARY(SPWNParser.DICTIONARY),
  DICT_ENTRY(SPWNParser.DICT_ENTRY),
  DICT_EXTRACT(SPWNParser.DICT_EXTRACT),
  CMP_STMT(SPWNParser.CMP_STMT),
  MACRO_DEF(SPWNParser.MACRO_DEF),
  ARG_DEFS(SPWNParser.ARG_DEFS),
  ARG_DEF(SPWNParser.ARG_DEF),
  ARG_TYPE(SPWNParser.ARG_TYPE),
  ARG_DEFAULT(SPWNParser.ARG_DEFAULT),
  NATIVE_TAG(SPWNParser.NATIVE_TAG),

  // Paths
  INDEX(SPWNParser.INDEX),
  ARGUMENTS(SPWNParser.ARGUMENTS),
  ARGUMENT(SPWNParser.ARGUMENT),

  UNKNOWN(-1),
  ;

  private static final Map<Integer, RuleKind> byTokenType =
                                      new HashMap<Integer, RuleKind>();
  static {
    for (RuleKind kind: values()) {
      if (kind != UNKNOWN) {
        byTokenType.put(kind.tokenType, kind);
      }
    }
  }

  private final int tokenType;

  private RuleKind(int tokenType) {
    this.tokenType = tokenType;
  }

  public int tokenType() {
    return tokenType;
  }

  public static RuleKind of(int tokenType) {
    RuleKind kind = byTokenType.get(tokenType);
    return kind == null ? UNKNOWN : kind;
  }

  public static RuleKind of(SpwnAST tree) {
    return of(tree.getType());
  }
}
