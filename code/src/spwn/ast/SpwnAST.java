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
package spwn.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;
import org.antlr.runtime.tree.Tree;

import spwn.ast.antlr.SPWNParser;

/**
 * Parse tree node produced by the SPWN grammar.  The node type is the
 * token type of one of the grammar's tree node tokens.
 */
public class SpwnAST extends CommonTree {

  public SpwnAST(Token t) {
    super(t);
  }

  public SpwnAST(SpwnAST node) {
    super(node);
  }

  @Override
  public Tree dupNode() {
    return new SpwnAST(this);
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * SpwnAST everywhere
   */
  public SpwnAST child(int i) {
    return (SpwnAST)super.getChild(i);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<SpwnAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  public List<SpwnAST> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children().subList(start, children.size());
  }

  /**
   * @return greatest line number of any token in this subtree
   */
  public int lastLine() {
    int max = getLine();
    ArrayList<SpwnAST> stack = new ArrayList<SpwnAST>(children());
    while (!stack.isEmpty()) {
      SpwnAST tree = stack.remove(stack.size() - 1);
      max = Math.max(max, tree.getLine());
      stack.addAll(tree.children());
    }
    return max;
  }

  /**
   * @return name of node type from grammar
   */
  public String typeName() {
    int type = getType();
    if (type < 0 || type >= SPWNParser.tokenNames.length) {
      return "<" + type + ">";
    }
    return SPWNParser.tokenNames[type];
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.print(typeName());
    if (childCount() == 0 && getText() != null) {
      writer.print(" ");
      writer.print(getText());
    }
    writer.println();
    for (int i = 0; i < this.getChildCount(); i++)
      this.child(i).printTree(writer, indent+2);
  }

  public static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }
}
