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

import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import spwn.ast.SpwnAST;
import spwn.common.exceptions.SPWNRuntimeError;
import spwn.common.exceptions.UserException;
import spwn.frontend.RuleKind;
import spwn.frontend.TreeBuilder;

/**
 * Macro parameter
 */
public class ArgDef {
  private final String name;
  private final Expression defaultValue;
  private final Tag properties;
  private final Expression type;

  public ArgDef(String name, Expression defaultValue, Tag properties,
                Expression type) {
    Preconditions.checkNotNull(name);
    Preconditions.checkNotNull(properties);
    this.name = name;
    this.defaultValue = defaultValue;
    this.properties = properties;
    this.type = type;
  }

  public static ArgDef required(String name) {
    return new ArgDef(name, null, Tag.EMPTY, null);
  }

  public String getName() {
    return name;
  }

  /**
   * @return default value, or null if the argument is required
   */
  public Expression getDefaultValue() {
    return defaultValue;
  }

  public Tag getProperties() {
    return properties;
  }

  /**
   * @return type annotation, e.g. @number, or null if untyped
   */
  public Expression getType() {
    return type;
  }

  public static ArgDef fromAST(TreeBuilder builder, SpwnAST tree)
      throws UserException {
    assert(RuleKind.of(tree) == RuleKind.ARG_DEF);
    if (tree.childCount() < 1 ||
        RuleKind.of(tree.child(0)) != RuleKind.SYMBOL) {
      throw new SPWNRuntimeError("argument definition must start with name");
    }
    String name = tree.child(0).getText();
    Expression defaultValue = null;
    Expression type = null;
    int tagStart = 1;
    for (SpwnAST part: tree.children(1)) {
      RuleKind kind = RuleKind.of(part);
      if (kind == RuleKind.ARG_TYPE) {
        type = builder.expression(part.child(0));
      } else if (kind == RuleKind.ARG_DEFAULT) {
        defaultValue = builder.expression(part.child(0));
      } else {
        break;
      }
      tagStart++;
    }
    Tag properties = builder.tags(tree.children(tagStart));
    return new ArgDef(name, defaultValue, properties, type);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ArgDef)) {
      return false;
    }
    ArgDef other = (ArgDef)obj;
    return name.equals(other.name) &&
           Objects.equal(defaultValue, other.defaultValue) &&
           properties.equals(other.properties) &&
           Objects.equal(type, other.type);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(name, defaultValue, properties, type);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (!properties.isEmpty()) {
      sb.append(properties).append(' ');
    }
    sb.append(name);
    if (type != null) {
      sb.append(": ").append(type);
    }
    if (defaultValue != null) {
      sb.append(" = ").append(defaultValue);
    }
    return sb.toString();
  }
}
