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
package exm.splc.ast;

import exm.splc.common.exceptions.SPLRuntimeError;

/**
 * Operators that can appear in SPL terms
 */
public class Operators {

  public static enum OpCategory {
    /** numeric x numeric -> numeric */
    ARITHMETIC,
    /** numeric x numeric -> boolean */
    COMPARISON,
    /** boolean x boolean -> boolean */
    LOGICAL,
  }

  public static enum UnaryOp {
    NEG("neg"),
    NOT("not");

    private final String sourceName;

    private UnaryOp(String sourceName) {
      this.sourceName = sourceName;
    }

    public String sourceName() {
      return sourceName;
    }

    public static UnaryOp fromSourceName(String name) {
      for (UnaryOp op: values()) {
        if (op.sourceName.equals(name)) {
          return op;
        }
      }
      throw new SPLRuntimeError("Unknown unary operator '" + name + "'");
    }
  }

  public static enum BinaryOp {
    EQ("eq", "=", OpCategory.COMPARISON),
    GT(">", ">", OpCategory.COMPARISON),
    OR("or", "OR", OpCategory.LOGICAL),
    AND("and", "AND", OpCategory.LOGICAL),
    PLUS("plus", "+", OpCategory.ARITHMETIC),
    MINUS("minus", "-", OpCategory.ARITHMETIC),
    MULT("mult", "*", OpCategory.ARITHMETIC),
    DIV("div", "/", OpCategory.ARITHMETIC);

    private final String sourceName;
    private final String targetSymbol;
    private final OpCategory category;

    private BinaryOp(String sourceName, String targetSymbol,
                     OpCategory category) {
      this.sourceName = sourceName;
      this.targetSymbol = targetSymbol;
      this.category = category;
    }

    public String sourceName() {
      return sourceName;
    }

    /**
     * @return symbol used for this operator in generated code
     */
    public String targetSymbol() {
      return targetSymbol;
    }

    public OpCategory category() {
      return category;
    }

    public static BinaryOp fromSourceName(String name) {
      for (BinaryOp op: values()) {
        if (op.sourceName.equals(name)) {
          return op;
        }
      }
      throw new SPLRuntimeError("Unknown binary operator '" + name + "'");
    }
  }
}
