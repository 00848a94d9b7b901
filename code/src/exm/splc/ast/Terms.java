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

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.splc.ast.Operators.BinaryOp;
import exm.splc.ast.Operators.UnaryOp;

/**
 * Expression nodes: terms, atoms and literals
 */
public class Terms {

  public static interface TermVisitor<T> {
    public T visitAtom(TermAtom term);
    public T visitUnary(TermUnary term);
    public T visitBinary(TermBinary term);
  }

  public static interface AtomVisitor<T> {
    public T visitVar(VarRef var);
    public T visitNumber(NumberLit num);
  }

  public static abstract class Term extends Node {
    protected Term(int id) {
      super(id);
    }

    public abstract <T> T accept(TermVisitor<T> visitor);
  }

  public static class TermAtom extends Term {
    private final Atom atom;

    public TermAtom(int id, Atom atom) {
      super(id);
      this.atom = atom;
    }

    public Atom getAtom() {
      return atom;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
      return visitor.visitAtom(this);
    }

    @Override
    public List<Atom> children() {
      return ImmutableList.of(atom);
    }

    @Override
    public String describe() {
      return "TermAtom";
    }
  }

  public static class TermUnary extends Term {
    private final UnaryOp op;
    private final Term operand;

    public TermUnary(int id, UnaryOp op, Term operand) {
      super(id);
      this.op = op;
      this.operand = operand;
    }

    public UnaryOp getOp() {
      return op;
    }

    public Term getOperand() {
      return operand;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
      return visitor.visitUnary(this);
    }

    @Override
    public List<Term> children() {
      return ImmutableList.of(operand);
    }

    @Override
    public String describe() {
      return "TermUnary " + op.sourceName();
    }
  }

  public static class TermBinary extends Term {
    private final Term left;
    private final BinaryOp op;
    private final Term right;

    public TermBinary(int id, Term left, BinaryOp op, Term right) {
      super(id);
      this.left = left;
      this.op = op;
      this.right = right;
    }

    public Term getLeft() {
      return left;
    }

    public BinaryOp getOp() {
      return op;
    }

    public Term getRight() {
      return right;
    }

    @Override
    public <T> T accept(TermVisitor<T> visitor) {
      return visitor.visitBinary(this);
    }

    @Override
    public List<Term> children() {
      return ImmutableList.of(left, right);
    }

    @Override
    public String describe() {
      return "TermBinary " + op.sourceName();
    }
  }

  /**
   * Variable reference or number literal: the only shapes allowed as
   * call arguments and function return values
   */
  public static abstract class Atom extends Node {
    protected Atom(int id) {
      super(id);
    }

    public abstract <T> T accept(AtomVisitor<T> visitor);

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }
  }

  public static class VarRef extends Atom {
    private final String name;

    public VarRef(int id, String name) {
      super(id);
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public <T> T accept(AtomVisitor<T> visitor) {
      return visitor.visitVar(this);
    }

    @Override
    public String describe() {
      return "VarRef " + name;
    }
  }

  public static class NumberLit extends Atom {
    private final long value;

    public NumberLit(int id, long value) {
      super(id);
      this.value = value;
    }

    public long getValue() {
      return value;
    }

    @Override
    public <T> T accept(AtomVisitor<T> visitor) {
      return visitor.visitNumber(this);
    }

    @Override
    public String describe() {
      return "NumberLit " + value;
    }
  }

  /**
   * String literal.  Only valid as the argument of print.
   */
  public static class StringLit extends Node {
    private final String value;

    public StringLit(int id, String value) {
      super(id);
      this.value = value;
    }

    public String getValue() {
      return value;
    }

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }

    @Override
    public String describe() {
      return "StringLit \"" + value + "\"";
    }
  }
}
