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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.splc.ast.Instructions.Assign;
import exm.splc.ast.Instructions.Branch;
import exm.splc.ast.Instructions.Call;
import exm.splc.ast.Instructions.DoUntilLoop;
import exm.splc.ast.Instructions.Halt;
import exm.splc.ast.Instructions.Instruction;
import exm.splc.ast.Instructions.Print;
import exm.splc.ast.Instructions.WhileLoop;
import exm.splc.ast.Operators.BinaryOp;
import exm.splc.ast.Operators.UnaryOp;
import exm.splc.ast.Terms.Atom;
import exm.splc.ast.Terms.NumberLit;
import exm.splc.ast.Terms.StringLit;
import exm.splc.ast.Terms.Term;
import exm.splc.ast.Terms.TermAtom;
import exm.splc.ast.Terms.TermBinary;
import exm.splc.ast.Terms.TermUnary;
import exm.splc.ast.Terms.VarRef;
import exm.splc.common.exceptions.SPLRuntimeError;
import exm.splc.common.util.Counter;

/**
 * Constructs syntax trees, giving each node a fresh identity.  One builder
 * should be used per tree so that ids are unique within the tree.
 */
public class ASTBuilder {
  private final Counter nodeIds = new Counter();

  private int nextId() {
    return nodeIds.nextInt();
  }

  /**
   * @return number of nodes created so far
   */
  public int nodeCount() {
    return (int)nodeIds.peek() - 1;
  }

  public Program program(List<String> globals, List<ProcDef> procs,
                         List<FuncDef> funcs, MainBlock main) {
    return new Program(nextId(), globals, procs, funcs, main);
  }

  /**
   * Program without any procedures or functions
   */
  public Program program(List<String> globals, MainBlock main) {
    return program(globals, Collections.<ProcDef>emptyList(),
                   Collections.<FuncDef>emptyList(), main);
  }

  public ProcDef proc(String name, List<String> params, Body body) {
    checkMax("parameters of " + name, params, RoutineDef.MAX_PARAMS);
    return new ProcDef(nextId(), name, params, body);
  }

  public FuncDef func(String name, List<String> params, Body body,
                      Atom returnAtom) {
    checkMax("parameters of " + name, params, RoutineDef.MAX_PARAMS);
    return new FuncDef(nextId(), name, params, body, returnAtom);
  }

  public Body body(List<String> locals, Algo algo) {
    checkMax("locals", locals, Body.MAX_LOCALS);
    return new Body(nextId(), locals, algo);
  }

  public MainBlock main(List<String> variables, Algo algo) {
    return new MainBlock(nextId(), variables, algo);
  }

  public Algo algo(Instruction... instructions) {
    return algo(Arrays.asList(instructions));
  }

  public Algo algo(List<? extends Instruction> instructions) {
    return new Algo(nextId(), instructions);
  }

  public Halt halt() {
    return new Halt(nextId());
  }

  public Print print(Atom atom) {
    return new Print(nextId(), atom);
  }

  public Print printString(String value) {
    return new Print(nextId(), str(value));
  }

  /**
   * Argument count is not limited here: the type checker reports
   * over-long argument lists
   */
  public Call call(String name, Atom... args) {
    return new Call(nextId(), name, Arrays.asList(args));
  }

  public Assign assign(String target, Term value) {
    return new Assign(nextId(), target, value);
  }

  public Assign assignCall(String target, String function, Atom... args) {
    Call call = call(function, args);
    return new Assign(nextId(), target, call);
  }

  public WhileLoop whileLoop(Term condition, Algo body) {
    return new WhileLoop(nextId(), condition, body);
  }

  public DoUntilLoop doUntil(Algo body, Term condition) {
    return new DoUntilLoop(nextId(), body, condition);
  }

  public Branch branch(Term condition, Algo thenBlock) {
    return branch(condition, thenBlock, null);
  }

  public Branch branch(Term condition, Algo thenBlock, Algo elseBlock) {
    return new Branch(nextId(), condition, thenBlock, elseBlock);
  }

  public VarRef var(String name) {
    return new VarRef(nextId(), name);
  }

  public NumberLit num(long value) {
    return new NumberLit(nextId(), value);
  }

  public StringLit str(String value) {
    return new StringLit(nextId(), value);
  }

  public TermAtom term(Atom atom) {
    return new TermAtom(nextId(), atom);
  }

  /**
   * Shorthand for a term consisting of a variable reference
   */
  public TermAtom v(String name) {
    return term(var(name));
  }

  /**
   * Shorthand for a term consisting of a number literal
   */
  public TermAtom n(long value) {
    return term(num(value));
  }

  public TermUnary unary(UnaryOp op, Term operand) {
    return new TermUnary(nextId(), op, operand);
  }

  public TermUnary neg(Term operand) {
    return unary(UnaryOp.NEG, operand);
  }

  public TermUnary not(Term operand) {
    return unary(UnaryOp.NOT, operand);
  }

  public TermBinary binary(Term left, BinaryOp op, Term right) {
    return new TermBinary(nextId(), left, op, right);
  }

  public TermBinary eq(Term left, Term right) {
    return binary(left, BinaryOp.EQ, right);
  }

  public TermBinary gt(Term left, Term right) {
    return binary(left, BinaryOp.GT, right);
  }

  public TermBinary and(Term left, Term right) {
    return binary(left, BinaryOp.AND, right);
  }

  public TermBinary or(Term left, Term right) {
    return binary(left, BinaryOp.OR, right);
  }

  public TermBinary plus(Term left, Term right) {
    return binary(left, BinaryOp.PLUS, right);
  }

  public TermBinary minus(Term left, Term right) {
    return binary(left, BinaryOp.MINUS, right);
  }

  public TermBinary mult(Term left, Term right) {
    return binary(left, BinaryOp.MULT, right);
  }

  public TermBinary div(Term left, Term right) {
    return binary(left, BinaryOp.DIV, right);
  }

  /**
   * The grammar bounds parameter and local lists, so a longer list means
   * a broken parser
   */
  private static void checkMax(String what, List<?> items, int max) {
    if (items.size() > max) {
      throw new SPLRuntimeError("At most " + max + " " + what
                                + " allowed, got " + items.size());
    }
  }
}
