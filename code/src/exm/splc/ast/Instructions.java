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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.splc.ast.Terms.Atom;
import exm.splc.ast.Terms.StringLit;
import exm.splc.ast.Terms.Term;
import exm.splc.common.exceptions.SPLRuntimeError;

/**
 * Instruction nodes.  The set of instructions is closed: passes dispatch
 * through {@link InstructionVisitor} so that every pass handles every
 * instruction.
 */
public class Instructions {

  public static interface InstructionVisitor<T> {
    public T visitHalt(Halt halt);
    public T visitPrint(Print print);
    public T visitCall(Call call);
    public T visitAssign(Assign assign);
    public T visitWhile(WhileLoop loop);
    public T visitDoUntil(DoUntilLoop loop);
    public T visitBranch(Branch branch);
  }

  public static abstract class Instruction extends Node {
    protected Instruction(int id) {
      super(id);
    }

    public abstract <T> T accept(InstructionVisitor<T> visitor);
  }

  public static class Halt extends Instruction {
    public Halt(int id) {
      super(id);
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
      return visitor.visitHalt(this);
    }

    @Override
    public List<Node> children() {
      return Collections.emptyList();
    }

    @Override
    public String describe() {
      return "Halt";
    }
  }

  /**
   * print of either an atom or a string literal
   */
  public static class Print extends Instruction {
    private final Atom atom;
    private final StringLit string;

    public Print(int id, Atom atom) {
      this(id, atom, null);
    }

    public Print(int id, StringLit string) {
      this(id, null, string);
    }

    private Print(int id, Atom atom, StringLit string) {
      super(id);
      if ((atom == null) == (string == null)) {
        throw new SPLRuntimeError("print needs exactly one of atom or string");
      }
      this.atom = atom;
      this.string = string;
    }

    public boolean isString() {
      return string != null;
    }

    /**
     * @return printed atom, null if a string is printed
     */
    public Atom getAtom() {
      return atom;
    }

    /**
     * @return printed string, null if an atom is printed
     */
    public StringLit getString() {
      return string;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
      return visitor.visitPrint(this);
    }

    @Override
    public List<Node> children() {
      return ImmutableList.<Node>of(isString() ? string : atom);
    }

    @Override
    public String describe() {
      return "Print";
    }
  }

  /**
   * Call of a procedure (as an instruction) or a function (as the right hand
   * side of an assignment)
   */
  public static class Call extends Instruction {
    public static final int MAX_ARGS = 3;

    private final String name;
    private final ImmutableList<Atom> args;

    public Call(int id, String name, List<? extends Atom> args) {
      super(id);
      this.name = name;
      this.args = ImmutableList.copyOf(args);
    }

    public String getName() {
      return name;
    }

    public List<Atom> getArgs() {
      return args;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
      return visitor.visitCall(this);
    }

    @Override
    public List<Atom> children() {
      return args;
    }

    @Override
    public String describe() {
      return "Call " + name + "(" + args.size() + " args)";
    }
  }

  /**
   * VAR = TERM or VAR = NAME ( INPUT )
   */
  public static class Assign extends Instruction {
    private final String target;
    private final Term value;
    private final Call call;

    public Assign(int id, String target, Term value) {
      this(id, target, value, null);
    }

    public Assign(int id, String target, Call call) {
      this(id, target, null, call);
    }

    private Assign(int id, String target, Term value, Call call) {
      super(id);
      if ((value == null) == (call == null)) {
        throw new SPLRuntimeError("assignment to " + target +
                          " needs exactly one of term or function call");
      }
      this.target = target;
      this.value = value;
      this.call = call;
    }

    public String getTarget() {
      return target;
    }

    public boolean isCall() {
      return call != null;
    }

    /**
     * @return assigned term, null for a function call assignment
     */
    public Term getValue() {
      return value;
    }

    /**
     * @return function call, null for a term assignment
     */
    public Call getCall() {
      return call;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
      return visitor.visitAssign(this);
    }

    @Override
    public List<Node> children() {
      return ImmutableList.<Node>of(isCall() ? call : value);
    }

    @Override
    public String describe() {
      return "Assign " + target;
    }
  }

  public static class WhileLoop extends Instruction {
    private final Term condition;
    private final Algo body;

    public WhileLoop(int id, Term condition, Algo body) {
      super(id);
      this.condition = condition;
      this.body = body;
    }

    public Term getCondition() {
      return condition;
    }

    public Algo getBody() {
      return body;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
      return visitor.visitWhile(this);
    }

    @Override
    public List<Node> children() {
      return ImmutableList.<Node>of(condition, body);
    }

    @Override
    public String describe() {
      return "While";
    }
  }

  public static class DoUntilLoop extends Instruction {
    private final Algo body;
    private final Term condition;

    public DoUntilLoop(int id, Algo body, Term condition) {
      super(id);
      this.body = body;
      this.condition = condition;
    }

    public Algo getBody() {
      return body;
    }

    public Term getCondition() {
      return condition;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
      return visitor.visitDoUntil(this);
    }

    @Override
    public List<Node> children() {
      return ImmutableList.<Node>of(body, condition);
    }

    @Override
    public String describe() {
      return "DoUntil";
    }
  }

  /**
   * if TERM { ALGO } [else { ALGO }]
   */
  public static class Branch extends Instruction {
    private final Term condition;
    private final Algo thenBlock;
    private final Algo elseBlock;

    public Branch(int id, Term condition, Algo thenBlock, Algo elseBlock) {
      super(id);
      this.condition = condition;
      this.thenBlock = thenBlock;
      this.elseBlock = elseBlock;
    }

    public Term getCondition() {
      return condition;
    }

    public Algo getThenBlock() {
      return thenBlock;
    }

    public boolean hasElse() {
      return elseBlock != null;
    }

    /**
     * @return else block, or null if none
     */
    public Algo getElseBlock() {
      return elseBlock;
    }

    @Override
    public <T> T accept(InstructionVisitor<T> visitor) {
      return visitor.visitBranch(this);
    }

    @Override
    public List<Node> children() {
      if (hasElse()) {
        return ImmutableList.<Node>of(condition, thenBlock, elseBlock);
      } else {
        return ImmutableList.<Node>of(condition, thenBlock);
      }
    }

    @Override
    public String describe() {
      return hasElse() ? "Branch (with else)" : "Branch";
    }
  }

  /**
   * @return instruction list rendered compactly, for log messages
   */
  public static String summarize(List<Instruction> instructions) {
    StringBuilder sb = new StringBuilder();
    for (Instruction i: instructions) {
      if (sb.length() > 0) {
        sb.append("; ");
      }
      sb.append(i.describe());
    }
    return StringUtils.abbreviate(sb.toString(), 120);
  }
}
