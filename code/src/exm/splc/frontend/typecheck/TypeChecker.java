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
package exm.splc.frontend.typecheck;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

import org.apache.log4j.Logger;

import exm.splc.ast.Algo;
import exm.splc.ast.FuncDef;
import exm.splc.ast.Instructions.Assign;
import exm.splc.ast.Instructions.Branch;
import exm.splc.ast.Instructions.Call;
import exm.splc.ast.Instructions.DoUntilLoop;
import exm.splc.ast.Instructions.Halt;
import exm.splc.ast.Instructions.Instruction;
import exm.splc.ast.Instructions.InstructionVisitor;
import exm.splc.ast.Instructions.Print;
import exm.splc.ast.Instructions.WhileLoop;
import exm.splc.ast.Node;
import exm.splc.ast.Operators.BinaryOp;
import exm.splc.ast.Program;
import exm.splc.ast.RoutineDef;
import exm.splc.ast.Terms.Atom;
import exm.splc.ast.Terms.AtomVisitor;
import exm.splc.ast.Terms.NumberLit;
import exm.splc.ast.Terms.Term;
import exm.splc.ast.Terms.TermAtom;
import exm.splc.ast.Terms.TermBinary;
import exm.splc.ast.Terms.TermUnary;
import exm.splc.ast.Terms.TermVisitor;
import exm.splc.ast.Terms.VarRef;
import exm.splc.common.Diagnostic;
import exm.splc.common.DiagnosticKind;
import exm.splc.common.Logging;
import exm.splc.common.lang.SemType;
import exm.splc.frontend.LogHelper;

/**
 * Structural type checker.  Computes a semantic type for every term and
 * atom and validates statements against the typing rules.
 *
 * Checking is fail-soft: problems are collected as diagnostics.  A term
 * whose type can't be determined (an undeclared variable) is left untyped,
 * and rules with an untyped operand are not checked again, so that one
 * mistake yields one diagnostic.
 */
public class TypeChecker {
  public static final int MAX_ARGS = Call.MAX_ARGS;

  private static final String PATH_SEP = " > ";

  private final Logger logger;

  /* State for the current run, reset by checkProgram */
  private final List<TypeScope> scopes = new ArrayList<TypeScope>();
  private final Map<String, Integer> procArities =
                                        new HashMap<String, Integer>();
  private final Map<String, Integer> funcArities =
                                        new HashMap<String, Integer>();
  private final Map<Integer, SemType> exprTypes =
                                        new HashMap<Integer, SemType>();
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  public TypeChecker() {
    this(Logging.getSPLLogger());
  }

  public TypeChecker(Logger logger) {
    this.logger = logger;
  }

  /**
   * Check the whole program.  May be called repeatedly: each call starts
   * from a clean state.
   * @return true if no problems were found
   */
  public boolean checkProgram(Program program) {
    reset();
    logger.debug("Type checking " + program);

    pushScope("Global");
    for (String g: program.getGlobals()) {
      declareVar(g, program.getId());
    }

    for (RoutineDef proc: program.getProcs()) {
      declareRoutine(proc, procArities);
    }
    for (RoutineDef func: program.getFuncs()) {
      declareRoutine(func, funcArities);
    }

    for (RoutineDef routine: program.getRoutines()) {
      checkRoutine(routine);
    }

    pushScope("Main");
    for (String v: program.getMain().getVariables()) {
      declareVar(v, program.getMain().getId());
    }
    checkAlgo(program.getMain().getAlgo());
    popScope();

    popScope();
    logger.debug("Type checking done: " + diagnostics.size() + " problems");
    return diagnostics.isEmpty();
  }

  private void reset() {
    scopes.clear();
    procArities.clear();
    funcArities.clear();
    exprTypes.clear();
    diagnostics.clear();
  }

  public List<Diagnostic> getDiagnostics() {
    return Collections.unmodifiableList(new ArrayList<Diagnostic>(
                                                          diagnostics));
  }

  /**
   * @return type computed for term, atom, string literal or function call
   *         node by the last run, or null if it had no type
   */
  public SemType getExprType(Node node) {
    return exprTypes.get(node.getId());
  }

  private void declareRoutine(RoutineDef routine,
                              Map<String, Integer> arities) {
    if (procArities.containsKey(routine.getName()) ||
        funcArities.containsKey(routine.getName())) {
      report(DiagnosticKind.DUPLICATE_NAME, "Routine '" + routine.getName()
             + "' already declared", routine.getId());
      return;
    }
    arities.put(routine.getName(), routine.getParams().size());
  }

  private void checkRoutine(RoutineDef routine) {
    LogHelper.debug(1, "checking " + routine);
    pushScope("Local:" + routine.getName());
    for (String param: routine.getParams()) {
      declareVar(param, routine.getId());
    }
    for (String local: routine.getBody().getLocals()) {
      declareVar(local, routine.getBody().getId());
    }
    checkAlgo(routine.getBody().getAlgo());

    if (routine instanceof FuncDef) {
      Atom ret = ((FuncDef)routine).getReturnAtom();
      SemType retType = ret.accept(termChecker);
      if (retType != null && retType != SemType.NUMERIC) {
        report(DiagnosticKind.INVALID_RETURN_TYPE, "Function '" +
               routine.getName() + "' must return numeric, got '" +
               retType + "'", ret.getId());
      }
    }
    popScope();
  }

  private void checkAlgo(Algo algo) {
    for (Instruction i: algo.getInstructions()) {
      i.accept(instructionChecker);
    }
  }

  private final InstructionVisitor<Void> instructionChecker =
                                      new InstructionVisitor<Void>() {
    @Override
    public Void visitHalt(Halt halt) {
      return null;
    }

    @Override
    public Void visitPrint(Print print) {
      if (print.isString()) {
        exprTypes.put(print.getString().getId(), SemType.STRING);
        return null;
      }
      SemType t = print.getAtom().accept(termChecker);
      if (t != null && t != SemType.NUMERIC) {
        report(DiagnosticKind.TYPE_MISMATCH, "Print can only output " +
               "numeric or string values, got '" + t + "'", print.getId());
      }
      return null;
    }

    @Override
    public Void visitCall(Call call) {
      checkCall(call, false);
      return null;
    }

    @Override
    public Void visitAssign(Assign assign) {
      SemType targetType = lookupVar(assign.getTarget());
      if (targetType == null) {
        report(DiagnosticKind.UNDECLARED_VARIABLE, "Variable '" +
               assign.getTarget() + "' not declared", assign.getId());
      } else if (targetType != SemType.NUMERIC) {
        report(DiagnosticKind.TYPE_MISMATCH, "Assignment LHS '" +
               assign.getTarget() + "' must be numeric", assign.getId());
      }

      SemType rhsType;
      if (assign.isCall()) {
        rhsType = checkCall(assign.getCall(), true);
      } else {
        rhsType = assign.getValue().accept(termChecker);
      }
      if (rhsType != null && rhsType != SemType.NUMERIC) {
        report(DiagnosticKind.TYPE_MISMATCH, "Assignment RHS must be " +
               "numeric, got '" + rhsType + "'", assign.getId());
      }
      return null;
    }

    @Override
    public Void visitWhile(WhileLoop loop) {
      checkCondition("While", loop.getCondition());
      checkAlgo(loop.getBody());
      return null;
    }

    @Override
    public Void visitDoUntil(DoUntilLoop loop) {
      checkAlgo(loop.getBody());
      checkCondition("Do-until", loop.getCondition());
      return null;
    }

    @Override
    public Void visitBranch(Branch branch) {
      checkCondition("If", branch.getCondition());
      checkAlgo(branch.getThenBlock());
      if (branch.hasElse()) {
        checkAlgo(branch.getElseBlock());
      }
      return null;
    }
  };

  private void checkCondition(String construct, Term cond) {
    SemType t = cond.accept(termChecker);
    if (t != null && t != SemType.BOOLEAN) {
      report(DiagnosticKind.TYPE_MISMATCH, construct + " condition must " +
             "be boolean, got '" + t + "'", cond.getId());
    }
  }

  /**
   * Check a procedure call statement or a function call expression
   * @param asFunction true if the call is the right hand side of an
   *        assignment
   * @return numeric for a function, void for a procedure, null if the
   *        callee is unknown or of the wrong kind
   */
  private SemType checkCall(Call call, boolean asFunction) {
    int arity = call.getArgs().size();
    boolean tooMany = arity > MAX_ARGS;
    if (tooMany) {
      report(DiagnosticKind.ARITY_MISMATCH, "Too many arguments to '" +
             call.getName() + "': " + arity + " (max " + MAX_ARGS + ")",
             call.getId());
    }
    for (Atom arg: call.getArgs()) {
      SemType argType = arg.accept(termChecker);
      if (argType != null && argType != SemType.NUMERIC) {
        report(DiagnosticKind.TYPE_MISMATCH, "Arguments must be numeric " +
               "atoms, got '" + argType + "'", arg.getId());
      }
    }

    String kind = asFunction ? "Function" : "Procedure";
    Map<String, Integer> arities = asFunction ? funcArities : procArities;
    Map<String, Integer> others = asFunction ? procArities : funcArities;
    Integer expected = arities.get(call.getName());
    if (expected == null) {
      if (others.containsKey(call.getName())) {
        report(DiagnosticKind.WRONG_CALL_KIND, "'" + call.getName() +
               "' is not a " + kind.toLowerCase(), call.getId());
      } else {
        report(DiagnosticKind.WRONG_CALL_KIND, "Unknown " +
               kind.toLowerCase() + " '" + call.getName() + "'",
               call.getId());
      }
      return null;
    }
    if (!tooMany && expected != arity) {
      report(DiagnosticKind.ARITY_MISMATCH, kind + " '" + call.getName() +
             "' arity mismatch: expected " + expected + ", got " + arity,
             call.getId());
    }
    SemType result = asFunction ? SemType.NUMERIC : SemType.VOID;
    exprTypes.put(call.getId(), result);
    return result;
  }

  /**
   * Computes and records term types.  Returns null for untyped terms.
   */
  private final TermChecker termChecker = new TermChecker();

  private class TermChecker implements TermVisitor<SemType>,
                                       AtomVisitor<SemType> {
    @Override
    public SemType visitAtom(TermAtom term) {
      return record(term, term.getAtom().accept(this));
    }

    @Override
    public SemType visitUnary(TermUnary term) {
      SemType operand = term.getOperand().accept(this);
      switch (term.getOp()) {
        case NEG:
          expect(operand, SemType.NUMERIC, term, "Unary 'neg' requires " +
                 "numeric, got '" + operand + "'");
          return record(term, SemType.NUMERIC);
        case NOT:
          expect(operand, SemType.BOOLEAN, term, "Unary 'not' requires " +
                 "boolean, got '" + operand + "'");
          return record(term, SemType.BOOLEAN);
        default:
          throw new IllegalStateException("Unknown unary operator " +
                                          term.getOp());
      }
    }

    @Override
    public SemType visitBinary(TermBinary term) {
      SemType left = term.getLeft().accept(this);
      SemType right = term.getRight().accept(this);
      BinaryOp op = term.getOp();
      switch (op.category()) {
        case ARITHMETIC:
          expectBoth(left, right, SemType.NUMERIC, term, "Binary '" +
                     op.sourceName() + "' requires numeric operands");
          return record(term, SemType.NUMERIC);
        case LOGICAL:
          expectBoth(left, right, SemType.BOOLEAN, term, "Binary '" +
                     op.sourceName() + "' requires boolean operands");
          return record(term, SemType.BOOLEAN);
        case COMPARISON:
          expectBoth(left, right, SemType.NUMERIC, term, "Comparison '" +
                     op.sourceName() + "' requires numeric operands");
          return record(term, SemType.BOOLEAN);
        default:
          throw new IllegalStateException("Unknown operator category " +
                                          op.category());
      }
    }

    @Override
    public SemType visitVar(VarRef var) {
      SemType t = lookupVar(var.getName());
      if (t == null) {
        report(DiagnosticKind.UNDECLARED_VARIABLE, "Variable '" +
               var.getName() + "' not declared", var.getId());
        return null;
      }
      return record(var, t);
    }

    @Override
    public SemType visitNumber(NumberLit num) {
      return record(num, SemType.NUMERIC);
    }

    private SemType record(Node node, SemType type) {
      if (type != null) {
        exprTypes.put(node.getId(), type);
        if (logger.isTraceEnabled()) {
          LogHelper.trace(4, node + " : " + type);
        }
      }
      return type;
    }

    private void expect(SemType actual, SemType expected, Node node,
                        String msg) {
      if (actual != null && actual != expected) {
        report(DiagnosticKind.TYPE_MISMATCH, msg, node.getId());
      }
    }

    private void expectBoth(SemType left, SemType right, SemType expected,
                            Node node, String msg) {
      if ((left != null && left != expected) ||
          (right != null && right != expected)) {
        report(DiagnosticKind.TYPE_MISMATCH, msg, node.getId());
      }
    }
  }

  private void pushScope(String name) {
    scopes.add(new TypeScope(name));
  }

  private void popScope() {
    scopes.remove(scopes.size() - 1);
  }

  private void declareVar(String name, int nodeId) {
    TypeScope inner = scopes.get(scopes.size() - 1);
    if (inner.vars.containsKey(name)) {
      report(DiagnosticKind.DUPLICATE_NAME, "Variable '" + name +
             "' already declared in this scope", nodeId);
      return;
    }
    inner.vars.put(name, SemType.NUMERIC);
  }

  /**
   * @return type of innermost declaration, or null if undeclared
   */
  private SemType lookupVar(String name) {
    ListIterator<TypeScope> it = scopes.listIterator(scopes.size());
    while (it.hasPrevious()) {
      SemType t = it.previous().vars.get(name);
      if (t != null) {
        return t;
      }
    }
    return null;
  }

  private String scopePath() {
    StringBuilder sb = new StringBuilder();
    for (TypeScope s: scopes) {
      if (sb.length() > 0) {
        sb.append(PATH_SEP);
      }
      sb.append(s.name);
    }
    return sb.toString();
  }

  private void report(DiagnosticKind kind, String msg, int nodeId) {
    Diagnostic d = new Diagnostic(kind, msg, nodeId, scopePath());
    LogHelper.debug(2, d.toString());
    diagnostics.add(d);
  }

  private static class TypeScope {
    final String name;
    final Map<String, SemType> vars = new LinkedHashMap<String, SemType>();

    TypeScope(String name) {
      this.name = name;
    }
  }
}
