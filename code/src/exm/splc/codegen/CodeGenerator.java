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
package exm.splc.codegen;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import exm.splc.ast.Algo;
import exm.splc.ast.FuncDef;
import exm.splc.ast.Instructions;
import exm.splc.ast.Instructions.Assign;
import exm.splc.ast.Instructions.Branch;
import exm.splc.ast.Instructions.Call;
import exm.splc.ast.Instructions.DoUntilLoop;
import exm.splc.ast.Instructions.Halt;
import exm.splc.ast.Instructions.Instruction;
import exm.splc.ast.Instructions.InstructionVisitor;
import exm.splc.ast.Instructions.Print;
import exm.splc.ast.Instructions.WhileLoop;
import exm.splc.ast.Operators.OpCategory;
import exm.splc.ast.Operators.UnaryOp;
import exm.splc.ast.ProcDef;
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
import exm.splc.common.Logging;
import exm.splc.common.Settings;
import exm.splc.common.exceptions.InvalidOptionException;
import exm.splc.common.exceptions.SPLRuntimeError;
import exm.splc.common.util.Counter;
import exm.splc.frontend.symbols.ScopeTable;
import exm.splc.frontend.symbols.SymbolEntry;

/**
 * Lowers a checked program to symbolic target code.
 *
 * Structured control flow becomes labels and jumps, and boolean
 * conditions become cascades of conditional jumps so that the right
 * operand of "and" / "or" is only evaluated when needed.  Procedure and
 * function calls are inlined: each call gets a fresh instantiation number
 * n and every parameter and local v of the callee is renamed to v_n.
 * Underscores can't appear in source identifiers so renamed variables
 * never capture the caller's.  Given a symbol table, main variables that
 * shadow a global are renamed the same way with instantiation number 0,
 * so that inlined routines writing the global don't clobber them.
 *
 * The input is assumed to have passed scope and type checking.  Anything
 * malformed is a compiler bug and raises {@link SPLRuntimeError}.
 */
public class CodeGenerator {
  /** Separator between source name and instantiation number */
  public static final String INSTANCE_SEP = "_";

  /** Instantiation number of the main block; calls count from 1 */
  public static final long MAIN_INSTANCE = 0;

  private final Logger logger;
  private final boolean inlineCalls;

  /* State for the current run */
  private List<String> lines;
  private Counter labelCounter;
  private Counter instanceCounter;
  private Map<String, ProcDef> procs;
  private Map<String, FuncDef> funcs;
  private RenameEnv env;

  /** Routines whose bodies are currently being inlined */
  private Set<String> inlining;

  public CodeGenerator() {
    this(Logging.getSPLLogger());
  }

  public CodeGenerator(Logger logger) {
    this(logger, inlineSetting());
  }

  public CodeGenerator(Logger logger, boolean inlineCalls) {
    this.logger = logger;
    this.inlineCalls = inlineCalls;
  }

  private static boolean inlineSetting() {
    try {
      return Settings.getBoolean(Settings.CODEGEN_INLINE_CALLS);
    } catch (InvalidOptionException e) {
      throw new SPLRuntimeError(e.getMessage());
    }
  }

  /**
   * Generate code for the main block of program, inlining routines.
   * @param program
   * @param symbols table from scope resolution, or null
   * @return symbolic lines, with labels as "REM label" marker lines
   */
  public List<String> generate(Program program, ScopeTable symbols) {
    lines = new ArrayList<String>();
    labelCounter = new Counter();
    instanceCounter = new Counter();
    procs = new LinkedHashMap<String, ProcDef>();
    funcs = new LinkedHashMap<String, FuncDef>();
    inlining = new HashSet<String>();
    env = mainEnv(symbols);

    for (ProcDef p: program.getProcs()) {
      procs.put(p.getName(), p);
    }
    for (FuncDef f: program.getFuncs()) {
      funcs.put(f.getName(), f);
    }

    logger.debug("Generating code for " + program + ", inlining " +
                 (inlineCalls ? "on" : "off"));
    genAlgo(program.getMain().getAlgo());
    logger.debug("Generated " + lines.size() + " lines with " +
                 (labelCounter.peek() - 1) + " labels and " +
                 (instanceCounter.peek() - 1) + " inlined calls");

    List<String> result = Collections.unmodifiableList(lines);
    lines = null;
    procs = null;
    funcs = null;
    inlining = null;
    env = null;
    return result;
  }

  /**
   * Environment of the main block.  With a symbol table, main variables
   * that shadow a global of the same name are renamed.  Without one, names
   * are left as they are.
   */
  private RenameEnv mainEnv(ScopeTable symbols) {
    if (symbols == null) {
      return RenameEnv.root();
    }
    Map<String, String> shadows = new LinkedHashMap<String, String>();
    for (SymbolEntry e: symbols.getMainScope().getEntries()) {
      if (symbols.getGlobalScope().contains(e.getName())) {
        shadows.put(e.getName(), mainName(e.getName()));
      }
    }
    if (shadows.isEmpty()) {
      return RenameEnv.root();
    }
    logger.debug("Main variables shadowing globals: " + shadows);
    return RenameEnv.root().push(shadows);
  }

  private static String mainName(String v) {
    return v + INSTANCE_SEP + MAIN_INSTANCE;
  }

  private void emit(String line) {
    if (logger.isTraceEnabled()) {
      logger.trace("emit: " + line);
    }
    lines.add(line);
  }

  private String newLabel(LabelKind kind) {
    return kind.prefix() + labelCounter.next();
  }

  private void placeLabel(String label) {
    emit(TargetCode.label(label));
  }

  private void genAlgo(Algo algo) {
    if (logger.isTraceEnabled()) {
      logger.trace("block: " + Instructions.summarize(
                                                algo.getInstructions()));
    }
    for (Instruction i: algo.getInstructions()) {
      i.accept(instructionGen);
    }
  }

  private final InstructionVisitor<Void> instructionGen =
                                      new InstructionVisitor<Void>() {
    @Override
    public Void visitHalt(Halt halt) {
      emit(TargetCode.stop());
      return null;
    }

    @Override
    public Void visitPrint(Print print) {
      if (print.isString()) {
        emit(TargetCode.print(TargetCode.quote(
                                print.getString().getValue())));
      } else {
        emit(TargetCode.print(atom(print.getAtom())));
      }
      return null;
    }

    @Override
    public Void visitCall(Call call) {
      ProcDef proc = procs.get(call.getName());
      if (proc == null) {
        throw new SPLRuntimeError("Call to unknown procedure " +
                                  call.getName() + " at " + call);
      }
      if (inlineCalls) {
        inline(proc, call, null);
      } else {
        emit(TargetCode.call(call.getName(), atoms(call.getArgs())));
      }
      return null;
    }

    @Override
    public Void visitAssign(Assign assign) {
      String target = name(assign.getTarget());
      if (!assign.isCall()) {
        emit(TargetCode.assign(target, value(assign.getValue())));
        return null;
      }

      Call call = assign.getCall();
      FuncDef func = funcs.get(call.getName());
      if (func == null) {
        throw new SPLRuntimeError("Call to unknown function " +
                                  call.getName() + " at " + call);
      }
      if (inlineCalls) {
        inline(func, call, target);
      } else {
        emit(TargetCode.assignCall(target, call.getName(),
                                   atoms(call.getArgs())));
      }
      return null;
    }

    @Override
    public Void visitWhile(WhileLoop loop) {
      String start = newLabel(LabelKind.WHILE_START);
      String body = newLabel(LabelKind.WHILE_BODY);
      String exit = newLabel(LabelKind.WHILE_EXIT);

      placeLabel(start);
      lower(loop.getCondition(), body, null);
      emit(TargetCode.gotoLabel(exit));
      placeLabel(body);
      genAlgo(loop.getBody());
      emit(TargetCode.gotoLabel(start));
      placeLabel(exit);
      return null;
    }

    @Override
    public Void visitDoUntil(DoUntilLoop loop) {
      String start = newLabel(LabelKind.DO_START);
      String exit = newLabel(LabelKind.DO_EXIT);

      placeLabel(start);
      genAlgo(loop.getBody());
      // Leave when condition holds, otherwise go round again
      lower(loop.getCondition(), exit, null);
      emit(TargetCode.gotoLabel(start));
      placeLabel(exit);
      return null;
    }

    @Override
    public Void visitBranch(Branch branch) {
      String then = newLabel(LabelKind.IF_THEN);
      String exit = newLabel(LabelKind.IF_EXIT);

      lower(branch.getCondition(), then, null);
      if (branch.hasElse()) {
        genAlgo(branch.getElseBlock());
      }
      emit(TargetCode.gotoLabel(exit));
      placeLabel(then);
      genAlgo(branch.getThenBlock());
      placeLabel(exit);
      return null;
    }
  };

  /**
   * Expand routine body in place of call.
   * @param target variable receiving a function's result, null for a
   *               procedure call
   */
  private void inline(RoutineDef routine, Call call, String target) {
    List<String> params = routine.getParams();
    if (params.size() != call.getArgs().size()) {
      throw new SPLRuntimeError("Arity mismatch calling " +
          routine.getName() + ": expected " + params.size() + " got " +
          call.getArgs().size());
    }
    if (!inlining.add(routine.getName())) {
      throw new SPLRuntimeError("Recursive call to " + routine.getName() +
                                " can't be inlined");
    }

    String kind = routine instanceof FuncDef ? TargetCode.FUNC
                                             : TargetCode.PROC;
    long instance = instanceCounter.next();
    Map<String, String> renames = new HashMap<String, String>();
    for (String v: params) {
      renames.put(v, v + INSTANCE_SEP + instance);
    }
    for (String v: routine.getBody().getLocals()) {
      renames.put(v, v + INSTANCE_SEP + instance);
    }
    RenameEnv calleeEnv = RenameEnv.forCallee(renames);
    logger.trace("inlining " + routine + " as instance " + instance);
    emit(TargetCode.inlineStart(kind, routine.getName()));

    // Arguments are evaluated in the caller's environment
    for (int i = 0; i < params.size(); i++) {
      emit(TargetCode.assign(renames.get(params.get(i)),
                             atom(call.getArgs().get(i))));
    }

    RenameEnv callerEnv = env;
    env = calleeEnv;
    try {
      genAlgo(routine.getBody().getAlgo());
      if (target != null) {
        emit(TargetCode.assign(target,
                      atom(((FuncDef)routine).getReturnAtom())));
      }
      emit(TargetCode.inlineEnd(kind, routine.getName()));
    } finally {
      env = callerEnv;
      inlining.remove(routine.getName());
    }
  }

  /**
   * Emit jumps so that control reaches trueLabel if cond holds.
   * Otherwise control goes to falseLabel, or falls through past the
   * emitted code if falseLabel is null.
   */
  private void lower(Term cond, String trueLabel, String falseLabel) {
    if (cond instanceof TermBinary) {
      TermBinary bin = (TermBinary)cond;
      switch (bin.getOp()) {
        case OR: {
          String mid = newLabel(LabelKind.OR_MID);
          lower(bin.getLeft(), trueLabel, mid);
          placeLabel(mid);
          lower(bin.getRight(), trueLabel, falseLabel);
          return;
        }
        case AND: {
          String mid = newLabel(LabelKind.AND_MID);
          String fallThrough = null;
          String leftFalse = falseLabel;
          if (leftFalse == null) {
            fallThrough = newLabel(LabelKind.FALL_THROUGH);
            leftFalse = fallThrough;
          }
          lower(bin.getLeft(), mid, leftFalse);
          placeLabel(mid);
          lower(bin.getRight(), trueLabel, falseLabel);
          if (fallThrough != null) {
            placeLabel(fallThrough);
          }
          return;
        }
        default:
          if (bin.getOp().category() == OpCategory.COMPARISON) {
            emit(TargetCode.ifThen(value(bin), trueLabel));
            if (falseLabel != null) {
              emit(TargetCode.gotoLabel(falseLabel));
            }
            return;
          }
          break;
      }
    } else if (cond instanceof TermUnary &&
        ((TermUnary)cond).getOp() == UnaryOp.NOT) {
      Term operand = ((TermUnary)cond).getOperand();
      if (falseLabel != null) {
        lower(operand, falseLabel, trueLabel);
      } else {
        String fallThrough = newLabel(LabelKind.FALL_THROUGH);
        lower(operand, fallThrough, trueLabel);
        placeLabel(fallThrough);
      }
      return;
    }

    emit(TargetCode.ifThen(value(cond), trueLabel));
    if (falseLabel != null) {
      emit(TargetCode.gotoLabel(falseLabel));
    }
  }

  /**
   * @return emitted name for a variable in the current environment
   */
  private String name(String source) {
    String renamed = env.lookup(source);
    if (renamed != null) {
      return renamed;
    }
    return source;
  }

  private String value(Term term) {
    return term.accept(valueRenderer);
  }

  private String atom(Atom atom) {
    return atom.accept(atomRenderer);
  }

  private List<String> atoms(List<Atom> atoms) {
    List<String> result = new ArrayList<String>(atoms.size());
    for (Atom a: atoms) {
      result.add(atom(a));
    }
    return result;
  }

  private final AtomVisitor<String> atomRenderer = new AtomVisitor<String>() {
    @Override
    public String visitVar(VarRef var) {
      return name(var.getName());
    }

    @Override
    public String visitNumber(NumberLit num) {
      return Long.toString(num.getValue());
    }
  };

  /**
   * Renders terms in value position
   */
  private final TermVisitor<String> valueRenderer = new TermVisitor<String>() {
    @Override
    public String visitAtom(TermAtom term) {
      return atom(term.getAtom());
    }

    @Override
    public String visitUnary(TermUnary term) {
      switch (term.getOp()) {
        case NEG:
          return "-" + operand(term.getOperand());
        case NOT:
          return "NOT(" + value(term.getOperand()) + ")";
        default:
          throw new SPLRuntimeError("Unknown unary operator " + term.getOp());
      }
    }

    @Override
    public String visitBinary(TermBinary term) {
      String left = operand(term.getLeft());
      String right = operand(term.getRight());
      String op = term.getOp().targetSymbol();
      if (term.getOp().category() == OpCategory.LOGICAL) {
        return "(" + left + " " + op + " " + right + ")";
      }
      return left + " " + op + " " + right;
    }

    /**
     * Parenthesise nested arithmetic and comparisons.  Logical terms
     * already carry their own parentheses.
     */
    private String operand(Term t) {
      String s = value(t);
      if (t instanceof TermBinary &&
          ((TermBinary)t).getOp().category() != OpCategory.LOGICAL) {
        return "(" + s + ")";
      }
      return s;
    }
  };
}
