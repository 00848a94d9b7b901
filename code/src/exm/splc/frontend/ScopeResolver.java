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
package exm.splc.frontend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.splc.ast.ASTWalk;
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
import exm.splc.ast.Program;
import exm.splc.ast.RoutineDef;
import exm.splc.ast.Terms.Atom;
import exm.splc.ast.Terms.AtomVisitor;
import exm.splc.ast.Terms.NumberLit;
import exm.splc.ast.Terms.TermAtom;
import exm.splc.ast.Terms.TermBinary;
import exm.splc.ast.Terms.TermUnary;
import exm.splc.ast.Terms.TermVisitor;
import exm.splc.ast.Terms.VarRef;
import exm.splc.common.Diagnostic;
import exm.splc.common.DiagnosticKind;
import exm.splc.common.Logging;
import exm.splc.common.exceptions.DoubleDefineException;
import exm.splc.common.lang.SemType;
import exm.splc.frontend.symbols.DeclId;
import exm.splc.frontend.symbols.DeclId.Bucket;
import exm.splc.frontend.symbols.Scope;
import exm.splc.frontend.symbols.ScopeTable;
import exm.splc.frontend.symbols.SymbolCategory;
import exm.splc.frontend.symbols.SymbolEntry;

/**
 * Builds the scope table for a program and binds every variable reference
 * to its declaration.
 *
 * Resolution is best-effort: problems are collected as diagnostics and
 * the pass always runs to completion, so all problems are reported at once.
 */
public class ScopeResolver {

  private final Logger logger;

  /* State for the current run */
  private ScopeTable table;
  private List<Diagnostic> diagnostics;

  public ScopeResolver() {
    this(Logging.getSPLLogger());
  }

  public ScopeResolver(Logger logger) {
    this.logger = logger;
  }

  public ScopeResolution resolve(Program program) {
    table = new ScopeTable();
    diagnostics = new ArrayList<Diagnostic>();

    logger.debug("Resolving scopes of " + program);
    declareGlobals(program);
    declareProcedures(program);
    declareFunctions(program);
    declareMainVariables(program);
    checkCrossCategory(program);

    for (RoutineDef routine: program.getRoutines()) {
      buildLocalScope(routine);
    }

    for (RoutineDef routine: program.getRoutines()) {
      resolveRoutine(routine);
    }
    resolveMain(program);

    checkRecursion(program);

    if (logger.isTraceEnabled()) {
      logger.trace("Scope table:\n" + table.prettyPrint());
    }
    logger.debug("Scope resolution done: " + table.bindingCount() +
                 " bindings, " + diagnostics.size() + " problems");

    ScopeResolution result = new ScopeResolution(table, diagnostics);
    table = null;
    diagnostics = null;
    return result;
  }

  private void declareGlobals(Program program) {
    List<String> globals = program.getGlobals();
    for (int i = 0; i < globals.size(); i++) {
      declare(table.getGlobalScope(), globals.get(i), SymbolCategory.VARIABLE,
              DeclId.of(program.getId(), Bucket.GLOBALS, i), SemType.NUMERIC);
    }
  }

  private void declareProcedures(Program program) {
    for (RoutineDef proc: program.getProcs()) {
      declareRoutine(proc, SymbolCategory.PROCEDURE,
                     table.getProcedureScope(), table.getFunctionScope());
    }
  }

  private void declareFunctions(Program program) {
    for (RoutineDef func: program.getFuncs()) {
      declareRoutine(func, SymbolCategory.FUNCTION,
                     table.getFunctionScope(), table.getProcedureScope());
    }
  }

  /**
   * Procedure and function names share one namespace
   */
  private void declareRoutine(RoutineDef routine, SymbolCategory category,
                              Scope scope, Scope otherScope) {
    DeclId declId = DeclId.ofNode(routine.getId());
    SymbolEntry other = otherScope.lookupLocal(routine.getName());
    if (other != null) {
      report(DiagnosticKind.CROSS_CATEGORY_CLASH,
          capitalize(category) + " '" + routine.getName() +
          "' conflicts with " + other.getCategory().humanReadable() +
          " name", routine.getId(), scope,
          Arrays.asList(other.getDeclId(), declId));
    }
    declare(scope, routine.getName(), category, declId, null);
  }

  private void declareMainVariables(Program program) {
    List<String> vars = program.getMain().getVariables();
    for (int i = 0; i < vars.size(); i++) {
      declare(table.getMainScope(), vars.get(i), SymbolCategory.VARIABLE,
              DeclId.of(program.getMain().getId(), Bucket.MAIN, i),
              SemType.NUMERIC);
    }
  }

  /**
   * Global and main variables must not share a name with a routine
   */
  private void checkCrossCategory(Program program) {
    for (Scope varScope: Arrays.asList(table.getGlobalScope(),
                                       table.getMainScope())) {
      String prefix = varScope == table.getMainScope() ?
                          "Main variable" : "Variable";
      for (SymbolEntry var: varScope.getEntries()) {
        for (Scope routineScope: Arrays.asList(table.getProcedureScope(),
                                               table.getFunctionScope())) {
          SymbolEntry routine = routineScope.lookupLocal(var.getName());
          if (routine != null) {
            report(DiagnosticKind.CROSS_CATEGORY_CLASH,
                prefix + " '" + var.getName() + "' conflicts with " +
                routine.getCategory().humanReadable() + " name",
                var.getDeclId().getNodeId(), varScope,
                Arrays.asList(var.getDeclId(), routine.getDeclId()));
          }
        }
      }
    }
  }

  private void buildLocalScope(RoutineDef routine) {
    Scope local = table.newLocalScope(routine);
    List<String> params = routine.getParams();
    for (int i = 0; i < params.size(); i++) {
      declare(local, params.get(i), SymbolCategory.PARAMETER,
              DeclId.of(routine.getId(), Bucket.PARAMS, i), SemType.NUMERIC);
    }

    List<String> locals = routine.getBody().getLocals();
    for (int i = 0; i < locals.size(); i++) {
      DeclId declId = DeclId.of(routine.getBody().getId(), Bucket.LOCALS, i);
      SymbolEntry param = local.lookupLocal(locals.get(i));
      if (param != null && param.getCategory() == SymbolCategory.PARAMETER) {
        report(DiagnosticKind.PARAM_SHADOWED,
            "Local variable '" + locals.get(i) + "' shadows parameter in " +
            routine.kindName() + " '" + routine.getName() + "'",
            routine.getBody().getId(), local,
            Arrays.asList(param.getDeclId(), declId));
      } else {
        declare(local, locals.get(i), SymbolCategory.VARIABLE, declId,
                SemType.NUMERIC);
      }
    }
  }

  /**
   * Declare, turning a duplicate into a diagnostic
   */
  private void declare(Scope scope, String name, SymbolCategory category,
                       DeclId declId, SemType type) {
    try {
      table.declare(scope, name, category, declId, type);
      LogHelper.trace(2, "declared " + name + " in " + scope);
    } catch (DoubleDefineException e) {
      report(DiagnosticKind.DUPLICATE_NAME, e.getMessage(),
             declId.getNodeId(), scope,
             Arrays.asList(e.getExisting().getDeclId(), declId));
    }
  }

  private void resolveRoutine(RoutineDef routine) {
    Scope local = table.localScopeOf(routine);
    if (local == null) {
      report(DiagnosticKind.INTERNAL_ERROR, "No local scope recorded for " +
             routine.kindName() + " '" + routine.getName() + "'",
             routine.getId(), table.getRoot(),
             Collections.<DeclId>emptyList());
      return;
    }
    LogHelper.debug(1, "resolving " + routine);
    ReferenceResolver resolver = new ReferenceResolver(local, false);
    resolver.resolveAlgo(routine.getBody().getAlgo());
    if (routine instanceof FuncDef) {
      ((FuncDef)routine).getReturnAtom().accept(resolver);
    }
  }

  private void resolveMain(Program program) {
    LogHelper.debug(1, "resolving " + program.getMain());
    new ReferenceResolver(table.getMainScope(), true)
                .resolveAlgo(program.getMain().getAlgo());
  }

  /**
   * Binds variable references and assignment targets in one block of code.
   */
  private class ReferenceResolver implements InstructionVisitor<Void>,
                                 TermVisitor<Void>, AtomVisitor<Void> {
    private final Scope scope;

    /** Main block: look in main variables, then globals */
    private final boolean inMain;

    ReferenceResolver(Scope scope, boolean inMain) {
      this.scope = scope;
      this.inMain = inMain;
    }

    private SymbolEntry lookup(String name) {
      if (inMain) {
        return table.lookupFromMain(name);
      }
      return table.lookupChain(scope, name);
    }

    void resolveAlgo(Algo algo) {
      for (Instruction i: algo.getInstructions()) {
        i.accept(this);
      }
    }

    @Override
    public Void visitHalt(Halt halt) {
      return null;
    }

    @Override
    public Void visitPrint(Print print) {
      if (!print.isString()) {
        print.getAtom().accept(this);
      }
      return null;
    }

    @Override
    public Void visitCall(Call call) {
      for (Atom arg: call.getArgs()) {
        arg.accept(this);
      }
      return null;
    }

    @Override
    public Void visitAssign(Assign assign) {
      SymbolEntry target = lookup(assign.getTarget());
      if (target == null) {
        undeclared(assign.getTarget(), assign.getId());
      } else {
        table.bindAssignTarget(assign, target);
      }
      if (assign.isCall()) {
        visitCall(assign.getCall());
      } else {
        assign.getValue().accept(this);
      }
      return null;
    }

    @Override
    public Void visitWhile(WhileLoop loop) {
      loop.getCondition().accept(this);
      resolveAlgo(loop.getBody());
      return null;
    }

    @Override
    public Void visitDoUntil(DoUntilLoop loop) {
      resolveAlgo(loop.getBody());
      loop.getCondition().accept(this);
      return null;
    }

    @Override
    public Void visitBranch(Branch branch) {
      branch.getCondition().accept(this);
      resolveAlgo(branch.getThenBlock());
      if (branch.hasElse()) {
        resolveAlgo(branch.getElseBlock());
      }
      return null;
    }

    @Override
    public Void visitAtom(TermAtom term) {
      return term.getAtom().accept(this);
    }

    @Override
    public Void visitUnary(TermUnary term) {
      return term.getOperand().accept(this);
    }

    @Override
    public Void visitBinary(TermBinary term) {
      term.getLeft().accept(this);
      term.getRight().accept(this);
      return null;
    }

    @Override
    public Void visitVar(VarRef var) {
      SymbolEntry entry = lookup(var.getName());
      if (entry == null) {
        undeclared(var.getName(), var.getId());
      } else {
        table.bind(var, entry);
        LogHelper.trace(3, var + " -> " + entry);
      }
      return null;
    }

    @Override
    public Void visitNumber(NumberLit num) {
      return null;
    }

    private void undeclared(String name, int nodeId) {
      report(DiagnosticKind.UNDECLARED_VARIABLE,
             "Undeclared variable '" + name + "'", nodeId, scope,
             Collections.<DeclId>emptyList());
    }
  }

  /**
   * Report each routine that can call itself, directly or through other
   * routines
   */
  private void checkRecursion(Program program) {
    Map<String, RoutineDef> routines = new LinkedHashMap<String, RoutineDef>();
    for (RoutineDef r: program.getRoutines()) {
      if (!routines.containsKey(r.getName())) {
        routines.put(r.getName(), r);
      }
    }

    ListMultimap<String, String> callGraph = ArrayListMultimap.create();
    for (RoutineDef r: routines.values()) {
      for (Call call: ASTWalk.collect(r.getBody(), Call.class)) {
        if (routines.containsKey(call.getName()) &&
            !callGraph.containsEntry(r.getName(), call.getName())) {
          callGraph.put(r.getName(), call.getName());
        }
      }
    }

    for (RoutineDef r: routines.values()) {
      List<String> cycle = findCycle(callGraph, r.getName());
      if (cycle != null) {
        Scope scope = r instanceof FuncDef ? table.getFunctionScope() :
                                             table.getProcedureScope();
        report(DiagnosticKind.RECURSIVE_DEFINITION,
               StringUtils.capitalize(r.kindName()) + " '" + r.getName() +
               "' is recursive: " + StringUtils.join(cycle, " -> "),
               r.getId(), scope,
               Collections.singletonList(DeclId.ofNode(r.getId())));
      }
    }
  }

  /**
   * Breadth-first search for the shortest call path from start back to
   * itself
   * @return path starting and ending with start, or null if none
   */
  private static List<String> findCycle(ListMultimap<String, String> graph,
                                        String start) {
    Map<String, String> cameFrom = new HashMap<String, String>();
    Deque<String> queue = new ArrayDeque<String>();
    queue.add(start);
    while (!queue.isEmpty()) {
      String curr = queue.removeFirst();
      for (String callee: graph.get(curr)) {
        if (callee.equals(start)) {
          List<String> path = new ArrayList<String>();
          path.add(start);
          for (String s = curr; !s.equals(start); s = cameFrom.get(s)) {
            path.add(s);
          }
          path.add(start);
          Collections.reverse(path);
          return path;
        }
        if (!cameFrom.containsKey(callee)) {
          cameFrom.put(callee, curr);
          queue.add(callee);
        }
      }
    }
    return null;
  }

  private void report(DiagnosticKind kind, String message, int nodeId,
                      Scope scope, List<DeclId> decls) {
    Diagnostic d = new Diagnostic(kind, message, nodeId,
                                  table.getScopePath(scope), decls);
    LogHelper.debug(2, d.toString());
    diagnostics.add(d);
  }

  private static String capitalize(SymbolCategory category) {
    return StringUtils.capitalize(category.humanReadable());
  }
}
