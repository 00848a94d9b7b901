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
package exm.splc.frontend.symbols;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.splc.ast.Instructions.Assign;
import exm.splc.ast.RoutineDef;
import exm.splc.ast.Terms.VarRef;
import exm.splc.common.exceptions.DoubleDefineException;
import exm.splc.common.exceptions.SPLRuntimeError;
import exm.splc.common.lang.SemType;
import exm.splc.common.util.Counter;

/**
 * Scope hierarchy of one program, plus the bindings from variable
 * references to their declarations.
 *
 * The hierarchy is fixed: a root scope with four children holding global
 * variables, procedure names, function names and main variables, and one
 * local scope per routine, parented at the global variables.
 */
public class ScopeTable {
  private static final String PATH_SEP = " > ";

  private final Counter scopeIds = new Counter();

  private final Scope root;
  private final Scope globals;
  private final Scope procedures;
  private final Scope functions;
  private final Scope mainVars;

  /** All scopes in creation order */
  private final List<Scope> scopes = new ArrayList<Scope>();

  /** Routine definition node id -> local scope */
  private final Map<Integer, Scope> localScopes =
                                  new LinkedHashMap<Integer, Scope>();

  private final Map<DeclId, SymbolEntry> declarations =
                                  new HashMap<DeclId, SymbolEntry>();

  /** VarRef node id -> entry */
  private final Map<Integer, SymbolEntry> varBindings =
                                  new HashMap<Integer, SymbolEntry>();

  /** Assign node id -> entry of target */
  private final Map<Integer, SymbolEntry> assignBindings =
                                  new HashMap<Integer, SymbolEntry>();

  public ScopeTable() {
    root = newScope(ScopeKind.ROOT, null, null);
    globals = newScope(ScopeKind.GLOBAL_VARS, root, null);
    procedures = newScope(ScopeKind.PROCEDURES, root, null);
    functions = newScope(ScopeKind.FUNCTIONS, root, null);
    mainVars = newScope(ScopeKind.MAIN_VARS, root, null);
  }

  private Scope newScope(ScopeKind kind, Scope parent, String owner) {
    Scope s = new Scope(scopeIds.nextInt(), kind, parent, owner);
    scopes.add(s);
    return s;
  }

  public Scope getRoot() {
    return root;
  }

  public Scope getGlobalScope() {
    return globals;
  }

  public Scope getProcedureScope() {
    return procedures;
  }

  public Scope getFunctionScope() {
    return functions;
  }

  public Scope getMainScope() {
    return mainVars;
  }

  /**
   * Create the local scope for a routine definition
   */
  public Scope newLocalScope(RoutineDef routine) {
    if (localScopes.containsKey(routine.getId())) {
      throw new SPLRuntimeError("Local scope for " + routine
                                + " created twice");
    }
    Scope s = newScope(ScopeKind.LOCAL, globals, routine.getName());
    localScopes.put(routine.getId(), s);
    return s;
  }

  /**
   * @return local scope of routine, or null if none was created
   */
  public Scope localScopeOf(RoutineDef routine) {
    return localScopes.get(routine.getId());
  }

  /**
   * Declare a name in a scope of this table
   * @throws DoubleDefineException
   */
  public SymbolEntry declare(Scope scope, String name,
        SymbolCategory category, DeclId declId, SemType type)
            throws DoubleDefineException {
    SymbolEntry entry = scope.declare(name, category, declId, type);
    declarations.put(declId, entry);
    return entry;
  }

  /**
   * @return declaration with the identity, or null
   */
  public SymbolEntry getDeclaration(DeclId declId) {
    return declarations.get(declId);
  }

  public SymbolEntry lookupLocal(Scope scope, String name) {
    return scope.lookupLocal(name);
  }

  /**
   * Look up name in scope and then its ancestors
   * @return innermost entry, or null if not found
   */
  public SymbolEntry lookupChain(Scope scope, String name) {
    for (Scope s = scope; s != null; s = s.getParent()) {
      SymbolEntry e = s.lookupLocal(name);
      if (e != null) {
        return e;
      }
    }
    return null;
  }

  /**
   * Look up a variable as seen from the main block: main variables
   * first, then globals
   */
  public SymbolEntry lookupFromMain(String name) {
    SymbolEntry e = mainVars.lookupLocal(name);
    if (e != null) {
      return e;
    }
    return lookupChain(globals, name);
  }

  /**
   * @return path from root, e.g. "Everywhere > Global > Local:inc"
   */
  public String getScopePath(Scope scope) {
    List<String> names = new ArrayList<String>();
    for (Scope s = scope; s != null; s = s.getParent()) {
      names.add(s.getDisplayName());
    }
    Collections.reverse(names);
    StringBuilder sb = new StringBuilder();
    for (String n: names) {
      if (sb.length() > 0) {
        sb.append(PATH_SEP);
      }
      sb.append(n);
    }
    return sb.toString();
  }

  public void bind(VarRef ref, SymbolEntry entry) {
    varBindings.put(ref.getId(), entry);
  }

  /**
   * @return declaration that a variable reference resolved to, or null
   */
  public SymbolEntry getBinding(VarRef ref) {
    return varBindings.get(ref.getId());
  }

  public void bindAssignTarget(Assign assign, SymbolEntry entry) {
    assignBindings.put(assign.getId(), entry);
  }

  /**
   * @return declaration of the assignment's target, or null
   */
  public SymbolEntry getAssignTarget(Assign assign) {
    return assignBindings.get(assign.getId());
  }

  public int bindingCount() {
    return varBindings.size();
  }

  public List<Scope> getScopes() {
    return Collections.unmodifiableList(scopes);
  }

  /**
   * Dump of the whole table, scopes as a tree with entries sorted by name
   */
  public String prettyPrint() {
    StringBuilder sb = new StringBuilder();
    prettyPrint(sb, root, "");
    return sb.toString();
  }

  private void prettyPrint(StringBuilder sb, Scope scope, String indent) {
    sb.append(indent).append(scope.getDisplayName())
      .append(" (scope ").append(scope.getId()).append(")\n");
    List<SymbolEntry> sorted = new ArrayList<SymbolEntry>(
                                              scope.getEntries());
    Collections.sort(sorted, new Comparator<SymbolEntry>() {
      @Override
      public int compare(SymbolEntry a, SymbolEntry b) {
        return a.getName().compareTo(b.getName());
      }
    });
    for (SymbolEntry e: sorted) {
      sb.append(indent).append("  - ").append(e).append("\n");
    }
    for (Scope child: scopes) {
      if (child.getParent() == scope) {
        prettyPrint(sb, child, indent + "  ");
      }
    }
  }
}
