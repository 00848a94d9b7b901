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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import exm.splc.common.exceptions.DoubleDefineException;
import exm.splc.common.lang.SemType;

/**
 * A single lexical scope: a mapping from names to entries, iterated in
 * declaration order.
 */
public class Scope {
  private final int id;
  private final ScopeKind kind;
  private final Scope parent;

  /** Routine name for local scopes, null otherwise */
  private final String owner;

  private final Map<String, SymbolEntry> entries =
                          new LinkedHashMap<String, SymbolEntry>();

  Scope(int id, ScopeKind kind, Scope parent, String owner) {
    this.id = id;
    this.kind = kind;
    this.parent = parent;
    this.owner = owner;
  }

  public int getId() {
    return id;
  }

  public ScopeKind getKind() {
    return kind;
  }

  /**
   * @return enclosing scope, or null for the root
   */
  public Scope getParent() {
    return parent;
  }

  public String getOwner() {
    return owner;
  }

  public String getDisplayName() {
    if (kind == ScopeKind.LOCAL) {
      return kind.displayName() + ":" + owner;
    }
    return kind.displayName();
  }

  /**
   * Add a new entry for name
   * @return the new entry
   * @throws DoubleDefineException if name is already declared in this scope.
   *        The scope is left unchanged.
   */
  public SymbolEntry declare(String name, SymbolCategory category,
                    DeclId declId, SemType type) throws DoubleDefineException {
    SymbolEntry entry = new SymbolEntry(name, category, this, declId, type);
    SymbolEntry existing = entries.get(name);
    if (existing != null) {
      throw new DoubleDefineException(existing, entry);
    }
    entries.put(name, entry);
    return entry;
  }

  /**
   * @return entry declared in this scope only, or null
   */
  public SymbolEntry lookupLocal(String name) {
    return entries.get(name);
  }

  public boolean contains(String name) {
    return entries.containsKey(name);
  }

  /**
   * @return entries in declaration order
   */
  public Collection<SymbolEntry> getEntries() {
    return Collections.unmodifiableCollection(entries.values());
  }

  @Override
  public String toString() {
    return getDisplayName() + "#" + id;
  }
}
