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

import exm.splc.common.lang.SemType;

/**
 * A declared name.  Immutable once created.
 */
public class SymbolEntry {
  private final String name;
  private final SymbolCategory category;
  private final Scope scope;
  private final DeclId declId;

  /** null for routines, which are typed by the type checker */
  private final SemType type;

  public SymbolEntry(String name, SymbolCategory category, Scope scope,
                     DeclId declId, SemType type) {
    this.name = name;
    this.category = category;
    this.scope = scope;
    this.declId = declId;
    this.type = type;
  }

  public String getName() {
    return name;
  }

  public SymbolCategory getCategory() {
    return category;
  }

  public Scope getScope() {
    return scope;
  }

  public DeclId getDeclId() {
    return declId;
  }

  public SemType getType() {
    return type;
  }

  @Override
  public String toString() {
    return category.humanReadable() + " " + name
        + (type == null ? "" : ":" + type) + " @ " + declId;
  }
}
