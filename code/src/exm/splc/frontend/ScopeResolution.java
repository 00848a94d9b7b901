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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.splc.common.Diagnostic;
import exm.splc.frontend.symbols.ScopeTable;

/**
 * Outcome of scope resolution: the table, complete as far as possible,
 * and every problem found while building it.
 */
public class ScopeResolution {
  private final ScopeTable table;
  private final ImmutableList<Diagnostic> diagnostics;

  public ScopeResolution(ScopeTable table, List<Diagnostic> diagnostics) {
    this.table = table;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  public ScopeTable getTable() {
    return table;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  public boolean hasErrors() {
    return !diagnostics.isEmpty();
  }
}
