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

package exm.splc.common.exceptions;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.splc.common.Diagnostic;

/**
 * Compilation stopped after a pass reported diagnostics.  Carries every
 * diagnostic of the failing pass.
 */
public class CompileErrorException extends UserException {

  public static enum Phase {
    SCOPE("scope checking"),
    TYPE("type checking");

    private final String description;

    private Phase(String description) {
      this.description = description;
    }

    public String description() {
      return description;
    }
  }

  private final Phase phase;
  private final ImmutableList<Diagnostic> diagnostics;

  public CompileErrorException(Phase phase, List<Diagnostic> diagnostics) {
    super(buildMessage(phase, diagnostics));
    this.phase = phase;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
  }

  private static String buildMessage(Phase phase,
                                     List<Diagnostic> diagnostics) {
    StringBuilder sb = new StringBuilder();
    sb.append(diagnostics.size());
    sb.append(diagnostics.size() == 1 ? " error" : " errors");
    sb.append(" during ");
    sb.append(phase.description());
    for (Diagnostic d: diagnostics) {
      sb.append("\n  ");
      sb.append(d);
    }
    return sb.toString();
  }

  public Phase getPhase() {
    return phase;
  }

  public List<Diagnostic> getDiagnostics() {
    return diagnostics;
  }

  private static final long serialVersionUID = 1L;
}
