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
package exm.splc.common;

import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.splc.frontend.symbols.DeclId;

/**
 * A problem found in the user's program.  Passes accumulate these rather
 * than throwing, so that one run reports every problem.
 */
public class Diagnostic {
  public static final int NO_NODE = -1;

  private final DiagnosticKind kind;
  private final String message;
  private final int nodeId;
  private final String scopePath;
  private final ImmutableList<DeclId> decls;

  public Diagnostic(DiagnosticKind kind, String message, int nodeId,
                    String scopePath, List<DeclId> decls) {
    this.kind = kind;
    this.message = message;
    this.nodeId = nodeId;
    this.scopePath = scopePath;
    this.decls = ImmutableList.copyOf(decls);
  }

  public Diagnostic(DiagnosticKind kind, String message, int nodeId,
                    String scopePath) {
    this(kind, message, nodeId, scopePath, Collections.<DeclId>emptyList());
  }

  public Diagnostic(DiagnosticKind kind, String message, int nodeId) {
    this(kind, message, nodeId, null);
  }

  public DiagnosticKind getKind() {
    return kind;
  }

  public String getMessage() {
    return message;
  }

  /**
   * @return id of the offending node, or NO_NODE if not attributable
   */
  public int getNodeId() {
    return nodeId;
  }

  /**
   * @return scope path e.g. "Everywhere > Global > Local:inc", or null
   */
  public String getScopePath() {
    return scopePath;
  }

  /**
   * @return declarations involved in the problem, e.g. both sides of a
   *         duplicate declaration
   */
  public List<DeclId> getDecls() {
    return decls;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind.tag()).append(": ").append(message);
    if (nodeId != NO_NODE) {
      sb.append(" (node #").append(nodeId).append(")");
    }
    if (scopePath != null) {
      sb.append(" [").append(scopePath).append("]");
    }
    return sb.toString();
  }
}
