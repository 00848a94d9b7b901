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

/**
 * Kinds of problem reported by the scope resolver and type checker.
 */
public enum DiagnosticKind {
  DUPLICATE_NAME("DuplicateName"),
  CROSS_CATEGORY_CLASH("CrossCategoryClash"),
  PARAM_SHADOWED("ParamShadowed"),
  UNDECLARED_VARIABLE("UndeclaredVariable"),
  TYPE_MISMATCH("TypeMismatch"),
  ARITY_MISMATCH("ArityMismatch"),
  WRONG_CALL_KIND("WrongCallKind"),
  INVALID_RETURN_TYPE("InvalidReturnType"),
  RECURSIVE_DEFINITION("RecursiveDefinition"),
  /** A pass found its own bookkeeping inconsistent: always a compiler bug */
  INTERNAL_ERROR("InternalError");

  private final String tag;

  private DiagnosticKind(String tag) {
    this.tag = tag;
  }

  /**
   * @return short machine-friendly tag, e.g. UndeclaredVariable
   */
  public String tag() {
    return tag;
  }
}
