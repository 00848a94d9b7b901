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
package exm.splc.common.lang;

/**
 * Semantic types of SPL.  All variables are numeric: booleans only exist as
 * the transient result of conditions and strings only as print arguments.
 */
public enum SemType {
  NUMERIC, BOOLEAN, STRING, VOID;

  public String typeName() {
    switch (this) {
      case NUMERIC:
        return "numeric";
      case BOOLEAN:
        return "boolean";
      case STRING:
        return "string";
      case VOID:
        return "void";
      default:
        throw new IllegalStateException("typeName not implemented for " + this);
    }
  }

  @Override
  public String toString() {
    return typeName();
  }
}
