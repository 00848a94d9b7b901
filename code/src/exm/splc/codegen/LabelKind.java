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

/**
 * Families of generated labels.  All families draw numbers from one
 * counter, so every label in a program is distinct.
 */
public enum LabelKind {
  IF_THEN("T"),
  IF_EXIT("X"),
  WHILE_START("WH"),
  WHILE_BODY("WB"),
  WHILE_EXIT("WE"),
  DO_START("DO"),
  DO_EXIT("DX"),
  OR_MID("OR"),
  AND_MID("AND"),
  /** Synthetic target for a false or fall-through path */
  FALL_THROUGH("F");

  private final String prefix;

  private LabelKind(String prefix) {
    this.prefix = prefix;
  }

  public String prefix() {
    return prefix;
  }
}
