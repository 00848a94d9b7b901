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
package exm.splc.ast;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.splc.ast.Terms.Atom;

/**
 * Function definition: like a procedure, plus the atom whose value is
 * returned after the body has run.
 */
public class FuncDef extends RoutineDef {
  private final Atom returnAtom;

  public FuncDef(int id, String name, List<String> params, Body body,
                 Atom returnAtom) {
    super(id, name, params, body);
    this.returnAtom = returnAtom;
  }

  public Atom getReturnAtom() {
    return returnAtom;
  }

  @Override
  public String kindName() {
    return "function";
  }

  @Override
  public List<Node> children() {
    return ImmutableList.<Node>of(getBody(), returnAtom);
  }
}
