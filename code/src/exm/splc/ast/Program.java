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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Root of the tree:
 * glob { VARIABLES } proc { PROCDEFS } func { FUNCDEFS } main { MAINPROG }
 */
public class Program extends Node {
  private final ImmutableList<String> globals;
  private final ImmutableList<ProcDef> procs;
  private final ImmutableList<FuncDef> funcs;
  private final MainBlock main;

  public Program(int id, List<String> globals, List<ProcDef> procs,
                 List<FuncDef> funcs, MainBlock main) {
    super(id);
    this.globals = ImmutableList.copyOf(globals);
    this.procs = ImmutableList.copyOf(procs);
    this.funcs = ImmutableList.copyOf(funcs);
    this.main = main;
  }

  public List<String> getGlobals() {
    return globals;
  }

  public List<ProcDef> getProcs() {
    return procs;
  }

  public List<FuncDef> getFuncs() {
    return funcs;
  }

  /**
   * @return procedures followed by functions, in declaration order
   */
  public List<RoutineDef> getRoutines() {
    return ImmutableList.<RoutineDef>builder()
              .addAll(procs).addAll(funcs).build();
  }

  public MainBlock getMain() {
    return main;
  }

  @Override
  public List<Node> children() {
    return ImmutableList.<Node>builder()
              .addAll(procs).addAll(funcs).add(main).build();
  }

  @Override
  public String describe() {
    return "Program glob {" + StringUtils.join(globals, " ") + "}";
  }
}
