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

import exm.splc.ast.Instructions.Instruction;

/**
 * An instruction sequence: the body of main, a routine, a loop or a
 * branch arm.
 */
public class Algo extends Node {
  private final ImmutableList<Instruction> instructions;

  public Algo(int id, List<? extends Instruction> instructions) {
    super(id);
    this.instructions = ImmutableList.copyOf(instructions);
  }

  public List<Instruction> getInstructions() {
    return instructions;
  }

  @Override
  public List<Instruction> children() {
    return instructions;
  }

  @Override
  public String describe() {
    return "Algo[" + instructions.size() + "]";
  }
}
