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
package exm.splc.ui;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.splc.codegen.LineFinalizer;
import exm.splc.codegen.NumberedLine;
import exm.splc.frontend.symbols.ScopeTable;

/**
 * Output of a successful compilation
 */
public class CompileResult {
  private final ScopeTable symbols;
  private final ImmutableList<String> symbolicLines;
  private final ImmutableList<NumberedLine> numberedLines;

  public CompileResult(ScopeTable symbols, List<String> symbolicLines,
                       List<NumberedLine> numberedLines) {
    this.symbols = symbols;
    this.symbolicLines = ImmutableList.copyOf(symbolicLines);
    this.numberedLines = ImmutableList.copyOf(numberedLines);
  }

  public ScopeTable getSymbols() {
    return symbols;
  }

  /**
   * @return generated code with symbolic labels
   */
  public List<String> getSymbolicLines() {
    return symbolicLines;
  }

  public List<NumberedLine> getNumberedLines() {
    return numberedLines;
  }

  /**
   * @return final program text
   */
  public String render() {
    return LineFinalizer.render(numberedLines);
  }
}
