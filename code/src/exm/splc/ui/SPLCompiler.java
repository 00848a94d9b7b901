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

import org.apache.log4j.Logger;

import exm.splc.ast.ASTPrinter;
import exm.splc.ast.Program;
import exm.splc.codegen.CodeGenerator;
import exm.splc.codegen.LineFinalizer;
import exm.splc.codegen.NumberedLine;
import exm.splc.common.Diagnostic;
import exm.splc.common.Settings;
import exm.splc.common.exceptions.CompileErrorException;
import exm.splc.common.exceptions.CompileErrorException.Phase;
import exm.splc.common.exceptions.InvalidOptionException;
import exm.splc.common.exceptions.SPLRuntimeError;
import exm.splc.frontend.ScopeResolution;
import exm.splc.frontend.ScopeResolver;
import exm.splc.frontend.typecheck.TypeChecker;

/**
 * Entry point to the compiler.  Runs the passes in order on a parsed
 * program, stopping after the first pass that reports problems.
 */
public class SPLCompiler {

  private final Logger logger;

  public SPLCompiler(Logger logger) {
    this.logger = logger;
  }

  /**
   * @param program syntax tree from the parser
   * @return generated program
   * @throws CompileErrorException if scope or type checking fail
   */
  public CompileResult compile(Program program)
                                  throws CompileErrorException {
    if (logger.isTraceEnabled()) {
      logger.trace("Syntax tree:\n" + ASTPrinter.printTree(program));
    }

    ScopeResolution scopes = new ScopeResolver(logger).resolve(program);
    if (scopes.hasErrors()) {
      throw fail(Phase.SCOPE, scopes.getDiagnostics());
    }

    TypeChecker checker = new TypeChecker(logger);
    if (!checker.checkProgram(program)) {
      throw fail(Phase.TYPE, checker.getDiagnostics());
    }

    List<String> symbolic = new CodeGenerator(logger, getBoolean(
            Settings.CODEGEN_INLINE_CALLS)).generate(program,
                                                     scopes.getTable());

    List<NumberedLine> numbered = new LineFinalizer(logger).finalize(
        symbolic, getInt(Settings.FINALIZE_START_LINE),
        getInt(Settings.FINALIZE_STEP));
    logger.debug("Compiled " + program + " to " + numbered.size() +
                 " lines");
    return new CompileResult(scopes.getTable(), symbolic, numbered);
  }

  private CompileErrorException fail(Phase phase,
                                     List<Diagnostic> diagnostics) {
    for (Diagnostic d: diagnostics) {
      logger.error(d.toString());
    }
    logger.debug("Stopping after " + phase.description());
    return new CompileErrorException(phase, diagnostics);
  }

  private static int getInt(String key) {
    try {
      return Settings.getInt(key);
    } catch (InvalidOptionException e) {
      throw new SPLRuntimeError(e.getMessage());
    }
  }

  private static boolean getBoolean(String key) {
    try {
      return Settings.getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new SPLRuntimeError(e.getMessage());
    }
  }
}
