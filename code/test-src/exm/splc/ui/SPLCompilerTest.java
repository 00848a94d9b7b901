package exm.splc.ui;

import static exm.splc.SamplePrograms.names;
import static exm.splc.SamplePrograms.none;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;

import org.junit.After;
import org.junit.BeforeClass;
import org.junit.Test;

import exm.splc.SamplePrograms;
import exm.splc.ast.ASTBuilder;
import exm.splc.ast.FuncDef;
import exm.splc.ast.ProcDef;
import exm.splc.ast.Program;
import exm.splc.common.DiagnosticKind;
import exm.splc.common.Logging;
import exm.splc.common.Settings;
import exm.splc.common.exceptions.CompileErrorException;
import exm.splc.common.exceptions.CompileErrorException.Phase;

public class SPLCompilerTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("SPLCompilerTest.splc.log", true);
  }

  @After
  public void resetSettings() {
    for (String key: Settings.getKeys()) {
      Settings.reset(key);
    }
  }

  private static SPLCompiler compiler() {
    return new SPLCompiler(Logging.getSPLLogger());
  }

  @Test
  public void testAssignAndPrint() throws CompileErrorException {
    ASTBuilder b = new ASTBuilder();
    CompileResult r = compiler().compile(SamplePrograms.assignAndPrint(b));

    assertEquals(Arrays.asList("x = 5", "PRINT x"), r.getSymbolicLines());
    assertEquals("10 x = 5\n20 PRINT x\n", r.render());
    assertEquals(1, r.getSymbols().getGlobalScope().getEntries().size());
  }

  @Test
  public void testIfElseProgram() throws CompileErrorException {
    ASTBuilder b = new ASTBuilder();
    Program p = b.program(none(), b.main(names("x"), b.algo(
        b.assign("x", b.n(1)),
        b.branch(b.gt(b.v("x"), b.n(0)),
                 b.algo(b.printString("a")),
                 b.algo(b.printString("b"))))));
    CompileResult r = compiler().compile(p);
    assertEquals(
        "10 x = 1\n" +
        "20 IF x > 0 THEN 50\n" +
        "30 PRINT \"b\"\n" +
        "40 GOTO 70\n" +
        "50 REM T1\n" +
        "60 PRINT \"a\"\n" +
        "70 REM X2\n", r.render());
  }

  @Test
  public void testInlinedProgram() throws CompileErrorException {
    ASTBuilder b = new ASTBuilder();
    CompileResult r = compiler().compile(SamplePrograms.incAndSquare(b));
    for (String line: r.getSymbolicLines()) {
      assertFalse(line, line.contains("CALL"));
    }
    assertEquals("120 PRINT y", r.getNumberedLines().get(11).toString());
  }

  @Test
  public void testMainVariableKeptApartFromGlobal()
                                          throws CompileErrorException {
    // glob{x} proc setg{x=5} main{var{x} x=1; setg; print x} prints 1
    ASTBuilder b = new ASTBuilder();
    ProcDef setg = b.proc("setg", none(), b.body(none(),
        b.algo(b.assign("x", b.n(5)))));
    Program p = b.program(names("x"), Arrays.asList(setg),
        Collections.<FuncDef>emptyList(),
        b.main(names("x"), b.algo(b.assign("x", b.n(1)),
                                  b.call("setg"),
                                  b.print(b.var("x")))));
    CompileResult r = compiler().compile(p);
    assertEquals(
        "10 x_0 = 1\n" +
        "20 REM INLINE PROC setg\n" +
        "30 x = 5\n" +
        "40 REM ENDINLINE PROC setg\n" +
        "50 PRINT x_0\n", r.render());
  }

  @Test
  public void testSettingsApplied() throws CompileErrorException {
    Settings.set(Settings.FINALIZE_START_LINE, "100");
    Settings.set(Settings.FINALIZE_STEP, "5");
    Settings.set(Settings.CODEGEN_INLINE_CALLS, "false");
    ASTBuilder b = new ASTBuilder();
    CompileResult r = compiler().compile(SamplePrograms.incAndSquare(b));
    assertEquals(
        "100 x = 3\n" +
        "105 CALL inc x\n" +
        "110 y = CALL sq x\n" +
        "115 PRINT y\n", r.render());
  }

  @Test
  public void testStopsAfterScopeErrors() {
    ASTBuilder b = new ASTBuilder();
    try {
      compiler().compile(SamplePrograms.undeclaredInCondition(b));
      fail("Expected CompileErrorException");
    } catch (CompileErrorException e) {
      assertEquals(Phase.SCOPE, e.getPhase());
      assertEquals(1, e.getDiagnostics().size());
      assertEquals(DiagnosticKind.UNDECLARED_VARIABLE,
                   e.getDiagnostics().get(0).getKind());
      assertTrue(e.getMessage(),
                 e.getMessage().startsWith("1 error during scope checking"));
    }
  }

  @Test
  public void testStopsAfterTypeErrors() {
    ASTBuilder b = new ASTBuilder();
    try {
      compiler().compile(SamplePrograms.whileOnNumber(b));
      fail("Expected CompileErrorException");
    } catch (CompileErrorException e) {
      assertEquals(Phase.TYPE, e.getPhase());
      assertEquals(1, e.getDiagnostics().size());
      assertEquals(DiagnosticKind.TYPE_MISMATCH,
                   e.getDiagnostics().get(0).getKind());
    }
  }

  @Test
  public void testRecursionRejected() {
    ASTBuilder b = new ASTBuilder();
    ProcDef loop = b.proc("loop", none(), b.body(none(),
        b.algo(b.call("loop"))));
    Program p = b.program(none(), Arrays.asList(loop),
        Collections.<FuncDef>emptyList(),
        b.main(none(), b.algo(b.call("loop"))));
    try {
      compiler().compile(p);
      fail("Expected CompileErrorException");
    } catch (CompileErrorException e) {
      assertEquals(Phase.SCOPE, e.getPhase());
      assertEquals(DiagnosticKind.RECURSIVE_DEFINITION,
                   e.getDiagnostics().get(0).getKind());
    }
  }
}
