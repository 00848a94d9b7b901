package exm.splc.frontend;

import static exm.splc.SamplePrograms.names;
import static exm.splc.SamplePrograms.none;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

import exm.splc.SamplePrograms;
import exm.splc.ast.ASTBuilder;
import exm.splc.ast.FuncDef;
import exm.splc.ast.Instructions.Assign;
import exm.splc.ast.ProcDef;
import exm.splc.ast.Program;
import exm.splc.ast.Terms.VarRef;
import exm.splc.common.Diagnostic;
import exm.splc.common.DiagnosticKind;
import exm.splc.common.Logging;
import exm.splc.frontend.symbols.DeclId;
import exm.splc.frontend.symbols.DeclId.Bucket;
import exm.splc.frontend.symbols.ScopeTable;
import exm.splc.frontend.symbols.SymbolCategory;
import exm.splc.frontend.symbols.SymbolEntry;

public class ScopeResolverTest {

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("ScopeResolverTest.splc.log", true);
  }

  private static ScopeResolution resolve(Program p) {
    return new ScopeResolver().resolve(p);
  }

  private static List<DiagnosticKind> kinds(ScopeResolution r) {
    List<DiagnosticKind> result = new ArrayList<DiagnosticKind>();
    for (Diagnostic d: r.getDiagnostics()) {
      result.add(d.getKind());
    }
    return result;
  }

  @Test
  public void testCleanProgram() {
    ASTBuilder b = new ASTBuilder();
    ScopeResolution r = resolve(SamplePrograms.incAndSquare(b));
    assertFalse(r.getDiagnostics().toString(), r.hasErrors());

    ScopeTable t = r.getTable();
    assertEquals(2, t.getMainScope().getEntries().size());
    assertEquals(1, t.getProcedureScope().getEntries().size());
    assertEquals(1, t.getFunctionScope().getEntries().size());
  }

  @Test
  public void testDuplicateGlobals() {
    ASTBuilder b = new ASTBuilder();
    Program p = b.program(names("x", "x"), b.main(none(), b.algo()));
    ScopeResolution r = resolve(p);

    assertEquals(Arrays.asList(DiagnosticKind.DUPLICATE_NAME), kinds(r));
    Diagnostic d = r.getDiagnostics().get(0);
    assertEquals(p.getId(), d.getNodeId());
    assertEquals("Everywhere > Global", d.getScopePath());
    assertEquals("Both declarations referenced",
        Arrays.asList(DeclId.of(p.getId(), Bucket.GLOBALS, 0),
                      DeclId.of(p.getId(), Bucket.GLOBALS, 1)),
        d.getDecls());

    // Table is still usable
    assertEquals(1, r.getTable().getGlobalScope().getEntries().size());
  }

  @Test
  public void testProcFuncSameName() {
    ASTBuilder b = new ASTBuilder();
    ProcDef proc = b.proc("f", none(), b.body(none(), b.algo()));
    FuncDef func = b.func("f", none(), b.body(none(), b.algo()), b.num(1));
    Program p = b.program(none(), Arrays.asList(proc), Arrays.asList(func),
                          b.main(none(), b.algo()));
    ScopeResolution r = resolve(p);

    assertEquals("Exactly one clash",
        Arrays.asList(DiagnosticKind.CROSS_CATEGORY_CLASH), kinds(r));
    Diagnostic d = r.getDiagnostics().get(0);
    assertEquals("Function 'f' conflicts with procedure name",
                 d.getMessage());
    assertEquals(func.getId(), d.getNodeId());
    assertEquals(Arrays.asList(DeclId.ofNode(proc.getId()),
                               DeclId.ofNode(func.getId())), d.getDecls());
  }

  @Test
  public void testVariableClashesWithRoutine() {
    ASTBuilder b = new ASTBuilder();
    ProcDef proc = b.proc("p", none(), b.body(none(), b.algo()));
    FuncDef func = b.func("f", none(), b.body(none(), b.algo()), b.num(1));
    Program p = b.program(names("p"), Arrays.asList(proc),
        Arrays.asList(func), b.main(names("f"), b.algo()));
    ScopeResolution r = resolve(p);

    assertEquals(Arrays.asList(DiagnosticKind.CROSS_CATEGORY_CLASH,
                               DiagnosticKind.CROSS_CATEGORY_CLASH),
                 kinds(r));
    assertEquals("Variable 'p' conflicts with procedure name",
                 r.getDiagnostics().get(0).getMessage());
    assertEquals("Everywhere > Global",
                 r.getDiagnostics().get(0).getScopePath());
    assertEquals("Main variable 'f' conflicts with function name",
                 r.getDiagnostics().get(1).getMessage());
    assertEquals("Everywhere > Main",
                 r.getDiagnostics().get(1).getScopePath());
  }

  @Test
  public void testParamShadowed() {
    ASTBuilder b = new ASTBuilder();
    ProcDef proc = b.proc("p", names("a"), b.body(names("a"), b.algo()));
    Program p = b.program(none(), Arrays.asList(proc),
        Collections.<FuncDef>emptyList(), b.main(none(), b.algo()));
    ScopeResolution r = resolve(p);

    assertEquals(Arrays.asList(DiagnosticKind.PARAM_SHADOWED), kinds(r));
    Diagnostic d = r.getDiagnostics().get(0);
    assertEquals(proc.getBody().getId(), d.getNodeId());
    assertEquals("Everywhere > Global > Local:p", d.getScopePath());
    assertEquals(Arrays.asList(DeclId.of(proc.getId(), Bucket.PARAMS, 0),
             DeclId.of(proc.getBody().getId(), Bucket.LOCALS, 0)),
             d.getDecls());
  }

  @Test
  public void testDuplicateParam() {
    ASTBuilder b = new ASTBuilder();
    ProcDef proc = b.proc("p", names("a", "a"), b.body(none(), b.algo()));
    Program p = b.program(none(), Arrays.asList(proc),
        Collections.<FuncDef>emptyList(), b.main(none(), b.algo()));
    ScopeResolution r = resolve(p);

    assertEquals(Arrays.asList(DiagnosticKind.DUPLICATE_NAME), kinds(r));
    assertEquals("Everywhere > Global > Local:p",
                 r.getDiagnostics().get(0).getScopePath());
  }

  @Test
  public void testBindings() {
    ASTBuilder b = new ASTBuilder();
    VarRef paramRef = b.var("a");
    VarRef globalRef = b.var("g");
    VarRef mainRef = b.var("x");
    Assign assignGlobal = b.assign("g", b.n(1));
    ProcDef proc = b.proc("p", names("a"), b.body(none(),
        b.algo(b.print(paramRef), b.print(globalRef))));
    Program p = b.program(names("g"), Arrays.asList(proc),
        Collections.<FuncDef>emptyList(),
        b.main(names("x"), b.algo(b.print(mainRef), assignGlobal)));
    ScopeResolution r = resolve(p);
    assertFalse(r.getDiagnostics().toString(), r.hasErrors());
    ScopeTable t = r.getTable();

    SymbolEntry param = t.getBinding(paramRef);
    assertEquals(SymbolCategory.PARAMETER, param.getCategory());
    assertEquals("Local:p", param.getScope().getDisplayName());
    assertSame(t.getGlobalScope(), t.getBinding(globalRef).getScope());
    assertSame(t.getMainScope(), t.getBinding(mainRef).getScope());
    assertEquals(DeclId.of(p.getMain().getId(), Bucket.MAIN, 0),
                 t.getBinding(mainRef).getDeclId());
    assertSame(t.getGlobalScope(),
               t.getAssignTarget(assignGlobal).getScope());
    assertEquals(3, t.bindingCount());
  }

  @Test
  public void testUndeclaredInRoutine() {
    ASTBuilder b = new ASTBuilder();
    VarRef z = b.var("z");
    ProcDef proc = b.proc("p", none(), b.body(none(), b.algo(b.print(z))));
    Program p = b.program(none(), Arrays.asList(proc),
        Collections.<FuncDef>emptyList(), b.main(none(), b.algo()));
    ScopeResolution r = resolve(p);

    assertEquals(Arrays.asList(DiagnosticKind.UNDECLARED_VARIABLE),
                 kinds(r));
    Diagnostic d = r.getDiagnostics().get(0);
    assertEquals(z.getId(), d.getNodeId());
    assertEquals("Everywhere > Global > Local:p", d.getScopePath());
  }

  @Test
  public void testLocalsInvisibleFromMain() {
    ASTBuilder b = new ASTBuilder();
    ProcDef proc = b.proc("p", none(), b.body(names("t"), b.algo()));
    Assign assign = b.assign("y", b.n(1));
    Program p = b.program(none(), Arrays.asList(proc),
        Collections.<FuncDef>emptyList(),
        b.main(none(), b.algo(b.print(b.var("t")), assign)));
    ScopeResolution r = resolve(p);

    assertEquals(Arrays.asList(DiagnosticKind.UNDECLARED_VARIABLE,
                               DiagnosticKind.UNDECLARED_VARIABLE),
                 kinds(r));
    assertEquals("Undeclared variable 't'",
                 r.getDiagnostics().get(0).getMessage());
    assertEquals("Assignment target reported at assignment",
                 assign.getId(), r.getDiagnostics().get(1).getNodeId());
  }

  @Test
  public void testUndeclaredInCondition() {
    ASTBuilder b = new ASTBuilder();
    ScopeResolution r = resolve(SamplePrograms.undeclaredInCondition(b));
    assertEquals(Arrays.asList(DiagnosticKind.UNDECLARED_VARIABLE),
                 kinds(r));
    assertEquals("Everywhere > Main",
                 r.getDiagnostics().get(0).getScopePath());
  }

  @Test
  public void testMutualRecursion() {
    ASTBuilder b = new ASTBuilder();
    ProcDef pa = b.proc("a", none(), b.body(none(), b.algo(b.call("b"))));
    ProcDef pb = b.proc("b", none(), b.body(none(), b.algo(b.call("a"))));
    ProcDef pc = b.proc("c", none(), b.body(none(), b.algo(b.call("a"))));
    Program p = b.program(none(), Arrays.asList(pa, pb, pc),
        Collections.<FuncDef>emptyList(), b.main(none(), b.algo()));
    ScopeResolution r = resolve(p);

    assertEquals(Arrays.asList(DiagnosticKind.RECURSIVE_DEFINITION,
                               DiagnosticKind.RECURSIVE_DEFINITION),
                 kinds(r));
    assertEquals("Procedure 'a' is recursive: a -> b -> a",
                 r.getDiagnostics().get(0).getMessage());
    assertEquals("Procedure 'b' is recursive: b -> a -> b",
                 r.getDiagnostics().get(1).getMessage());
    assertEquals(pa.getId(), r.getDiagnostics().get(0).getNodeId());
  }

  @Test
  public void testSelfRecursiveFunction() {
    ASTBuilder b = new ASTBuilder();
    FuncDef f = b.func("f", names("n"), b.body(names("r"),
        b.algo(b.assignCall("r", "f", b.var("n")))), b.var("r"));
    Program p = b.program(none(), Collections.<ProcDef>emptyList(),
        Arrays.asList(f), b.main(none(), b.algo()));
    ScopeResolution r = resolve(p);

    assertEquals(Arrays.asList(DiagnosticKind.RECURSIVE_DEFINITION),
                 kinds(r));
    assertEquals("Function 'f' is recursive: f -> f",
                 r.getDiagnostics().get(0).getMessage());
    assertEquals("Everywhere > Function",
                 r.getDiagnostics().get(0).getScopePath());
  }

  @Test
  public void testDeterministic() {
    ASTBuilder b = new ASTBuilder();
    ProcDef proc = b.proc("p", names("a", "a"), b.body(names("a"),
        b.algo(b.print(b.var("q")))));
    Program p = b.program(names("p", "g", "g"), Arrays.asList(proc),
        Collections.<FuncDef>emptyList(), b.main(names("p"), b.algo()));

    List<String> first = new ArrayList<String>();
    for (Diagnostic d: resolve(p).getDiagnostics()) {
      first.add(d.toString());
    }
    List<String> second = new ArrayList<String>();
    for (Diagnostic d: resolve(p).getDiagnostics()) {
      second.add(d.toString());
    }
    assertTrue(first.size() > 3);
    assertEquals(first, second);
  }
}
