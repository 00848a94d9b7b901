package exm.splc.frontend.symbols;

import static exm.splc.SamplePrograms.names;
import static exm.splc.SamplePrograms.none;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.splc.ast.ASTBuilder;
import exm.splc.ast.ProcDef;
import exm.splc.common.exceptions.DoubleDefineException;
import exm.splc.common.exceptions.SPLRuntimeError;
import exm.splc.common.lang.SemType;
import exm.splc.frontend.symbols.DeclId.Bucket;

public class ScopeTableTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static ProcDef proc(String name) {
    ASTBuilder b = new ASTBuilder();
    return b.proc(name, names("a"), b.body(none(), b.algo()));
  }

  @Test
  public void testBaseScopes() {
    ScopeTable t = new ScopeTable();
    assertNull(t.getRoot().getParent());
    assertSame(t.getRoot(), t.getGlobalScope().getParent());
    assertSame(t.getRoot(), t.getProcedureScope().getParent());
    assertSame(t.getRoot(), t.getFunctionScope().getParent());
    assertSame(t.getRoot(), t.getMainScope().getParent());
    assertEquals(5, t.getScopes().size());

    assertEquals("Everywhere", t.getScopePath(t.getRoot()));
    assertEquals("Everywhere > Procedure",
                 t.getScopePath(t.getProcedureScope()));
    assertEquals("Everywhere > Main", t.getScopePath(t.getMainScope()));
  }

  @Test
  public void testLocalScopeUnderGlobals() {
    ScopeTable t = new ScopeTable();
    ProcDef p = proc("inc");
    Scope local = t.newLocalScope(p);

    assertSame(local, t.localScopeOf(p));
    assertSame(t.getGlobalScope(), local.getParent());
    assertEquals("Local:inc", local.getDisplayName());
    assertEquals("Everywhere > Global > Local:inc", t.getScopePath(local));
  }

  @Test
  public void testLookup() throws DoubleDefineException {
    ScopeTable t = new ScopeTable();
    ProcDef p = proc("inc");
    Scope local = t.newLocalScope(p);
    SymbolEntry g = t.declare(t.getGlobalScope(), "g",
        SymbolCategory.VARIABLE, DeclId.of(1, Bucket.GLOBALS, 0),
        SemType.NUMERIC);
    SymbolEntry a = t.declare(local, "a", SymbolCategory.PARAMETER,
        DeclId.of(p.getId(), Bucket.PARAMS, 0), SemType.NUMERIC);

    assertNull("Globals not declared locally", t.lookupLocal(local, "g"));
    assertSame(g, t.lookupChain(local, "g"));
    assertSame(a, t.lookupChain(local, "a"));
    assertNull("Parameters invisible from globals",
               t.lookupChain(t.getGlobalScope(), "a"));
    assertSame(g, t.getDeclaration(DeclId.of(1, Bucket.GLOBALS, 0)));
    assertSame(local, a.getScope());
  }

  @Test
  public void testLookupFromMain() throws DoubleDefineException {
    ScopeTable t = new ScopeTable();
    SymbolEntry g = t.declare(t.getGlobalScope(), "x",
        SymbolCategory.VARIABLE, DeclId.of(1, Bucket.GLOBALS, 0),
        SemType.NUMERIC);
    assertSame(g, t.lookupFromMain("x"));

    SymbolEntry m = t.declare(t.getMainScope(), "x",
        SymbolCategory.VARIABLE, DeclId.of(2, Bucket.MAIN, 0),
        SemType.NUMERIC);
    assertSame("Main variables come first", m, t.lookupFromMain("x"));
    assertNull(t.lookupFromMain("y"));
  }

  @Test
  public void testDuplicateRejected() throws DoubleDefineException {
    ScopeTable t = new ScopeTable();
    Scope globals = t.getGlobalScope();
    t.declare(globals, "x", SymbolCategory.VARIABLE,
              DeclId.of(1, Bucket.GLOBALS, 0), SemType.NUMERIC);
    try {
      t.declare(globals, "x", SymbolCategory.VARIABLE,
                DeclId.of(1, Bucket.GLOBALS, 1), SemType.NUMERIC);
      fail("Expected DoubleDefineException");
    } catch (DoubleDefineException e) {
      assertEquals(DeclId.of(1, Bucket.GLOBALS, 0),
                   e.getExisting().getDeclId());
      assertEquals(DeclId.of(1, Bucket.GLOBALS, 1),
                   e.getRejected().getDeclId());
      assertTrue(e.getMessage(), e.getMessage().contains("'x'"));
    }
    assertEquals("Scope unchanged", 1, globals.getEntries().size());
    assertNull(t.getDeclaration(DeclId.of(1, Bucket.GLOBALS, 1)));
  }

  @Test
  public void testLocalScopeOnce() {
    ScopeTable t = new ScopeTable();
    ProcDef p = proc("p");
    t.newLocalScope(p);
    exception.expect(SPLRuntimeError.class);
    t.newLocalScope(p);
  }

  @Test
  public void testPrettyPrintSorted() throws DoubleDefineException {
    ScopeTable t = new ScopeTable();
    t.declare(t.getGlobalScope(), "b", SymbolCategory.VARIABLE,
              DeclId.of(1, Bucket.GLOBALS, 0), SemType.NUMERIC);
    t.declare(t.getGlobalScope(), "a", SymbolCategory.VARIABLE,
              DeclId.of(1, Bucket.GLOBALS, 1), SemType.NUMERIC);
    Scope local = t.newLocalScope(proc("f"));

    String dump = t.prettyPrint();
    assertTrue(dump, dump.startsWith("Everywhere (scope 1)\n"));
    int a = dump.indexOf("variable a:numeric @ #1.globals[1]");
    int b = dump.indexOf("variable b:numeric @ #1.globals[0]");
    assertTrue(dump, a >= 0 && b > a);
    assertTrue(dump, dump.indexOf(local.getDisplayName()) > b);

    // Declaration order is kept in the scope itself
    assertEquals("b", globalsFirst(t).getName());
  }

  private static SymbolEntry globalsFirst(ScopeTable t) {
    return t.getGlobalScope().getEntries().iterator().next();
  }

  @Test
  public void testDeclId() {
    assertEquals("#1.globals[0]", DeclId.of(1, Bucket.GLOBALS, 0).toString());
    assertEquals("#7.locals[2]", DeclId.of(7, Bucket.LOCALS, 2).toString());
    assertEquals("#5", DeclId.ofNode(5).toString());
    assertEquals(DeclId.of(3, Bucket.PARAMS, 1),
                 DeclId.of(3, Bucket.PARAMS, 1));
    assertFalse(DeclId.of(3, Bucket.PARAMS, 1).equals(
                DeclId.of(3, Bucket.LOCALS, 1)));
    assertFalse(DeclId.ofNode(3).equals(DeclId.of(3, Bucket.MAIN, 0)));
    assertEquals(3, DeclId.of(3, Bucket.MAIN, 0).getNodeId());
  }
}
