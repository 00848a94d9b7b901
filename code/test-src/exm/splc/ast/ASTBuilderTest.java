package exm.splc.ast;

import static exm.splc.SamplePrograms.names;
import static exm.splc.SamplePrograms.none;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.splc.SamplePrograms;
import exm.splc.ast.Instructions.Call;
import exm.splc.ast.Terms.VarRef;
import exm.splc.common.exceptions.SPLRuntimeError;

public class ASTBuilderTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @Test
  public void testIdsUniqueAndDense() {
    ASTBuilder b = new ASTBuilder();
    Program p = SamplePrograms.assignAndPrint(b);

    Set<Integer> ids = ASTWalk.collectIds(p);
    assertEquals("Every node should be reachable", b.nodeCount(), ids.size());
    assertEquals(8, b.nodeCount());
    for (int i = 1; i <= 8; i++) {
      assertTrue("id " + i + " should be used", ids.contains(i));
    }
    // Children are built before their parents
    assertEquals(8, p.getId());
  }

  @Test
  public void testBuildersIndependent() {
    ASTBuilder b1 = new ASTBuilder();
    ASTBuilder b2 = new ASTBuilder();
    b1.halt();
    b1.halt();
    assertEquals("Each builder owns its counter", 1, b2.halt().getId());
  }

  @Test
  public void testCollectByClass() {
    ASTBuilder b = new ASTBuilder();
    Program p = SamplePrograms.incAndSquare(b);

    List<String> calls = new ArrayList<String>();
    for (Call c: ASTWalk.collect(p, Call.class)) {
      calls.add(c.getName());
    }
    assertEquals(names("inc", "sq"), calls);

    List<String> vars = new ArrayList<String>();
    for (VarRef v: ASTWalk.collect(p.getMain(), VarRef.class)) {
      vars.add(v.getName());
    }
    assertEquals(names("x", "x", "y"), vars);
  }

  @Test
  public void testPrintTree() {
    ASTBuilder b = new ASTBuilder();
    Program p = SamplePrograms.assignAndPrint(b);
    String dump = ASTPrinter.printTree(p);

    String[] lines = dump.split("\n");
    assertEquals(8, lines.length);
    assertEquals("Program glob {x} #8", lines[0]);
    assertEquals("  Main var {} #7", lines[1]);
    assertEquals("      Assign x #3", lines[3]);
    assertEquals("        TermAtom #2", lines[4]);
    assertEquals("          NumberLit 5 #1", lines[5]);
  }

  @Test
  public void testTooManyParams() {
    ASTBuilder b = new ASTBuilder();
    exception.expect(SPLRuntimeError.class);
    b.proc("p", names("a", "b", "c", "d"), b.body(none(), b.algo()));
  }

  @Test
  public void testCallArgsNotLimited() {
    ASTBuilder b = new ASTBuilder();
    Call c = b.call("p", b.num(1), b.num(2), b.num(3), b.num(4));
    assertEquals(4, c.getArgs().size());
  }

  @Test
  public void testAssignNeedsOneRhs() {
    exception.expect(SPLRuntimeError.class);
    new Instructions.Assign(1, "x", (Terms.Term)null);
  }
}
