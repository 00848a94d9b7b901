package exm.splc;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.splc.ast.ASTBuilder;
import exm.splc.ast.FuncDef;
import exm.splc.ast.ProcDef;
import exm.splc.ast.Program;

/**
 * Small SPL programs shared by tests
 */
public class SamplePrograms {

  public static List<String> names(String... names) {
    return Arrays.asList(names);
  }

  public static List<String> none() {
    return Collections.emptyList();
  }

  /**
   * glob{x} proc{} func{} main{var{} x = 5; print x}
   */
  public static Program assignAndPrint(ASTBuilder b) {
    return b.program(names("x"),
        b.main(none(), b.algo(
            b.assign("x", b.n(5)),
            b.print(b.var("x")))));
  }

  /**
   * main{var{} if (x > 0) {print "a"} else {print "b"}}, x undeclared
   */
  public static Program undeclaredInCondition(ASTBuilder b) {
    return b.program(none(),
        b.main(none(), b.algo(
            b.branch(b.gt(b.v("x"), b.n(0)),
                     b.algo(b.printString("a")),
                     b.algo(b.printString("b"))))));
  }

  /**
   * glob{x} main{var{} while x {halt}}
   */
  public static Program whileOnNumber(ASTBuilder b) {
    return b.program(names("x"),
        b.main(none(), b.algo(
            b.whileLoop(b.v("x"), b.algo(b.halt())))));
  }

  /**
   * proc inc(a) {local{t} t = a plus 1; print t}
   * func sq(n) {local{r} r = n mult n} return r
   * main{var{x y} x = 3; inc(x); y = sq(x); print y}
   */
  public static Program incAndSquare(ASTBuilder b) {
    ProcDef inc = b.proc("inc", names("a"),
        b.body(names("t"), b.algo(
            b.assign("t", b.plus(b.v("a"), b.n(1))),
            b.print(b.var("t")))));
    FuncDef sq = b.func("sq", names("n"),
        b.body(names("r"), b.algo(
            b.assign("r", b.mult(b.v("n"), b.v("n"))))),
        b.var("r"));
    return b.program(none(), Arrays.asList(inc), Arrays.asList(sq),
        b.main(names("x", "y"), b.algo(
            b.assign("x", b.n(3)),
            b.call("inc", b.var("x")),
            b.assignCall("y", "sq", b.var("x")),
            b.print(b.var("y")))));
  }
}
