package exm.splc.codegen;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.AppenderSkeleton;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.spi.LoggingEvent;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.splc.common.Logging;

public class LineFinalizerTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  @BeforeClass
  public static void setupLogging() throws Exception {
    Logging.setupLogging("LineFinalizerTest.splc.log", true);
  }

  private static List<String> text(List<NumberedLine> lines) {
    List<String> result = new ArrayList<String>();
    for (NumberedLine l: lines) {
      result.add(l.toString());
    }
    return result;
  }

  @Test
  public void testBlankLinesDropped() {
    List<NumberedLine> out = new LineFinalizer().finalize(
        Arrays.asList("x = 5", "", "   ", "PRINT x"), 10, 10);
    assertEquals(Arrays.asList("10 x = 5", "20 PRINT x"), text(out));
    assertEquals(20, out.get(1).getNumber());
    assertEquals("PRINT x", out.get(1).getText());
  }

  @Test
  public void testNumbering() {
    List<String> lines = new ArrayList<String>();
    for (int k = 0; k < 25; k++) {
      lines.add("PRINT " + k);
    }
    List<NumberedLine> out = new LineFinalizer().finalize(lines, 10, 10);
    for (int k = 0; k < 25; k++) {
      assertEquals("Line " + k, 10 + 10 * k, out.get(k).getNumber());
    }

    out = new LineFinalizer().finalize(lines.subList(0, 3), 1, 1);
    assertEquals(Arrays.asList("1 PRINT 0", "2 PRINT 1", "3 PRINT 2"),
                 text(out));
  }

  @Test
  public void testLabelsResolved() {
    List<String> lines = Arrays.asList(
        "REM WH1",
        "IF x > 0 THEN WB2",
        "GOTO WE3",
        "REM WB2",
        "x = x - 1",
        "GOTO WH1",
        "REM WE3");
    assertEquals(Arrays.asList(
        "10 REM WH1",
        "20 IF x > 0 THEN 40",
        "30 GOTO 70",
        "40 REM WB2",
        "50 x = x - 1",
        "60 GOTO 10",
        "70 REM WE3"),
        text(new LineFinalizer().finalize(lines, 10, 10)));
  }

  @Test
  public void testForwardAndIndentedLabels() {
    List<String> lines = Arrays.asList(
        "GOTO AND12",
        "",
        "  REM AND12  ");
    assertEquals(Arrays.asList("100 GOTO 105", "105   REM AND12  "),
        text(new LineFinalizer().finalize(lines, 100, 5)));
  }

  @Test
  public void testUnknownLabelKept() {
    List<String> lines = Arrays.asList("GOTO Q9", "IF a THEN T1", "REM T1");
    assertEquals(Arrays.asList("10 GOTO Q9", "20 IF a THEN 30", "30 REM T1"),
        text(new LineFinalizer().finalize(lines, 10, 10)));
  }

  /**
   * Collects messages logged at WARN or above
   */
  private static class WarningCollector extends AppenderSkeleton {
    final List<String> warnings = new ArrayList<String>();

    @Override
    protected void append(LoggingEvent event) {
      if (event.getLevel().isGreaterOrEqual(Level.WARN)) {
        warnings.add(event.getRenderedMessage());
      }
    }

    @Override
    public void close() {
    }

    @Override
    public boolean requiresLayout() {
      return false;
    }
  }

  @Test
  public void testUnknownLabelWarnedEachRun() {
    Logger logger = Logger.getLogger("LineFinalizerTest.warnings");
    logger.setAdditivity(false);
    logger.setLevel(Level.DEBUG);
    WarningCollector collector = new WarningCollector();
    logger.addAppender(collector);

    List<String> lines = Arrays.asList("GOTO Q9", "REM T1");
    LineFinalizer finalizer = new LineFinalizer(logger);
    finalizer.finalize(lines, 10, 10);
    finalizer.finalize(lines, 10, 10);
    new LineFinalizer(logger).finalize(lines, 10, 10);

    String expected = "Undefined label Q9 on line 10, left unresolved";
    assertEquals(Arrays.asList(expected, expected, expected),
                 collector.warnings);
    logger.removeAppender(collector);
  }

  @Test
  public void testStringLiteralsUntouched() {
    List<String> lines = Arrays.asList("REM T1", "PRINT \"GOTO T1\"",
                                       "GOTO T1");
    assertEquals(Arrays.asList("10 REM T1", "20 PRINT \"GOTO T1\"",
                               "30 GOTO 10"),
        text(new LineFinalizer().finalize(lines, 10, 10)));
  }

  @Test
  public void testRender() {
    List<NumberedLine> out = new LineFinalizer().finalize(
        Arrays.asList("x = 5", "PRINT x"), 10, 10);
    assertEquals("10 x = 5\n20 PRINT x\n", LineFinalizer.render(out));
  }

  @Test
  public void testStepMustBePositive() {
    exception.expect(IllegalArgumentException.class);
    new LineFinalizer().finalize(Arrays.asList("STOP"), 10, 0);
  }
}
