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
package exm.splc.codegen;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;

import exm.splc.common.Logging;

/**
 * Numbers symbolic target code and replaces label references with line
 * numbers.
 */
public class LineFinalizer {
  private static final Pattern LABEL_DEF =
        Pattern.compile("^\\s*" + TargetCode.REM + "\\s+([A-Za-z]+\\d+)\\s*$");
  private static final Pattern JUMP =
        Pattern.compile("\\b(" + TargetCode.GOTO + "|" + TargetCode.THEN +
                        ")\\s+([A-Za-z]+\\d+)\\b");

  private final Logger logger;

  public LineFinalizer() {
    this(Logging.getSPLLogger());
  }

  public LineFinalizer(Logger logger) {
    this.logger = logger;
  }

  /**
   * @param lines symbolic code; blank lines are dropped
   * @param start number of first line
   * @param step increment between line numbers, must be positive
   * @return numbered lines with jump targets resolved.  References to
   *         labels that are never placed are left as they are.
   */
  public List<NumberedLine> finalize(List<String> lines, int start,
                                     int step) {
    Preconditions.checkArgument(step > 0, "step must be positive: %s", step);

    List<NumberedLine> numbered = new ArrayList<NumberedLine>(lines.size());
    int lineNum = start;
    for (String line: lines) {
      if (StringUtils.isBlank(line)) {
        continue;
      }
      numbered.add(new NumberedLine(lineNum, line));
      lineNum += step;
    }

    Map<String, Integer> labelLines = new HashMap<String, Integer>();
    for (NumberedLine line: numbered) {
      Matcher m = LABEL_DEF.matcher(line.getText());
      if (m.matches()) {
        labelLines.put(m.group(1), line.getNumber());
      }
    }
    logger.debug("Finalizing " + numbered.size() + " lines with " +
                 labelLines.size() + " labels");

    // Warnings already given during this call
    Set<String> warned = new HashSet<String>();
    List<NumberedLine> result = new ArrayList<NumberedLine>(numbered.size());
    for (NumberedLine line: numbered) {
      result.add(new NumberedLine(line.getNumber(),
                                  resolveJumps(line, labelLines, warned)));
    }
    return result;
  }

  /**
   * Rewrite jump targets outside of string literals
   */
  private String resolveJumps(NumberedLine line,
                              Map<String, Integer> labelLines,
                              Set<String> warned) {
    String[] parts = line.getText().split("\"", -1);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) {
        sb.append('"');
      }
      if (i % 2 == 1) {
        // Inside quotes
        sb.append(parts[i]);
        continue;
      }
      Matcher m = JUMP.matcher(parts[i]);
      StringBuffer out = new StringBuffer();
      while (m.find()) {
        String label = m.group(2);
        Integer target = labelLines.get(label);
        String replacement;
        if (target != null) {
          replacement = m.group(1) + " " + target;
        } else {
          String msg = "Undefined label " + label + " on line " +
                       line.getNumber() + ", left unresolved";
          if (warned.add(msg)) {
            logger.warn(msg);
          } else {
            logger.debug("Duplicate Warning: " + msg);
          }
          replacement = m.group(1) + " " + label;
        }
        m.appendReplacement(out, Matcher.quoteReplacement(replacement));
      }
      m.appendTail(out);
      sb.append(out);
    }
    return sb.toString();
  }

  /**
   * @return program text, one line per instruction, newline-terminated
   */
  public static String render(List<NumberedLine> lines) {
    StringBuilder sb = new StringBuilder();
    for (NumberedLine line: lines) {
      sb.append(line.toString()).append('\n');
    }
    return sb.toString();
  }
}
