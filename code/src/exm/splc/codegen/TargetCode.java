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

import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Builders for lines of target code.  The target is a flat, line-oriented
 * instruction set with symbolic labels, resolved to line numbers by
 * {@link LineFinalizer}.
 */
public class TargetCode {

  /** Keyword of label marker lines */
  public static final String REM = "REM";
  public static final String GOTO = "GOTO";
  public static final String THEN = "THEN";
  public static final String CALL = "CALL";
  public static final String PROC = "PROC";
  public static final String FUNC = "FUNC";

  public static String print(String value) {
    return "PRINT " + value;
  }

  public static String quote(String s) {
    return "\"" + s + "\"";
  }

  public static String assign(String target, String expr) {
    return target + " = " + expr;
  }

  /**
   * Call instruction, for when inlining is disabled
   */
  public static String call(String name, List<String> args) {
    if (args.isEmpty()) {
      return CALL + " " + name;
    }
    return CALL + " " + name + " " + StringUtils.join(args, " ");
  }

  public static String assignCall(String target, String name,
                                  List<String> args) {
    return assign(target, call(name, args));
  }

  public static String stop() {
    return "STOP";
  }

  public static String ifThen(String cond, String label) {
    return "IF " + cond + " " + THEN + " " + label;
  }

  public static String gotoLabel(String label) {
    return GOTO + " " + label;
  }

  public static String label(String label) {
    return REM + " " + label;
  }

  /**
   * Comment opening an inlined routine body.  Never matches a label
   * marker, which has a single word after REM.
   * @param kind {@link #PROC} or {@link #FUNC}
   */
  public static String inlineStart(String kind, String name) {
    return REM + " INLINE " + kind + " " + name;
  }

  public static String inlineEnd(String kind, String name) {
    return REM + " ENDINLINE " + kind + " " + name;
  }
}
