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
package exm.splc.ast;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Indented dump of a syntax tree with node ids, for trace output.
 */
public class ASTPrinter {

  public static String printTree(Node root) {
    StringWriter sw = new StringWriter();
    final PrintWriter writer = new PrintWriter(sw);
    ASTWalk.walk(root, new ASTWalk.NodeWalker() {
      @Override
      public void visit(Node node, int depth) {
        indent(writer, depth * 2);
        writer.println(node.toString());
      }
    });
    writer.flush();
    return sw.toString();
  }

  private static void indent(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }
}
