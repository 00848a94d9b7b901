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

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Generic traversal of syntax trees.
 */
public class ASTWalk {

  public static interface NodeWalker {
    /**
     * Called once per node, parents before children
     * @param node
     * @param depth distance from walk root
     */
    public void visit(Node node, int depth);
  }

  /**
   * Pre-order walk in source order
   */
  public static void walk(Node root, NodeWalker walker) {
    walk(root, 0, walker);
  }

  private static void walk(Node node, int depth, NodeWalker walker) {
    walker.visit(node, depth);
    for (Node child: node.children()) {
      walk(child, depth + 1, walker);
    }
  }

  /**
   * @return ids of all nodes in the subtree, in pre-order
   */
  public static Set<Integer> collectIds(Node root) {
    final Set<Integer> ids = new LinkedHashSet<Integer>();
    walk(root, new NodeWalker() {
      @Override
      public void visit(Node node, int depth) {
        ids.add(node.getId());
      }
    });
    return ids;
  }

  /**
   * @return all nodes in subtree that are instances of the class
   */
  public static <T extends Node> List<T> collect(Node root,
                                                 final Class<T> cls) {
    final List<T> result = new ArrayList<T>();
    walk(root, new NodeWalker() {
      @Override
      public void visit(Node node, int depth) {
        if (cls.isInstance(node)) {
          result.add(cls.cast(node));
        }
      }
    });
    return result;
  }
}
