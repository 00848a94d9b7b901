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

import java.util.List;

/**
 * Base class of all SPL syntax tree nodes.  Trees are immutable and every
 * node carries an identity that is unique within its tree.
 */
public abstract class Node {
  private final int id;

  protected Node(int id) {
    this.id = id;
  }

  public int getId() {
    return id;
  }

  /**
   * @return direct children, in source order
   */
  public abstract List<? extends Node> children();

  /**
   * @return one line summary of this node without its children
   */
  public abstract String describe();

  @Override
  public String toString() {
    return describe() + " #" + id;
  }
}
