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
package exm.splc.frontend.symbols;

/**
 * Identity of a declaration.  Routines are identified by their definition
 * node.  Names declared as bare strings (globals, main variables, parameters
 * and locals) have no node of their own, so they are identified by the node
 * that lists them, the list they are in and their position in that list.
 */
public class DeclId {

  public static enum Bucket {
    GLOBALS("globals"),
    MAIN("main"),
    PARAMS("params"),
    LOCALS("locals");

    private final String label;

    private Bucket(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }

  private final int nodeId;

  /** null for declarations that are nodes themselves */
  private final Bucket bucket;
  private final int index;

  private DeclId(int nodeId, Bucket bucket, int index) {
    this.nodeId = nodeId;
    this.bucket = bucket;
    this.index = index;
  }

  public static DeclId ofNode(int nodeId) {
    return new DeclId(nodeId, null, -1);
  }

  public static DeclId of(int ownerNodeId, Bucket bucket, int index) {
    assert(bucket != null);
    assert(index >= 0);
    return new DeclId(ownerNodeId, bucket, index);
  }

  /**
   * @return id of declaring node, or of node owning the name list
   */
  public int getNodeId() {
    return nodeId;
  }

  public Bucket getBucket() {
    return bucket;
  }

  public int getIndex() {
    return index;
  }

  public boolean isNode() {
    return bucket == null;
  }

  @Override
  public int hashCode() {
    int result = nodeId;
    result = 31 * result + (bucket == null ? 0 : bucket.hashCode());
    result = 31 * result + index;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof DeclId))
      return false;
    DeclId other = (DeclId) obj;
    return nodeId == other.nodeId && bucket == other.bucket
        && index == other.index;
  }

  @Override
  public String toString() {
    if (bucket == null) {
      return "#" + nodeId;
    }
    return "#" + nodeId + "." + bucket.label() + "[" + index + "]";
  }
}
