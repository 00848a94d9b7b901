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

import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * Immutable chain of renaming frames used while inlining.  Each inlined
 * routine gets a frame mapping its parameters and locals to fresh names.
 */
public class RenameEnv {
  private static final RenameEnv ROOT =
            new RenameEnv(null, ImmutableMap.<String, String>of());

  private final RenameEnv parent;
  private final ImmutableMap<String, String> renames;

  private RenameEnv(RenameEnv parent, Map<String, String> renames) {
    this.parent = parent;
    this.renames = ImmutableMap.copyOf(renames);
  }

  /**
   * @return environment of the main block, which renames nothing
   */
  public static RenameEnv root() {
    return ROOT;
  }

  /**
   * Environment for an inlined routine body.  Routines see globals but not
   * the variables of their caller, so the new frame sits directly on the
   * root.
   */
  public static RenameEnv forCallee(Map<String, String> renames) {
    return ROOT.push(renames);
  }

  public RenameEnv push(Map<String, String> frame) {
    return new RenameEnv(this, frame);
  }

  public RenameEnv getParent() {
    return parent;
  }

  public boolean isRoot() {
    return parent == null;
  }

  /**
   * @return innermost renaming of name, or null if not renamed
   */
  public String lookup(String name) {
    for (RenameEnv e = this; e != null; e = e.parent) {
      String renamed = e.renames.get(name);
      if (renamed != null) {
        return renamed;
      }
    }
    return null;
  }

  public int depth() {
    int d = 0;
    for (RenameEnv e = this.parent; e != null; e = e.parent) {
      d++;
    }
    return d;
  }

  @Override
  public String toString() {
    return isRoot() ? "<root>" : renames + " <- " + parent;
  }
}
