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

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

/**
 * Body of a procedure or function: up to three local variable names
 * followed by the instructions.
 */
public class Body extends Node {
  public static final int MAX_LOCALS = 3;

  private final ImmutableList<String> locals;
  private final Algo algo;

  public Body(int id, List<String> locals, Algo algo) {
    super(id);
    this.locals = ImmutableList.copyOf(locals);
    this.algo = algo;
  }

  public List<String> getLocals() {
    return locals;
  }

  public Algo getAlgo() {
    return algo;
  }

  @Override
  public List<Algo> children() {
    return ImmutableList.of(algo);
  }

  @Override
  public String describe() {
    return "Body local {" + StringUtils.join(locals, " ") + "}";
  }
}
