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
 * Common structure of procedure and function definitions.
 */
public abstract class RoutineDef extends Node {
  public static final int MAX_PARAMS = 3;

  private final String name;
  private final ImmutableList<String> params;
  private final Body body;

  protected RoutineDef(int id, String name, List<String> params, Body body) {
    super(id);
    this.name = name;
    this.params = ImmutableList.copyOf(params);
    this.body = body;
  }

  public String getName() {
    return name;
  }

  public List<String> getParams() {
    return params;
  }

  public Body getBody() {
    return body;
  }

  /**
   * @return "procedure" or "function"
   */
  public abstract String kindName();

  @Override
  public String describe() {
    return kindName() + " " + name + "(" + StringUtils.join(params, " ") + ")";
  }
}
