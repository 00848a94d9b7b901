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
package exm.splc.common.util;

/**
 * Monotonic allocator for integer identifiers.  Each compilation run owns
 * its own counters: node ids, scope ids, label numbers and inline
 * instantiation numbers are never shared between runs.
 */
public class Counter {
  private long next;

  public Counter() {
    this(1);
  }

  public Counter(long first) {
    this.next = first;
  }

  /**
   * @return the next value, never returned before by this counter
   */
  public long next() {
    return next++;
  }

  public int nextInt() {
    long val = next();
    if (val > Integer.MAX_VALUE) {
      throw new IllegalStateException("Counter overflowed int range: " + val);
    }
    return (int)val;
  }

  /**
   * @return the value that will be returned by the next call to next()
   */
  public long peek() {
    return next;
  }

  @Override
  public String toString() {
    return "Counter(next=" + next + ")";
  }
}
