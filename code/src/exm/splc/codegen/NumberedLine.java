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

/**
 * A line of final target code
 */
public class NumberedLine {
  private final int number;
  private final String text;

  public NumberedLine(int number, String text) {
    this.number = number;
    this.text = text;
  }

  public int getNumber() {
    return number;
  }

  public String getText() {
    return text;
  }

  @Override
  public int hashCode() {
    return 31 * number + text.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof NumberedLine))
      return false;
    NumberedLine other = (NumberedLine)obj;
    return number == other.number && text.equals(other.text);
  }

  @Override
  public String toString() {
    return number + " " + text;
  }
}
