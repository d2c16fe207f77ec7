/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.prover.parse;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Strings;
import net.hydromatic.prover.util.ProverException;

/** Exception caused by malformed literal text. */
public class ParseException extends RuntimeException
    implements ProverException {
  private final String text;
  private final int column;

  ParseException(String message, String text, int column) {
    super(message);
    this.text = requireNonNull(text);
    this.column = column;
  }

  @Override
  public String text() {
    return text;
  }

  @Override
  public int column() {
    return column;
  }

  @Override
  public String toString() {
    return super.toString() + " at column " + column + " of '" + text + "'";
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(text)
        .append('\n')
        .append(Strings.repeat(" ", column))
        .append("^ Error: ")
        .append(getMessage());
  }
}

// End ParseException.java
