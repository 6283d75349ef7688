/*
 * Copyright 2026 The Minipy Authors.
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
 * limitations under the License.
 */

package io.minipy.compiler.parsing;

/** A syntax tree document that cannot be turned into a tree. */
public class AstReadException extends Exception {
  private static final long serialVersionUID = 1L;

  public AstReadException(String message) {
    super(message);
  }

  public AstReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
