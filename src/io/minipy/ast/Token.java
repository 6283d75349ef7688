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

package io.minipy.ast;

/**
 * The tag of every {@link Node}. One constant per statement, expression, literal, parameter and
 * pattern kind of the Python 3 syntax tree, plus a few structural containers.
 */
public enum Token {
  MODULE, // top-level node for a whole translation unit
  BLOCK, // statement list
  EMPTY, // placeholder for an absent optional child
  DECORATORS, // decorator expressions of a def or class
  ARG_LIST, // bases and keywords of a class

  // Statements
  FUNCTION_DEF,
  CLASS_DEF,
  RETURN,
  DELETE,
  ASSIGN,
  AUG_ASSIGN,
  ANN_ASSIGN,
  FOR,
  WHILE,
  IF,
  WITH,
  WITH_ITEM,
  MATCH,
  MATCH_CASE,
  RAISE,
  TRY,
  EXCEPT_HANDLER,
  ASSERT,
  IMPORT,
  IMPORT_FROM,
  ALIAS, // "name as asname" inside an import
  GLOBAL,
  NONLOCAL,
  EXPR, // expression statement
  PASS,
  BREAK,
  CONTINUE,

  // Boolean operators
  AND,
  OR,

  NAMED_EXPR, // :=

  // Binary operators
  ADD,
  SUB,
  MULT,
  MAT_MULT,
  DIV,
  MOD,
  POW,
  LSHIFT,
  RSHIFT,
  BIT_OR,
  BIT_XOR,
  BIT_AND,
  FLOOR_DIV,

  // Unary operators
  INVERT,
  NOT,
  UADD,
  USUB,

  LAMBDA,
  IF_EXP, // conditional expression
  DICT,
  SET,
  LIST_COMP,
  SET_COMP,
  DICT_COMP,
  GENERATOR_EXP,
  COMPREHENSION, // one "for ... in ... if ..." clause
  AWAIT,
  YIELD,
  YIELD_FROM,
  COMPARE,

  // Comparison operators, only used as COMPARE operator lists
  EQ,
  NOT_EQ,
  LT,
  LT_E,
  GT,
  GT_E,
  IS,
  IS_NOT,
  IN,
  NOT_IN,

  CALL,
  KEYWORD, // keyword argument, or **mapping when unnamed
  FORMATTED_VALUE, // replacement field of an f-string
  JOINED_STR, // f-string
  ATTRIBUTE,
  SUBSCRIPT,
  STARRED,
  NAME,
  LIST,
  TUPLE,
  SLICE,

  // Literals
  INT,
  FLOAT,
  IMAGINARY,
  STRING,
  BYTES,
  TRUE,
  FALSE,
  NONE,
  ELLIPSIS,

  // Parameters
  ARGUMENTS,
  PARAM,

  // Patterns
  MATCH_VALUE,
  MATCH_SINGLETON,
  MATCH_SEQUENCE,
  MATCH_MAPPING,
  MATCH_CLASS,
  MATCH_KEYWORD, // attr=pattern inside a class pattern
  MATCH_STAR,
  MATCH_AS,
  MATCH_OR;
}
