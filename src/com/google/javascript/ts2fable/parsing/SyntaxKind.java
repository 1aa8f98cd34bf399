/*
 * Copyright 2017 The Closure Compiler Authors.
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

package com.google.javascript.ts2fable.parsing;

import com.google.common.collect.ImmutableMap;
import org.jspecify.annotations.Nullable;

/** The kinds of nodes in a declaration syntax tree. */
public enum SyntaxKind {
  SOURCE_FILE,
  MODULE_BLOCK,

  // Statements
  INTERFACE_DECLARATION,
  CLASS_DECLARATION,
  ENUM_DECLARATION,
  TYPE_ALIAS_DECLARATION,
  VARIABLE_STATEMENT,
  FUNCTION_DECLARATION,
  MODULE_DECLARATION,
  IMPORT_DECLARATION,
  IMPORT_EQUALS_DECLARATION,
  EXPORT_DECLARATION,
  EXPORT_ASSIGNMENT,
  NAMESPACE_EXPORT_DECLARATION,

  // Parts of statements
  ENUM_MEMBER,
  VARIABLE_DECLARATION,
  PARAMETER,
  TYPE_PARAMETER,
  HERITAGE_CLAUSE,
  EXPRESSION_WITH_TYPE_ARGUMENTS,

  // Members
  METHOD_SIGNATURE,
  METHOD_DECLARATION,
  PROPERTY_SIGNATURE,
  PROPERTY_DECLARATION,
  CONSTRUCTOR,
  INDEX_SIGNATURE,
  CALL_SIGNATURE,
  CONSTRUCT_SIGNATURE,
  GET_ACCESSOR,
  SET_ACCESSOR,

  // Names and expressions
  IDENTIFIER,
  QUALIFIED_NAME,
  COMPUTED_PROPERTY_NAME,
  STRING_LITERAL,
  NUMERIC_LITERAL,
  TRUE_KEYWORD,
  FALSE_KEYWORD,
  PROPERTY_ACCESS_EXPRESSION,
  PREFIX_UNARY_EXPRESSION,
  BINARY_EXPRESSION,
  OBJECT_BINDING_PATTERN,
  ARRAY_BINDING_PATTERN,

  // Modifiers
  DECLARE_KEYWORD,
  EXPORT_KEYWORD,
  DEFAULT_KEYWORD,
  STATIC_KEYWORD,
  ABSTRACT_KEYWORD,
  READONLY_KEYWORD,
  PUBLIC_KEYWORD,
  PRIVATE_KEYWORD,
  PROTECTED_KEYWORD,
  CONST_KEYWORD,
  ASYNC_KEYWORD,
  OVERRIDE_KEYWORD,

  // Keyword types
  ANY_KEYWORD,
  STRING_KEYWORD,
  NUMBER_KEYWORD,
  BOOLEAN_KEYWORD,
  VOID_KEYWORD,
  UNDEFINED_KEYWORD,
  NULL_KEYWORD,
  NEVER_KEYWORD,
  OBJECT_KEYWORD,
  SYMBOL_KEYWORD,
  UNKNOWN_KEYWORD,
  BIGINT_KEYWORD,

  // Type nodes
  TYPE_REFERENCE,
  ARRAY_TYPE,
  UNION_TYPE,
  INTERSECTION_TYPE,
  TUPLE_TYPE,
  FUNCTION_TYPE,
  CONSTRUCTOR_TYPE,
  LITERAL_TYPE,
  THIS_TYPE,
  TYPE_LITERAL,
  MAPPED_TYPE,
  INDEXED_ACCESS_TYPE,
  TYPE_QUERY,
  TYPE_OPERATOR,
  TYPE_PREDICATE,
  PARENTHESIZED_TYPE,
  CONDITIONAL_TYPE,
  INFER_TYPE,
  IMPORT_TYPE,
  TEMPLATE_LITERAL_TYPE;

  private static final ImmutableMap<String, SyntaxKind> MODIFIERS =
      ImmutableMap.<String, SyntaxKind>builder()
          .put("declare", DECLARE_KEYWORD)
          .put("export", EXPORT_KEYWORD)
          .put("default", DEFAULT_KEYWORD)
          .put("static", STATIC_KEYWORD)
          .put("abstract", ABSTRACT_KEYWORD)
          .put("readonly", READONLY_KEYWORD)
          .put("public", PUBLIC_KEYWORD)
          .put("private", PRIVATE_KEYWORD)
          .put("protected", PROTECTED_KEYWORD)
          .put("const", CONST_KEYWORD)
          .put("async", ASYNC_KEYWORD)
          .put("override", OVERRIDE_KEYWORD)
          .buildOrThrow();

  private static final ImmutableMap<String, SyntaxKind> KEYWORD_TYPES =
      ImmutableMap.<String, SyntaxKind>builder()
          .put("any", ANY_KEYWORD)
          .put("string", STRING_KEYWORD)
          .put("number", NUMBER_KEYWORD)
          .put("boolean", BOOLEAN_KEYWORD)
          .put("void", VOID_KEYWORD)
          .put("undefined", UNDEFINED_KEYWORD)
          .put("null", NULL_KEYWORD)
          .put("never", NEVER_KEYWORD)
          .put("object", OBJECT_KEYWORD)
          .put("symbol", SYMBOL_KEYWORD)
          .put("unknown", UNKNOWN_KEYWORD)
          .put("bigint", BIGINT_KEYWORD)
          .buildOrThrow();

  /** Returns the modifier kind spelled {@code text}, or null if it is not a modifier. */
  static @Nullable SyntaxKind forModifier(String text) {
    return MODIFIERS.get(text);
  }

  /** Returns the keyword type spelled {@code text}, or null if it is not a keyword type. */
  static @Nullable SyntaxKind forKeywordType(String text) {
    return KEYWORD_TYPES.get(text);
  }

  public boolean isModifier() {
    return MODIFIERS.containsValue(this);
  }
}
