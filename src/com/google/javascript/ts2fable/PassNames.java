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

package com.google.javascript.ts2fable;

/** Pass names as known to the pass config and shown in logs. */
public final class PassNames {
  public static final String CONVERT_AMBIENT_VARIABLES_TO_IMPORTS =
      "convertAmbientVariablesToImports";
  public static final String RESOLVE_THIS_TYPES = "resolveThisTypes";
  public static final String COLLAPSE_NODE_ARRAYS = "collapseNodeArrays";
  public static final String RENAME_DATE_TIME = "renameDateTime";
  public static final String DETECT_BROWSER_OPENS = "detectBrowserOpens";
  public static final String EXTRACT_STATIC_MEMBERS = "extractStaticMembers";
  public static final String CREATE_EXPORTS_INTERFACE = "createExportsInterface";
  public static final String ESCAPE_RESERVED_WORDS = "escapeReservedWords";
  public static final String QUOTE_GENERIC_FUNCTION_PARAMETERS = "quoteGenericFunctionParameters";
  public static final String QUOTE_GENERIC_TYPE_PARAMETERS = "quoteGenericTypeParameters";
  public static final String SPECIALIZE_STRING_LITERAL_OVERLOADS =
      "specializeStringLiteralOverloads";
  public static final String DEDUPLICATE_UNIONS = "deduplicateUnions";

  private PassNames() {}
}
