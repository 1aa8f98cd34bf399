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

import com.google.common.collect.ImmutableList;

/**
 * Pass factories and meta-data for the translator passes.
 *
 * <p>Static members must be extracted before {@code IExports} collects the static holders.
 * Ambient variables are converted to imports last, once their types have been rewritten.
 */
public final class DefaultPassConfig extends PassConfig {

  public DefaultPassConfig(TranslatorOptions options) {
    super(options);
  }

  @Override
  protected ImmutableList<PassFactory> getModuleFixes() {
    return ImmutableList.of(resolveThisTypes, collapseNodeArrays, renameDateTime);
  }

  @Override
  protected ImmutableList<PassFactory> getFixPasses() {
    return ImmutableList.of(
        detectBrowserOpens,
        extractStaticMembers,
        createExportsInterface,
        escapeReservedWords,
        quoteGenericFunctionParameters,
        quoteGenericTypeParameters,
        specializeStringLiteralOverloads,
        deduplicateUnions,
        convertAmbientVariablesToImports);
  }

  /** Turns {@code declare var} statements into imports of the declaring module. */
  private final PassFactory convertAmbientVariablesToImports =
      PassFactory.builder()
          .setName(PassNames.CONVERT_AMBIENT_VARIABLES_TO_IMPORTS)
          .setCondition((o) -> o.importAmbientVariables)
          .setInternalFactory(
              (translator) -> new ConvertAmbientVariablesToImports(translator.getNamespace()))
          .build();

  private final PassFactory resolveThisTypes =
      PassFactory.builder()
          .setName(PassNames.RESOLVE_THIS_TYPES)
          .setInternalFactory((translator) -> new ResolveThisTypes())
          .build();

  private final PassFactory collapseNodeArrays =
      PassFactory.builder()
          .setName(PassNames.COLLAPSE_NODE_ARRAYS)
          .setInternalFactory((translator) -> new CollapseNodeArrays())
          .build();

  private final PassFactory renameDateTime =
      PassFactory.builder()
          .setName(PassNames.RENAME_DATE_TIME)
          .setInternalFactory((translator) -> new RenameDateTime())
          .build();

  private final PassFactory detectBrowserOpens =
      PassFactory.builder()
          .setName(PassNames.DETECT_BROWSER_OPENS)
          .setInternalFactory((translator) -> new DetectBrowserOpens(options.browserOpen))
          .build();

  private final PassFactory extractStaticMembers =
      PassFactory.builder()
          .setName(PassNames.EXTRACT_STATIC_MEMBERS)
          .setInternalFactory((translator) -> new ExtractStaticMembers())
          .build();

  private final PassFactory createExportsInterface =
      PassFactory.builder()
          .setName(PassNames.CREATE_EXPORTS_INTERFACE)
          .setInternalFactory(
              (translator) -> new CreateExportsInterface(options.importAmbientVariables))
          .build();

  private final PassFactory escapeReservedWords =
      PassFactory.builder()
          .setName(PassNames.ESCAPE_RESERVED_WORDS)
          .setInternalFactory((translator) -> new EscapeReservedWords())
          .build();

  private final PassFactory quoteGenericFunctionParameters =
      PassFactory.builder()
          .setName(PassNames.QUOTE_GENERIC_FUNCTION_PARAMETERS)
          .setInternalFactory((translator) -> new QuoteGenericFunctionParameters())
          .build();

  private final PassFactory quoteGenericTypeParameters =
      PassFactory.builder()
          .setName(PassNames.QUOTE_GENERIC_TYPE_PARAMETERS)
          .setInternalFactory((translator) -> new QuoteGenericTypeParameters())
          .build();

  private final PassFactory specializeStringLiteralOverloads =
      PassFactory.builder()
          .setName(PassNames.SPECIALIZE_STRING_LITERAL_OVERLOADS)
          .setInternalFactory((translator) -> new SpecializeStringLiteralOverloads())
          .build();

  private final PassFactory deduplicateUnions =
      PassFactory.builder()
          .setName(PassNames.DEDUPLICATE_UNIONS)
          .setInternalFactory((translator) -> new DeduplicateUnions())
          .build();
}
