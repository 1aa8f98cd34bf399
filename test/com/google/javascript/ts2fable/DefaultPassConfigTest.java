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

import static com.google.common.collect.ImmutableList.toImmutableList;
import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DefaultPassConfigTest {

  private final TranslatorOptions options = new TranslatorOptions();
  private final DefaultPassConfig config = new DefaultPassConfig(options);

  @Test
  public void testModuleFixOrder() {
    assertThat(names(config.getModuleFixes()))
        .containsExactly(
            PassNames.RESOLVE_THIS_TYPES,
            PassNames.COLLAPSE_NODE_ARRAYS,
            PassNames.RENAME_DATE_TIME)
        .inOrder();
  }

  @Test
  public void testFixPassOrder() {
    assertThat(names(config.getFixPasses()))
        .containsExactly(
            PassNames.DETECT_BROWSER_OPENS,
            PassNames.EXTRACT_STATIC_MEMBERS,
            PassNames.CREATE_EXPORTS_INTERFACE,
            PassNames.ESCAPE_RESERVED_WORDS,
            PassNames.QUOTE_GENERIC_FUNCTION_PARAMETERS,
            PassNames.QUOTE_GENERIC_TYPE_PARAMETERS,
            PassNames.SPECIALIZE_STRING_LITERAL_OVERLOADS,
            PassNames.DEDUPLICATE_UNIONS,
            PassNames.CONVERT_AMBIENT_VARIABLES_TO_IMPORTS)
        .inOrder();
  }

  @Test
  public void testImportConversionIsOptIn() {
    PassFactory convert = config.getFixPasses().get(8);
    assertThat(convert.isEnabled(options)).isFalse();
    assertThat(convert.isEnabled(new TranslatorOptions().setImportAmbientVariables(true)))
        .isTrue();
  }

  @Test
  public void testOtherPassesAlwaysRun() {
    for (PassFactory factory : config.getModuleFixes()) {
      assertThat(factory.isEnabled(options)).isTrue();
    }
    for (PassFactory factory : config.getFixPasses().subList(0, 8)) {
      assertThat(factory.isEnabled(options)).isTrue();
    }
  }

  @Test
  public void testCreate() {
    Translator translator = new Translator(options);
    assertThat(config.getFixPasses().get(8).create(translator))
        .isInstanceOf(ConvertAmbientVariablesToImports.class);
    assertThat(config.getFixPasses().get(3).create(translator))
        .isInstanceOf(EscapeReservedWords.class);
    assertThat(config.getFixPasses().get(7).create(translator))
        .isInstanceOf(DeduplicateUnions.class);
  }

  private static ImmutableList<String> names(List<PassFactory> factories) {
    return factories.stream().map(PassFactory::getName).collect(toImmutableList());
  }
}
