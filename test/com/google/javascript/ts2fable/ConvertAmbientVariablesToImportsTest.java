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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.javascript.ts2fable.ir.FsArray;
import com.google.javascript.ts2fable.ir.FsImport;
import com.google.javascript.ts2fable.ir.FsTypes;
import com.google.javascript.ts2fable.ir.FsVariable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ConvertAmbientVariablesToImportsTest extends FixPassTestCase {

  @Override
  protected FixPass getProcessor() {
    return new ConvertAmbientVariablesToImports(NAMESPACE);
  }

  @Test
  public void testDeclaredVariableBecomesImport() {
    assertThat(processGlobal(new FsVariable(true, "foo", FsTypes.STRING)))
        .containsExactly(new FsImport(ImmutableList.of("Test"), "foo", "string"));
  }

  @Test
  public void testUndeclaredVariableIsKept() {
    testSame(file(new FsVariable(false, "foo", FsTypes.STRING)));
  }

  @Test
  public void testNamespacePathFollowsModules() {
    assertThat(
            processGlobal(
                FsTypes.module(
                    "N",
                    FsTypes.module(
                        "M", new FsVariable(true, "x", new FsArray(FsTypes.mapped("Foo")))))))
        .containsExactly(
            FsTypes.module(
                "N",
                FsTypes.module(
                    "M",
                    new FsImport(ImmutableList.of("Test", "N", "M"), "x", "ResizeArray<Foo>"))));
  }

  @Test
  public void testExistingImportMovesToItsModule() {
    assertThat(
            processGlobal(
                FsTypes.module(
                    "N", new FsImport(ImmutableList.of("Other"), "v", "obj"))))
        .containsExactly(
            FsTypes.module("N", new FsImport(ImmutableList.of("Test", "N"), "v", "obj")));
  }
}
