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
import com.google.javascript.ts2fable.ir.FsFunction;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsProperty;
import com.google.javascript.ts2fable.ir.FsTypes;
import com.google.javascript.ts2fable.ir.FsVariable;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CreateExportsInterfaceTest extends FixPassTestCase {

  private static final FsVariable VERSION = new FsVariable(true, "version", FsTypes.STRING);
  private static final FsFunction INIT =
      new FsFunction(null, false, "init", ImmutableList.of(), ImmutableList.of(), FsTypes.UNIT);
  private static final FsInterface FOO = FsTypes.emptyInterface("Foo");
  private static final FsInterface FOO_STATIC =
      new FsInterface(
          true, "FooStatic", ImmutableList.of(), ImmutableList.of(), ImmutableList.of());

  private boolean ambientVariablesAreImported = false;

  @Override
  protected FixPass getProcessor() {
    return new CreateExportsInterface(ambientVariablesAreImported);
  }

  private static FsInterface exports(FsVariable variable, FsFunction function, FsProperty holder) {
    return FsTypes.emptyInterface(CreateExportsInterface.EXPORTS_NAME)
        .withMembers(ImmutableList.of(variable, function, holder));
  }

  @Test
  public void testExportsComeFirst() {
    assertThat(processGlobal(FOO, FOO_STATIC, VERSION, INIT))
        .containsExactly(
            FsTypes.emptyInterface(CreateExportsInterface.EXPORTS_NAME)
                .withMembers(
                    ImmutableList.of(
                        FsProperty.of("Foo", false, FsTypes.mapped("FooStatic")), VERSION, INIT)),
            FOO,
            FOO_STATIC,
            VERSION,
            INIT)
        .inOrder();
  }

  @Test
  public void testMembersFollowModuleOrder() {
    assertThat(processGlobal(VERSION, INIT, FOO, FOO_STATIC).get(0))
        .isEqualTo(
            exports(VERSION, INIT, FsProperty.of("Foo", false, FsTypes.mapped("FooStatic"))));
  }

  @Test
  public void testModuleWithoutExportsIsKept() {
    testSame(file(FOO, FsTypes.module("N", FOO)));
  }

  @Test
  public void testEachModuleGetsItsOwnExports() {
    assertThat(processGlobal(FsTypes.module("N", VERSION)))
        .containsExactly(
            FsTypes.module(
                "N",
                FsTypes.emptyInterface(CreateExportsInterface.EXPORTS_NAME)
                    .withMembers(ImmutableList.of(VERSION)),
                VERSION));
  }

  @Test
  public void testImportedVariablesAreLeftOut() {
    ambientVariablesAreImported = true;
    FsVariable local = new FsVariable(false, "local", FsTypes.FLOAT);
    assertThat(processGlobal(VERSION, INIT, local))
        .containsExactly(
            FsTypes.emptyInterface(CreateExportsInterface.EXPORTS_NAME)
                .withMembers(ImmutableList.of(INIT, local)),
            VERSION,
            INIT,
            local)
        .inOrder();
  }

  @Test
  public void testOnlyImportedVariables() {
    ambientVariablesAreImported = true;
    testSame(file(VERSION));
  }

  @Test
  public void testGenericHolderAccessorUsesBareName() {
    FsInterface holder =
        new FsInterface(
            true,
            "BoxStatic",
            ImmutableList.of(FsTypes.mapped("T")),
            ImmutableList.of(),
            ImmutableList.of());
    assertThat(processGlobal(holder).get(0))
        .isEqualTo(
            FsTypes.emptyInterface(CreateExportsInterface.EXPORTS_NAME)
                .withMembers(
                    ImmutableList.of(FsProperty.of("Box", false, FsTypes.mapped("BoxStatic")))));
  }
}
