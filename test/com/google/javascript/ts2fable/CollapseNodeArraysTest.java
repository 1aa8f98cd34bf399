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
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsProperty;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class CollapseNodeArraysTest extends FixPassTestCase {

  @Override
  protected FixPass getProcessor() {
    return new CollapseNodeArrays();
  }

  private static FsInterface withProperty(FsType type) {
    return FsTypes.emptyInterface("Node")
        .withMembers(ImmutableList.of(FsProperty.of("children", false, type)));
  }

  @Test
  public void testNodeArrayBecomesArray() {
    FsType nodeArray =
        FsTypes.generic(
            FsTypes.mapped("NodeArray"), ImmutableList.of(FsTypes.mapped("Statement")));
    assertThat(processGlobal(withProperty(nodeArray)))
        .containsExactly(withProperty(new FsArray(FsTypes.mapped("Statement"))));
  }

  @Test
  public void testOtherGenericsAreKept() {
    testSame(
        file(
            withProperty(
                FsTypes.generic(
                    FsTypes.mapped("NodeArray"),
                    ImmutableList.of(FsTypes.STRING, FsTypes.FLOAT)))));
    testSame(
        file(
            withProperty(
                FsTypes.generic(FsTypes.mapped("Array"), ImmutableList.of(FsTypes.STRING)))));
  }
}
