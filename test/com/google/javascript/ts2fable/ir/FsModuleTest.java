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


package com.google.javascript.ts2fable.ir;

import static com.google.common.truth.Truth.assertThat;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FsModuleTest {

  @Test
  public void testGlobal() {
    assertThat(FsTypes.module("").isGlobal()).isTrue();
    assertThat(FsTypes.module("N").isGlobal()).isFalse();
  }

  @Test
  public void testPartition() {
    FsModule inner = FsTypes.module("Inner");
    FsInterface a = FsTypes.emptyInterface("A");
    FsInterface b = FsTypes.emptyInterface("B");
    FsModule outer = FsTypes.module("Outer", a, inner, b);

    assertThat(outer.getModules()).containsExactly(inner);
    assertThat(outer.getNonModules()).containsExactly(a, b).inOrder();
  }
}
