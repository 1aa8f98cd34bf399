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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.javascript.ts2fable.ir.FsArray;
import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsFunction;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsMapped;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsParam;
import com.google.javascript.ts2fable.ir.FsProperty;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;
import com.google.javascript.ts2fable.ir.FsUnion;
import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FsTypeRewriterTest {

  private static final UnaryOperator<FsType> RENAME_FOO =
      t -> t instanceof FsMapped m && m.name().equals("Foo") ? FsTypes.mapped("Bar") : t;

  @Test
  public void testChildrenAreRewrittenBeforeParent() {
    List<FsType.Kind> visited = new ArrayList<>();
    FsTypeRewriter.rewrite(
        t -> {
          visited.add(t.getKind());
          return t;
        },
        new FsUnion(false, ImmutableList.of(new FsArray(FsTypes.STRING), FsTypes.FLOAT)));
    assertThat(visited)
        .containsExactly(
            FsType.Kind.MAPPED, FsType.Kind.ARRAY, FsType.Kind.MAPPED, FsType.Kind.UNION)
        .inOrder();
  }

  @Test
  public void testParentSeesRewrittenChildren() {
    FsType rewritten =
        FsTypeRewriter.rewrite(
            t -> {
              if (t instanceof FsArray array) {
                assertThat(array.elementType()).isEqualTo(FsTypes.mapped("Bar"));
              }
              return RENAME_FOO.apply(t);
            },
            new FsArray(FsTypes.mapped("Foo")));
    assertThat(rewritten).isEqualTo(new FsArray(FsTypes.mapped("Bar")));
  }

  @Test
  public void testRewritesEveryPosition() {
    FsType foo = FsTypes.mapped("Foo");
    FsType bar = FsTypes.mapped("Bar");
    FsInterface it =
        new FsInterface(
            false,
            "I",
            ImmutableList.of(foo),
            ImmutableList.of(FsTypes.generic(foo, ImmutableList.of(foo))),
            ImmutableList.of(
                new FsProperty(
                    null, new FsParam("k", false, false, foo), "Item", false, false, foo),
                new FsFunction(
                    null,
                    false,
                    "f",
                    ImmutableList.of(foo),
                    ImmutableList.of(new FsParam("x", false, false, foo)),
                    foo)));
    FsInterface expected =
        new FsInterface(
            false,
            "I",
            ImmutableList.of(bar),
            ImmutableList.of(FsTypes.generic(bar, ImmutableList.of(bar))),
            ImmutableList.of(
                new FsProperty(
                    null, new FsParam("k", false, false, bar), "Item", false, false, bar),
                new FsFunction(
                    null,
                    false,
                    "f",
                    ImmutableList.of(bar),
                    ImmutableList.of(new FsParam("x", false, false, bar)),
                    bar)));
    assertThat(FsTypeRewriter.rewrite(RENAME_FOO, it)).isEqualTo(expected);
  }

  @Test
  public void testParamMustStayParam() {
    FsFunction fn =
        new FsFunction(
            null,
            false,
            "f",
            ImmutableList.of(),
            ImmutableList.of(new FsParam("x", false, false, FsTypes.STRING)),
            FsTypes.UNIT);
    assertThrows(
        IllegalStateException.class,
        () -> FsTypeRewriter.rewrite(t -> t instanceof FsParam ? FsTypes.OBJ : t, fn));
  }

  @Test
  public void testRewriteFileAppliesRuleToModules() {
    FsFile file =
        new FsFile(
            "Test",
            ImmutableList.of(),
            ImmutableList.of(FsTypes.module("", FsTypes.module("N"))));
    FsFile rewritten =
        FsTypeRewriter.rewriteFile(
            t -> t instanceof FsModule m && !m.isGlobal() ? m.withName("M") : t, file);
    assertThat(rewritten.modules()).containsExactly(FsTypes.module("", FsTypes.module("M")));
  }

  @Test
  public void testRewriteFileRejectsNonModules() {
    FsFile file =
        new FsFile("Test", ImmutableList.of(), ImmutableList.of(FsTypes.module("")));
    assertThrows(
        IllegalStateException.class,
        () -> FsTypeRewriter.rewriteFile(t -> FsTypes.OBJ, file));
  }

  @Test
  public void testRewriteModuleContentsSkipsTopLevelModules() {
    List<FsType> visited = new ArrayList<>();
    FsModule global = FsTypes.module("", FsTypes.emptyInterface("A"));
    FsTypeRewriter.rewriteModuleContents(
        t -> {
          visited.add(t);
          return t;
        },
        new FsFile("Test", ImmutableList.of(), ImmutableList.of(global)));
    assertThat(visited).containsExactly(FsTypes.emptyInterface("A"));
  }
}
