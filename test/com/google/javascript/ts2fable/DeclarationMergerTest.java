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
import com.google.javascript.ts2fable.ir.FsEnum;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsProperty;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DeclarationMergerTest {

  private static FsInterface iface(String name, String... members) {
    ImmutableList.Builder<FsType> properties = ImmutableList.builder();
    for (String member : members) {
      properties.add(FsProperty.of(member, false, FsTypes.STRING));
    }
    return new FsInterface(
        false, name, ImmutableList.of(), ImmutableList.of(), properties.build());
  }

  @Test
  public void testInterfacesMergeIntoFirstOccurrence() {
    FsEnum en = new FsEnum("E", ImmutableList.of());
    ImmutableList<FsType> merged =
        DeclarationMerger.mergeTypes(
            ImmutableList.of(iface("A", "a"), en, iface("B", "b"), iface("A", "c")));
    assertThat(merged).containsExactly(iface("A", "a", "c"), en, iface("B", "b")).inOrder();
  }

  @Test
  public void testMembersAndInheritsKeepDeclarationOrder() {
    FsInterface first =
        new FsInterface(
            false,
            "X",
            ImmutableList.of(),
            ImmutableList.of(FsTypes.mapped("P")),
            ImmutableList.of(FsProperty.of("a", false, FsTypes.STRING)));
    FsInterface second =
        new FsInterface(
            false,
            "X",
            ImmutableList.of(),
            ImmutableList.of(FsTypes.mapped("Q")),
            ImmutableList.of(FsProperty.of("b", false, FsTypes.STRING)));
    FsInterface merged =
        (FsInterface)
            DeclarationMerger.mergeTypes(ImmutableList.of(first, second, iface("X", "c")))
                .get(0);
    assertThat(merged.inherits())
        .containsExactly(FsTypes.mapped("P"), FsTypes.mapped("Q"))
        .inOrder();
    assertThat(merged.members())
        .containsExactly(
            FsProperty.of("a", false, FsTypes.STRING),
            FsProperty.of("b", false, FsTypes.STRING),
            FsProperty.of("c", false, FsTypes.STRING))
        .inOrder();
  }

  @Test
  public void testRepeatedNamespacesMerge() {
    ImmutableList<FsType> merged =
        DeclarationMerger.mergeModules(
            ImmutableList.of(
                FsTypes.module("N", iface("A")),
                FsTypes.module("M", iface("C")),
                FsTypes.module("N", iface("B"))));
    assertThat(merged)
        .containsExactly(
            FsTypes.module("N", iface("A"), iface("B")), FsTypes.module("M", iface("C")))
        .inOrder();
  }

  @Test
  public void testInterfacesMergeAcrossRepeatedNamespaces() {
    ImmutableList<FsType> merged =
        DeclarationMerger.mergeModules(
            ImmutableList.of(
                FsTypes.module("N", iface("A", "a")), FsTypes.module("N", iface("A", "b"))));
    assertThat(merged).containsExactly(FsTypes.module("N", iface("A", "a", "b")));
  }

  @Test
  public void testNestedNamespacesMergeDepthFirst() {
    ImmutableList<FsType> merged =
        DeclarationMerger.mergeModules(
            ImmutableList.of(
                FsTypes.module("N", FsTypes.module("M", iface("A"))),
                FsTypes.module("N", FsTypes.module("M", iface("B")))));
    assertThat(merged)
        .containsExactly(FsTypes.module("N", FsTypes.module("M", iface("A"), iface("B"))));
  }

  @Test
  public void testMergeFileModules() {
    FsModule global =
        FsTypes.module(
            "",
            FsTypes.module("N", iface("A")),
            iface("I", "x"),
            FsTypes.module("N", iface("B")),
            iface("I", "y"));
    assertThat(DeclarationMerger.mergeFileModules(ImmutableList.of(global)))
        .containsExactly(
            FsTypes.module(
                "", FsTypes.module("N", iface("A"), iface("B")), iface("I", "x", "y")));
  }

  @Test
  public void testMergeIsIdempotent() {
    ImmutableList<FsType> once =
        DeclarationMerger.mergeModules(
            ImmutableList.of(
                FsTypes.module("N", iface("A", "a"), iface("A", "b")),
                FsTypes.module("N", iface("B"))));
    assertThat(DeclarationMerger.mergeModules(once)).isEqualTo(once);
  }
}
