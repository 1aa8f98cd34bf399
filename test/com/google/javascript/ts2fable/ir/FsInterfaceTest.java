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

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class FsInterfaceTest {

  private static final FsProperty INSTANCE_PROPERTY = FsProperty.of("a", false, FsTypes.STRING);
  private static final FsProperty STATIC_PROPERTY =
      new FsProperty(null, null, "b", false, true, FsTypes.FLOAT);
  private static final FsFunction STATIC_FUNCTION =
      new FsFunction(null, true, "c", ImmutableList.of(), ImmutableList.of(), FsTypes.UNIT);
  private static final FsFunction INSTANCE_FUNCTION =
      new FsFunction(null, false, "d", ImmutableList.of(), ImmutableList.of(), FsTypes.UNIT);

  @Test
  public void testPartitionKeepsOrder() {
    FsInterface it =
        FsTypes.emptyInterface("Foo")
            .withMembers(
                ImmutableList.of(
                    INSTANCE_PROPERTY, STATIC_PROPERTY, STATIC_FUNCTION, INSTANCE_FUNCTION));

    assertThat(it.hasStaticMembers()).isTrue();
    assertThat(it.getStaticMembers()).containsExactly(STATIC_PROPERTY, STATIC_FUNCTION).inOrder();
    assertThat(it.getNonStaticMembers())
        .containsExactly(INSTANCE_PROPERTY, INSTANCE_FUNCTION)
        .inOrder();
  }

  @Test
  public void testNoStaticMembers() {
    FsInterface it =
        FsTypes.emptyInterface("Foo").withMembers(ImmutableList.of(INSTANCE_PROPERTY));
    assertThat(it.hasStaticMembers()).isFalse();
    assertThat(it.getStaticMembers()).isEmpty();
  }

  @Test
  public void testWithName() {
    FsInterface it = FsTypes.emptyInterface("Foo").withMembers(ImmutableList.of(STATIC_FUNCTION));
    FsInterface renamed = it.withName("Bar");
    assertThat(renamed.name()).isEqualTo("Bar");
    assertThat(renamed.members()).isEqualTo(it.members());
  }
}
