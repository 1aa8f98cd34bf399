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
import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsType;

/**
 * Splits every interface that has static members in two: the interface keeps its instance
 * members, and a new {@code <Name>Static} interface placed right after it holds the static ones.
 * The static holder inherits nothing and keeps the type parameters.
 */
final class ExtractStaticMembers implements FixPass {

  static final String STATIC_SUFFIX = "Static";

  @Override
  public FsFile process(FsFile file) {
    return FsTypeRewriter.rewriteFile(ExtractStaticMembers::extract, file);
  }

  private static FsType extract(FsType type) {
    if (!(type instanceof FsModule module)) {
      return type;
    }
    ImmutableList.Builder<FsType> types = ImmutableList.builder();
    for (FsType t : module.types()) {
      if (t instanceof FsInterface it && it.hasStaticMembers()) {
        types.add(it.withMembers(it.getNonStaticMembers()));
        types.add(
            new FsInterface(
                true,
                it.name() + STATIC_SUFFIX,
                it.typeParameters(),
                ImmutableList.of(),
                it.getStaticMembers()));
      } else {
        types.add(t);
      }
    }
    return module.withTypes(types.build());
  }
}
