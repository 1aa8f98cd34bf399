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
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Combines declarations that TypeScript allows to be split: interfaces declared more than once in
 * the same scope, and namespaces opened more than once.
 */
final class DeclarationMerger {

  private DeclarationMerger() {}

  /**
   * Merges interfaces with the same name into the first one, appending inherited types and
   * members in order. Everything else keeps its position.
   */
  static ImmutableList<FsType> mergeTypes(List<FsType> types) {
    Map<String, Integer> index = new HashMap<>();
    List<FsType> merged = new ArrayList<>();
    for (FsType type : types) {
      if (type instanceof FsInterface b) {
        Integer i = index.get(b.name());
        if (i != null && merged.get(i) instanceof FsInterface a) {
          merged.set(
              i,
              new FsInterface(
                  a.isStatic(),
                  a.name(),
                  a.typeParameters(),
                  concat(a.inherits(), b.inherits()),
                  concat(a.members(), b.members())));
          continue;
        }
        index.put(b.name(), merged.size());
      }
      merged.add(type);
    }
    return ImmutableList.copyOf(merged);
  }

  /**
   * Merges modules with the same name at the same level. Each module's submodules and interfaces
   * are merged first; a repeated module then has its contents appended to the first one, and the
   * combined contents are merged again.
   */
  static ImmutableList<FsType> mergeModules(List<FsType> types) {
    Map<String, Integer> index = new HashMap<>();
    List<FsType> merged = new ArrayList<>();
    for (FsType type : types) {
      if (!(type instanceof FsModule md)) {
        merged.add(type);
        continue;
      }
      FsModule md2 = md.withTypes(mergeTypes(mergeModules(md.types())));
      Integer i = index.get(md.name());
      if (i != null) {
        FsModule a = (FsModule) merged.get(i);
        merged.set(i, a.withTypes(mergeTypes(mergeModules(concat(a.types(), md2.types())))));
      } else {
        index.put(md2.name(), merged.size());
        merged.add(md2);
      }
    }
    return ImmutableList.copyOf(merged);
  }

  /** Merges the top-level modules of a file. */
  static ImmutableList<FsModule> mergeFileModules(List<FsModule> modules) {
    ImmutableList.Builder<FsModule> result = ImmutableList.builder();
    for (FsType type : mergeModules(ImmutableList.copyOf(modules))) {
      result.add((FsModule) type);
    }
    return result.build();
  }

  private static ImmutableList<FsType> concat(List<FsType> a, List<FsType> b) {
    return ImmutableList.<FsType>builder().addAll(a).addAll(b).build();
  }
}
