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
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;
import com.google.javascript.ts2fable.ir.FsUnion;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Removes structurally equal alternatives from unions, keeping the first occurrence. Fable has
 * erased unions of at most six cases, so larger unions become {@code obj}.
 */
final class DeduplicateUnions implements FixPass {

  static final int MAX_UNION_CASES = 6;

  @Override
  public FsFile process(FsFile file) {
    return FsTypeRewriter.rewriteFile(DeduplicateUnions::deduplicate, file);
  }

  private static FsType deduplicate(FsType type) {
    if (!(type instanceof FsUnion union)) {
      return type;
    }
    Set<FsType> distinct = new LinkedHashSet<>(union.types());
    if (distinct.size() > MAX_UNION_CASES) {
      return FsTypes.OBJ;
    }
    return union.withTypes(ImmutableList.copyOf(distinct));
  }
}
