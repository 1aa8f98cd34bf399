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
import com.google.javascript.ts2fable.ir.FsFunction;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsProperty;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;
import com.google.javascript.ts2fable.ir.FsVariable;

/**
 * Collects the values a module exports into a leading {@code IExports} interface: its variables,
 * its free functions, and one property per static holder giving access to the class.
 *
 * <p>The accessor of a generic holder is typed with the bare holder name, since an F# property
 * cannot introduce type parameters.
 */
final class CreateExportsInterface implements FixPass {

  static final String EXPORTS_NAME = "IExports";

  private final boolean ambientVariablesAreImported;

  /**
   * @param ambientVariablesAreImported whether {@code declare var} statements are left out, to be
   *     turned into imports later
   */
  CreateExportsInterface(boolean ambientVariablesAreImported) {
    this.ambientVariablesAreImported = ambientVariablesAreImported;
  }

  @Override
  public FsFile process(FsFile file) {
    return FsTypeRewriter.rewriteFile(this::createExports, file);
  }

  private FsType createExports(FsType type) {
    if (!(type instanceof FsModule module)) {
      return type;
    }
    ImmutableList.Builder<FsType> exports = ImmutableList.builder();
    for (FsType t : module.types()) {
      if (t instanceof FsVariable variable) {
        if (!(ambientVariablesAreImported && variable.hasDeclare())) {
          exports.add(t);
        }
      } else if (t instanceof FsFunction) {
        exports.add(t);
      } else if (t instanceof FsInterface it && it.isStatic()) {
        exports.add(FsProperty.of(className(it.name()), false, FsTypes.mapped(it.name())));
      }
    }
    ImmutableList<FsType> members = exports.build();
    if (members.isEmpty()) {
      return module;
    }
    FsInterface exportsInterface =
        new FsInterface(false, EXPORTS_NAME, ImmutableList.of(), ImmutableList.of(), members);
    return module.withTypes(
        ImmutableList.<FsType>builder().add(exportsInterface).addAll(module.types()).build());
  }

  /** The name of the class a static holder was extracted from. */
  private static String className(String holderName) {
    return holderName.endsWith(ExtractStaticMembers.STATIC_SUFFIX)
        ? holderName.substring(0, holderName.length() - ExtractStaticMembers.STATIC_SUFFIX.length())
        : holderName;
  }
}
