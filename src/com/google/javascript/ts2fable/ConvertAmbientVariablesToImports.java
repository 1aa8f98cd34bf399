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

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsImport;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsVariable;

/**
 * Converts {@code declare var} statements into imports from the JavaScript module that declares
 * them. The import path is the root namespace followed by the names of the enclosing modules.
 * Imports that already exist are moved to the namespace of their module.
 *
 * <p>The import keeps the printed type of the variable, so this runs after every other rewrite.
 */
final class ConvertAmbientVariablesToImports implements FixPass {

  private final String rootNamespace;

  ConvertAmbientVariablesToImports(String rootNamespace) {
    this.rootNamespace = rootNamespace;
  }

  @Override
  public FsFile process(FsFile file) {
    ImmutableList<String> namespace = ImmutableList.of(rootNamespace);
    return file.withModules(
        file.modules().stream().map(m -> convert(namespace, m)).collect(toImmutableList()));
  }

  private FsModule convert(ImmutableList<String> namespace, FsModule module) {
    ImmutableList<String> moduleNamespace =
        module.isGlobal()
            ? namespace
            : ImmutableList.<String>builder().addAll(namespace).add(module.name()).build();
    return module.withTypes(
        module.types().stream()
            .map(t -> convertType(moduleNamespace, t))
            .collect(toImmutableList()));
  }

  private FsType convertType(ImmutableList<String> namespace, FsType type) {
    if (type instanceof FsModule submodule) {
      return convert(namespace, submodule);
    } else if (type instanceof FsImport anImport) {
      return anImport.withNamespace(namespace);
    } else if (type instanceof FsVariable variable && variable.hasDeclare()) {
      return new FsImport(namespace, variable.name(), CodePrinter.printType(variable.type()));
    }
    return type;
  }
}
