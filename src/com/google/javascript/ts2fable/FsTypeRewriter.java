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

import static com.google.common.base.Preconditions.checkState;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.javascript.ts2fable.ir.FsAlias;
import com.google.javascript.ts2fable.ir.FsArray;
import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsFunction;
import com.google.javascript.ts2fable.ir.FsGeneric;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsParam;
import com.google.javascript.ts2fable.ir.FsProperty;
import com.google.javascript.ts2fable.ir.FsTuple;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsUnion;
import com.google.javascript.ts2fable.ir.FsVariable;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Bottom-up rewriting of {@link FsType} trees.
 *
 * <p>{@link #rewrite} first rebuilds every child of a node with the rule applied, then applies the
 * rule to the rebuilt node itself. Leaves (mapped names, enums, imports, string literals, {@code
 * this}, TODO and none) only see the rule.
 */
public final class FsTypeRewriter {

  private FsTypeRewriter() {}

  public static FsType rewrite(UnaryOperator<FsType> rule, FsType type) {
    return rule.apply(rewriteChildren(rule, type));
  }

  /** Applies {@code rule} to every module of {@code file}, including the modules themselves. */
  public static FsFile rewriteFile(UnaryOperator<FsType> rule, FsFile file) {
    return file.withModules(
        file.modules().stream().map(m -> rewriteModule(rule, m)).collect(toImmutableList()));
  }

  /** Applies {@code rule} to the contents of every module of {@code file}, not to the modules. */
  public static FsFile rewriteModuleContents(UnaryOperator<FsType> rule, FsFile file) {
    return file.withModules(
        file.modules().stream().map(m -> rewriteContents(rule, m)).collect(toImmutableList()));
  }

  /** Applies {@code rule} to the contents of {@code module} but not to the module itself. */
  public static FsModule rewriteContents(UnaryOperator<FsType> rule, FsModule module) {
    return module.withTypes(rewriteAll(rule, module.types()));
  }

  private static FsModule rewriteModule(UnaryOperator<FsType> rule, FsModule module) {
    FsType rewritten = rewrite(rule, module);
    checkState(rewritten instanceof FsModule, "module must be rewritten to a module: %s", module);
    return (FsModule) rewritten;
  }

  private static FsType rewriteChildren(UnaryOperator<FsType> rule, FsType type) {
    switch (type.getKind()) {
      case INTERFACE:
        FsInterface it = (FsInterface) type;
        return new FsInterface(
            it.isStatic(),
            it.name(),
            rewriteAll(rule, it.typeParameters()),
            rewriteAll(rule, it.inherits()),
            rewriteAll(rule, it.members()));
      case PROPERTY:
        FsProperty pr = (FsProperty) type;
        return pr.withIndexAndType(
            pr.index() == null ? null : rewriteParam(rule, pr.index()),
            rewrite(rule, pr.type()));
      case PARAM:
        FsParam pm = (FsParam) type;
        return pm.withType(rewrite(rule, pm.type()));
      case ARRAY:
        return new FsArray(rewrite(rule, ((FsArray) type).elementType()));
      case FUNCTION:
        FsFunction fn = (FsFunction) type;
        return new FsFunction(
            fn.emit(),
            fn.isStatic(),
            fn.name(),
            rewriteAll(rule, fn.typeParameters()),
            fn.params().stream().map(p -> rewriteParam(rule, p)).collect(toImmutableList()),
            rewrite(rule, fn.returnType()));
      case UNION:
        FsUnion un = (FsUnion) type;
        return un.withTypes(rewriteAll(rule, un.types()));
      case ALIAS:
        FsAlias al = (FsAlias) type;
        return new FsAlias(
            al.name(), rewrite(rule, al.type()), rewriteAll(rule, al.typeParameters()));
      case GENERIC:
        FsGeneric gn = (FsGeneric) type;
        return new FsGeneric(rewrite(rule, gn.type()), rewriteAll(rule, gn.typeParameters()));
      case TUPLE:
        return new FsTuple(rewriteAll(rule, ((FsTuple) type).types()));
      case MODULE:
        return rewriteContents(rule, (FsModule) type);
      case FILE:
        FsFile file = (FsFile) type;
        return file.withModules(
            file.modules().stream()
                .map(m -> rewriteContents(rule, m))
                .collect(toImmutableList()));
      case VARIABLE:
        FsVariable vb = (FsVariable) type;
        return new FsVariable(vb.hasDeclare(), vb.name(), rewrite(rule, vb.type()));
      default:
        return type;
    }
  }

  /** Parameters are rewritten in place and must stay parameters. */
  private static FsParam rewriteParam(UnaryOperator<FsType> rule, FsParam param) {
    FsType rewritten = rewrite(rule, param);
    checkState(rewritten instanceof FsParam, "param must be rewritten to a param: %s", rewritten);
    return (FsParam) rewritten;
  }

  private static ImmutableList<FsType> rewriteAll(UnaryOperator<FsType> rule, List<FsType> types) {
    return types.stream().map(t -> rewrite(rule, t)).collect(toImmutableList());
  }
}
