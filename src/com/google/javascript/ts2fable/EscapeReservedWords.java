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

import com.google.javascript.ts2fable.ir.FsAlias;
import com.google.javascript.ts2fable.ir.FsFile;
import com.google.javascript.ts2fable.ir.FsFunction;
import com.google.javascript.ts2fable.ir.FsInterface;
import com.google.javascript.ts2fable.ir.FsMapped;
import com.google.javascript.ts2fable.ir.FsModule;
import com.google.javascript.ts2fable.ir.FsParam;
import com.google.javascript.ts2fable.ir.FsProperty;
import com.google.javascript.ts2fable.ir.FsType;
import com.google.javascript.ts2fable.ir.FsTypes;
import com.google.javascript.ts2fable.ir.FsVariable;

/**
 * Escapes names that F# would not accept as identifiers. See {@link ReservedWords#escape}.
 *
 * <p>Enum case names are left alone; the printer normalizes them instead.
 */
final class EscapeReservedWords implements FixPass {

  @Override
  public FsFile process(FsFile file) {
    return FsTypeRewriter.rewriteFile(EscapeReservedWords::escape, file);
  }

  private static FsType escape(FsType type) {
    switch (type.getKind()) {
      case MAPPED:
        return FsTypes.mapped(ReservedWords.escape(((FsMapped) type).name()));
      case PARAM:
        FsParam pm = (FsParam) type;
        return pm.withName(ReservedWords.escape(pm.name()));
      case FUNCTION:
        FsFunction fn = (FsFunction) type;
        return fn.name() == null ? fn : fn.withName(ReservedWords.escape(fn.name()));
      case PROPERTY:
        FsProperty pr = (FsProperty) type;
        return pr.withName(ReservedWords.escape(pr.name()));
      case INTERFACE:
        FsInterface it = (FsInterface) type;
        return it.withName(ReservedWords.escape(it.name()));
      case MODULE:
        FsModule md = (FsModule) type;
        return md.withName(ReservedWords.escape(md.name()));
      case VARIABLE:
        FsVariable vb = (FsVariable) type;
        return vb.withName(ReservedWords.escape(vb.name()));
      case ALIAS:
        FsAlias al = (FsAlias) type;
        return al.withName(ReservedWords.escape(al.name()));
      default:
        return type;
    }
  }
}
