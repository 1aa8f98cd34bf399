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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import org.jspecify.annotations.Nullable;

/** An enumeration, either declared with {@code enum} or derived from a string literal union. */
public record FsEnum(String name, ImmutableList<FsEnum.Case> cases) implements FsType {
  public FsEnum {
    requireNonNull(name, "name");
    requireNonNull(cases, "cases");
  }

  /** The kind of value an enum case carries. */
  public enum CaseType {
    NUMERIC,
    STRING,
    UNKNOWN
  }

  /**
   * One case of an enum.
   *
   * @param value the literal text of the initializer, if it could be read
   */
  public record Case(String name, CaseType type, @Nullable String value) {
    public Case {
      requireNonNull(name, "name");
      requireNonNull(type, "type");
    }
  }

  @Override
  public Kind getKind() {
    return Kind.ENUM;
  }

  /**
   * The resolved kind of the whole enum: unknown if any case is unknown, else string if any case
   * is a string, else numeric.
   */
  public CaseType type() {
    if (cases.stream().anyMatch(c -> c.type() == CaseType.UNKNOWN)) {
      return CaseType.UNKNOWN;
    } else if (cases.stream().anyMatch(c -> c.type() == CaseType.STRING)) {
      return CaseType.STRING;
    }
    return CaseType.NUMERIC;
  }
}
