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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.io.Serializable;
import org.jspecify.annotations.Nullable;

/** Translator options. */
public class TranslatorOptions implements Serializable {
  private static final long serialVersionUID = 1L;

  /** The namespaces every generated file opens. */
  public static final ImmutableList<String> DEFAULT_OPENS =
      ImmutableList.of("System", "Fable.Core", "Fable.Import.JS");

  public static final String DEFAULT_BROWSER_OPEN = "Fable.Import.Browser";

  /** The root namespace. Null means the output file name without its extension. */
  @Nullable String namespace = null;

  ImmutableList<String> opens = DEFAULT_OPENS;

  /** Opened in addition when a file refers to DOM types. */
  String browserOpen = DEFAULT_BROWSER_OPEN;

  /** Whether {@code declare var} statements become imports. */
  boolean importAmbientVariables = false;

  @CanIgnoreReturnValue
  public TranslatorOptions setNamespace(@Nullable String namespace) {
    this.namespace = namespace;
    return this;
  }

  public @Nullable String getNamespace() {
    return namespace;
  }

  @CanIgnoreReturnValue
  public TranslatorOptions setOpens(ImmutableList<String> opens) {
    this.opens = checkNotNull(opens);
    return this;
  }

  public ImmutableList<String> getOpens() {
    return opens;
  }

  @CanIgnoreReturnValue
  public TranslatorOptions setBrowserOpen(String browserOpen) {
    this.browserOpen = checkNotNull(browserOpen);
    return this;
  }

  public String getBrowserOpen() {
    return browserOpen;
  }

  @CanIgnoreReturnValue
  public TranslatorOptions setImportAmbientVariables(boolean importAmbientVariables) {
    this.importAmbientVariables = importAmbientVariables;
    return this;
  }

  public boolean getImportAmbientVariables() {
    return importAmbientVariables;
  }
}
