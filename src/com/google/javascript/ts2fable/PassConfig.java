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

/** Pass factories for the translator. */
public abstract class PassConfig {

  // Used by the subclasses.
  protected final TranslatorOptions options;

  public PassConfig(TranslatorOptions options) {
    this.options = options;
  }

  /**
   * Gets the fixes applied to each module directly after merging. They resolve references that
   * only make sense inside the declaration that contains them.
   */
  protected abstract ImmutableList<PassFactory> getModuleFixes();

  /** Gets the ordered fix passes that make the merged tree printable. */
  protected abstract ImmutableList<PassFactory> getFixPasses();
}
