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

import com.google.javascript.ts2fable.ir.FsFile;

/**
 * A whole-tree rewrite of a translated file.
 *
 * <p>Passes never modify their input; they return a new tree, which may be the input itself when
 * nothing changed.
 */
public interface FixPass {

  /**
   * Rewrites {@code file}.
   *
   * @param file the current tree
   * @return the rewritten tree
   */
  FsFile process(FsFile file);
}
