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
import com.google.javascript.ts2fable.ir.FsMapped;
import java.util.logging.Logger;

/**
 * Adds the browser namespace to the opens of a file that refers to DOM types, recognized by their
 * {@code HTML} prefix. The tree itself is not changed.
 */
final class DetectBrowserOpens implements FixPass {

  private static final Logger logger = Logger.getLogger(DetectBrowserOpens.class.getName());

  static final String HTML_PREFIX = "HTML";

  private final String browserOpen;
  private boolean hasBrowser;

  DetectBrowserOpens(String browserOpen) {
    this.browserOpen = browserOpen;
  }

  @Override
  public FsFile process(FsFile file) {
    hasBrowser = false;
    FsTypeRewriter.rewrite(
        type -> {
          if (type instanceof FsMapped mapped && mapped.name().startsWith(HTML_PREFIX)) {
            hasBrowser = true;
          }
          return type;
        },
        file);
    if (!hasBrowser || file.opens().contains(browserOpen)) {
      return file;
    }
    logger.fine(() -> "Found browser types, opening " + browserOpen);
    return file.withOpens(
        ImmutableList.<String>builder().addAll(file.opens()).add(browserOpen).build());
  }
}
