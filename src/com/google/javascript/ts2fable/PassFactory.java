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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.ForOverride;
import java.util.function.Function;

/**
 * A factory for creating fix passes based on the options injected.
 *
 * <p>Contains the meta-data of a pass: a human-readable name for logging and the condition under
 * which it runs.
 */
@AutoValue
public abstract class PassFactory {

  /** The name of the pass as it will appear in logs. */
  public abstract String getName();

  public abstract Function<TranslatorOptions, Boolean> getCondition();

  /**
   * A simple factory function for creating actual pass instances.
   *
   * <p>Users should call {@link #create(Translator)} rather than use this object directly.
   */
  abstract Function<Translator, ? extends FixPass> getInternalFactory();

  public abstract Builder toBuilder();

  PassFactory() {
    // Subclasses in this package only.
  }

  /** A builder for a {@link PassFactory}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setName(String x);

    public abstract Builder setCondition(Function<TranslatorOptions, Boolean> cond);

    public abstract Builder setInternalFactory(Function<Translator, ? extends FixPass> x);

    @ForOverride
    abstract PassFactory autoBuild();

    public final PassFactory build() {
      PassFactory result = autoBuild();
      checkState(!result.getName().isEmpty());
      return result;
    }
  }

  public static Builder builder() {
    return new AutoValue_PassFactory.Builder().setCondition((o) -> true);
  }

  /** Whether the pass is enabled by {@code options}. */
  final boolean isEnabled(TranslatorOptions options) {
    return getCondition().apply(options);
  }

  /** Creates a new fix pass to be run. */
  final FixPass create(Translator translator) {
    return getInternalFactory().apply(translator);
  }
}
