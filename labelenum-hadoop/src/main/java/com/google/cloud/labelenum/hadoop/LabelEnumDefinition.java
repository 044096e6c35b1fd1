/*
 * Copyright 2026 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.cloud.labelenum.hadoop;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.cloud.labelenum.LabelEnum;
import com.google.common.collect.ImmutableList;

/** Declaration of a {@link LabelEnum} read from a Hadoop configuration. */
@AutoValue
public abstract class LabelEnumDefinition {

  /** How labels are indexed. */
  public enum Type {
    /** Labels are indexed 1, 2, 3, ...; see {@link LabelEnum#create}. */
    SEQUENTIAL,
    /** Labels are indexed 1, 2, 4, ...; see {@link LabelEnum#createComposite}. */
    COMPOSITE
  }

  public static Builder builder() {
    return new AutoValue_LabelEnumDefinition.Builder().setType(Type.SEQUENTIAL);
  }

  public abstract Builder toBuilder();

  public abstract String getName();

  public abstract ImmutableList<String> getLabels();

  public abstract Type getType();

  /** Builds the enum this definition declares. */
  public LabelEnum toLabelEnum() {
    String[] labels = getLabels().toArray(new String[0]);
    switch (getType()) {
      case COMPOSITE:
        return LabelEnum.createComposite(labels);
      case SEQUENTIAL:
        return LabelEnum.create(labels);
    }
    throw new IllegalStateException("Unknown label enum type: " + getType());
  }

  /** Mutable builder for the {@link LabelEnumDefinition} class. */
  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setName(String name);

    public abstract Builder setLabels(Iterable<String> labels);

    public abstract Builder setType(Type type);

    abstract LabelEnumDefinition autoBuild();

    public LabelEnumDefinition build() {
      LabelEnumDefinition definition = autoBuild();
      checkArgument(
          !definition.getLabels().isEmpty(),
          "Label enum '%s' must declare at least one label",
          definition.getName());
      return definition;
    }
  }
}
