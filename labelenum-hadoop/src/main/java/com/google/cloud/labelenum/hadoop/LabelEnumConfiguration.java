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
import static com.google.common.base.Strings.isNullOrEmpty;

import com.google.cloud.labelenum.LabelEnum;
import com.google.cloud.labelenum.hadoop.LabelEnumDefinition.Type;
import com.google.cloud.labelenum.util.HadoopConfigurationProperty;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.hadoop.conf.Configuration;

/**
 * Reads {@link LabelEnum} declarations from a Hadoop {@link Configuration}.
 *
 * <p>An enum named {@code status} is declared with:
 *
 * <pre>
 * labelenum.names = status
 * labelenum.status.labels = pending, running, done
 * labelenum.status.type = SEQUENTIAL
 * </pre>
 *
 * <p>Labels are comma-separated and trimmed; blank entries are dropped, so an empty label can not
 * be declared this way.
 */
public class LabelEnumConfiguration {
  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final String LABEL_ENUM_CONFIG_PREFIX = "labelenum";

  public static final String LABELS_SUFFIX = ".labels";

  /** Deprecated key suffix for labels, superseded by {@link #LABELS_SUFFIX}. */
  public static final String DEPRECATED_VALUES_SUFFIX = ".values";

  public static final String TYPE_SUFFIX = ".type";

  /** Configuration key for the names of the declared enums. Default value: none */
  public static final HadoopConfigurationProperty<Collection<String>> LABEL_ENUM_NAMES =
      new HadoopConfigurationProperty<>(LABEL_ENUM_CONFIG_PREFIX + ".names", ImmutableList.of());

  private LabelEnumConfiguration() {}

  /** Returns the property holding the labels of enum {@code name}, in index order. */
  @VisibleForTesting
  static HadoopConfigurationProperty<Collection<String>> labelsProperty(String name) {
    return new HadoopConfigurationProperty<>(
        enumKeyPrefix(name) + LABELS_SUFFIX, null, enumKeyPrefix(name) + DEPRECATED_VALUES_SUFFIX);
  }

  /** Returns the property holding the {@link Type} of enum {@code name}. */
  @VisibleForTesting
  static HadoopConfigurationProperty<Type> typeProperty(String name) {
    return new HadoopConfigurationProperty<>(enumKeyPrefix(name) + TYPE_SUFFIX, Type.SEQUENTIAL);
  }

  /**
   * Reads the declaration of enum {@code name}.
   *
   * @throws IllegalArgumentException if the enum declares no labels or an unknown type
   */
  public static LabelEnumDefinition getDefinition(Configuration config, String name) {
    checkArgument(!isNullOrEmpty(name), "Label enum name must not be empty");
    HadoopConfigurationProperty<Collection<String>> labelsProperty = labelsProperty(name);
    Collection<String> labels = labelsProperty.getStringCollection(config);
    checkArgument(
        !labels.isEmpty(),
        "Label enum '%s' must declare at least one label in '%s'",
        name,
        labelsProperty.getKey());
    return LabelEnumDefinition.builder()
        .setName(name)
        .setLabels(labels)
        .setType(typeProperty(name).get(config, config::getEnum))
        .build();
  }

  /** Builds enum {@code name} from its declaration in {@code config}. */
  public static LabelEnum getLabelEnum(Configuration config, String name) {
    return getDefinition(config, name).toLabelEnum();
  }

  /**
   * Builds every enum listed in {@link #LABEL_ENUM_NAMES}, keyed by name in listed order.
   *
   * <p>A name listed more than once is loaded once, at its first position.
   */
  public static ImmutableMap<String, LabelEnum> getLabelEnums(Configuration config) {
    Map<String, LabelEnum> labelEnums = new LinkedHashMap<>();
    for (String name : LABEL_ENUM_NAMES.getStringCollection(config)) {
      if (labelEnums.containsKey(name)) {
        logger.atFine().log("Skipping duplicate label enum name '%s'", name);
        continue;
      }
      LabelEnum labelEnum = getLabelEnum(config, name);
      logger.atFine().log("Loaded label enum '%s': %s", name, labelEnum);
      labelEnums.put(name, labelEnum);
    }
    return ImmutableMap.copyOf(labelEnums);
  }

  private static String enumKeyPrefix(String name) {
    return LABEL_ENUM_CONFIG_PREFIX + "." + name;
  }
}
