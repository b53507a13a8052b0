/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.util;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import javax.annotation.Nonnull;

public class SystemMapper {

  private static final ObjectMapper JSON_MAPPER = configureMapper(new ObjectMapper());

  private static final ObjectMapper YAML_MAPPER = configureMapper(new YAMLMapper());

  private static final ObjectWriter PRETTY_WRITER = JSON_MAPPER.writerWithDefaultPrettyPrinter();

  private SystemMapper() {
  }

  @Nonnull
  public static ObjectMapper jsonMapper() {
    return JSON_MAPPER;
  }

  @Nonnull
  public static ObjectMapper yamlMapper() {
    return YAML_MAPPER;
  }

  /**
   * @return a writer for files persisted to the data directory, which are meant to be readable by hand
   */
  @Nonnull
  public static ObjectWriter prettyWriter() {
    return PRETTY_WRITER;
  }

  public static ObjectMapper configureMapper(final ObjectMapper mapper) {
    return mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL)
        .setVisibility(PropertyAccessor.ALL, JsonAutoDetect.Visibility.NONE)
        .setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY)
        .setVisibility(PropertyAccessor.CREATOR, JsonAutoDetect.Visibility.PUBLIC_ONLY)
        .registerModules(
            new JavaTimeModule(),
            new Jdk8Module());
  }
}
