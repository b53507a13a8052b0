/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.configuration;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.whispersystems.peerbackup.util.SystemMapper;

/**
 * Reads a {@link PeerBackupConfiguration} from YAML and validates it. Omitted sections and properties keep their
 * defaults.
 */
public final class ConfigurationLoader {

  private ConfigurationLoader() {
  }

  public static PeerBackupConfiguration load(final Path path) throws IOException, InvalidConfigurationException {
    try (final InputStream inputStream = Files.newInputStream(path)) {
      return load(inputStream);
    }
  }

  public static PeerBackupConfiguration load(final InputStream inputStream)
      throws IOException, InvalidConfigurationException {

    final PeerBackupConfiguration configuration =
        SystemMapper.yamlMapper().readValue(inputStream, PeerBackupConfiguration.class);

    validate(configuration);
    return configuration;
  }

  public static void validate(final PeerBackupConfiguration configuration) throws InvalidConfigurationException {
    try (final ValidatorFactory validatorFactory = Validation.buildDefaultValidatorFactory()) {
      final Validator validator = validatorFactory.getValidator();
      final Set<ConstraintViolation<PeerBackupConfiguration>> violations = validator.validate(configuration);

      if (!violations.isEmpty()) {
        throw new InvalidConfigurationException(violations);
      }
    }
  }
}
