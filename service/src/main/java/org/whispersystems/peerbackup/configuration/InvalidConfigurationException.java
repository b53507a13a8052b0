/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.configuration;

import jakarta.validation.ConstraintViolation;
import java.util.List;
import java.util.Set;

public class InvalidConfigurationException extends Exception {

  private final List<String> violations;

  public InvalidConfigurationException(final Set<? extends ConstraintViolation<?>> constraintViolations) {
    this(constraintViolations.stream()
        .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
        .sorted()
        .toList());
  }

  private InvalidConfigurationException(final List<String> violations) {
    super("Invalid configuration: " + String.join(", ", violations));
    this.violations = violations;
  }

  public List<String> getViolations() {
    return violations;
  }
}
