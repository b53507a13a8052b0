/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import java.util.Set;
import java.util.stream.Collectors;
import org.whispersystems.peerbackup.util.SystemMapper;

public final class ControlMessageCodec {

  private static final ObjectMapper MAPPER = SystemMapper.jsonMapper();
  private static final Validator VALIDATOR = Validation.buildDefaultValidatorFactory().getValidator();

  private ControlMessageCodec() {
  }

  public static String encode(final ControlMessage message) {
    try {
      return MAPPER.writerFor(ControlMessage.class).writeValueAsString(message);
    } catch (final JsonProcessingException e) {
      throw new IllegalArgumentException("Control message could not be serialized", e);
    }
  }

  /**
   * @throws JsonProcessingException if the message is malformed, of an unknown type, or missing a required field
   */
  public static ControlMessage decode(final String json) throws JsonProcessingException {
    final ControlMessage message = MAPPER.readValue(json, ControlMessage.class);

    if (message == null) {
      throw new JsonMappingException(null, "Control message must be a JSON object");
    }

    final Set<ConstraintViolation<ControlMessage>> violations = VALIDATOR.validate(message);
    if (!violations.isEmpty()) {
      throw new JsonMappingException(null, "Invalid " + message.messageType().wireName() + ": "
          + violations.stream()
          .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
          .sorted()
          .collect(Collectors.joining(", ")));
    }

    return message;
  }
}
