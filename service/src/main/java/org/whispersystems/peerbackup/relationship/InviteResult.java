/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.relationship;

import com.fasterxml.jackson.annotation.JsonProperty;
import javax.annotation.Nullable;
import org.whispersystems.peerbackup.storage.ProviderRelationship;

/**
 * The outcome of an invitation sent to a prospective provider.
 *
 * @param outcome      how the invitation ended
 * @param relationship the provider relationship as it stands after the invitation, if one was recorded
 * @param error        a description of the failure, for {@link Outcome#FAILED} and {@link Outcome#TIMED_OUT}
 */
public record InviteResult(
    @JsonProperty("outcome") Outcome outcome,
    @JsonProperty("relationship") @Nullable ProviderRelationship relationship,
    @JsonProperty("error") @Nullable String error) {

  public enum Outcome {
    @JsonProperty("accepted")
    ACCEPTED,

    @JsonProperty("declined")
    DECLINED,

    @JsonProperty("timed_out")
    TIMED_OUT,

    @JsonProperty("failed")
    FAILED
  }

  public static InviteResult accepted(final ProviderRelationship relationship) {
    return new InviteResult(Outcome.ACCEPTED, relationship, null);
  }

  public static InviteResult declined(final ProviderRelationship relationship) {
    return new InviteResult(Outcome.DECLINED, relationship, null);
  }

  public static InviteResult timedOut(@Nullable final ProviderRelationship relationship) {
    return new InviteResult(Outcome.TIMED_OUT, relationship, "No response to invitation");
  }

  public static InviteResult failed(@Nullable final ProviderRelationship relationship, final String error) {
    return new InviteResult(Outcome.FAILED, relationship, error);
  }

  public boolean isAccepted() {
    return outcome == Outcome.ACCEPTED;
  }
}
