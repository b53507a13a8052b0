/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.peerbackup.discovery;

import static org.whispersystems.peerbackup.metrics.MetricsUtil.name;
import static org.whispersystems.peerbackup.protocol.EventTags.tag;

import com.google.common.base.Preconditions;
import io.micrometer.core.instrument.Metrics;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.whispersystems.peerbackup.backup.BackupPaths;
import org.whispersystems.peerbackup.identity.Identity;
import org.whispersystems.peerbackup.identity.IdentityProvider;
import org.whispersystems.peerbackup.identity.IdentityUnavailableException;
import org.whispersystems.peerbackup.identity.SignedEvent;
import org.whispersystems.peerbackup.protocol.ControlMessage.DiscoveryChallenge;
import org.whispersystems.peerbackup.protocol.ControlMessage.DiscoveryResponse;
import org.whispersystems.peerbackup.protocol.ControlMessageSender;
import org.whispersystems.peerbackup.protocol.EventTags;
import org.whispersystems.peerbackup.transport.KnownPeer;
import org.whispersystems.peerbackup.transport.PeerDirectory;
import org.whispersystems.peerbackup.util.LatestValuePublisher;
import reactor.core.publisher.Flux;

/**
 * Finds the peers that hold backups for this device's identity, typically after the identity was recovered on a new
 * device.
 * <p>
 * A discovery run sends a signed challenge to every online peer and collects the signed responses that arrive within
 * the run's window. Every challenged peer answers, so the presence of a response reveals nothing; only the signed
 * {@code has_backups} tag of a response that echoes the run's challenge counts. Peers that do not answer in time are
 * left out of the result, and there is no second attempt.
 */
public class DiscoveryCoordinator {

  private static final String QUERY_CONTENT = "Backup discovery query";

  private static final Duration COMPLETED_RUN_RETENTION = Duration.ofHours(1);

  private static final String RESPONSE_COUNTER_NAME = name(DiscoveryCoordinator.class, "responses");
  private static final String ACCEPTED_TAG_NAME = "accepted";
  private static final String HAS_BACKUPS_TAG_NAME = "hasBackups";

  private static final SecureRandom SECURE_RANDOM = new SecureRandom();

  private static final Logger log = LoggerFactory.getLogger(DiscoveryCoordinator.class);

  private final IdentityProvider identityProvider;
  private final PeerDirectory peerDirectory;
  private final ControlMessageSender messageSender;
  private final ScheduledExecutorService scheduler;
  private final Clock clock;

  private final Map<String, DiscoveryRun> runs = new ConcurrentHashMap<>();

  private static class DiscoveryRun {

    private final String challenge;
    private final Set<String> responders = ConcurrentHashMap.newKeySet();
    private final LatestValuePublisher<DiscoveryStatus> status;

    private DiscoveryRun(final String challenge, final DiscoveryStatus initialStatus) {
      this.challenge = challenge;
      this.status = new LatestValuePublisher<>(initialStatus);
    }
  }

  public DiscoveryCoordinator(final IdentityProvider identityProvider,
      final PeerDirectory peerDirectory,
      final ControlMessageSender messageSender,
      final ScheduledExecutorService scheduler,
      final Clock clock) {

    this.identityProvider = identityProvider;
    this.peerDirectory = peerDirectory;
    this.messageSender = messageSender;
    this.scheduler = scheduler;
    this.clock = clock;
  }

  /**
   * Challenge every online peer and collect responses for {@code timeoutSeconds}. Returns without waiting; the
   * progress of the run is available from {@link #getDiscoveryStatus} and {@link #discoveryUpdates}.
   *
   * @return the id of the new discovery run
   *
   * @throws IdentityUnavailableException if this device has no identity to sign challenges with
   */
  public String startDiscovery(final int timeoutSeconds) throws IdentityUnavailableException {
    Preconditions.checkArgument(timeoutSeconds > 0, "Discovery window must be positive");

    final Identity identity = identityProvider.requireIdentity();
    final String ownCallsign = BackupPaths.normalizeCallsign(identity.callsign());

    final List<String> peers = peerDirectory.onlinePeers().stream()
        .filter(KnownPeer::online)
        .map(peer -> BackupPaths.normalizeCallsign(peer.callsign()))
        .filter(callsign -> !callsign.equals(ownCallsign))
        .distinct()
        .toList();

    final String discoveryId = randomHex(16);
    final DiscoveryRun run = new DiscoveryRun(randomHex(32), DiscoveryStatus.started(discoveryId, peers.size()));
    runs.put(discoveryId, run);

    for (final String peer : peers) {
      final SignedEvent event = identity.sign(SignedEvent.TEXT_NOTE_KIND, List.of(
              tag(EventTags.ACTION, EventTags.DISCOVERY_QUERY_ACTION),
              tag(EventTags.TARGET, identity.publicKey()),
              tag(EventTags.CHALLENGE, run.challenge),
              tag(EventTags.CALLSIGN, identity.callsign()),
              tag(EventTags.TARGET_CALLSIGN, peer)),
          QUERY_CONTENT, clock.instant());

      messageSender.send(peer, new DiscoveryChallenge(event, discoveryId)).whenComplete((ignored, throwable) -> {
        if (throwable == null) {
          synchronized (run) {
            run.status.update(current -> current.isComplete() ? current : current.withDeviceQueried());
          }
        } else {
          log.debug("Could not challenge {} for discovery {}", peer, discoveryId);
        }
      });
    }

    scheduler.schedule(() -> complete(discoveryId), timeoutSeconds, TimeUnit.SECONDS);

    log.info("Started discovery {} across {} peers", discoveryId, peers.size());
    return discoveryId;
  }

  public Optional<DiscoveryStatus> getDiscoveryStatus(final String discoveryId) {
    return Optional.ofNullable(runs.get(discoveryId)).map(run -> run.status.current());
  }

  /**
   * @return a stream of a run's status that completes when the run does, or empty if the run is unknown
   */
  public Optional<Flux<DiscoveryStatus>> discoveryUpdates(final String discoveryId) {
    return Optional.ofNullable(runs.get(discoveryId)).map(run -> run.status.updates());
  }

  /**
   * Folds a response whose signature and freshness were already checked into its discovery run. Responses for
   * unknown or finished runs, responses that do not echo the run's challenge, and repeated responses from the same
   * peer are ignored.
   */
  public void handleResponse(final String senderCallsign, final DiscoveryResponse response) {
    final DiscoveryRun run = StringUtils.isBlank(response.discoveryId()) ? null : runs.get(response.discoveryId());
    if (run == null) {
      log.debug("Ignoring response from {} for unknown discovery {}", senderCallsign, response.discoveryId());
      return;
    }

    final SignedEvent event = response.event();
    if (!event.tagValue(EventTags.CHALLENGE).map(run.challenge::equals).orElse(false)) {
      log.warn("Ignoring discovery response from {} that does not answer our challenge", senderCallsign);
      countResponse(false, false);
      return;
    }

    final String callsign = BackupPaths.normalizeCallsign(senderCallsign);
    final boolean hasBackups = event.tagValue(EventTags.HAS_BACKUPS).map(Boolean::parseBoolean).orElse(false);

    @Nullable final DiscoveredProvider provider = hasBackups
        ? new DiscoveredProvider(callsign, event.publicKey(),
        response.maxStorageBytes() != null ? response.maxStorageBytes() : 0,
        response.snapshotCount() != null ? response.snapshotCount() : 0,
        response.latestSnapshot())
        : null;

    synchronized (run) {
      if (run.status.current().isComplete()) {
        log.debug("Ignoring late response from {} for discovery {}", callsign, response.discoveryId());
        countResponse(false, hasBackups);
        return;
      }

      if (!run.responders.add(callsign)) {
        log.debug("Ignoring repeated response from {} for discovery {}", callsign, response.discoveryId());
        countResponse(false, hasBackups);
        return;
      }

      run.status.update(current -> current.withResponse(provider));
    }

    countResponse(true, hasBackups);

    if (provider != null) {
      log.info("{} holds {} snapshots for this identity", callsign, provider.snapshotCount());
    }
  }

  private void complete(final String discoveryId) {
    final DiscoveryRun run = runs.get(discoveryId);
    if (run == null) {
      return;
    }

    final DiscoveryStatus completed;
    synchronized (run) {
      completed = run.status.update(DiscoveryStatus::completed);
      run.status.complete();
    }

    log.info("Discovery {} complete: {} of {} peers responded, {} providers found", discoveryId,
        completed.devicesResponded(), completed.devicesToQuery(), completed.providersFound().size());

    scheduler.schedule(() -> runs.remove(discoveryId), COMPLETED_RUN_RETENTION.toMillis(), TimeUnit.MILLISECONDS);
  }

  private static void countResponse(final boolean accepted, final boolean hasBackups) {
    Metrics.counter(RESPONSE_COUNTER_NAME,
            ACCEPTED_TAG_NAME, String.valueOf(accepted),
            HAS_BACKUPS_TAG_NAME, String.valueOf(hasBackups))
        .increment();
  }

  private static String randomHex(final int length) {
    final byte[] bytes = new byte[length];
    SECURE_RANDOM.nextBytes(bytes);
    return HexFormat.of().formatHex(bytes);
  }
}
