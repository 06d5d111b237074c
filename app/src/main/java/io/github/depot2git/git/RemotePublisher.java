package io.github.depot2git.git;

import io.github.depot2git.FatalConversionException;
import io.github.depot2git.InvariantViolationException;
import io.github.depot2git.UnrecognizedInputException;
import io.github.depot2git.config.RemoteMapping;
import io.github.depot2git.store.StateKey;
import java.io.IOException;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.RemoteSetUrlCommand;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RefSpec;
import org.eclipse.jgit.transport.RemoteConfig;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.transport.URIish;

/**
 * Mirrors the converted refs to the configured git remotes. The local repository is authoritative, so every push
 * is forced; a failed push is logged and the conversion carries on.
 */
public final class RemotePublisher {
    private static final Logger logger = LogManager.getLogger(RemotePublisher.class);

    private final TargetRepository target;
    private final List<RemoteMapping> remotes;

    public RemotePublisher(TargetRepository target, List<RemoteMapping> remotes) {
        this.target = target;
        this.remotes = List.copyOf(remotes);
    }

    public boolean isEmpty() {
        return remotes.isEmpty();
    }

    /**
     * Adds the configured remotes the repository does not have yet. A remote that already exists must have the
     * configured URLs.
     */
    public void configure() throws FatalConversionException {
        if (remotes.isEmpty()) {
            return;
        }
        List<RemoteConfig> existing;
        try {
            existing = target.git().remoteList().call();
        } catch (GitAPIException e) {
            throw new FatalConversionException("Could not list the git remotes", e);
        }
        for (var present : existing) {
            if (remotes.stream().noneMatch(r -> r.name().equals(present.getName()))) {
                logger.debug("Ignoring remote {} that is not configured", present.getName());
            }
        }
        for (var remote : remotes) {
            var present = existing.stream().filter(r -> r.getName().equals(remote.name())).findFirst();
            if (present.isPresent()) {
                checkUrls(remote, present.get());
            } else {
                add(remote);
            }
        }
    }

    private static void checkUrls(RemoteMapping remote, RemoteConfig present) throws UnrecognizedInputException {
        var url = present.getURIs().isEmpty() ? null : present.getURIs().get(0);
        var pushUrl = present.getPushURIs().isEmpty() ? url : present.getPushURIs().get(0);
        if (!uri(remote, remote.url()).equals(url) || !uri(remote, remote.effectivePushUrl()).equals(pushUrl)) {
            throw new UnrecognizedInputException("Remote " + remote.name() + " points at " + url + " (push " + pushUrl
                    + ") but is configured as " + remote.url() + " (push " + remote.effectivePushUrl() + ")");
        }
    }

    private void add(RemoteMapping remote) throws FatalConversionException {
        try {
            target.git().remoteAdd().setName(remote.name()).setUri(uri(remote, remote.url())).call();
            logger.info("Added remote {} ({})", remote.name(), remote.url());
            if (!remote.effectivePushUrl().equals(remote.url())) {
                target.git()
                        .remoteSetUrl()
                        .setRemoteName(remote.name())
                        .setRemoteUri(uri(remote, remote.effectivePushUrl()))
                        .setUriType(RemoteSetUrlCommand.UriType.PUSH)
                        .call();
                logger.info("Set push URL of {} to {}", remote.name(), remote.effectivePushUrl());
            }
        } catch (GitAPIException e) {
            throw new FatalConversionException("Could not add remote " + remote.name(), e);
        }
    }

    private static URIish uri(RemoteMapping remote, String url) throws UnrecognizedInputException {
        try {
            return new URIish(url);
        } catch (URISyntaxException e) {
            throw new UnrecognizedInputException("Remote " + remote.name() + " has an invalid URL: " + url, e);
        }
    }

    /** Pushes the converter's state refs, which hold the retrieved history. */
    public boolean pushState() {
        var namespace = StateKey.NAMESPACE + "*";
        return push("state", List.of(new RefSpec("+" + namespace + ":" + namespace)));
    }

    /** Pushes the given branches together with both notes refs. */
    public boolean pushBranches(Collection<String> branches) throws IOException, InvariantViolationException {
        var specs = new ArrayList<RefSpec>();
        for (var branch : branches) {
            var ref = Constants.R_HEADS + branch;
            specs.add(new RefSpec("+" + ref + ":" + ref));
        }
        for (var notes : List.of(Annotations.NOTES_REF, CommitMessages.INFO_NOTES_REF)) {
            if (Refs.resolve(target.repository(), notes).isPresent()) {
                specs.add(new RefSpec("+" + notes + ":" + notes));
            }
        }
        return push("branches", specs);
    }

    private boolean push(String what, List<RefSpec> specs) {
        if (specs.isEmpty()) {
            return true;
        }
        boolean pushed = true;
        for (var remote : remotes) {
            logger.info("Pushing {} to {}", what, remote.name());
            try {
                Iterable<PushResult> results =
                        target.git().push().setRemote(remote.name()).setRefSpecs(specs).call();
                for (var result : results) {
                    for (var update : result.getRemoteUpdates()) {
                        if (!isPushSuccessful(update.getStatus())) {
                            logger.error(
                                    "Push of {} to {} failed: {} {}",
                                    update.getSrcRef(),
                                    remote.name(),
                                    update.getStatus(),
                                    update.getMessage() == null ? "" : update.getMessage());
                            pushed = false;
                        }
                    }
                }
            } catch (GitAPIException e) {
                logger.error("Push of {} to {} failed", what, remote.name(), e);
                pushed = false;
            }
        }
        return pushed;
    }

    static boolean isPushSuccessful(RemoteRefUpdate.Status status) {
        return status == RemoteRefUpdate.Status.OK || status == RemoteRefUpdate.Status.UP_TO_DATE;
    }
}
