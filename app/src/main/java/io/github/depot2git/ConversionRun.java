package io.github.depot2git;

import io.github.depot2git.config.ConverterConfig;
import io.github.depot2git.config.MergeStrategy;
import io.github.depot2git.git.Annotations;
import io.github.depot2git.git.CommitMessages;
import io.github.depot2git.git.IdentityMapper;
import io.github.depot2git.git.Refs;
import io.github.depot2git.git.RemotePublisher;
import io.github.depot2git.git.TargetRepository;
import io.github.depot2git.git.WorkingTree;
import io.github.depot2git.process.BranchNames;
import io.github.depot2git.process.OrphanageProcessor;
import io.github.depot2git.process.TransactionProcessor;
import io.github.depot2git.retrieve.RetrievalService;
import io.github.depot2git.source.RetryingSourceRepository;
import io.github.depot2git.source.SourceRepository;
import io.github.depot2git.stitch.HistoryRewriter;
import io.github.depot2git.stitch.HistoryStitcher;
import io.github.depot2git.stitch.RewritePlan;
import io.github.depot2git.store.GitStateStore;
import io.github.depot2git.store.StateKeys;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.jetbrains.annotations.Nullable;

/**
 * One invocation of the converter: retrieval, then processing, then the optional history stitching. Each stage
 * resumes from the state the previous invocation left behind.
 */
public final class ConversionRun implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ConversionRun.class);

    /**
     * @param restart discard all converted state and branches first
     * @param finalizeHistory run the stitching stage after processing
     * @param stitchPlan with {@code finalizeHistory}: an existing file is applied as the plan; otherwise the
     *     computed plan is written there for review and nothing is rewritten
     */
    public record Options(boolean restart, boolean finalizeHistory, @Nullable Path stitchPlan) {
        public static Options defaults() {
            return new Options(false, false, null);
        }
    }

    private final ConversionContext context;
    private final RemotePublisher remotes;

    private ConversionRun(ConversionContext context, RemotePublisher remotes) {
        this.context = context;
        this.remotes = remotes;
    }

    /** Opens (or creates) the git repository, adds the configured remotes and resolves the depot. */
    public static ConversionRun open(ConverterConfig config, SourceRepository source)
            throws IOException, GitAPIException, ConversionException {
        var retrying = new RetryingSourceRepository(source, config.retrier());
        var depot = retrying.depots().stream()
                .filter(d -> d.name().equals(config.depot()))
                .findFirst()
                .orElseThrow(() -> new UnrecognizedInputException("Depot " + config.depot() + " does not exist"));
        var identities = new IdentityMapper(config.users(), ZoneId.systemDefault());
        var target = TargetRepository.openOrInit(config.gitRepoPath());
        var remotes = new RemotePublisher(target, config.remotes());
        try {
            remotes.configure();
        } catch (ConversionException e) {
            target.close();
            throw e;
        }
        var context = new ConversionContext(
                config,
                depot,
                retrying,
                target,
                new GitStateStore(target.repository()),
                new WorkingTree(target),
                identities,
                new CommitMessages(config.messageStyle()));
        return new ConversionRun(context, remotes);
    }

    public ConversionContext context() {
        return context;
    }

    public void run(Options options) throws IOException, ConversionException {
        var config = context.config();
        logger.info(
                "Converting depot {} into {} (method {}, merge strategy {})",
                context.depot().name(),
                config.gitRepoPath(),
                config.method().configName(),
                config.mergeStrategy().configName());
        var streams = StreamSelection.resolve(context);
        if (options.restart()) {
            restart(streams);
        }

        switch (config.method()) {
            case SKIP -> logger.info("Retrieval skipped");
            case POP, DIFF, DEEP_HIST -> {
                new RetrievalService(context).retrieveAll(streams);
                remotes.pushState();
            }
        }

        switch (config.mergeStrategy()) {
            case SKIP -> logger.info("Processing skipped");
            case ORPHANAGE -> new OrphanageProcessor(context, streams).process();
            case NORMAL -> new TransactionProcessor(context, streams).process();
        }
        if (config.mergeStrategy() != MergeStrategy.SKIP) {
            remotes.pushState();
            remotes.pushBranches(existingBranches(streams));
        }

        if (options.finalizeHistory()) {
            finalizeHistory(streams, options.stitchPlan());
            remotes.pushBranches(existingBranches(streams));
        }
    }

    private List<String> existingBranches(List<ConfiguredStream> streams) throws IOException, ConversionException {
        var names = new BranchNames(streams);
        var branches = new ArrayList<String>();
        for (var stream : streams) {
            var branch = names.branchFor(stream.number(), stream.info().name());
            if (context.target().branchTip(branch).isPresent()) {
                branches.add(branch);
            }
        }
        return branches;
    }

    /** Source users that have no entry in the user map. */
    public Set<String> missingUsers() throws ConversionException {
        return context.identities().missingUsers(context.source().users());
    }

    private void finalizeHistory(List<ConfiguredStream> streams, @Nullable Path planFile)
            throws IOException, ConversionException {
        if (planFile != null && Files.exists(planFile)) {
            logger.info("Applying reviewed stitch plan {}", planFile);
            var plan = RewritePlan.fromJson(Files.readString(planFile, StandardCharsets.UTF_8));
            new HistoryRewriter(context).apply(plan);
            return;
        }
        var plan = new HistoryStitcher(context, streams).plan();
        if (planFile != null) {
            Files.writeString(planFile, plan.toJson(), StandardCharsets.UTF_8);
            logger.info("Stitch plan written to {}; run again with the same file to apply it", planFile);
            return;
        }
        new HistoryRewriter(context).apply(plan);
    }

    /** Deletes the depot's converter state, the annotation notes and the branches of the selected streams. */
    private void restart(List<ConfiguredStream> streams) throws IOException, ConversionException {
        var store = context.store();
        var keys = store.keys(StateKeys.depotPrefix(context.depot().number()));
        for (var key : keys) {
            store.delete(key);
        }
        var repository = context.target().repository();
        for (var notes : List.of(Annotations.NOTES_REF, CommitMessages.INFO_NOTES_REF)) {
            if (Refs.resolve(repository, notes).isPresent()) {
                Refs.delete(repository, notes, null);
            }
        }
        var names = new BranchNames(streams);
        int branches = 0;
        for (var stream : streams) {
            var branch = names.branchFor(stream.number(), stream.info().name());
            var tip = context.target().branchTip(branch);
            if (tip.isPresent()) {
                context.target().deleteBranch(branch, tip.get());
                branches++;
            }
        }
        logger.warn(
                "Restart: deleted {} state keys and {} branches of {}", keys.size(), branches, context.depot().name());
    }

    @Override
    public void close() {
        context.target().close();
    }
}
