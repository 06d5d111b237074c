package io.github.depot2git;

import io.github.depot2git.config.ConverterConfig;
import io.github.depot2git.git.CommitMessages;
import io.github.depot2git.git.IdentityMapper;
import io.github.depot2git.git.TargetRepository;
import io.github.depot2git.git.WorkingTree;
import io.github.depot2git.source.Depot;
import io.github.depot2git.source.SourceRepository;
import io.github.depot2git.store.StateStore;

/**
 * Everything one conversion run works with. Passed explicitly to each stage; there is no global state.
 *
 * @param source already wrapped in the run's retry budget
 */
public record ConversionContext(
        ConverterConfig config,
        Depot depot,
        SourceRepository source,
        TargetRepository target,
        StateStore store,
        WorkingTree workingTree,
        IdentityMapper identities,
        CommitMessages messages) {}
