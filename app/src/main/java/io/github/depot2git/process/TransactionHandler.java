package io.github.depot2git.process;

import io.github.depot2git.FatalConversionException;
import java.io.IOException;

/** Applies one kind of transaction to the branches. */
@FunctionalInterface
public interface TransactionHandler {
    void handle(TransactionStep step) throws IOException, FatalConversionException;
}
