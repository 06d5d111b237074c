package io.github.depot2git.store;

import org.eclipse.jgit.lib.PersonIdent;

/** What an appended sequence entry records besides its tree: the transaction and who made it, and when. */
public record EntryInfo(long transaction, PersonIdent ident) {}
