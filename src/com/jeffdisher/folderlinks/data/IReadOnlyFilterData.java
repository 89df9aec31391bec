package com.jeffdisher.folderlinks.data;

import com.jeffdisher.folderlinks.projection.IFiltersReading;
import com.jeffdisher.folderlinks.projection.IPeerReading;


/**
 * The interface for read-only transactions against the local filter store.
 * Note that holding this across a remote call is not allowed:  read what is needed, close, and open a new transaction
 * once the call returns.  This means there is an ABA window between a read and a later write which callers must
 * tolerate (all writes in this engine are whole-record replacements, for this reason).
 */
public interface IReadOnlyFilterData extends AutoCloseable
{
	/**
	 * @return The folder state.
	 */
	IFiltersReading readFilters();
	/**
	 * @return The peer, presence, and chat list caches.
	 */
	IPeerReading readPeers();
	/**
	 * We implement AutoCloseable so we can use the try-with-resources idiom but we have no need for the exception so
	 * we override the close() not to throw it.
	 */
	void close();
}
