package com.jeffdisher.folderlinks.data;

import com.jeffdisher.folderlinks.projection.FiltersState;
import com.jeffdisher.folderlinks.projection.PeerCache;


/**
 * The interface for read-write transactions against the local filter store.  Only one of these can be open at a time.
 */
public interface IReadWriteFilterData extends IReadOnlyFilterData
{
	/**
	 * Calling this marks the folder state as changed, meaning observers will be notified when the transaction closes.
	 * 
	 * @return The shared folder state instance.
	 */
	FiltersState writableFilters();
	/**
	 * @return The shared peer cache instance.
	 */
	PeerCache writablePeers();
}
