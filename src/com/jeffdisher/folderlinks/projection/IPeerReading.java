package com.jeffdisher.folderlinks.projection;

import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.Peer;


/**
 * The read-only view of the local peer and presence caches.
 */
public interface IPeerReading
{
	/**
	 * @param id The peer to look up.
	 * @return The cached peer or null if it isn't known locally.
	 */
	Peer getPeer(EntityId id);

	/**
	 * @param id The peer to look up.
	 * @return True if this peer currently has an entry in the local chat list.
	 */
	boolean hasChatListPresence(EntityId id);

	/**
	 * @param id The user to look up.
	 * @return The last-seen time, in Unix seconds, or null if unknown.
	 */
	Integer getPresence(EntityId id);
}
