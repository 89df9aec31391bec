package com.jeffdisher.folderlinks.projection;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.Peer;


/**
 * The mutable projection of the peers, presences, and chat list membership known locally.
 * Like FiltersState, this is only touched inside a LocalFilterStore transaction.
 */
public class PeerCache implements IPeerReading
{
	private final Map<EntityId, Peer> _peers = new HashMap<>();
	private final Map<EntityId, Integer> _presences = new HashMap<>();
	private final Set<EntityId> _chatList = new HashSet<>();

	@Override
	public Peer getPeer(EntityId id)
	{
		return _peers.get(id);
	}

	@Override
	public boolean hasChatListPresence(EntityId id)
	{
		return _chatList.contains(id);
	}

	@Override
	public Integer getPresence(EntityId id)
	{
		return _presences.get(id);
	}

	/**
	 * Inserts or replaces the given peers.  The incoming object always wins.
	 * 
	 * @param peers The peers to write.
	 */
	public void upsertPeers(Collection<Peer> peers)
	{
		for (Peer peer : peers)
		{
			_peers.put(peer.id(), peer);
		}
	}

	/**
	 * @param presences The last-seen times to write, in Unix seconds, by user.
	 */
	public void updatePresences(Map<EntityId, Integer> presences)
	{
		_presences.putAll(presences);
	}

	/**
	 * @param id The peer.
	 * @param isPresent True if the peer should have a chat list entry, false to remove it.
	 */
	public void setChatListPresence(EntityId id, boolean isPresent)
	{
		if (isPresent)
		{
			_chatList.add(id);
		}
		else
		{
			_chatList.remove(id);
		}
	}
}
