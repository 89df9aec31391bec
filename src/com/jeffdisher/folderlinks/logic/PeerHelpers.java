package com.jeffdisher.folderlinks.logic;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.folderlinks.data.IReadWriteFilterData;
import com.jeffdisher.folderlinks.projection.IPeerReading;
import com.jeffdisher.folderlinks.projection.PeerCache;
import com.jeffdisher.folderlinks.remote.RemotePeer;
import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.InputPeer;
import com.jeffdisher.folderlinks.types.Peer;
import com.jeffdisher.folderlinks.types.PeerKind;


/**
 * Helpers shared by the components for moving peers between the local cache and remote calls.
 */
public class PeerHelpers
{
	/**
	 * Resolves the given ids into remote-addressable references.  Ids which aren't in the local peer cache are
	 * silently dropped, as are secret chats (which can't be addressed remotely).
	 * 
	 * @param peers The peer cache.
	 * @param entityIds The ids to resolve.
	 * @return The resolved references, in the same order.
	 */
	public static List<InputPeer> resolveInputPeers(IPeerReading peers, List<EntityId> entityIds)
	{
		List<InputPeer> resolved = new ArrayList<>();
		for (EntityId id : entityIds)
		{
			Peer peer = peers.getPeer(id);
			if ((null != peer) && (PeerKind.SECRET_CHAT != peer.kind()))
			{
				resolved.add(InputPeer.fromPeer(peer));
			}
		}
		return resolved;
	}

	/**
	 * Merges the peer objects accompanying a remote response into the peer and presence caches.  The incoming objects
	 * always replace what was cached.
	 * 
	 * @param access The write transaction.
	 * @param remotePeers The peers from the response.
	 */
	public static void mergeRemotePeers(IReadWriteFilterData access, List<RemotePeer> remotePeers)
	{
		PeerCache cache = access.writablePeers();
		List<Peer> peers = new ArrayList<>();
		Map<EntityId, Integer> presences = new HashMap<>();
		for (RemotePeer remote : remotePeers)
		{
			peers.add(remote.peer());
			if ((PeerKind.USER == remote.peer().kind()) && (null != remote.presenceTimestamp()))
			{
				presences.put(remote.peer().id(), remote.presenceTimestamp());
			}
		}
		cache.upsertPeers(peers);
		cache.updatePresences(presences);
	}

	/**
	 * @param remotePeers The peers from a response.
	 * @return The participant counts of the channels which reported one.
	 */
	public static Map<EntityId, Integer> memberCountsOf(List<RemotePeer> remotePeers)
	{
		Map<EntityId, Integer> counts = new HashMap<>();
		for (RemotePeer remote : remotePeers)
		{
			if ((PeerKind.CHANNEL == remote.peer().kind()) && (null != remote.participantsCount()))
			{
				counts.put(remote.peer().id(), remote.participantsCount());
			}
		}
		return counts;
	}
}
