package com.jeffdisher.folderlinks.remote;

import java.util.List;

import com.jeffdisher.folderlinks.types.EntityId;


/**
 * The response to checking a folder link slug.  This has 2 shapes:
 * -a fresh invite, for a folder which has no local counterpart, listing all of its chats
 * -an already-joined invite, naming the local folder and listing only the chats missing from it
 * 
 * @param alreadyJoinedFilterId The local folder id, if already joined (null for a fresh invite).
 * @param title The title of the link (only for a fresh invite).
 * @param peers All chats (fresh) or the missing chats (already-joined).
 * @param alreadyPeers The chats the server considers already present (only for already-joined).
 * @param remotePeers The peer objects accompanying the response.
 */
public record CheckedInvite(Integer alreadyJoinedFilterId
		, String title
		, List<EntityId> peers
		, List<EntityId> alreadyPeers
		, List<RemotePeer> remotePeers
)
{
	public static CheckedInvite fresh(String title, List<EntityId> peers, List<RemotePeer> remotePeers)
	{
		return new CheckedInvite(null, title, peers, List.of(), remotePeers);
	}

	public static CheckedInvite alreadyJoined(int filterId, List<EntityId> missingPeers, List<EntityId> alreadyPeers, List<RemotePeer> remotePeers)
	{
		return new CheckedInvite(filterId, null, missingPeers, alreadyPeers, remotePeers);
	}

	public boolean isAlreadyJoined()
	{
		return (null != alreadyJoinedFilterId);
	}
}
