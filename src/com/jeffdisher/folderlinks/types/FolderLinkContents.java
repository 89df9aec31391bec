package com.jeffdisher.folderlinks.types;

import java.util.List;
import java.util.Map;
import java.util.Set;


/**
 * The preview of a folder link, shown before the user picks which chats to join.
 * 
 * @param localFilterId The local folder this link already corresponds to (null if it was never joined).
 * @param title The folder title (null if the local folder couldn't be found).
 * @param peers The chats to offer, in display order.
 * @param alreadyMemberPeerIds The subset of peers which are already in the local chat list.
 * @param memberCounts Participant counts for the channels which reported one.
 */
public record FolderLinkContents(Integer localFilterId
		, String title
		, List<Peer> peers
		, Set<EntityId> alreadyMemberPeerIds
		, Map<EntityId, Integer> memberCounts
)
{
	public FolderLinkContents
	{
		peers = List.copyOf(peers);
		alreadyMemberPeerIds = Set.copyOf(alreadyMemberPeerIds);
		memberCounts = Map.copyOf(memberCounts);
	}
}
