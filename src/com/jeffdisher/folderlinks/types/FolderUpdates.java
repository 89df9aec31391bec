package com.jeffdisher.folderlinks.types;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;


/**
 * The chats which can be joined into a shared folder because the owner added them after the local copy was created.
 * Equality only considers the folder and the ordered list of missing chat ids, so a change in title, member counts,
 * or which of those chats are in the peer cache, alone is not considered a new value.
 */
public final class FolderUpdates
{
	private final int _folderId;
	private final String _title;
	private final List<EntityId> _missingEntityIds;
	private final List<Peer> _missingPeers;
	private final Map<EntityId, Integer> _memberCounts;

	/**
	 * Creates the updates where every missing chat is known to the peer cache.
	 */
	public FolderUpdates(int folderId, String title, List<Peer> missingPeers, Map<EntityId, Integer> memberCounts)
	{
		this(folderId
				, title
				, missingPeers.stream().map((Peer peer) -> peer.id()).collect(Collectors.toList())
				, missingPeers
				, memberCounts
		);
	}

	/**
	 * Creates the updates where missingPeers only holds the cached subset of missingEntityIds.
	 */
	public FolderUpdates(int folderId, String title, List<EntityId> missingEntityIds, List<Peer> missingPeers, Map<EntityId, Integer> memberCounts)
	{
		_folderId = folderId;
		_title = title;
		_missingEntityIds = List.copyOf(missingEntityIds);
		_missingPeers = List.copyOf(missingPeers);
		_memberCounts = Map.copyOf(memberCounts);
	}

	public int getFolderId()
	{
		return _folderId;
	}

	public String getTitle()
	{
		return _title;
	}

	public List<Peer> getMissingPeers()
	{
		return _missingPeers;
	}

	public Map<EntityId, Integer> getMemberCounts()
	{
		return _memberCounts;
	}

	public List<EntityId> getMissingEntityIds()
	{
		return _missingEntityIds;
	}

	public int availableChatsToJoin()
	{
		return _missingPeers.size();
	}

	/**
	 * @return These updates in the shape of a link preview, so they can be offered through the same join flow.
	 */
	public FolderLinkContents toLinkContents()
	{
		return new FolderLinkContents(_folderId, _title, _missingPeers, Set.of(), _memberCounts);
	}

	@Override
	public boolean equals(Object obj)
	{
		boolean isEqual = false;
		if (obj instanceof FolderUpdates)
		{
			FolderUpdates other = (FolderUpdates)obj;
			isEqual = (_folderId == other._folderId)
					&& _missingEntityIds.equals(other._missingEntityIds)
			;
		}
		return isEqual;
	}

	@Override
	public int hashCode()
	{
		return (31 * _folderId) + _missingEntityIds.hashCode();
	}

	@Override
	public String toString()
	{
		return "FolderUpdates(" + _folderId + ", missing=" + _missingEntityIds + ")";
	}
}
