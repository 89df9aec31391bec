package com.jeffdisher.folderlinks.types;

import java.util.List;
import java.util.Map;


/**
 * The result of the last poll for chats which the owner added to a shared folder but which are missing locally.
 * At most one of these exists per folder.
 * 
 * @param folderId The folder this describes.
 * @param timestamp When the poll completed, in Unix seconds.
 * @param missingEntityIds The chats the server reported as missing, in server order.
 * @param memberCounts The participant counts reported for some of those chats.
 */
public record PendingUpdateRecord(int folderId, int timestamp, List<EntityId> missingEntityIds, Map<EntityId, Integer> memberCounts)
{
	public PendingUpdateRecord
	{
		missingEntityIds = List.copyOf(missingEntityIds);
		memberCounts = Map.copyOf(memberCounts);
	}

	public static PendingUpdateRecord empty(int folderId, int timestamp)
	{
		return new PendingUpdateRecord(folderId, timestamp, List.of(), Map.of());
	}
}
