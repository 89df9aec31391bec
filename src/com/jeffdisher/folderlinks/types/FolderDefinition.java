package com.jeffdisher.folderlinks.types;

import java.util.List;


/**
 * A folder (chat list filter) as held by the local filter store.
 * 
 * @param id The folder identifier, unique per account.
 * @param title The user-visible title.
 * @param isShared True if the folder is exported or was joined through a link.
 * @param includedEntityIds The chats explicitly included in the folder, in their display order (no duplicates).
 */
public record FolderDefinition(int id, String title, boolean isShared, List<EntityId> includedEntityIds)
{
	public FolderDefinition
	{
		includedEntityIds = List.copyOf(includedEntityIds);
	}

	public boolean includes(EntityId entityId)
	{
		return includedEntityIds.contains(entityId);
	}
}
