package com.jeffdisher.folderlinks.remote;

import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.FolderDefinition;


/**
 * One element of the update stream the server returns after a membership-changing call.
 * Only the fields relevant to the kind are set.
 */
public record RemoteUpdate(Kind kind, int folderId, FolderDefinition definition, EntityId entityId)
{
	public static RemoteUpdate folderUpdated(int folderId, FolderDefinition definition)
	{
		return new RemoteUpdate(Kind.FOLDER_UPDATED, folderId, definition, null);
	}

	public static RemoteUpdate folderDeleted(int folderId)
	{
		return new RemoteUpdate(Kind.FOLDER_UPDATED, folderId, null, null);
	}

	public static RemoteUpdate chatJoined(EntityId entityId)
	{
		return new RemoteUpdate(Kind.CHAT_JOINED, 0, null, entityId);
	}

	public static RemoteUpdate chatLeft(EntityId entityId)
	{
		return new RemoteUpdate(Kind.CHAT_LEFT, 0, null, entityId);
	}


	public static enum Kind
	{
		/**
		 * The folder was created or changed (definition is set) or deleted (definition is null).
		 */
		FOLDER_UPDATED,
		CHAT_JOINED,
		CHAT_LEFT,
	}
}
