package com.jeffdisher.folderlinks.types;


/**
 * Returned once a folder link join is visible in local state.
 * NOTE:  newChatCount is counted against the local chat list before the join was sent so it describes how many of the
 * requested chats were already present, not how many were added.
 */
public record JoinFolderResult(int folderId, String title, int newChatCount)
{
}
