package com.jeffdisher.folderlinks.types;


/**
 * The quotas which apply to one tier of user.
 * 
 * @param maxSharedFolderLinks How many invite links can be exported across all shared folders.
 * @param maxSharedFolderJoins How many shared folders can be joined.
 * @param maxFolders How many folders (of any kind) can exist.
 * @param maxFolderChats How many chats a single folder can include.
 */
public record LimitsTable(int maxSharedFolderLinks, int maxSharedFolderJoins, int maxFolders, int maxFolderChats)
{
}
