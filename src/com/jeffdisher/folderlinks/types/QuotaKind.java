package com.jeffdisher.folderlinks.types;


/**
 * Which quota was exceeded when the server refused a folder operation.
 */
public enum QuotaKind
{
	/**
	 * Too many folders.
	 */
	DIALOG_FILTER_COUNT,
	/**
	 * Too many shared folders joined (or too many shared folders, when exporting).
	 */
	SHARED_FOLDER_JOIN_COUNT,
	/**
	 * Too many invite links exported.
	 */
	SHARED_FOLDER_INVITE_LINK_COUNT,
	/**
	 * Too many channels joined.
	 */
	CHANNEL_COUNT,
}
