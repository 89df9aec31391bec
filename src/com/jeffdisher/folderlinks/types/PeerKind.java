package com.jeffdisher.folderlinks.types;


/**
 * The kinds of peer the folder engine distinguishes.  Only channels and basic groups can ever be shared through a
 * folder link.
 */
public enum PeerKind
{
	USER,
	BASIC_GROUP,
	CHANNEL,
	SECRET_CHAT,
}
