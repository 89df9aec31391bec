package com.jeffdisher.folderlinks.types;

import java.util.List;


/**
 * An exported invite link to a shared folder.
 * The link is stored in its full URL form and the slug is derived from it, never the other way around, so that the
 * stored form always round-trips.
 * 
 * @param title The title of the link (not necessarily the title of the folder).
 * @param link The full URL of the link.
 * @param memberEntityIds The chats which the link shares, in the order the server reported them.
 * @param revoked True if the link was revoked and can no longer be joined.
 */
public record SharedLinkInfo(String title, String link, List<EntityId> memberEntityIds, boolean revoked)
{
	public static final String LINK_PREFIX = "https://t.me/folder/";

	/**
	 * @param slug The short identifier of a folder link.
	 * @return The full URL for that slug.
	 */
	public static String linkForSlug(String slug)
	{
		return LINK_PREFIX + slug;
	}

	public SharedLinkInfo
	{
		memberEntityIds = List.copyOf(memberEntityIds);
	}

	/**
	 * @return The path component of the link, used as its canonical identifier in remote calls.
	 */
	public String slug()
	{
		return link.startsWith(LINK_PREFIX)
				? link.substring(LINK_PREFIX.length())
				: link
		;
	}
}
