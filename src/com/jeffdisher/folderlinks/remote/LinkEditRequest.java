package com.jeffdisher.folderlinks.remote;

import java.util.List;

import com.jeffdisher.folderlinks.types.InputPeer;


/**
 * A partial update of an exported link.  A null title or peers list means that field is left unchanged:  only the
 * presence of a field decides if it is sent, never its value (an empty peers list is still sent).
 */
public record LinkEditRequest(String title, List<InputPeer> peers, boolean revoke)
{
	public boolean isTitleChanged()
	{
		return (null != title);
	}

	public boolean isPeersChanged()
	{
		return (null != peers);
	}
}
