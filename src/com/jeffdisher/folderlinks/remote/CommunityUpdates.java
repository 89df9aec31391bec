package com.jeffdisher.folderlinks.remote;

import java.util.List;

import com.jeffdisher.folderlinks.types.EntityId;


/**
 * The response to polling a shared folder for chats which are missing locally.
 */
public record CommunityUpdates(List<EntityId> missingPeers, List<RemotePeer> remotePeers)
{
}
