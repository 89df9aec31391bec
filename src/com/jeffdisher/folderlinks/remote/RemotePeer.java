package com.jeffdisher.folderlinks.remote;

import com.jeffdisher.folderlinks.types.Peer;


/**
 * A peer object which accompanies a remote response.
 * 
 * @param peer The peer, to be merged into the local peer cache.
 * @param participantsCount The number of participants, only reported for channels (null if not reported).
 * @param presenceTimestamp The last-seen time for users, in Unix seconds (null if this isn't a user or it is hidden).
 */
public record RemotePeer(Peer peer, Integer participantsCount, Integer presenceTimestamp)
{
}
