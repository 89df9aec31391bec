package com.jeffdisher.folderlinks.remote;

import java.util.List;


/**
 * The update stream returned by join, join-updates, and leave calls.
 */
public record RemoteUpdates(List<RemoteUpdate> updates, List<RemotePeer> remotePeers)
{
}
