package com.jeffdisher.folderlinks.remote;

import java.util.List;

import com.jeffdisher.folderlinks.types.SharedLinkInfo;


/**
 * All the links exported for one folder, with the peers they reference.
 */
public record ExportedInvites(List<SharedLinkInfo> invites, List<RemotePeer> peers)
{
}
