package com.jeffdisher.folderlinks.logic;

import com.jeffdisher.folderlinks.remote.RemoteUpdates;


/**
 * Where the update streams returned by membership-changing calls are sent to be applied to local state.
 * An implementation may apply them inline or later, on another thread, which is why callers which need to see the
 * result wait on the store's change feed instead of assuming it is applied on return.
 */
public interface IRemoteUpdateSink
{
	void addUpdates(RemoteUpdates updates);
}
