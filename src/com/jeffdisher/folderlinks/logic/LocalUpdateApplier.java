package com.jeffdisher.folderlinks.logic;

import com.jeffdisher.folderlinks.data.IReadWriteFilterData;
import com.jeffdisher.folderlinks.data.LocalFilterStore;
import com.jeffdisher.folderlinks.projection.FiltersState;
import com.jeffdisher.folderlinks.remote.RemoteUpdate;
import com.jeffdisher.folderlinks.remote.RemoteUpdates;


/**
 * The default IRemoteUpdateSink:  applies the whole update stream to the LocalFilterStore, inline, in a single write
 * transaction.
 */
public class LocalUpdateApplier implements IRemoteUpdateSink
{
	private final LocalFilterStore _store;

	public LocalUpdateApplier(LocalFilterStore store)
	{
		_store = store;
	}

	@Override
	public void addUpdates(RemoteUpdates updates)
	{
		try (IReadWriteFilterData access = _store.openForWrite())
		{
			PeerHelpers.mergeRemotePeers(access, updates.remotePeers());
			for (RemoteUpdate update : updates.updates())
			{
				switch (update.kind())
				{
				case FOLDER_UPDATED:
					FiltersState filters = access.writableFilters();
					if (null != update.definition())
					{
						filters.upsertFilter(update.definition());
					}
					else
					{
						filters.removeFilter(update.folderId());
						filters.removePendingUpdates(update.folderId());
					}
					filters.mirrorFiltersAsRemote();
					break;
				case CHAT_JOINED:
					access.writablePeers().setChatListPresence(update.entityId(), true);
					break;
				case CHAT_LEFT:
					access.writablePeers().setChatListPresence(update.entityId(), false);
					break;
				}
			}
		}
	}
}
