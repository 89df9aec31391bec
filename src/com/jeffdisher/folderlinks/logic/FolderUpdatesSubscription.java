package com.jeffdisher.folderlinks.logic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.jeffdisher.folderlinks.data.FiltersSnapshot;
import com.jeffdisher.folderlinks.data.IReadOnlyFilterData;
import com.jeffdisher.folderlinks.data.IStateObserver;
import com.jeffdisher.folderlinks.data.LocalFilterStore;
import com.jeffdisher.folderlinks.projection.IPeerReading;
import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.FolderDefinition;
import com.jeffdisher.folderlinks.types.FolderUpdates;
import com.jeffdisher.folderlinks.types.PendingUpdateRecord;
import com.jeffdisher.folderlinks.types.Peer;


/**
 * A live view of the chats which can be joined into one shared folder.
 * Every change to the folder state is re-derived into a FolderUpdates (or null) but the listener is only told when
 * the derived value differs from the last one sent, under FolderUpdates equality.  A new subscription always sends
 * its first value.
 */
public class FolderUpdatesSubscription implements IStateObserver, AutoCloseable
{
	/**
	 * Derives the value for one folder from a snapshot of the folder state.
	 * 
	 * @param snapshot The folder state.
	 * @param peers The peer cache, used to resolve the missing chats.
	 * @param folderId The folder.
	 * @return The updates or null, if there is no record, no folder, the folder isn't shared, or no chat is missing.
	 */
	public static FolderUpdates derive(FiltersSnapshot snapshot, IPeerReading peers, int folderId)
	{
		PendingUpdateRecord record = snapshot.findUpdates(folderId);
		FolderDefinition folder = snapshot.findFilter(folderId);
		if ((null == record) || (null == folder) || !folder.isShared())
		{
			return null;
		}
		List<EntityId> missingIds = new ArrayList<>();
		for (EntityId id : record.missingEntityIds())
		{
			if (!folder.includes(id))
			{
				missingIds.add(id);
			}
		}
		if (missingIds.isEmpty())
		{
			return null;
		}
		// Chats which aren't in the peer cache can't be shown but they are still part of the value.
		List<Peer> missingPeers = new ArrayList<>();
		for (EntityId id : missingIds)
		{
			Peer peer = peers.getPeer(id);
			if (null != peer)
			{
				missingPeers.add(peer);
			}
		}
		return new FolderUpdates(folderId, folder.title(), missingIds, missingPeers, record.memberCounts());
	}


	private final LocalFilterStore _store;
	private final int _folderId;
	private final IFolderUpdatesListener _listener;

	// NOTE:  These are only touched on the store's dispatcher thread.
	private boolean _didSend;
	private FolderUpdates _lastSent;
	// Closing can come from any thread.
	private boolean _isClosed;

	public FolderUpdatesSubscription(LocalFilterStore store, int folderId, IFolderUpdatesListener listener)
	{
		_store = store;
		_folderId = folderId;
		_listener = listener;
	}

	public int getFolderId()
	{
		return _folderId;
	}

	@Override
	public boolean stateChanged(FiltersSnapshot snapshot)
	{
		if (_isClosed())
		{
			return false;
		}
		FolderUpdates derived;
		try (IReadOnlyFilterData access = _store.openForRead())
		{
			derived = derive(snapshot, access.readPeers(), _folderId);
		}
		if (!_didSend || !Objects.equals(_lastSent, derived))
		{
			_didSend = true;
			_lastSent = derived;
			boolean keep = _listener.updatesChanged(derived);
			if (!keep)
			{
				_markClosed();
			}
		}
		return !_isClosed();
	}

	/**
	 * Stops the subscription.  The listener may still receive a value which was already being delivered.
	 */
	@Override
	public void close()
	{
		_markClosed();
		_store.unregisterObserver(this);
	}


	private synchronized boolean _isClosed()
	{
		return _isClosed;
	}

	private synchronized void _markClosed()
	{
		_isClosed = true;
	}
}
