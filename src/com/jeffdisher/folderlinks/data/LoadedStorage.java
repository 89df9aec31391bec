package com.jeffdisher.folderlinks.data;

import com.jeffdisher.folderlinks.projection.FiltersState;
import com.jeffdisher.folderlinks.projection.IFiltersReading;
import com.jeffdisher.folderlinks.projection.IPeerReading;
import com.jeffdisher.folderlinks.projection.PeerCache;
import com.jeffdisher.folderlinks.utils.Assert;


/**
 * Implements the read and write transactions of the LocalFilterStore.
 * While this is basically just a container which knows how to report its changes on close, it also does ensure that
 * there is no access attempts made after it is closed.
 */
public class LoadedStorage implements IReadWriteFilterData
{
	public static IReadOnlyFilterData openReadOnly(UnlockRead readLock, FiltersState filters, PeerCache peers)
	{
		return new LoadedStorage(readLock, null, filters, peers);
	}

	public static IReadWriteFilterData openReadWrite(UnlockWrite writeLock, FiltersState filters, PeerCache peers)
	{
		return new LoadedStorage(null, writeLock, filters, peers);
	}


	private final UnlockRead _readLock;
	private final UnlockWrite _writeLock;
	private final FiltersState _filters;
	private final PeerCache _peers;
	private boolean _isOpen;
	private boolean _changed_filters;

	private LoadedStorage(UnlockRead readLock, UnlockWrite writeLock, FiltersState filters, PeerCache peers)
	{
		_readLock = readLock;
		_writeLock = writeLock;
		_filters = filters;
		_peers = peers;
		_isOpen = true;
	}

	@Override
	public IFiltersReading readFilters()
	{
		Assert.assertTrue(_isOpen);
		return _filters;
	}

	@Override
	public IPeerReading readPeers()
	{
		Assert.assertTrue(_isOpen);
		return _peers;
	}

	@Override
	public FiltersState writableFilters()
	{
		Assert.assertTrue(_isOpen);
		Assert.assertTrue(null != _writeLock);
		_changed_filters = true;
		return _filters;
	}

	@Override
	public PeerCache writablePeers()
	{
		Assert.assertTrue(_isOpen);
		Assert.assertTrue(null != _writeLock);
		return _peers;
	}

	@Override
	public void close()
	{
		Assert.assertTrue(_isOpen);
		if (null != _writeLock)
		{
			_writeLock.closeWrite(_changed_filters);
		}
		else
		{
			_readLock.closeRead();
		}
		_isOpen = false;
	}


	/**
	 * Implemented by a read-only caller to be notified when the storage is closed.
	 */
	public interface UnlockRead
	{
		void closeRead();
	}

	/**
	 * Implemented by a read-write caller to be notified when the storage is closed.
	 */
	public interface UnlockWrite
	{
		/**
		 * @param didChangeFilters True if the folder state was opened for writing during the transaction.
		 */
		void closeWrite(boolean didChangeFilters);
	}
}
