package com.jeffdisher.folderlinks.logic;

import com.jeffdisher.folderlinks.data.FiltersSnapshot;
import com.jeffdisher.folderlinks.data.IStateObserver;
import com.jeffdisher.folderlinks.scheduler.CancellationToken;
import com.jeffdisher.folderlinks.types.OperationCancelledException;
import com.jeffdisher.folderlinks.utils.Assert;


/**
 * Observes the store's change feed until a given folder appears in the local folder list.
 * This is how a join bridges the gap between the server accepting it and the local state reflecting it.
 */
public class FolderVisibilityWaiter implements IStateObserver
{
	private final int _folderId;
	private boolean _isVisible;

	public FolderVisibilityWaiter(int folderId)
	{
		_folderId = folderId;
	}

	@Override
	public synchronized boolean stateChanged(FiltersSnapshot snapshot)
	{
		if (null != snapshot.findFilter(_folderId))
		{
			_isVisible = true;
			this.notifyAll();
		}
		// Once we have seen it, we don't need any more snapshots.
		return !_isVisible;
	}

	/**
	 * Blocks until the folder is visible, the token is cancelled, or the timeout expires.
	 * 
	 * @param token Used to abandon the wait.
	 * @param timeoutMillis The longest time to wait (must be positive).
	 * @return True if the folder became visible, false if the timeout expired first.
	 * @throws OperationCancelledException The token was cancelled before the folder became visible.
	 */
	public boolean await(CancellationToken token, long timeoutMillis) throws OperationCancelledException
	{
		Assert.assertTrue(timeoutMillis > 0L);
		Runnable onCancel = () -> _wake();
		boolean didRegister = token.registerOnCancel(onCancel);
		try
		{
			return _waitForVisible(token, timeoutMillis);
		}
		finally
		{
			if (didRegister)
			{
				token.unregisterOnCancel(onCancel);
			}
		}
	}


	private synchronized boolean _waitForVisible(CancellationToken token, long timeoutMillis) throws OperationCancelledException
	{
		long deadlineNanos = System.nanoTime() + (timeoutMillis * 1_000_000L);
		long remainingMillis = timeoutMillis;
		while (!_isVisible && !token.isCancelled() && (remainingMillis > 0L))
		{
			try
			{
				this.wait(remainingMillis);
			}
			catch (InterruptedException e)
			{
				// We don't use interruption in this system:  cancellation goes through the token.
				throw Assert.unexpected(e);
			}
			remainingMillis = (deadlineNanos - System.nanoTime()) / 1_000_000L;
		}
		if (!_isVisible && token.isCancelled())
		{
			throw new OperationCancelledException();
		}
		return _isVisible;
	}

	private synchronized void _wake()
	{
		this.notifyAll();
	}
}
