package com.jeffdisher.folderlinks.scheduler;

import java.util.ArrayList;
import java.util.List;


/**
 * Passed through every blocking point of an engine operation so that a caller which abandons the operation (a
 * dismissed screen, for example) can wake it up and make it release whatever it was waiting on.
 * A token can only be cancelled once and can't be reset.
 */
public class CancellationToken
{
	private boolean _isCancelled;
	private final List<Runnable> _onCancel = new ArrayList<>();

	/**
	 * Cancels the token, running every registered callback on the calling thread.  Does nothing if already cancelled.
	 */
	public void cancel()
	{
		List<Runnable> toRun;
		synchronized (this)
		{
			if (_isCancelled)
			{
				return;
			}
			_isCancelled = true;
			toRun = new ArrayList<>(_onCancel);
			_onCancel.clear();
		}
		// We run these outside of our monitor since they typically need to acquire the waiter's monitor.
		for (Runnable callback : toRun)
		{
			callback.run();
		}
	}

	public synchronized boolean isCancelled()
	{
		return _isCancelled;
	}

	/**
	 * Registers a callback to run when the token is cancelled.
	 * 
	 * @param callback The callback.
	 * @return False if the token was already cancelled, in which case the callback was NOT registered.
	 */
	public synchronized boolean registerOnCancel(Runnable callback)
	{
		if (!_isCancelled)
		{
			_onCancel.add(callback);
		}
		return !_isCancelled;
	}

	/**
	 * Removes a callback previously registered (matched by identity).  Does nothing if it isn't registered.
	 * 
	 * @param callback The callback to remove.
	 */
	public synchronized void unregisterOnCancel(Runnable callback)
	{
		_onCancel.removeIf((Runnable existing) -> (existing == callback));
	}
}
