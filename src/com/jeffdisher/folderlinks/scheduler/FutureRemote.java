package com.jeffdisher.folderlinks.scheduler;

import com.jeffdisher.folderlinks.types.OperationCancelledException;
import com.jeffdisher.folderlinks.types.RemoteCallException;
import com.jeffdisher.folderlinks.utils.Assert;


/**
 * The asynchronously-returned result of a remote folder-invite call.
 * Note that a successful result can be null (for calls with nothing to return) so completion is tracked separately.
 * 
 * @param <R> The response type.
 */
public class FutureRemote<R>
{
	private boolean _isComplete;
	private R _result;
	private RemoteCallException _exception;

	/**
	 * Blocks for the asynchronous operation to complete, with no way to cancel the wait.
	 * 
	 * @return The response (can be null).
	 * @throws RemoteCallException The failure reported by the service.
	 */
	public R get() throws RemoteCallException
	{
		try
		{
			return get(new CancellationToken());
		}
		catch (OperationCancelledException e)
		{
			// Nobody else has this token.
			throw Assert.unexpected(e);
		}
	}

	/**
	 * Blocks for the asynchronous operation to complete or for the token to be cancelled.  If both have happened, the
	 * result is returned.
	 * Note that cancelling only stops the wait:  the remote call, itself, still runs to completion.
	 * 
	 * @param token The token the caller can use to abandon the wait.
	 * @return The response (can be null).
	 * @throws RemoteCallException The failure reported by the service.
	 * @throws OperationCancelledException The token was cancelled before the call completed.
	 */
	public R get(CancellationToken token) throws RemoteCallException, OperationCancelledException
	{
		Runnable onCancel = () -> _wake();
		boolean didRegister = token.registerOnCancel(onCancel);
		try
		{
			return _waitForResult(token);
		}
		finally
		{
			if (didRegister)
			{
				token.unregisterOnCancel(onCancel);
			}
		}
	}

	/**
	 * Called to set the response on success.
	 * 
	 * @param result The response (can be null).
	 */
	public synchronized void success(R result)
	{
		Assert.assertTrue(!_isComplete);
		_result = result;
		_isComplete = true;
		this.notifyAll();
	}

	/**
	 * Called to set the exception which caused the failure.
	 * 
	 * @param exception The exception to throw.
	 */
	public synchronized void failure(RemoteCallException exception)
	{
		Assert.assertTrue(!_isComplete);
		Assert.assertTrue(null != exception);
		_exception = exception;
		_isComplete = true;
		this.notifyAll();
	}

	public synchronized boolean isComplete()
	{
		return _isComplete;
	}


	private synchronized R _waitForResult(CancellationToken token) throws RemoteCallException, OperationCancelledException
	{
		while (!_isComplete && !token.isCancelled())
		{
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption in this system:  cancellation goes through the token.
				throw Assert.unexpected(e);
			}
		}
		if (!_isComplete)
		{
			throw new OperationCancelledException();
		}
		if (null != _exception)
		{
			throw _exception;
		}
		return _result;
	}

	private synchronized void _wake()
	{
		this.notifyAll();
	}
}
