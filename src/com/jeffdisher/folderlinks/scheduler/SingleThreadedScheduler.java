package com.jeffdisher.folderlinks.scheduler;

import com.jeffdisher.folderlinks.remote.IFolderInviteService;
import com.jeffdisher.folderlinks.types.RemoteCallException;


/**
 * An implementation of IRemoteScheduler which runs all calls inline, before returning the future.
 * This is mostly meant for tests and tools, where deterministic ordering matters more than latency.
 */
public class SingleThreadedScheduler implements IRemoteScheduler
{
	private final IFolderInviteService _service;
	private boolean _isShutdown;

	public SingleThreadedScheduler(IFolderInviteService service)
	{
		_service = service;
	}

	@Override
	public <R> FutureRemote<R> schedule(IRemoteCall<R> call)
	{
		FutureRemote<R> future = new FutureRemote<>();
		if (_isShutdown)
		{
			future.failure(WorkQueue.createShutdownError());
		}
		else
		{
			try
			{
				future.success(call.run(_service));
			}
			catch (RemoteCallException e)
			{
				future.failure(e);
			}
			catch (RuntimeException e)
			{
				// Unchecked failures from the transport are reported as transport failures.
				future.failure(new RemoteCallException(RemoteCallException.TRANSPORT_FAILURE, e));
			}
		}
		return future;
	}

	@Override
	public void shutdown()
	{
		_isShutdown = true;
	}
}
