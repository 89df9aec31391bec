package com.jeffdisher.folderlinks.scheduler;

import com.jeffdisher.folderlinks.remote.IFolderInviteService;
import com.jeffdisher.folderlinks.types.RemoteCallException;
import com.jeffdisher.folderlinks.utils.Assert;
import com.jeffdisher.folderlinks.utils.MiscHelpers;


/**
 * An implementation of IRemoteScheduler which runs all calls on a set of background threads, via a work queue.
 * It relies on being explicitly shut down in order to stop running.
 */
public class MultiThreadedScheduler implements IRemoteScheduler
{
	private final IFolderInviteService _service;
	private final WorkQueue _queue;
	private final Thread[] _threads;

	public MultiThreadedScheduler(IFolderInviteService service, int threadCount)
	{
		Assert.assertTrue(threadCount > 0);
		_service = service;
		_queue = new WorkQueue();
		_threads = new Thread[threadCount];
		for (int i = 0; i < threadCount; ++i)
		{
			_threads[i] = MiscHelpers.createThread(() -> {
				boolean keepRunning = true;
				while (keepRunning)
				{
					Runnable run = _queue.pollForNext();
					if (null != run)
					{
						run.run();
					}
					else
					{
						keepRunning = false;
					}
				}
			}, "Remote scheduler thread #" + i);
			_threads[i].start();
		}
	}

	@Override
	public <R> FutureRemote<R> schedule(IRemoteCall<R> call)
	{
		FutureRemote<R> future = new FutureRemote<>();
		Runnable r = () -> {
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
				// A broken transport shouldn't leave the caller waiting forever.
				future.failure(new RemoteCallException(RemoteCallException.TRANSPORT_FAILURE, e));
			}
		};
		boolean didEnqueue = _queue.enqueue(r);
		if (!didEnqueue)
		{
			future.failure(WorkQueue.createShutdownError());
		}
		return future;
	}

	@Override
	public void shutdown()
	{
		_queue.shutdown();
		for (Thread thread : _threads)
		{
			try
			{
				thread.join();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
	}
}
