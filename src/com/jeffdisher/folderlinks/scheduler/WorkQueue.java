package com.jeffdisher.folderlinks.scheduler;

import java.util.LinkedList;
import java.util.Queue;

import com.jeffdisher.folderlinks.types.RemoteCallException;
import com.jeffdisher.folderlinks.utils.Assert;


/**
 * An unbounded queue of work shared by the threads of a MultiThreadedScheduler.
 */
public class WorkQueue
{
	public static RemoteCallException createShutdownError()
	{
		return new RemoteCallException(RemoteCallException.TRANSPORT_FAILURE);
	}


	private final Queue<Runnable> _queue = new LinkedList<>();
	private boolean _running = true;

	/**
	 * Blocks until there is work to do or the queue is shut down.  Work enqueued before the shutdown is still handed
	 * out, so every accepted runnable runs.
	 * 
	 * @return The next runnable or null, if the queue was shut down and is now empty.
	 */
	public synchronized Runnable pollForNext()
	{
		while (_running && _queue.isEmpty())
		{
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// We don't use interruption.
				throw Assert.unexpected(e);
			}
		}
		return _queue.poll();
	}

	/**
	 * @param r The work to enqueue.
	 * @return False if the queue was already shut down, meaning the runnable was dropped.
	 */
	public synchronized boolean enqueue(Runnable r)
	{
		if (_running)
		{
			_queue.add(r);
			this.notify();
		}
		return _running;
	}

	public synchronized void shutdown()
	{
		_running = false;
		this.notifyAll();
	}
}
