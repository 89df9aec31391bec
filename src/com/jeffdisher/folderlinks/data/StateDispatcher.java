package com.jeffdisher.folderlinks.data;

import java.util.LinkedList;
import java.util.Queue;
import java.util.function.Consumer;

import com.jeffdisher.folderlinks.utils.Assert;
import com.jeffdisher.folderlinks.utils.MiscHelpers;


/**
 * Hands state-change notifications off from the thread which committed the transaction to a single background thread,
 * which runs them one at a time in the order they were accepted.
 * The queue is unbounded since tasks are accepted while the store's write lock is held and a notified observer may
 * itself need a read transaction:  blocking the writer on a full queue would deadlock.
 */
public class StateDispatcher implements Consumer<Runnable>
{
	private final Thread _backgroundThread;
	private final Queue<Runnable> _tasks;
	private boolean _keepRunning;

	public StateDispatcher()
	{
		_backgroundThread = MiscHelpers.createThread(() -> _backgroundMain(), "StateDispatcher");
		_tasks = new LinkedList<>();
	}

	public void start()
	{
		synchronized (this)
		{
			_keepRunning = true;
		}
		_backgroundThread.start();
	}

	public void shutdown()
	{
		synchronized (this)
		{
			_keepRunning = false;
			this.notifyAll();
		}
		try
		{
			_backgroundThread.join();
		}
		catch (InterruptedException e)
		{
			// We don't expect the calling thread to be one which uses interrupts.
			throw Assert.unexpected(e);
		}
	}

	@Override
	public synchronized void accept(Runnable task)
	{
		Assert.assertTrue(null != task);
		// Tasks which arrive after shutdown are dropped:  nobody is listening anymore.
		if (_keepRunning)
		{
			_tasks.add(task);
			this.notifyAll();
		}
	}


	private void _backgroundMain()
	{
		Runnable toRun = _backgroundGetNextTask();
		while (null != toRun)
		{
			toRun.run();
			toRun = _backgroundGetNextTask();
		}
	}

	private synchronized Runnable _backgroundGetNextTask()
	{
		while (_keepRunning && _tasks.isEmpty())
		{
			try
			{
				this.wait();
			}
			catch (InterruptedException e)
			{
				// This thread doesn't use interruption.
				throw Assert.unexpected(e);
			}
		}
		// We drain what was already queued, even when shutting down, so tests are deterministic.
		return _tasks.poll();
	}
}
