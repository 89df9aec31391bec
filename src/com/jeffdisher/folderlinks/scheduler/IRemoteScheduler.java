package com.jeffdisher.folderlinks.scheduler;


/**
 * The interface for scheduling remote folder-invite calls.
 * The design behind this is to allow asynchronous operation scheduling, returning futures instead of blocking.
 * An implementation may be inline, on a background thread, or some other kind of asynchronous executor or thread pool.
 */
public interface IRemoteScheduler
{
	/**
	 * Schedules a call against the remote service.
	 * 
	 * @param <R> The response type.
	 * @param call The call to run (note that the caller cannot assume what thread will run this).
	 * @return The asynchronously-completed future.
	 */
	<R> FutureRemote<R> schedule(IRemoteCall<R> call);

	/**
	 * Stops accepting new calls.  Calls scheduled after this will fail with a transport error.
	 */
	void shutdown();
}
