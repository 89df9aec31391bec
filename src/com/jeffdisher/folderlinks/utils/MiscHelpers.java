package com.jeffdisher.folderlinks.utils;


/**
 * Basic utilities for miscellaneous uses.
 */
public class MiscHelpers
{
	/**
	 * Creates a daemon thread with the given name, not yet started.
	 * 
	 * @param runner The main body of the thread.
	 * @param name The name to give the thread (shows up in stack dumps).
	 * @return The new thread.
	 */
	public static Thread createThread(Runnable runner, String name)
	{
		Thread thread = new Thread(runner, name);
		thread.setDaemon(true);
		return thread;
	}

	/**
	 * @param millis Milliseconds since the Unix Epoch.
	 * @return The same instant as whole seconds, truncated into the 32-bit timestamp the folder state stores.
	 */
	public static int unixSeconds(long millis)
	{
		return (int)(millis / 1000L);
	}
}
