package com.jeffdisher.folderlinks.projection;

import java.util.Map;

import com.jeffdisher.folderlinks.EnvVars;


/**
 * The tunables of the folder engine.  This is effectively a mutable struct, populated with defaults and then
 * optionally overridden from the environment.
 */
public class SyncPrefs
{
	// Pending updates are re-polled once per hour, per folder.
	public static final int DEFAULT_UPDATE_INTERVAL_SECONDS = 60 * 60;
	// Debug polling makes the interval short enough to watch updates arrive by hand.
	public static final int DEBUG_UPDATE_INTERVAL_SECONDS = 5;
	public static final long DEFAULT_JOIN_CONFIRMATION_TIMEOUT_MILLIS = 30_000L;
	public static final int DEFAULT_SCHEDULER_THREAD_COUNT = 2;


	public static SyncPrefs defaultPrefs()
	{
		SyncPrefs prefs = new SyncPrefs();
		prefs.updateIntervalSeconds = DEFAULT_UPDATE_INTERVAL_SECONDS;
		prefs.joinConfirmationTimeoutMillis = DEFAULT_JOIN_CONFIRMATION_TIMEOUT_MILLIS;
		prefs.schedulerThreadCount = DEFAULT_SCHEDULER_THREAD_COUNT;
		prefs.verbose = false;
		return prefs;
	}

	/**
	 * Builds the prefs from defaults, overridden by whichever of the EnvVars are set in the given environment.
	 * Values which can't be parsed are ignored.
	 * 
	 * @param environment The environment (typically System.getenv()).
	 * @return The new prefs object.
	 */
	public static SyncPrefs fromEnvironment(Map<String, String> environment)
	{
		SyncPrefs prefs = defaultPrefs();
		if (environment.containsKey(EnvVars.ENV_VAR_FOLDER_LINKS_DEBUG_POLLING))
		{
			prefs.updateIntervalSeconds = DEBUG_UPDATE_INTERVAL_SECONDS;
		}
		if (environment.containsKey(EnvVars.ENV_VAR_FOLDER_LINKS_VERBOSE))
		{
			prefs.verbose = true;
		}
		prefs.joinConfirmationTimeoutMillis = _parseLong(environment.get(EnvVars.ENV_VAR_FOLDER_LINKS_JOIN_TIMEOUT_MILLIS), prefs.joinConfirmationTimeoutMillis);
		prefs.schedulerThreadCount = (int)_parseLong(environment.get(EnvVars.ENV_VAR_FOLDER_LINKS_SCHEDULER_THREADS), prefs.schedulerThreadCount);
		return prefs;
	}


	// These are exposed just as public fields since this is effectively a mutable struct.
	/**
	 * How old a pending update record must be, in seconds, before a poll of an already-observed folder goes to the
	 * server again.
	 */
	public int updateIntervalSeconds;

	/**
	 * How long a join waits for the joined folder to appear in local state before giving up.
	 */
	public long joinConfirmationTimeoutMillis;

	/**
	 * The number of threads used to run remote calls.
	 */
	public int schedulerThreadCount;

	/**
	 * True if verbose log lines should be written.
	 */
	public boolean verbose;


	private static long _parseLong(String value, long defaultValue)
	{
		long parsed = defaultValue;
		if (null != value)
		{
			try
			{
				long candidate = Long.parseLong(value.trim());
				if (candidate > 0L)
				{
					parsed = candidate;
				}
			}
			catch (NumberFormatException e)
			{
				// Fall back to the default.
				parsed = defaultValue;
			}
		}
		return parsed;
	}
}
