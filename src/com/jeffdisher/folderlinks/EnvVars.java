package com.jeffdisher.folderlinks;


/**
 * Just contains the environment variables the engine checks (see SyncPrefs.fromEnvironment()).
 */
public class EnvVars
{
	/**
	 * If set, already-observed folders are re-polled after a few seconds instead of an hour.
	 */
	public static final String ENV_VAR_FOLDER_LINKS_DEBUG_POLLING = "FOLDER_LINKS_DEBUG_POLLING";

	/**
	 * Enables verbose logging.  If not set, verbose logs will not be written.
	 */
	public static final String ENV_VAR_FOLDER_LINKS_VERBOSE = "FOLDER_LINKS_VERBOSE";

	/**
	 * The number of milliseconds a join will wait for the joined folder to become visible locally.
	 */
	public static final String ENV_VAR_FOLDER_LINKS_JOIN_TIMEOUT_MILLIS = "FOLDER_LINKS_JOIN_TIMEOUT_MILLIS";

	/**
	 * The number of background threads used for remote calls.
	 */
	public static final String ENV_VAR_FOLDER_LINKS_SCHEDULER_THREADS = "FOLDER_LINKS_SCHEDULER_THREADS";
}
