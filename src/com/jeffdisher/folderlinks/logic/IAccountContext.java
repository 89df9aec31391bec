package com.jeffdisher.folderlinks.logic;

import com.eclipsesource.json.JsonObject;


/**
 * The read-only facts about the account which the engine needs but does not own:  its identity, its premium status,
 * the cached app configuration, and the clock.
 * The expectation is that a single instance will be created per account and passed through the engine.
 */
public interface IAccountContext
{
	/**
	 * @return The identifier of the local account record.
	 */
	int getAccountId();

	/**
	 * @return True if the account currently has premium status.
	 */
	boolean isPremium();

	/**
	 * @return The most recently cached app configuration (never null, but possibly empty).
	 */
	JsonObject currentAppConfiguration();

	/**
	 * @return Milliseconds since the Unix Epoch.
	 */
	long currentTimeMillis();
}
