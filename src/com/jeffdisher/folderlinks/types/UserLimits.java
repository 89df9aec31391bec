package com.jeffdisher.folderlinks.types;


/**
 * Both tiers of limits, as resolved from a single app configuration snapshot, along with which tier the caller is in.
 */
public record UserLimits(LimitsTable standard, LimitsTable premium, boolean isPremiumCaller)
{
	/**
	 * @return The table which applies to the caller right now.
	 */
	public LimitsTable callerLimits()
	{
		return isPremiumCaller
				? premium
				: standard
		;
	}
}
