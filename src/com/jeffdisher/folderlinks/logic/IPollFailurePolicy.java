package com.jeffdisher.folderlinks.logic;

import com.jeffdisher.folderlinks.types.PendingUpdateRecord;
import com.jeffdisher.folderlinks.types.RemoteCallException;


/**
 * Decides what a failed update poll leaves behind in local state.  Poll failures are never reported to the caller.
 */
public interface IPollFailurePolicy
{
	/**
	 * The standard policy:  treat the failure as "nothing missing" and cache an empty record, so the folder isn't
	 * polled again until the refresh interval passes.  The real error is only visible in the verbose log.
	 * 
	 * @return The policy.
	 */
	public static IPollFailurePolicy absorbAndCacheEmpty()
	{
		return (int folderId, int timestamp, RemoteCallException error) -> PendingUpdateRecord.empty(folderId, timestamp);
	}

	/**
	 * @param folderId The folder which was polled.
	 * @param timestamp The current time, in Unix seconds.
	 * @param error The failure.
	 * @return The record to write for the folder or null to leave the local state unchanged.
	 */
	PendingUpdateRecord recordForFailure(int folderId, int timestamp, RemoteCallException error);
}
