package com.jeffdisher.folderlinks.logic;

import java.util.HashSet;
import java.util.Set;


/**
 * Remembers which (account, folder) pairs have been polled for updates at least once.  The first poll of a folder is
 * never rate-limited.
 * This is owned by the FolderUpdatesPoller which created it (or was given it) and lives exactly as long as that
 * poller:  nothing is persisted, so a new engine always polls each folder once on first contact.
 */
public class FirstObservationCache
{
	private final Set<Key> _observed = new HashSet<>();

	/**
	 * Records that the folder was observed.
	 * 
	 * @param accountId The account.
	 * @param folderId The folder.
	 * @return True if this was the first observation of this folder for this account.
	 */
	public synchronized boolean markObserved(int accountId, int folderId)
	{
		return _observed.add(new Key(accountId, folderId));
	}

	/**
	 * @param accountId The account.
	 * @param folderId The folder.
	 * @return True if the folder was observed at least once.
	 */
	public synchronized boolean wasObserved(int accountId, int folderId)
	{
		return _observed.contains(new Key(accountId, folderId));
	}


	private static record Key(int accountId, int folderId)
	{
	}
}
