package com.jeffdisher.folderlinks.logic;

import com.jeffdisher.folderlinks.types.FolderUpdates;


/**
 * Receives the values of a FolderUpdatesSubscription.
 * Calls are made on the store's dispatcher thread, one at a time.
 */
public interface IFolderUpdatesListener
{
	/**
	 * Called with the current value when subscribing and then whenever it changes.
	 * 
	 * @param updates The chats available to join or null, if there are none.
	 * @return True to keep listening or false to close the subscription.
	 */
	boolean updatesChanged(FolderUpdates updates);
}
