package com.jeffdisher.folderlinks.data;


/**
 * Observes the folder state of a LocalFilterStore.
 * Calls are made via the store's dispatcher, one at a time and in commit order.
 */
public interface IStateObserver
{
	/**
	 * Called with the current state when the observer is registered and then after every write transaction which
	 * changed the folder state.
	 * 
	 * @param snapshot The state as of the end of the transaction.
	 * @return True to stay registered or false to unregister the observer.
	 */
	boolean stateChanged(FiltersSnapshot snapshot);
}
