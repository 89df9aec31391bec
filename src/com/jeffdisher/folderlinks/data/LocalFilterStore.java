package com.jeffdisher.folderlinks.data;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

import com.jeffdisher.folderlinks.projection.FiltersState;
import com.jeffdisher.folderlinks.projection.PeerCache;
import com.jeffdisher.folderlinks.utils.Assert;


/**
 * The local transactional store of an account's folders, their pending updates, and the peer caches they reference.
 * Interactions are done using explicitly read-only or read-write transactions:  any number of readers or a single
 * writer.
 * Every write transaction which touched the folder state publishes a FiltersSnapshot to the registered observers,
 * through the dispatcher.  The snapshot is handed to the dispatcher before the write lock is released, so observers
 * see snapshots in commit order.
 */
public class LocalFilterStore
{
	/**
	 * Creates an empty store.
	 * 
	 * @param dispatcher Runs the observer notifications.  Must serialize all runnables it is given.
	 * @return The new store.
	 */
	public static LocalFilterStore createEmpty(Consumer<Runnable> dispatcher)
	{
		return new LocalFilterStore(dispatcher, FiltersState.createEmpty(), new PeerCache());
	}


	private final Consumer<Runnable> _dispatcher;
	private final FiltersState _filters;
	private final PeerCache _peers;
	private final ReadWriteLock _readWriteLock;

	// NOTE:  We only interact with these in the dispatcher's thread!
	private final List<IStateObserver> _observers;
	private FiltersSnapshot _lastDispatched;

	private LocalFilterStore(Consumer<Runnable> dispatcher, FiltersState filters, PeerCache peers)
	{
		_dispatcher = dispatcher;
		_filters = filters;
		_peers = peers;
		_readWriteLock = new ReentrantReadWriteLock();
		_observers = new ArrayList<>();
		_lastDispatched = FiltersSnapshot.of(filters);
	}

	/**
	 * Opens a read-only transaction.  This will access a shared read lock so no write transaction can begin before
	 * this is closed.
	 * 
	 * @return The interface for issuing read-only operations against the store.
	 */
	public IReadOnlyFilterData openForRead()
	{
		Lock lock = _readWriteLock.readLock();
		lock.lock();
		return LoadedStorage.openReadOnly(() -> lock.unlock(), _filters, _peers);
	}

	/**
	 * Opens a read-write transaction.  This will access an exclusive write lock so no other transaction can begin
	 * before this is closed.
	 * 
	 * @return The interface for issuing read-write operations against the store.
	 */
	public IReadWriteFilterData openForWrite()
	{
		Lock lock = _readWriteLock.writeLock();
		lock.lock();
		return LoadedStorage.openReadWrite((boolean didChangeFilters) -> {
			if (didChangeFilters)
			{
				FiltersSnapshot snapshot = FiltersSnapshot.of(_filters);
				_dispatcher.accept(() -> _dispatchSnapshot(snapshot));
			}
			lock.unlock();
		}, _filters, _peers);
	}

	/**
	 * Adds an observer.  It will immediately be sent the current state (via the dispatcher) and then every later
	 * change.  The observer MUST NOT already be registered.
	 * 
	 * @param observer The observer to add.
	 */
	public void registerObserver(IStateObserver observer)
	{
		_dispatcher.accept(() -> {
			Assert.assertTrue(!_containsObserver(observer));
			boolean keep = observer.stateChanged(_lastDispatched);
			if (keep)
			{
				_observers.add(observer);
			}
		});
	}

	/**
	 * Removes an observer.  It is not an error if it was already removed (observers can remove themselves by
	 * returning false).
	 * 
	 * @param observer The observer to remove.
	 */
	public void unregisterObserver(IStateObserver observer)
	{
		_dispatcher.accept(() -> {
			_observers.removeIf((IStateObserver existing) -> (existing == observer));
		});
	}


	private void _dispatchSnapshot(FiltersSnapshot snapshot)
	{
		_lastDispatched = snapshot;
		Iterator<IStateObserver> iter = _observers.iterator();
		while (iter.hasNext())
		{
			IStateObserver observer = iter.next();
			boolean keep = observer.stateChanged(snapshot);
			if (!keep)
			{
				iter.remove();
			}
		}
	}

	private boolean _containsObserver(IStateObserver observer)
	{
		boolean found = false;
		for (IStateObserver existing : _observers)
		{
			if (existing == observer)
			{
				found = true;
				break;
			}
		}
		return found;
	}
}
