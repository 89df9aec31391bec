package com.jeffdisher.folderlinks.logic;

import java.util.List;

import com.jeffdisher.folderlinks.data.IReadOnlyFilterData;
import com.jeffdisher.folderlinks.data.IReadWriteFilterData;
import com.jeffdisher.folderlinks.data.LocalFilterStore;
import com.jeffdisher.folderlinks.projection.SyncPrefs;
import com.jeffdisher.folderlinks.remote.CommunityUpdates;
import com.jeffdisher.folderlinks.remote.RemoteUpdates;
import com.jeffdisher.folderlinks.scheduler.CancellationToken;
import com.jeffdisher.folderlinks.scheduler.IRemoteScheduler;
import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.FolderOperationException;
import com.jeffdisher.folderlinks.types.FolderUpdates;
import com.jeffdisher.folderlinks.types.InputPeer;
import com.jeffdisher.folderlinks.types.OperationCancelledException;
import com.jeffdisher.folderlinks.types.PendingUpdateRecord;
import com.jeffdisher.folderlinks.types.QuotaExceededException;
import com.jeffdisher.folderlinks.types.RemoteCallException;
import com.jeffdisher.folderlinks.utils.MiscHelpers;


/**
 * Keeps the pending update records of shared folders current and exposes the operations to act on them.
 * Per folder, a poll goes to the server if this is the first time the folder was seen by this poller or if the cached
 * record is older than the refresh interval.  Otherwise, it does nothing.
 */
public class FolderUpdatesPoller
{
	private final ILogger _logger;
	private final IAccountContext _account;
	private final LocalFilterStore _store;
	private final IRemoteScheduler _scheduler;
	private final IRemoteUpdateSink _updateSink;
	private final SyncPrefs _prefs;
	private final FirstObservationCache _firstObservations;
	private final IPollFailurePolicy _failurePolicy;

	public FolderUpdatesPoller(ILogger logger
			, IAccountContext account
			, LocalFilterStore store
			, IRemoteScheduler scheduler
			, IRemoteUpdateSink updateSink
			, SyncPrefs prefs
			, FirstObservationCache firstObservations
			, IPollFailurePolicy failurePolicy
	)
	{
		_logger = logger;
		_account = account;
		_store = store;
		_scheduler = scheduler;
		_updateSink = updateSink;
		_prefs = prefs;
		_firstObservations = firstObservations;
		_failurePolicy = failurePolicy;
	}

	/**
	 * Polls the folder for chats which are missing locally, if the folder is due.
	 * Remote failures are never reported:  they are handed to the failure policy instead.
	 * 
	 * @param folderId The shared folder to poll.
	 * @param token Used to abandon the wait.
	 * @return True if a remote call was made, false if the cached record was still fresh.
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public boolean pollOnce(int folderId, CancellationToken token) throws OperationCancelledException
	{
		int now = MiscHelpers.unixSeconds(_account.currentTimeMillis());
		PendingUpdateRecord current;
		try (IReadOnlyFilterData access = _store.openForRead())
		{
			current = access.readFilters().getPendingUpdates(folderId);
		}
		boolean isFirst = _firstObservations.markObserved(_account.getAccountId(), folderId);
		if (!isFirst && (null != current) && ((current.timestamp() + _prefs.updateIntervalSeconds) >= now))
		{
			return false;
		}
		
		ILogger log = _logger.logStart("Polling updates of folder " + folderId + (isFirst ? " (first contact)" : ""));
		CommunityUpdates result = null;
		RemoteCallException error = null;
		try
		{
			result = _scheduler.schedule((service) -> service.getUpdates(folderId)).get(token);
			if (null == result)
			{
				// An empty response goes through the failure policy, like any other failed poll.
				throw new RemoteCallException(RemoteCallException.TRANSPORT_FAILURE);
			}
		}
		catch (RemoteCallException e)
		{
			error = e;
		}
		int completed = MiscHelpers.unixSeconds(_account.currentTimeMillis());
		
		if (null != result)
		{
			PendingUpdateRecord record = new PendingUpdateRecord(folderId, completed, result.missingPeers(), PeerHelpers.memberCountsOf(result.remotePeers()));
			try (IReadWriteFilterData access = _store.openForWrite())
			{
				PeerHelpers.mergeRemotePeers(access, result.remotePeers());
				access.writableFilters().replacePendingUpdates(record);
			}
			log.logFinish(result.missingPeers().size() + " chats missing");
		}
		else
		{
			log.logVerbose("Remote error: " + error.getErrorCode());
			PendingUpdateRecord record = _failurePolicy.recordForFailure(folderId, completed, error);
			if (null != record)
			{
				try (IReadWriteFilterData access = _store.openForWrite())
				{
					access.writableFilters().replacePendingUpdates(record);
				}
			}
			log.logFinish("Poll failed" + ((null != record) ? ", cached " + record.missingEntityIds().size() + " missing" : ""));
		}
		return true;
	}

	/**
	 * Subscribes to the chats which can be joined into the folder.  The listener immediately receives the current
	 * value (possibly null) and then every distinct change.
	 * 
	 * @param folderId The shared folder.
	 * @param listener The listener.
	 * @return The subscription, which must be closed to stop listening.
	 */
	public FolderUpdatesSubscription subscribe(int folderId, IFolderUpdatesListener listener)
	{
		FolderUpdatesSubscription subscription = new FolderUpdatesSubscription(_store, folderId, listener);
		_store.registerObserver(subscription);
		return subscription;
	}

	/**
	 * Joins some of the available chats into the folder.
	 * 
	 * @param updates The updates being acted on.
	 * @param entityIds The chats to join (normally a subset of the missing chats).
	 * @param token Used to abandon the wait.
	 * @throws QuotaExceededException The account hit a channel, folder, or shared folder quota.
	 * @throws FolderOperationException Any other failure.
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public void acceptAvailable(FolderUpdates updates, List<EntityId> entityIds, CancellationToken token) throws QuotaExceededException, FolderOperationException, OperationCancelledException
	{
		int folderId = updates.getFolderId();
		ILogger log = _logger.logStart("Joining " + entityIds.size() + " of " + updates.availableChatsToJoin() + " available chats into folder " + folderId);
		List<InputPeer> inputPeers = _resolve(entityIds);
		RemoteUpdates result;
		try
		{
			result = _scheduler.schedule((service) -> service.joinUpdates(folderId, inputPeers)).get(token);
		}
		catch (RemoteCallException e)
		{
			log.logVerbose("Remote error: " + e.getErrorCode());
			log.logFinish("Join failed");
			QuotaExceededException quota = QuotaErrors.quotaErrorForJoin(e, _account);
			if (null != quota)
			{
				throw quota;
			}
			throw new FolderOperationException("acceptAvailable");
		}
		_updateSink.addUpdates(result);
		log.logFinish("Joined");
	}

	/**
	 * Hides the pending updates of the folder.  The local record is removed first, unconditionally, and then the
	 * server is told.  A failure to tell the server is ignored since the local dismissal is what counts.
	 * 
	 * @param folderId The folder.
	 */
	public void dismiss(int folderId)
	{
		ILogger log = _logger.logStart("Hiding updates of folder " + folderId);
		try (IReadWriteFilterData access = _store.openForWrite())
		{
			access.writableFilters().removePendingUpdates(folderId);
		}
		try
		{
			boolean didAcknowledge = _scheduler.schedule((service) -> service.hideUpdates(folderId)).get();
			log.logFinish(didAcknowledge ? "Hidden" : "Hidden locally (server declined)");
		}
		catch (RemoteCallException e)
		{
			log.logVerbose("Remote error: " + e.getErrorCode());
			log.logFinish("Hidden locally");
		}
	}

	/**
	 * Leaves a shared folder, also leaving the given chats.  Failures are not reported:  the folder simply stays.
	 * 
	 * @param folderId The folder.
	 * @param removeEntityIds The chats to leave along with the folder.
	 * @param token Used to abandon the wait.
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public void leave(int folderId, List<EntityId> removeEntityIds, CancellationToken token) throws OperationCancelledException
	{
		ILogger log = _logger.logStart("Leaving folder " + folderId + " and " + removeEntityIds.size() + " chats");
		List<InputPeer> inputPeers = _resolve(removeEntityIds);
		try
		{
			RemoteUpdates result = _scheduler.schedule((service) -> service.leave(folderId, inputPeers)).get(token);
			_updateSink.addUpdates(result);
			log.logFinish("Left");
		}
		catch (RemoteCallException e)
		{
			log.logVerbose("Remote error: " + e.getErrorCode());
			log.logFinish("Leave failed");
		}
	}

	/**
	 * Asks the server which chats it suggests leaving along with the folder.
	 * 
	 * @param folderId The folder.
	 * @param token Used to abandon the wait.
	 * @return The suggested chats (empty if the server couldn't be asked).
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public List<EntityId> getLeaveSuggestions(int folderId, CancellationToken token) throws OperationCancelledException
	{
		try
		{
			return List.copyOf(_scheduler.schedule((service) -> service.getLeaveSuggestions(folderId)).get(token));
		}
		catch (RemoteCallException e)
		{
			_logger.logVerbose("Leave suggestions for folder " + folderId + " unavailable: " + e.getErrorCode());
			return List.of();
		}
	}


	private List<InputPeer> _resolve(List<EntityId> entityIds)
	{
		try (IReadOnlyFilterData access = _store.openForRead())
		{
			return PeerHelpers.resolveInputPeers(access.readPeers(), entityIds);
		}
	}
}
