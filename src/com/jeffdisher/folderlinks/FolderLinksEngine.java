package com.jeffdisher.folderlinks;

import java.util.List;

import com.jeffdisher.folderlinks.data.LocalFilterStore;
import com.jeffdisher.folderlinks.data.StateDispatcher;
import com.jeffdisher.folderlinks.logic.FirstObservationCache;
import com.jeffdisher.folderlinks.logic.FolderLinkLifecycle;
import com.jeffdisher.folderlinks.logic.FolderLinkResolver;
import com.jeffdisher.folderlinks.logic.FolderUpdatesPoller;
import com.jeffdisher.folderlinks.logic.FolderUpdatesSubscription;
import com.jeffdisher.folderlinks.logic.IAccountContext;
import com.jeffdisher.folderlinks.logic.IFolderUpdatesListener;
import com.jeffdisher.folderlinks.logic.ILogger;
import com.jeffdisher.folderlinks.logic.IPollFailurePolicy;
import com.jeffdisher.folderlinks.logic.LimitsResolver;
import com.jeffdisher.folderlinks.logic.LocalUpdateApplier;
import com.jeffdisher.folderlinks.projection.SyncPrefs;
import com.jeffdisher.folderlinks.remote.IFolderInviteService;
import com.jeffdisher.folderlinks.scheduler.CancellationToken;
import com.jeffdisher.folderlinks.scheduler.IRemoteScheduler;
import com.jeffdisher.folderlinks.scheduler.MultiThreadedScheduler;
import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.FolderLinkContents;
import com.jeffdisher.folderlinks.types.FolderOperationException;
import com.jeffdisher.folderlinks.types.FolderUpdates;
import com.jeffdisher.folderlinks.types.JoinFolderResult;
import com.jeffdisher.folderlinks.types.OperationCancelledException;
import com.jeffdisher.folderlinks.types.QuotaExceededException;
import com.jeffdisher.folderlinks.types.SharedLinkInfo;
import com.jeffdisher.folderlinks.types.UserLimits;


/**
 * The shared folder link engine for one account:  owns the store, the change dispatcher, and the remote scheduler,
 * and wires them into the link, join, and update components.
 * Every blocking operation takes a CancellationToken so the caller can abandon it.
 */
public class FolderLinksEngine
{
	/**
	 * Creates and starts an engine with its own dispatcher thread and remote scheduler threads.
	 * 
	 * @param logger The top-level logger.
	 * @param account The account this engine serves.
	 * @param service The remote service for that account.
	 * @param prefs The tunables.
	 * @return The running engine (must be shut down).
	 */
	public static FolderLinksEngine start(ILogger logger, IAccountContext account, IFolderInviteService service, SyncPrefs prefs)
	{
		StateDispatcher dispatcher = new StateDispatcher();
		dispatcher.start();
		LocalFilterStore store = LocalFilterStore.createEmpty(dispatcher);
		MultiThreadedScheduler scheduler = new MultiThreadedScheduler(service, prefs.schedulerThreadCount);
		return new FolderLinksEngine(logger, account, store, scheduler, prefs, new FirstObservationCache(), IPollFailurePolicy.absorbAndCacheEmpty(), dispatcher);
	}


	private final IAccountContext _account;
	private final LocalFilterStore _store;
	private final IRemoteScheduler _scheduler;
	private final StateDispatcher _dispatcher;
	private final FolderLinkLifecycle _lifecycle;
	private final FolderLinkResolver _resolver;
	private final FolderUpdatesPoller _poller;

	/**
	 * Wires an engine around existing parts.  The dispatcher is only used for shutdown (it can be null if the store's
	 * dispatcher is owned elsewhere).
	 */
	public FolderLinksEngine(ILogger logger
			, IAccountContext account
			, LocalFilterStore store
			, IRemoteScheduler scheduler
			, SyncPrefs prefs
			, FirstObservationCache firstObservations
			, IPollFailurePolicy failurePolicy
			, StateDispatcher dispatcher
	)
	{
		LocalUpdateApplier applier = new LocalUpdateApplier(store);
		_account = account;
		_store = store;
		_scheduler = scheduler;
		_dispatcher = dispatcher;
		_lifecycle = new FolderLinkLifecycle(logger, account, store, scheduler);
		_resolver = new FolderLinkResolver(logger, account, store, scheduler, applier, prefs);
		_poller = new FolderUpdatesPoller(logger, account, store, scheduler, applier, prefs, firstObservations, failurePolicy);
	}

	public LocalFilterStore getStore()
	{
		return _store;
	}

	/**
	 * @return The standard and premium limits, as currently configured for this account.
	 */
	public UserLimits currentLimits()
	{
		return LimitsResolver.resolveLimits(_account.currentAppConfiguration(), _account.isPremium());
	}

	public SharedLinkInfo exportLink(int folderId, String title, List<EntityId> entityIds, CancellationToken token) throws QuotaExceededException, FolderOperationException, OperationCancelledException
	{
		return _lifecycle.export(folderId, title, entityIds, token);
	}

	public SharedLinkInfo editLink(int folderId, SharedLinkInfo link, String newTitle, List<EntityId> newEntityIds, boolean revoke, CancellationToken token) throws FolderOperationException, OperationCancelledException
	{
		return _lifecycle.edit(folderId, link, newTitle, newEntityIds, revoke, token);
	}

	public void revokeLink(int folderId, SharedLinkInfo link, CancellationToken token) throws FolderOperationException, OperationCancelledException
	{
		_lifecycle.revoke(folderId, link, token);
	}

	public List<SharedLinkInfo> getExportedLinks(int folderId, CancellationToken token) throws OperationCancelledException
	{
		return _lifecycle.getExportedLinks(folderId, token);
	}

	public FolderLinkContents checkLink(String slug, CancellationToken token) throws FolderOperationException, OperationCancelledException
	{
		return _resolver.check(slug, token);
	}

	public JoinFolderResult joinLink(String slug, List<EntityId> entityIds, CancellationToken token) throws QuotaExceededException, FolderOperationException, OperationCancelledException
	{
		return _resolver.join(slug, entityIds, token);
	}

	public boolean pollUpdates(int folderId, CancellationToken token) throws OperationCancelledException
	{
		return _poller.pollOnce(folderId, token);
	}

	public FolderUpdatesSubscription subscribeToUpdates(int folderId, IFolderUpdatesListener listener)
	{
		return _poller.subscribe(folderId, listener);
	}

	public void joinAvailableChats(FolderUpdates updates, List<EntityId> entityIds, CancellationToken token) throws QuotaExceededException, FolderOperationException, OperationCancelledException
	{
		_poller.acceptAvailable(updates, entityIds, token);
	}

	public void hideUpdates(int folderId)
	{
		_poller.dismiss(folderId);
	}

	public void leaveFolder(int folderId, List<EntityId> removeEntityIds, CancellationToken token) throws OperationCancelledException
	{
		_poller.leave(folderId, removeEntityIds, token);
	}

	public List<EntityId> getLeaveSuggestions(int folderId, CancellationToken token) throws OperationCancelledException
	{
		return _poller.getLeaveSuggestions(folderId, token);
	}

	/**
	 * Stops the remote scheduler (waiting for in-flight calls) and then the dispatcher (delivering what was queued).
	 */
	public void shutdown()
	{
		_scheduler.shutdown();
		if (null != _dispatcher)
		{
			_dispatcher.shutdown();
		}
	}
}
