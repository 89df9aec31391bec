package com.jeffdisher.folderlinks.logic;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.jeffdisher.folderlinks.data.IReadOnlyFilterData;
import com.jeffdisher.folderlinks.data.IReadWriteFilterData;
import com.jeffdisher.folderlinks.data.LocalFilterStore;
import com.jeffdisher.folderlinks.projection.IPeerReading;
import com.jeffdisher.folderlinks.projection.SyncPrefs;
import com.jeffdisher.folderlinks.remote.CheckedInvite;
import com.jeffdisher.folderlinks.remote.RemoteUpdate;
import com.jeffdisher.folderlinks.remote.RemoteUpdates;
import com.jeffdisher.folderlinks.scheduler.CancellationToken;
import com.jeffdisher.folderlinks.scheduler.IRemoteScheduler;
import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.FolderDefinition;
import com.jeffdisher.folderlinks.types.FolderLinkContents;
import com.jeffdisher.folderlinks.types.FolderOperationException;
import com.jeffdisher.folderlinks.types.InputPeer;
import com.jeffdisher.folderlinks.types.JoinFolderResult;
import com.jeffdisher.folderlinks.types.OperationCancelledException;
import com.jeffdisher.folderlinks.types.Peer;
import com.jeffdisher.folderlinks.types.QuotaExceededException;
import com.jeffdisher.folderlinks.types.RemoteCallException;


/**
 * Resolves folder link slugs into previews and joins them.
 */
public class FolderLinkResolver
{
	private final ILogger _logger;
	private final IAccountContext _account;
	private final LocalFilterStore _store;
	private final IRemoteScheduler _scheduler;
	private final IRemoteUpdateSink _updateSink;
	private final SyncPrefs _prefs;

	public FolderLinkResolver(ILogger logger
			, IAccountContext account
			, LocalFilterStore store
			, IRemoteScheduler scheduler
			, IRemoteUpdateSink updateSink
			, SyncPrefs prefs
	)
	{
		_logger = logger;
		_account = account;
		_store = store;
		_scheduler = scheduler;
		_updateSink = updateSink;
		_prefs = prefs;
	}

	/**
	 * Checks a folder link, building the preview to show before joining.
	 * The peers accompanying the response are merged into the local caches before the preview is built, whichever
	 * shape the response has.
	 * 
	 * @param slug The slug of the link.
	 * @param token Used to abandon the wait.
	 * @return The preview.
	 * @throws FolderOperationException The link couldn't be checked (invalid, expired, or a remote failure).
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public FolderLinkContents check(String slug, CancellationToken token) throws FolderOperationException, OperationCancelledException
	{
		ILogger log = _logger.logStart("Checking folder link " + slug);
		CheckedInvite invite;
		try
		{
			invite = _scheduler.schedule((service) -> service.checkInvite(slug)).get(token);
		}
		catch (RemoteCallException e)
		{
			log.logVerbose("Remote error: " + e.getErrorCode());
			log.logFinish("Check failed");
			throw new FolderOperationException("check");
		}
		
		FolderLinkContents contents;
		try (IReadWriteFilterData access = _store.openForWrite())
		{
			PeerHelpers.mergeRemotePeers(access, invite.remotePeers());
			Map<EntityId, Integer> memberCounts = PeerHelpers.memberCountsOf(invite.remotePeers());
			contents = invite.isAlreadyJoined()
					? _buildAlreadyJoinedPreview(access, invite, memberCounts)
					: _buildFreshPreview(access.readPeers(), invite, memberCounts)
			;
		}
		log.logFinish("Preview has " + contents.peers().size() + " chats" + ((null != contents.localFilterId()) ? (", already joined as folder " + contents.localFilterId()) : ""));
		return contents;
	}

	/**
	 * Joins the given chats through a folder link.  This only returns once the joined folder is visible in the local
	 * folder list, so the caller can immediately navigate to it.
	 * 
	 * @param slug The slug of the link.
	 * @param entityIds The chats to join.
	 * @param token Used to abandon the wait (including the wait for local state to catch up).
	 * @return The joined folder.
	 * @throws QuotaExceededException The account hit a channel, folder, or shared folder quota.
	 * @throws FolderOperationException Any other failure, including the joined folder never becoming visible.
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public JoinFolderResult join(String slug, List<EntityId> entityIds, CancellationToken token) throws QuotaExceededException, FolderOperationException, OperationCancelledException
	{
		ILogger log = _logger.logStart("Joining folder link " + slug + " with " + entityIds.size() + " chats");
		int newChatCount = 0;
		List<InputPeer> inputPeers;
		try (IReadOnlyFilterData access = _store.openForRead())
		{
			IPeerReading peers = access.readPeers();
			// NOTE:  This counts the requested chats which are already in the chat list, before the join happens.
			for (EntityId id : entityIds)
			{
				if (peers.hasChatListPresence(id))
				{
					newChatCount += 1;
				}
			}
			inputPeers = PeerHelpers.resolveInputPeers(peers, entityIds);
		}
		
		RemoteUpdates updates;
		try
		{
			updates = _scheduler.schedule((service) -> service.joinInvite(slug, inputPeers)).get(token);
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
			throw new FolderOperationException("join");
		}
		
		_updateSink.addUpdates(updates);
		JoinFolderResult result = _extractJoinedFolder(updates, newChatCount);
		if (null == result)
		{
			log.logError("Join of " + slug + " returned no folder");
			log.logFinish("Join failed");
			throw new FolderOperationException("join");
		}
		
		FolderVisibilityWaiter waiter = new FolderVisibilityWaiter(result.folderId());
		_store.registerObserver(waiter);
		boolean isVisible;
		try
		{
			isVisible = waiter.await(token, _prefs.joinConfirmationTimeoutMillis);
		}
		finally
		{
			_store.unregisterObserver(waiter);
		}
		if (!isVisible)
		{
			log.logError("Folder " + result.folderId() + " not visible after " + _prefs.joinConfirmationTimeoutMillis + " ms");
			log.logFinish("Join failed");
			throw new FolderOperationException("join");
		}
		log.logFinish("Joined as folder " + result.folderId());
		return result;
	}


	private static FolderLinkContents _buildFreshPreview(IPeerReading peers, CheckedInvite invite, Map<EntityId, Integer> memberCounts)
	{
		List<Peer> resultPeers = new ArrayList<>();
		Set<EntityId> alreadyMemberPeerIds = new HashSet<>();
		for (EntityId id : invite.peers())
		{
			Peer peer = peers.getPeer(id);
			if (null != peer)
			{
				resultPeers.add(peer);
				if (peers.hasChatListPresence(id))
				{
					alreadyMemberPeerIds.add(id);
				}
			}
		}
		// NOTE:  A fresh preview never reports any chat as already joined, so the set computed above is discarded.
		// This looks like it could be a latent bug but the join screen's pre-selection depends on it.
		alreadyMemberPeerIds.clear();
		return new FolderLinkContents(null, invite.title(), resultPeers, alreadyMemberPeerIds, memberCounts);
	}

	private static FolderLinkContents _buildAlreadyJoinedPreview(IReadOnlyFilterData access, CheckedInvite invite, Map<EntityId, Integer> memberCounts)
	{
		IPeerReading peers = access.readPeers();
		int filterId = invite.alreadyJoinedFilterId();
		FolderDefinition current = access.readFilters().getFilter(filterId);
		String title = (null != current)
				? current.title()
				: null
		;
		List<EntityId> included = (null != current)
				? current.includedEntityIds()
				: List.of()
		;
		
		List<Peer> resultPeers = new ArrayList<>();
		Set<EntityId> resultIds = new HashSet<>();
		Set<EntityId> alreadyMemberPeerIds = new HashSet<>();
		for (EntityId id : invite.peers())
		{
			Peer peer = peers.getPeer(id);
			if (null != peer)
			{
				resultPeers.add(peer);
				resultIds.add(id);
				if (included.contains(id) && peers.hasChatListPresence(id))
				{
					alreadyMemberPeerIds.add(id);
				}
			}
		}
		// Chats already in the folder are offered again if the account could share them itself.
		for (EntityId id : included)
		{
			if (!resultIds.contains(id))
			{
				Peer peer = peers.getPeer(id);
				if ((null != peer) && SharePermissions.canShareLinkToPeer(peer))
				{
					resultPeers.add(peer);
					resultIds.add(id);
					if (peers.hasChatListPresence(id))
					{
						alreadyMemberPeerIds.add(id);
					}
				}
			}
		}
		return new FolderLinkContents(filterId, title, resultPeers, alreadyMemberPeerIds, memberCounts);
	}

	private static JoinFolderResult _extractJoinedFolder(RemoteUpdates updates, int newChatCount)
	{
		JoinFolderResult result = null;
		for (RemoteUpdate update : updates.updates())
		{
			if (RemoteUpdate.Kind.FOLDER_UPDATED == update.kind())
			{
				// Only the first folder update is considered, even if it was a deletion.
				FolderDefinition definition = update.definition();
				if (null != definition)
				{
					result = new JoinFolderResult(update.folderId(), definition.title(), newChatCount);
				}
				break;
			}
		}
		return result;
	}
}
