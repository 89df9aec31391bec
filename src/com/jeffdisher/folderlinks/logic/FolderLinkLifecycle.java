package com.jeffdisher.folderlinks.logic;

import java.util.List;

import com.jeffdisher.folderlinks.data.IReadOnlyFilterData;
import com.jeffdisher.folderlinks.data.IReadWriteFilterData;
import com.jeffdisher.folderlinks.data.LocalFilterStore;
import com.jeffdisher.folderlinks.projection.FiltersState;
import com.jeffdisher.folderlinks.remote.ExportedInvite;
import com.jeffdisher.folderlinks.remote.ExportedInvites;
import com.jeffdisher.folderlinks.remote.LinkEditRequest;
import com.jeffdisher.folderlinks.scheduler.CancellationToken;
import com.jeffdisher.folderlinks.scheduler.IRemoteScheduler;
import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.FolderOperationException;
import com.jeffdisher.folderlinks.types.InputPeer;
import com.jeffdisher.folderlinks.types.OperationCancelledException;
import com.jeffdisher.folderlinks.types.QuotaExceededException;
import com.jeffdisher.folderlinks.types.RemoteCallException;
import com.jeffdisher.folderlinks.types.SharedLinkInfo;


/**
 * Creates, edits, lists, and revokes the invite links of a folder the account owns.
 * Each operation reads what it needs in one transaction, makes the remote call with no transaction open, and then
 * writes the result back in a new transaction.
 */
public class FolderLinkLifecycle
{
	private final ILogger _logger;
	private final IAccountContext _account;
	private final LocalFilterStore _store;
	private final IRemoteScheduler _scheduler;

	public FolderLinkLifecycle(ILogger logger, IAccountContext account, LocalFilterStore store, IRemoteScheduler scheduler)
	{
		_logger = logger;
		_account = account;
		_store = store;
		_scheduler = scheduler;
	}

	/**
	 * Exports a new invite link for the folder.  On success, the folder definition returned by the server replaces
	 * the local one (or is appended) and the remote-known folder mirror is reset to the local list.
	 * 
	 * @param folderId The folder to share.
	 * @param title The title of the new link.
	 * @param entityIds The chats to include in the link.
	 * @param token Used to abandon the wait.
	 * @return The new link.
	 * @throws QuotaExceededException The account has too many links or shared folders.
	 * @throws FolderOperationException Any other failure.
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public SharedLinkInfo export(int folderId, String title, List<EntityId> entityIds, CancellationToken token) throws QuotaExceededException, FolderOperationException, OperationCancelledException
	{
		ILogger log = _logger.logStart("Exporting link for folder " + folderId + " with " + entityIds.size() + " chats");
		List<InputPeer> inputPeers = _resolve(entityIds);
		ExportedInvite result;
		try
		{
			result = _scheduler.schedule((service) -> service.exportInvite(folderId, title, inputPeers)).get(token);
		}
		catch (RemoteCallException e)
		{
			log.logVerbose("Remote error: " + e.getErrorCode());
			log.logFinish("Export failed");
			QuotaExceededException quota = QuotaErrors.quotaErrorForExport(e, _account);
			if (null != quota)
			{
				throw quota;
			}
			throw new FolderOperationException("export");
		}
		
		try (IReadWriteFilterData access = _store.openForWrite())
		{
			FiltersState filters = access.writableFilters();
			filters.upsertFilter(result.filter());
			filters.mirrorFiltersAsRemote();
		}
		log.logFinish("Exported " + result.invite().link());
		return result.invite();
	}

	/**
	 * Edits an existing link.  Only the fields which are given are changed:  a null title or null entityIds leaves
	 * that field alone.
	 * 
	 * @param folderId The folder the link belongs to.
	 * @param link The link to edit.
	 * @param newTitle The new title (null to leave unchanged).
	 * @param newEntityIds The new set of chats (null to leave unchanged).
	 * @param revoke True to revoke the link.
	 * @param token Used to abandon the wait.
	 * @return The link, as updated by the server.
	 * @throws FolderOperationException The edit failed.
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public SharedLinkInfo edit(int folderId, SharedLinkInfo link, String newTitle, List<EntityId> newEntityIds, boolean revoke, CancellationToken token) throws FolderOperationException, OperationCancelledException
	{
		ILogger log = _logger.logStart("Editing link " + link.slug() + " of folder " + folderId);
		List<InputPeer> inputPeers = (null != newEntityIds)
				? _resolve(newEntityIds)
				: null
		;
		LinkEditRequest request = new LinkEditRequest(newTitle, inputPeers, revoke);
		String slug = link.slug();
		try
		{
			SharedLinkInfo edited = _scheduler.schedule((service) -> service.editExportedInvite(folderId, slug, request)).get(token);
			log.logFinish("Edited " + edited.link() + (edited.revoked() ? " (revoked)" : ""));
			return edited;
		}
		catch (RemoteCallException e)
		{
			log.logVerbose("Remote error: " + e.getErrorCode());
			log.logFinish("Edit failed");
			throw new FolderOperationException("edit");
		}
	}

	/**
	 * Deletes a link.  There is no retry.
	 * 
	 * @param folderId The folder the link belongs to.
	 * @param link The link to delete.
	 * @param token Used to abandon the wait.
	 * @throws FolderOperationException The delete failed.
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public void revoke(int folderId, SharedLinkInfo link, CancellationToken token) throws FolderOperationException, OperationCancelledException
	{
		ILogger log = _logger.logStart("Deleting link " + link.slug() + " of folder " + folderId);
		String slug = link.slug();
		try
		{
			_scheduler.schedule((service) -> {
				service.deleteExportedInvite(folderId, slug);
				return null;
			}).get(token);
			log.logFinish("Deleted");
		}
		catch (RemoteCallException e)
		{
			log.logVerbose("Remote error: " + e.getErrorCode());
			log.logFinish("Delete failed");
			throw new FolderOperationException("revoke");
		}
	}

	/**
	 * Lists the links exported for the folder, merging the peers which accompany them into the local caches.
	 * 
	 * @param folderId The folder.
	 * @param token Used to abandon the wait.
	 * @return The links or null, if the server couldn't be asked.
	 * @throws OperationCancelledException The token was cancelled.
	 */
	public List<SharedLinkInfo> getExportedLinks(int folderId, CancellationToken token) throws OperationCancelledException
	{
		ILogger log = _logger.logStart("Listing links of folder " + folderId);
		ExportedInvites result;
		try
		{
			result = _scheduler.schedule((service) -> service.getExportedInvites(folderId)).get(token);
		}
		catch (RemoteCallException e)
		{
			log.logVerbose("Remote error: " + e.getErrorCode());
			log.logFinish("Listing unavailable");
			return null;
		}
		try (IReadWriteFilterData access = _store.openForWrite())
		{
			PeerHelpers.mergeRemotePeers(access, result.peers());
		}
		log.logFinish("Found " + result.invites().size() + " links");
		return List.copyOf(result.invites());
	}


	private List<InputPeer> _resolve(List<EntityId> entityIds)
	{
		try (IReadOnlyFilterData access = _store.openForRead())
		{
			return PeerHelpers.resolveInputPeers(access.readPeers(), entityIds);
		}
	}
}
