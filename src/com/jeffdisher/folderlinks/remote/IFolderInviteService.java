package com.jeffdisher.folderlinks.remote;

import java.util.List;

import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.InputPeer;
import com.jeffdisher.folderlinks.types.RemoteCallException;
import com.jeffdisher.folderlinks.types.SharedLinkInfo;


/**
 * The remote folder-invite service, for one account.
 * All calls block until the server responds.  They are never called directly by the engine logic, but only through
 * an IRemoteScheduler, so implementations can assume they are not on a caller's thread.
 * Failures are reported as a RemoteCallException carrying the server's error code.
 */
public interface IFolderInviteService
{
	ExportedInvite exportInvite(int folderId, String title, List<InputPeer> peers) throws RemoteCallException;

	ExportedInvites getExportedInvites(int folderId) throws RemoteCallException;

	SharedLinkInfo editExportedInvite(int folderId, String slug, LinkEditRequest request) throws RemoteCallException;

	void deleteExportedInvite(int folderId, String slug) throws RemoteCallException;

	CheckedInvite checkInvite(String slug) throws RemoteCallException;

	RemoteUpdates joinInvite(String slug, List<InputPeer> peers) throws RemoteCallException;

	CommunityUpdates getUpdates(int folderId) throws RemoteCallException;

	RemoteUpdates joinUpdates(int folderId, List<InputPeer> peers) throws RemoteCallException;

	/**
	 * @return True if the server acknowledged the hide.
	 */
	boolean hideUpdates(int folderId) throws RemoteCallException;

	RemoteUpdates leave(int folderId, List<InputPeer> peers) throws RemoteCallException;

	List<EntityId> getLeaveSuggestions(int folderId) throws RemoteCallException;
}
