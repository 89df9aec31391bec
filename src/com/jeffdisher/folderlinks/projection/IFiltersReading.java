package com.jeffdisher.folderlinks.projection;

import java.util.List;

import com.jeffdisher.folderlinks.types.FolderDefinition;
import com.jeffdisher.folderlinks.types.PendingUpdateRecord;


/**
 * The read-only view of the folder (chat list filter) state.
 */
public interface IFiltersReading
{
	/**
	 * @param folderId The folder to look up.
	 * @return The folder definition or null if there is no such folder.
	 */
	FolderDefinition getFilter(int folderId);

	/**
	 * @return All local folders, in display order.
	 */
	List<FolderDefinition> getFilters();

	/**
	 * @return The folders as last acknowledged by the server.
	 */
	List<FolderDefinition> getRemoteFilters();

	/**
	 * @param folderId The folder to look up.
	 * @return The pending update record for this folder or null if there isn't one.
	 */
	PendingUpdateRecord getPendingUpdates(int folderId);

	/**
	 * @return All pending update records, in the order they were written.
	 */
	List<PendingUpdateRecord> getAllPendingUpdates();
}
