package com.jeffdisher.folderlinks.data;

import java.util.List;

import com.jeffdisher.folderlinks.projection.IFiltersReading;
import com.jeffdisher.folderlinks.types.FolderDefinition;
import com.jeffdisher.folderlinks.types.PendingUpdateRecord;


/**
 * An immutable copy of the folder state, as of the end of one write transaction.  These are what the store's change
 * feed delivers to its observers.
 */
public record FiltersSnapshot(List<FolderDefinition> filters, List<PendingUpdateRecord> updates)
{
	public static FiltersSnapshot of(IFiltersReading state)
	{
		return new FiltersSnapshot(state.getFilters(), state.getAllPendingUpdates());
	}

	public FiltersSnapshot
	{
		filters = List.copyOf(filters);
		updates = List.copyOf(updates);
	}

	public FolderDefinition findFilter(int folderId)
	{
		return filters.stream()
				.filter((FolderDefinition filter) -> (folderId == filter.id()))
				.findFirst()
				.orElse(null)
		;
	}

	public PendingUpdateRecord findUpdates(int folderId)
	{
		return updates.stream()
				.filter((PendingUpdateRecord record) -> (folderId == record.folderId()))
				.findFirst()
				.orElse(null)
		;
	}
}
