package com.jeffdisher.folderlinks.projection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.jeffdisher.folderlinks.types.FolderDefinition;
import com.jeffdisher.folderlinks.types.PendingUpdateRecord;
import com.jeffdisher.folderlinks.utils.Assert;


/**
 * The mutable projection of the account's folders and their pending updates.
 * This is only ever touched inside a LocalFilterStore transaction, so it does no locking of its own.
 */
public class FiltersState implements IFiltersReading
{
	public static FiltersState createEmpty()
	{
		return new FiltersState();
	}


	private final List<FolderDefinition> _filters;
	private final List<FolderDefinition> _remoteFilters;
	private final List<PendingUpdateRecord> _updates;

	private FiltersState()
	{
		_filters = new ArrayList<>();
		_remoteFilters = new ArrayList<>();
		_updates = new ArrayList<>();
	}

	@Override
	public FolderDefinition getFilter(int folderId)
	{
		int index = _indexOfFilter(_filters, folderId);
		return (index >= 0)
				? _filters.get(index)
				: null
		;
	}

	@Override
	public List<FolderDefinition> getFilters()
	{
		return Collections.unmodifiableList(new ArrayList<>(_filters));
	}

	@Override
	public List<FolderDefinition> getRemoteFilters()
	{
		return Collections.unmodifiableList(new ArrayList<>(_remoteFilters));
	}

	@Override
	public PendingUpdateRecord getPendingUpdates(int folderId)
	{
		PendingUpdateRecord match = null;
		for (PendingUpdateRecord record : _updates)
		{
			if (folderId == record.folderId())
			{
				match = record;
				break;
			}
		}
		return match;
	}

	@Override
	public List<PendingUpdateRecord> getAllPendingUpdates()
	{
		return Collections.unmodifiableList(new ArrayList<>(_updates));
	}

	/**
	 * Replaces the folder with the same id, in place, or appends it if there isn't one.
	 * 
	 * @param definition The new definition.
	 */
	public void upsertFilter(FolderDefinition definition)
	{
		Assert.assertTrue(null != definition);
		int index = _indexOfFilter(_filters, definition.id());
		if (index >= 0)
		{
			_filters.set(index, definition);
		}
		else
		{
			_filters.add(definition);
		}
	}

	/**
	 * @param folderId The folder to remove.
	 * @return True if there was such a folder.
	 */
	public boolean removeFilter(int folderId)
	{
		return _filters.removeIf((FolderDefinition filter) -> (folderId == filter.id()));
	}

	/**
	 * Sets the remote-known mirror to exactly the current local folder list.
	 */
	public void mirrorFiltersAsRemote()
	{
		_remoteFilters.clear();
		_remoteFilters.addAll(_filters);
	}

	/**
	 * Replaces the pending update record for the record's folder.  Any existing record for that folder is removed
	 * first and the new one is appended, so there is never more than one per folder.
	 * 
	 * @param record The new record.
	 */
	public void replacePendingUpdates(PendingUpdateRecord record)
	{
		Assert.assertTrue(null != record);
		removePendingUpdates(record.folderId());
		_updates.add(record);
	}

	/**
	 * @param folderId The folder whose record should be removed.
	 * @return True if there was a record to remove.
	 */
	public boolean removePendingUpdates(int folderId)
	{
		return _updates.removeIf((PendingUpdateRecord record) -> (folderId == record.folderId()));
	}


	private static int _indexOfFilter(List<FolderDefinition> list, int folderId)
	{
		int found = -1;
		for (int i = 0; i < list.size(); ++i)
		{
			if (folderId == list.get(i).id())
			{
				found = i;
				break;
			}
		}
		return found;
	}
}
