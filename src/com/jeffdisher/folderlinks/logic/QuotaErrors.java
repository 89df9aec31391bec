package com.jeffdisher.folderlinks.logic;

import com.jeffdisher.folderlinks.types.LimitsTable;
import com.jeffdisher.folderlinks.types.QuotaExceededException;
import com.jeffdisher.folderlinks.types.QuotaKind;
import com.jeffdisher.folderlinks.types.RemoteCallException;
import com.jeffdisher.folderlinks.types.UserLimits;


/**
 * Translates remote error codes into the engine's error taxonomy, at the point of the call.
 * Which codes are recognized depends on the call:  a code which isn't a quota error for this call is just a generic
 * failure, which the caller reports as a FolderOperationException.
 */
public class QuotaErrors
{
	public static final String INVITES_TOO_MUCH = "INVITES_TOO_MUCH";
	public static final String COMMUNITIES_TOO_MUCH = "COMMUNITIES_TOO_MUCH";
	public static final String USER_CHANNELS_TOO_MUCH = "USER_CHANNELS_TOO_MUCH";
	public static final String DIALOG_FILTERS_TOO_MUCH = "DIALOG_FILTERS_TOO_MUCH";
	public static final String FILTERS_TOO_MUCH = "FILTERS_TOO_MUCH";

	/**
	 * Interprets the failure of an export call.
	 * 
	 * @param error The remote failure.
	 * @param account The account (only consulted for quota codes).
	 * @return The quota error to throw or null, if this is a generic failure.
	 */
	public static QuotaExceededException quotaErrorForExport(RemoteCallException error, IAccountContext account)
	{
		QuotaExceededException result;
		switch (error.getErrorCode())
		{
		case INVITES_TOO_MUCH:
			result = _quota(account, QuotaKind.SHARED_FOLDER_INVITE_LINK_COUNT);
			break;
		case COMMUNITIES_TOO_MUCH:
			result = _quota(account, QuotaKind.SHARED_FOLDER_JOIN_COUNT);
			break;
		default:
			result = null;
		}
		return result;
	}

	/**
	 * Interprets the failure of a join or join-updates call.
	 * 
	 * @param error The remote failure.
	 * @param account The account (only consulted for quota codes).
	 * @return The quota error to throw or null, if this is a generic failure.
	 */
	public static QuotaExceededException quotaErrorForJoin(RemoteCallException error, IAccountContext account)
	{
		QuotaExceededException result;
		switch (error.getErrorCode())
		{
		case USER_CHANNELS_TOO_MUCH:
			result = _quota(account, QuotaKind.CHANNEL_COUNT);
			break;
		case DIALOG_FILTERS_TOO_MUCH:
			result = _quota(account, QuotaKind.DIALOG_FILTER_COUNT);
			break;
		case COMMUNITIES_TOO_MUCH:
		case FILTERS_TOO_MUCH:
			result = _quota(account, QuotaKind.SHARED_FOLDER_JOIN_COUNT);
			break;
		default:
			result = null;
		}
		return result;
	}

	/**
	 * @param table A limits table.
	 * @param kind The quota.
	 * @return The value of that quota in the table.
	 */
	public static int limitFor(LimitsTable table, QuotaKind kind)
	{
		int limit;
		switch (kind)
		{
		case DIALOG_FILTER_COUNT:
			limit = table.maxFolders();
			break;
		case SHARED_FOLDER_JOIN_COUNT:
			limit = table.maxSharedFolderJoins();
			break;
		case SHARED_FOLDER_INVITE_LINK_COUNT:
			limit = table.maxSharedFolderLinks();
			break;
		case CHANNEL_COUNT:
			// Channel overflow is reported against the per-folder chat limit.
			limit = table.maxFolderChats();
			break;
		default:
			throw new IllegalArgumentException("Unknown quota: " + kind);
		}
		return limit;
	}


	private static QuotaExceededException _quota(IAccountContext account, QuotaKind kind)
	{
		UserLimits limits = LimitsResolver.resolveLimits(account.currentAppConfiguration(), account.isPremium());
		return new QuotaExceededException(kind, limitFor(limits.callerLimits(), kind), limitFor(limits.premium(), kind));
	}
}
