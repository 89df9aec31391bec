package com.jeffdisher.folderlinks.logic;

import com.eclipsesource.json.JsonObject;
import com.eclipsesource.json.JsonValue;
import com.jeffdisher.folderlinks.types.LimitsTable;
import com.jeffdisher.folderlinks.types.UserLimits;


/**
 * Reads the standard and premium quota tables out of the app configuration.
 * The engine operations only consult this once the server has refused something for quota reasons, never on a success
 * path.
 */
public class LimitsResolver
{
	public static final String KEY_FOLDERS = "dialog_filters_limit";
	public static final String KEY_FOLDER_CHATS = "dialog_filters_chats_limit";
	public static final String KEY_SHARED_FOLDER_LINKS = "chatlist_invites_limit";
	public static final String KEY_SHARED_FOLDER_JOINS = "chatlists_joined_limit";

	private static final String SUFFIX_DEFAULT = "_default";
	private static final String SUFFIX_PREMIUM = "_premium";

	// The values the server documents as its defaults, used when the configuration is missing or malformed.
	public static final LimitsTable DEFAULT_STANDARD = new LimitsTable(3, 2, 10, 100);
	public static final LimitsTable DEFAULT_PREMIUM = new LimitsTable(100, 20, 20, 200);

	/**
	 * Resolves both limit tables.  This never fails:  any missing or non-numeric value falls back to its default.
	 * 
	 * @param appConfiguration The cached app configuration.
	 * @param isPremiumCaller True if the caller currently has premium status.
	 * @return Both tables, with the caller's tier.
	 */
	public static UserLimits resolveLimits(JsonObject appConfiguration, boolean isPremiumCaller)
	{
		LimitsTable standard = _readTable(appConfiguration, SUFFIX_DEFAULT, DEFAULT_STANDARD);
		LimitsTable premium = _readTable(appConfiguration, SUFFIX_PREMIUM, DEFAULT_PREMIUM);
		return new UserLimits(standard, premium, isPremiumCaller);
	}


	private static LimitsTable _readTable(JsonObject config, String suffix, LimitsTable defaults)
	{
		return new LimitsTable(_readInt(config, KEY_SHARED_FOLDER_LINKS + suffix, defaults.maxSharedFolderLinks())
				, _readInt(config, KEY_SHARED_FOLDER_JOINS + suffix, defaults.maxSharedFolderJoins())
				, _readInt(config, KEY_FOLDERS + suffix, defaults.maxFolders())
				, _readInt(config, KEY_FOLDER_CHATS + suffix, defaults.maxFolderChats())
		);
	}

	private static int _readInt(JsonObject config, String key, int defaultValue)
	{
		JsonValue value = (null != config)
				? config.get(key)
				: null
		;
		int result = defaultValue;
		if ((null != value) && value.isNumber())
		{
			// The config sends these as doubles, in some versions, so we truncate rather than use asInt().
			result = (int)value.asDouble();
		}
		return result;
	}
}
