package com.jeffdisher.folderlinks.types;


/**
 * Thrown when the server refused an operation because the caller hit one of their quotas.
 * The limit is the one for the caller's current tier while premiumLimit is always the premium value, so callers can
 * tell whether upgrading would help.
 */
public class QuotaExceededException extends FolderLinksException
{
	private static final long serialVersionUID = 1L;

	private final QuotaKind _kind;
	private final int _limit;
	private final int _premiumLimit;

	public QuotaExceededException(QuotaKind kind, int limit, int premiumLimit)
	{
		super("Quota exceeded: " + kind + " (limit " + limit + ", premium limit " + premiumLimit + ")");
		_kind = kind;
		_limit = limit;
		_premiumLimit = premiumLimit;
	}

	public QuotaKind getKind()
	{
		return _kind;
	}

	public int getLimit()
	{
		return _limit;
	}

	public int getPremiumLimit()
	{
		return _premiumLimit;
	}
}
