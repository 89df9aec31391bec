package com.jeffdisher.folderlinks.types;


/**
 * A coded failure returned by the remote folder-invite service (or a transport failure, which has no known code).
 * These never escape the engine:  they are translated into FolderOperationException or QuotaExceededException where
 * the call was made.
 */
public class RemoteCallException extends FolderLinksException
{
	private static final long serialVersionUID = 1L;

	/**
	 * The code used when the failure happened below the service (connection lost, scheduler shut down, etc).
	 */
	public static final String TRANSPORT_FAILURE = "TRANSPORT_FAILURE";

	private final String _errorCode;

	public RemoteCallException(String errorCode)
	{
		super("Remote call failed: " + errorCode);
		_errorCode = errorCode;
	}

	public RemoteCallException(String errorCode, Exception cause)
	{
		super("Remote call failed: " + errorCode, cause);
		_errorCode = errorCode;
	}

	public String getErrorCode()
	{
		return _errorCode;
	}
}
