package com.jeffdisher.folderlinks.types;


/**
 * Superclass of all the folder engine's checked exceptions.
 */
public class FolderLinksException extends Exception
{
	private static final long serialVersionUID = 1L;

	public FolderLinksException(String message)
	{
		super(message);
	}

	public FolderLinksException(String message, Exception exception)
	{
		super(message, exception);
	}
}
