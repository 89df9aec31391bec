package com.jeffdisher.folderlinks.types;


/**
 * Thrown when the caller cancelled an operation through its CancellationToken while it was waiting.
 */
public class OperationCancelledException extends FolderLinksException
{
	private static final long serialVersionUID = 1L;

	public OperationCancelledException()
	{
		super("Operation cancelled");
	}
}
