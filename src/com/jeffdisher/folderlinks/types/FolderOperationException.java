package com.jeffdisher.folderlinks.types;


/**
 * The generic failure of a folder operation.  No detail about the underlying cause is exposed to the caller.
 */
public class FolderOperationException extends FolderLinksException
{
	private static final long serialVersionUID = 1L;

	public FolderOperationException(String operation)
	{
		super("Folder operation failed: " + operation);
	}
}
