package com.jeffdisher.folderlinks.remote;

import com.jeffdisher.folderlinks.types.FolderDefinition;
import com.jeffdisher.folderlinks.types.SharedLinkInfo;


/**
 * The response to an export:  the folder as the server now sees it and the new link.
 */
public record ExportedInvite(FolderDefinition filter, SharedLinkInfo invite)
{
}
