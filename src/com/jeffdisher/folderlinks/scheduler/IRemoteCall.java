package com.jeffdisher.folderlinks.scheduler;

import com.jeffdisher.folderlinks.remote.IFolderInviteService;
import com.jeffdisher.folderlinks.types.RemoteCallException;


/**
 * One remote call, as handed to an IRemoteScheduler.
 * 
 * @param <R> The response type.
 */
public interface IRemoteCall<R>
{
	R run(IFolderInviteService service) throws RemoteCallException;
}
