package com.jeffdisher.folderlinks.logic;

import com.jeffdisher.folderlinks.types.Peer;


/**
 * Decides which peers the current account may put into a folder link.
 */
public class SharePermissions
{
	/**
	 * A channel is shareable if the account created it, holds invite rights, or it has a public handle.  A basic group
	 * is shareable unless the account is banned from adding members.  Nothing else can be shared.
	 * 
	 * @param peer The peer to check.
	 * @return True if a link to this peer can be shared.
	 */
	public static boolean canShareLinkToPeer(Peer peer)
	{
		boolean isEnabled = false;
		switch (peer.kind())
		{
		case CHANNEL:
			isEnabled = peer.isCreator()
					|| peer.canInviteUsers()
					|| (null != peer.publicHandle())
			;
			break;
		case BASIC_GROUP:
			isEnabled = !peer.isAddMembersBanned();
			break;
		default:
			isEnabled = false;
		}
		return isEnabled;
	}
}
