package com.jeffdisher.folderlinks.types;


/**
 * A cached peer object, as known to the local peer cache.
 * 
 * @param id The identifier of the peer.
 * @param kind What kind of peer this is.
 * @param title The display name (user name, group or channel title).
 * @param accessHash The hash which must accompany the id when the peer is addressed in a remote call.
 * @param isCreator True if the current account created this channel.
 * @param canInviteUsers True if the current account holds invite rights in this channel.
 * @param publicHandle The public username of the channel (null if it has none).
 * @param isAddMembersBanned True if the current account is banned from adding members to this basic group.
 */
public record Peer(EntityId id
		, PeerKind kind
		, String title
		, long accessHash
		, boolean isCreator
		, boolean canInviteUsers
		, String publicHandle
		, boolean isAddMembersBanned
)
{
	public static Peer channel(EntityId id, String title, long accessHash, boolean isCreator, boolean canInviteUsers, String publicHandle)
	{
		return new Peer(id, PeerKind.CHANNEL, title, accessHash, isCreator, canInviteUsers, publicHandle, false);
	}

	public static Peer basicGroup(EntityId id, String title, boolean isAddMembersBanned)
	{
		return new Peer(id, PeerKind.BASIC_GROUP, title, 0L, false, false, null, isAddMembersBanned);
	}

	public static Peer user(EntityId id, String title, long accessHash)
	{
		return new Peer(id, PeerKind.USER, title, accessHash, false, false, null, false);
	}
}
