package com.jeffdisher.folderlinks.types;


/**
 * The remote-addressable reference to a peer, built from the local peer cache before any remote call which names
 * peers.
 */
public record InputPeer(EntityId id, PeerKind kind, long accessHash)
{
	public static InputPeer fromPeer(Peer peer)
	{
		return new InputPeer(peer.id(), peer.kind(), peer.accessHash());
	}
}
