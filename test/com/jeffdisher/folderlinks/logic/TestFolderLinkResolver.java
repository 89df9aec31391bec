package com.jeffdisher.folderlinks.logic;

import java.util.List;
import java.util.Set;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.jeffdisher.folderlinks.data.LocalFilterStore;
import com.jeffdisher.folderlinks.data.StateDispatcher;
import com.jeffdisher.folderlinks.projection.SyncPrefs;
import com.jeffdisher.folderlinks.remote.CheckedInvite;
import com.jeffdisher.folderlinks.remote.RemotePeer;
import com.jeffdisher.folderlinks.remote.RemoteUpdate;
import com.jeffdisher.folderlinks.remote.RemoteUpdates;
import com.jeffdisher.folderlinks.scheduler.CancellationToken;
import com.jeffdisher.folderlinks.scheduler.SingleThreadedScheduler;
import com.jeffdisher.folderlinks.testutils.DelayedUpdateSink;
import com.jeffdisher.folderlinks.testutils.FakeAccountContext;
import com.jeffdisher.folderlinks.testutils.FakeFolderInviteService;
import com.jeffdisher.folderlinks.testutils.SilentLogger;
import com.jeffdisher.folderlinks.testutils.StoreHelpers;
import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.FolderDefinition;
import com.jeffdisher.folderlinks.types.FolderLinkContents;
import com.jeffdisher.folderlinks.types.FolderOperationException;
import com.jeffdisher.folderlinks.types.JoinFolderResult;
import com.jeffdisher.folderlinks.types.OperationCancelledException;
import com.jeffdisher.folderlinks.types.Peer;
import com.jeffdisher.folderlinks.types.QuotaExceededException;
import com.jeffdisher.folderlinks.types.QuotaKind;


public class TestFolderLinkResolver
{
	private static final EntityId NEWS = StoreHelpers.id(100L);
	private static final EntityId SPORTS = StoreHelpers.id(101L);
	private static final EntityId FRIENDS = StoreHelpers.id(200L);
	private static final EntityId BANNED = StoreHelpers.id(201L);
	private static final Peer NEWS_PEER = Peer.channel(NEWS, "News", 11L, true, false, null);
	private static final Peer SPORTS_PEER = Peer.channel(SPORTS, "Sports", 12L, false, false, null);
	private static final Peer FRIENDS_PEER = Peer.basicGroup(FRIENDS, "Friends", false);
	private static final Peer BANNED_PEER = Peer.basicGroup(BANNED, "Banned", true);
	private static final String SLUG = "slug";
	private static final int FOLDER_ID = 9;

	private FakeAccountContext _account;
	private FakeFolderInviteService _service;
	private SyncPrefs _prefs;

	@Before
	public void setup()
	{
		_account = new FakeAccountContext();
		_service = new FakeFolderInviteService();
		_prefs = SyncPrefs.defaultPrefs();
	}

	@Test
	public void testFreshPreviewNeverReportsMembers() throws Throwable
	{
		LocalFilterStore store = StoreHelpers.inlineStore();
		StoreHelpers.addPeers(store, NEWS_PEER);
		StoreHelpers.addToChatList(store, NEWS);
		_service.checkResult = CheckedInvite.fresh("Shared", List.of(NEWS, SPORTS), List.of(new RemotePeer(SPORTS_PEER, 42, null)));
		
		FolderLinkContents contents = _resolver(store).check(SLUG, new CancellationToken());
		Assert.assertNull(contents.localFilterId());
		Assert.assertEquals("Shared", contents.title());
		Assert.assertEquals(List.of(NEWS_PEER, SPORTS_PEER), contents.peers());
		// NEWS is in the chat list but a fresh preview still reports no members.
		Assert.assertTrue(contents.alreadyMemberPeerIds().isEmpty());
		Assert.assertEquals(Integer.valueOf(42), contents.memberCounts().get(SPORTS));
		Assert.assertEquals(SLUG, _service.lastSlug);
	}

	@Test
	public void testCheckMergesPeersBeforePreview() throws Throwable
	{
		LocalFilterStore store = StoreHelpers.inlineStore();
		EntityId user = StoreHelpers.id(500L);
		_service.checkResult = CheckedInvite.fresh("Shared", List.of(SPORTS), List.of(new RemotePeer(SPORTS_PEER, null, null), new RemotePeer(Peer.user(user, "Ann", 3L), null, 99)));
		
		FolderLinkContents contents = _resolver(store).check(SLUG, new CancellationToken());
		Assert.assertEquals(List.of(SPORTS_PEER), contents.peers());
		Assert.assertTrue(contents.memberCounts().isEmpty());
		Assert.assertEquals(SPORTS_PEER, StoreHelpers.readPeer(store, SPORTS));
		Assert.assertEquals("Ann", StoreHelpers.readPeer(store, user).title());
	}

	@Test
	public void testAlreadyJoinedPreview() throws Throwable
	{
		LocalFilterStore store = StoreHelpers.inlineStore();
		StoreHelpers.addPeers(store, NEWS_PEER, FRIENDS_PEER, BANNED_PEER);
		StoreHelpers.addToChatList(store, NEWS, FRIENDS);
		StoreHelpers.addFolder(store, new FolderDefinition(FOLDER_ID, "Local title", true, List.of(NEWS, BANNED)));
		_service.checkResult = CheckedInvite.alreadyJoined(FOLDER_ID, List.of(SPORTS, FRIENDS), List.of(NEWS, BANNED), List.of(new RemotePeer(SPORTS_PEER, 7, null)));
		
		FolderLinkContents contents = _resolver(store).check(SLUG, new CancellationToken());
		Assert.assertEquals(Integer.valueOf(FOLDER_ID), contents.localFilterId());
		Assert.assertEquals("Local title", contents.title());
		// Missing chats first, then the included ones which can still be shared (BANNED can't).
		Assert.assertEquals(List.of(SPORTS_PEER, FRIENDS_PEER, NEWS_PEER), contents.peers());
		// FRIENDS is in the chat list but not in the folder so it isn't a member.
		Assert.assertEquals(Set.of(NEWS), contents.alreadyMemberPeerIds());
		Assert.assertEquals(Integer.valueOf(7), contents.memberCounts().get(SPORTS));
	}

	@Test(expected = FolderOperationException.class)
	public void testCheckFailure() throws Throwable
	{
		_service.errors.put(FakeFolderInviteService.CHECK, "INVITE_SLUG_EXPIRED");
		_resolver(StoreHelpers.inlineStore()).check(SLUG, new CancellationToken());
	}

	@Test
	public void testJoinInline() throws Throwable
	{
		LocalFilterStore store = StoreHelpers.inlineStore();
		StoreHelpers.addPeers(store, NEWS_PEER, SPORTS_PEER, FRIENDS_PEER);
		StoreHelpers.addToChatList(store, NEWS, FRIENDS);
		FolderDefinition joined = new FolderDefinition(FOLDER_ID, "Shared", true, List.of(NEWS, SPORTS));
		_service.joinResult = new RemoteUpdates(List.of(RemoteUpdate.chatJoined(SPORTS), RemoteUpdate.folderUpdated(FOLDER_ID, joined)), List.of());
		
		JoinFolderResult result = _resolver(store).join(SLUG, List.of(NEWS, SPORTS), new CancellationToken());
		Assert.assertEquals(new JoinFolderResult(FOLDER_ID, "Shared", 1), result);
		Assert.assertEquals(joined, StoreHelpers.readFolder(store, FOLDER_ID));
		Assert.assertTrue(StoreHelpers.isInChatList(store, SPORTS));
		Assert.assertEquals(2, _service.lastPeers.size());
	}

	@Test
	public void testJoinUsesFirstFolderUpdate() throws Throwable
	{
		LocalFilterStore store = StoreHelpers.inlineStore();
		FolderDefinition first = new FolderDefinition(FOLDER_ID, "First", true, List.of());
		FolderDefinition second = new FolderDefinition(FOLDER_ID + 1, "Second", true, List.of());
		_service.joinResult = new RemoteUpdates(List.of(RemoteUpdate.folderUpdated(FOLDER_ID, first), RemoteUpdate.folderUpdated(FOLDER_ID + 1, second)), List.of());
		
		JoinFolderResult result = _resolver(store).join(SLUG, List.of(), new CancellationToken());
		Assert.assertEquals(FOLDER_ID, result.folderId());
		Assert.assertEquals("First", result.title());
	}

	@Test
	public void testJoinWithoutFolderIsGeneric() throws Throwable
	{
		LocalFilterStore store = StoreHelpers.inlineStore();
		_service.joinResult = new RemoteUpdates(List.of(RemoteUpdate.chatJoined(NEWS)), List.of());
		try
		{
			_resolver(store).join(SLUG, List.of(NEWS), new CancellationToken());
			Assert.fail();
		}
		catch (FolderOperationException e)
		{
			// Expected.
		}
		// The remote call still succeeded so its updates were applied.
		Assert.assertEquals(1, _service.getCallCount(FakeFolderInviteService.JOIN));
		Assert.assertTrue(StoreHelpers.isInChatList(store, NEWS));
	}

	@Test
	public void testJoinQuota() throws Throwable
	{
		_account.isPremium = true;
		_service.errors.put(FakeFolderInviteService.JOIN, QuotaErrors.USER_CHANNELS_TOO_MUCH);
		try
		{
			_resolver(StoreHelpers.inlineStore()).join(SLUG, List.of(), new CancellationToken());
			Assert.fail();
		}
		catch (QuotaExceededException e)
		{
			Assert.assertEquals(QuotaKind.CHANNEL_COUNT, e.getKind());
			Assert.assertEquals(200, e.getLimit());
			Assert.assertEquals(200, e.getPremiumLimit());
		}
	}

	@Test
	public void testJoinWaitsForLocalState() throws Throwable
	{
		StateDispatcher dispatcher = new StateDispatcher();
		dispatcher.start();
		LocalFilterStore store = LocalFilterStore.createEmpty(dispatcher);
		DelayedUpdateSink sink = new DelayedUpdateSink(new LocalUpdateApplier(store));
		FolderLinkResolver resolver = new FolderLinkResolver(new SilentLogger(), _account, store, new SingleThreadedScheduler(_service), sink, _prefs);
		FolderDefinition joined = new FolderDefinition(FOLDER_ID, "Shared", true, List.of(NEWS));
		_service.joinResult = new RemoteUpdates(List.of(RemoteUpdate.folderUpdated(FOLDER_ID, joined)), List.of(new RemotePeer(NEWS_PEER, 3, null)));
		
		JoinFolderResult[] result = new JoinFolderResult[1];
		Throwable[] error = new Throwable[1];
		Thread joiner = new Thread(() -> {
			try
			{
				result[0] = resolver.join(SLUG, List.of(NEWS), new CancellationToken());
			}
			catch (Throwable t)
			{
				error[0] = t;
			}
		});
		joiner.start();
		sink.waitForHeld(1);
		// The remote call finished but the local state hasn't caught up so the join must still be waiting.
		joiner.join(200L);
		Assert.assertTrue(joiner.isAlive());
		
		sink.release();
		joiner.join();
		Assert.assertNull(error[0]);
		Assert.assertEquals(new JoinFolderResult(FOLDER_ID, "Shared", 0), result[0]);
		Assert.assertEquals(joined, StoreHelpers.readFolder(store, FOLDER_ID));
		dispatcher.shutdown();
	}

	@Test
	public void testJoinTimesOut() throws Throwable
	{
		StateDispatcher dispatcher = new StateDispatcher();
		dispatcher.start();
		LocalFilterStore store = LocalFilterStore.createEmpty(dispatcher);
		_prefs.joinConfirmationTimeoutMillis = 100L;
		// Updates are dropped so the folder never appears.
		FolderLinkResolver resolver = new FolderLinkResolver(new SilentLogger(), _account, store, new SingleThreadedScheduler(_service), (RemoteUpdates updates) -> {}, _prefs);
		_service.joinResult = new RemoteUpdates(List.of(RemoteUpdate.folderUpdated(FOLDER_ID, new FolderDefinition(FOLDER_ID, "Shared", true, List.of()))), List.of());
		try
		{
			resolver.join(SLUG, List.of(), new CancellationToken());
			Assert.fail();
		}
		catch (FolderOperationException e)
		{
			// Expected.
		}
		dispatcher.shutdown();
	}

	@Test
	public void testJoinCancelledWhileWaiting() throws Throwable
	{
		StateDispatcher dispatcher = new StateDispatcher();
		dispatcher.start();
		LocalFilterStore store = LocalFilterStore.createEmpty(dispatcher);
		DelayedUpdateSink sink = new DelayedUpdateSink(new LocalUpdateApplier(store));
		FolderLinkResolver resolver = new FolderLinkResolver(new SilentLogger(), _account, store, new SingleThreadedScheduler(_service), sink, _prefs);
		_service.joinResult = new RemoteUpdates(List.of(RemoteUpdate.folderUpdated(FOLDER_ID, new FolderDefinition(FOLDER_ID, "Shared", true, List.of()))), List.of());
		
		CancellationToken token = new CancellationToken();
		Throwable[] error = new Throwable[1];
		Thread joiner = new Thread(() -> {
			try
			{
				resolver.join(SLUG, List.of(), token);
			}
			catch (Throwable t)
			{
				error[0] = t;
			}
		});
		joiner.start();
		sink.waitForHeld(1);
		token.cancel();
		joiner.join();
		Assert.assertTrue(error[0] instanceof OperationCancelledException);
		dispatcher.shutdown();
	}


	private FolderLinkResolver _resolver(LocalFilterStore store)
	{
		return new FolderLinkResolver(new SilentLogger(), _account, store, new SingleThreadedScheduler(_service), new LocalUpdateApplier(store), _prefs);
	}
}
