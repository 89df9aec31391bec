package com.jeffdisher.folderlinks.logic;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.jeffdisher.folderlinks.data.LocalFilterStore;
import com.jeffdisher.folderlinks.projection.SyncPrefs;
import com.jeffdisher.folderlinks.remote.CommunityUpdates;
import com.jeffdisher.folderlinks.remote.RemotePeer;
import com.jeffdisher.folderlinks.remote.RemoteUpdate;
import com.jeffdisher.folderlinks.remote.RemoteUpdates;
import com.jeffdisher.folderlinks.scheduler.CancellationToken;
import com.jeffdisher.folderlinks.scheduler.SingleThreadedScheduler;
import com.jeffdisher.folderlinks.testutils.FakeAccountContext;
import com.jeffdisher.folderlinks.testutils.FakeFolderInviteService;
import com.jeffdisher.folderlinks.testutils.SilentLogger;
import com.jeffdisher.folderlinks.testutils.StoreHelpers;
import com.jeffdisher.folderlinks.types.EntityId;
import com.jeffdisher.folderlinks.types.FolderDefinition;
import com.jeffdisher.folderlinks.types.FolderOperationException;
import com.jeffdisher.folderlinks.types.FolderUpdates;
import com.jeffdisher.folderlinks.types.Peer;
import com.jeffdisher.folderlinks.types.PendingUpdateRecord;
import com.jeffdisher.folderlinks.types.QuotaExceededException;
import com.jeffdisher.folderlinks.types.QuotaKind;
import com.jeffdisher.folderlinks.types.RemoteCallException;
import com.jeffdisher.folderlinks.utils.MiscHelpers;


public class TestFolderUpdatesPoller
{
	private static final EntityId INCLUDED = StoreHelpers.id(1L);
	private static final EntityId ADDED1 = StoreHelpers.id(2L);
	private static final EntityId ADDED2 = StoreHelpers.id(3L);
	private static final Peer INCLUDED_PEER = Peer.channel(INCLUDED, "Included", 1L, false, false, null);
	private static final Peer ADDED1_PEER = Peer.channel(ADDED1, "Added 1", 2L, false, false, null);
	private static final Peer ADDED2_PEER = Peer.basicGroup(ADDED2, "Added 2", false);
	private static final int FOLDER_ID = 4;

	private FakeAccountContext _account;
	private FakeFolderInviteService _service;
	private LocalFilterStore _store;
	private SyncPrefs _prefs;
	private FirstObservationCache _observations;
	private FolderUpdatesPoller _poller;

	@Before
	public void setup()
	{
		_account = new FakeAccountContext();
		_service = new FakeFolderInviteService();
		_store = StoreHelpers.inlineStore();
		_prefs = SyncPrefs.defaultPrefs();
		_observations = new FirstObservationCache();
		StoreHelpers.addPeers(_store, INCLUDED_PEER, ADDED1_PEER, ADDED2_PEER);
		StoreHelpers.addFolder(_store, new FolderDefinition(FOLDER_ID, "Shared", true, List.of(INCLUDED)));
		_poller = _createPoller(IPollFailurePolicy.absorbAndCacheEmpty());
	}

	@Test
	public void testFirstPollStoresRecord() throws Throwable
	{
		_service.updatesResult = new CommunityUpdates(List.of(ADDED1, ADDED2), List.of(new RemotePeer(ADDED1_PEER, 25, null)));
		Assert.assertTrue(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		
		PendingUpdateRecord record = StoreHelpers.readPendingUpdates(_store, FOLDER_ID);
		Assert.assertEquals(List.of(ADDED1, ADDED2), record.missingEntityIds());
		Assert.assertEquals(Integer.valueOf(25), record.memberCounts().get(ADDED1));
		Assert.assertEquals(1, record.memberCounts().size());
		Assert.assertEquals(_now(), record.timestamp());
		Assert.assertTrue(_observations.wasObserved(_account.accountId, FOLDER_ID));
	}

	@Test
	public void testDebounce() throws Throwable
	{
		_service.updatesResult = new CommunityUpdates(List.of(ADDED1), List.of());
		Assert.assertTrue(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		Assert.assertEquals(1, _service.getCallCount(FakeFolderInviteService.GET_UPDATES));
		
		// Inside the interval:  nothing goes remote.
		_account.advanceSeconds(_prefs.updateIntervalSeconds - 1);
		Assert.assertFalse(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		Assert.assertEquals(1, _service.getCallCount(FakeFolderInviteService.GET_UPDATES));
		
		// Past the interval:  exactly one call.
		_account.advanceSeconds(2);
		Assert.assertTrue(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		Assert.assertEquals(2, _service.getCallCount(FakeFolderInviteService.GET_UPDATES));
		Assert.assertEquals(_now(), StoreHelpers.readPendingUpdates(_store, FOLDER_ID).timestamp());
	}

	@Test
	public void testFirstObservationIgnoresFreshRecord() throws Throwable
	{
		StoreHelpers.putPendingUpdates(_store, PendingUpdateRecord.empty(FOLDER_ID, _now()));
		_service.updatesResult = new CommunityUpdates(List.of(ADDED2), List.of());
		Assert.assertTrue(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		Assert.assertEquals(List.of(ADDED2), StoreHelpers.readPendingUpdates(_store, FOLDER_ID).missingEntityIds());
		
		// A new cache starts over, which is how a restart behaves.
		_observations = new FirstObservationCache();
		_poller = _createPoller(IPollFailurePolicy.absorbAndCacheEmpty());
		Assert.assertTrue(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		Assert.assertEquals(2, _service.getCallCount(FakeFolderInviteService.GET_UPDATES));
	}

	@Test
	public void testFailureCachesEmptyRecord() throws Throwable
	{
		StoreHelpers.putPendingUpdates(_store, new PendingUpdateRecord(FOLDER_ID, 5, List.of(ADDED1), Map.of()));
		_service.errors.put(FakeFolderInviteService.GET_UPDATES, "FLOOD_WAIT_30");
		Assert.assertTrue(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		Assert.assertEquals(PendingUpdateRecord.empty(FOLDER_ID, _now()), StoreHelpers.readPendingUpdates(_store, FOLDER_ID));
		
		// The empty record suppresses an immediate retry.
		Assert.assertFalse(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		Assert.assertEquals(1, _service.getCallCount(FakeFolderInviteService.GET_UPDATES));
	}

	@Test
	public void testEmptyResponseTreatedAsFailure() throws Throwable
	{
		StoreHelpers.putPendingUpdates(_store, new PendingUpdateRecord(FOLDER_ID, 5, List.of(ADDED1), Map.of()));
		List<String> errorCodes = new ArrayList<>();
		_poller = _createPoller((int folderId, int timestamp, RemoteCallException error) -> {
			errorCodes.add(error.getErrorCode());
			return PendingUpdateRecord.empty(folderId, timestamp);
		});
		Assert.assertNull(_service.updatesResult);
		Assert.assertTrue(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		Assert.assertEquals(List.of(RemoteCallException.TRANSPORT_FAILURE), errorCodes);
		Assert.assertEquals(PendingUpdateRecord.empty(FOLDER_ID, _now()), StoreHelpers.readPendingUpdates(_store, FOLDER_ID));
	}

	@Test
	public void testFailurePolicyCanLeaveState() throws Throwable
	{
		PendingUpdateRecord existing = new PendingUpdateRecord(FOLDER_ID, 5, List.of(ADDED1), Map.of());
		StoreHelpers.putPendingUpdates(_store, existing);
		_service.errors.put(FakeFolderInviteService.GET_UPDATES, "FLOOD_WAIT_30");
		_poller = _createPoller((int folderId, int timestamp, RemoteCallException error) -> null);
		Assert.assertTrue(_poller.pollOnce(FOLDER_ID, new CancellationToken()));
		Assert.assertEquals(existing, StoreHelpers.readPendingUpdates(_store, FOLDER_ID));
	}

	@Test
	public void testSubscriptionFollowsPolls() throws Throwable
	{
		List<FolderUpdates> seen = new ArrayList<>();
		FolderUpdatesSubscription subscription = _poller.subscribe(FOLDER_ID, (FolderUpdates updates) -> {
			seen.add(updates);
			return true;
		});
		// The current value (nothing) is sent immediately.
		Assert.assertEquals(1, seen.size());
		Assert.assertNull(seen.get(0));
		
		_service.updatesResult = new CommunityUpdates(List.of(INCLUDED, ADDED1), List.of(new RemotePeer(ADDED1_PEER, 10, null)));
		_poller.pollOnce(FOLDER_ID, new CancellationToken());
		Assert.assertEquals(2, seen.size());
		FolderUpdates updates = seen.get(1);
		// The chat already in the folder isn't offered.
		Assert.assertEquals(List.of(ADDED1_PEER), updates.getMissingPeers());
		Assert.assertEquals(Integer.valueOf(10), updates.getMemberCounts().get(ADDED1));
		
		// Same chats, different counts:  no new value.
		_account.advanceSeconds(_prefs.updateIntervalSeconds + 1);
		_service.updatesResult = new CommunityUpdates(List.of(INCLUDED, ADDED1), List.of(new RemotePeer(ADDED1_PEER, 11, null)));
		_poller.pollOnce(FOLDER_ID, new CancellationToken());
		Assert.assertEquals(2, seen.size());
		
		_account.advanceSeconds(_prefs.updateIntervalSeconds + 1);
		_service.updatesResult = new CommunityUpdates(List.of(ADDED1, ADDED2), List.of());
		_poller.pollOnce(FOLDER_ID, new CancellationToken());
		Assert.assertEquals(3, seen.size());
		Assert.assertEquals(List.of(ADDED1, ADDED2), seen.get(2).getMissingEntityIds());
		
		subscription.close();
		_poller.dismiss(FOLDER_ID);
		Assert.assertEquals(3, seen.size());
	}

	@Test
	public void testAcceptAvailable() throws Throwable
	{
		StoreHelpers.putPendingUpdates(_store, new PendingUpdateRecord(FOLDER_ID, _now(), List.of(ADDED1, ADDED2), Map.of()));
		FolderUpdates updates = new FolderUpdates(FOLDER_ID, "Shared", List.of(ADDED1_PEER, ADDED2_PEER), Map.of());
		FolderDefinition grown = new FolderDefinition(FOLDER_ID, "Shared", true, List.of(INCLUDED, ADDED1));
		_service.joinUpdatesResult = new RemoteUpdates(List.of(RemoteUpdate.chatJoined(ADDED1), RemoteUpdate.folderUpdated(FOLDER_ID, grown)), List.of());
		
		_poller.acceptAvailable(updates, List.of(ADDED1), new CancellationToken());
		Assert.assertEquals(1, _service.lastPeers.size());
		Assert.assertEquals(grown, StoreHelpers.readFolder(_store, FOLDER_ID));
		Assert.assertTrue(StoreHelpers.isInChatList(_store, ADDED1));
	}

	@Test
	public void testAcceptAvailableQuota() throws Throwable
	{
		FolderUpdates updates = new FolderUpdates(FOLDER_ID, "Shared", List.of(ADDED1_PEER), Map.of());
		_service.errors.put(FakeFolderInviteService.JOIN_UPDATES, QuotaErrors.FILTERS_TOO_MUCH);
		try
		{
			_poller.acceptAvailable(updates, List.of(ADDED1), new CancellationToken());
			Assert.fail();
		}
		catch (QuotaExceededException e)
		{
			Assert.assertEquals(QuotaKind.SHARED_FOLDER_JOIN_COUNT, e.getKind());
			Assert.assertEquals(2, e.getLimit());
			Assert.assertEquals(20, e.getPremiumLimit());
		}
		
		_service.errors.put(FakeFolderInviteService.JOIN_UPDATES, "CHATLIST_INVALID");
		try
		{
			_poller.acceptAvailable(updates, List.of(ADDED1), new CancellationToken());
			Assert.fail();
		}
		catch (FolderOperationException e)
		{
			// Expected.
		}
	}

	@Test
	public void testDismissIsLocalFirst() throws Throwable
	{
		StoreHelpers.putPendingUpdates(_store, new PendingUpdateRecord(FOLDER_ID, _now(), List.of(ADDED1), Map.of()));
		_service.errors.put(FakeFolderInviteService.HIDE_UPDATES, "FLOOD_WAIT_30");
		_poller.dismiss(FOLDER_ID);
		Assert.assertNull(StoreHelpers.readPendingUpdates(_store, FOLDER_ID));
		Assert.assertEquals(1, _service.getCallCount(FakeFolderInviteService.HIDE_UPDATES));
	}

	@Test
	public void testLeave() throws Throwable
	{
		StoreHelpers.addToChatList(_store, INCLUDED);
		_service.errors.put(FakeFolderInviteService.LEAVE, "FLOOD_WAIT_30");
		_poller.leave(FOLDER_ID, List.of(INCLUDED), new CancellationToken());
		Assert.assertNotNull(StoreHelpers.readFolder(_store, FOLDER_ID));
		
		_service.errors.remove(FakeFolderInviteService.LEAVE);
		_service.leaveResult = new RemoteUpdates(List.of(RemoteUpdate.folderDeleted(FOLDER_ID), RemoteUpdate.chatLeft(INCLUDED)), List.of());
		_poller.leave(FOLDER_ID, List.of(INCLUDED), new CancellationToken());
		Assert.assertNull(StoreHelpers.readFolder(_store, FOLDER_ID));
		Assert.assertFalse(StoreHelpers.isInChatList(_store, INCLUDED));
		Assert.assertEquals(2, _service.getCallCount(FakeFolderInviteService.LEAVE));
	}

	@Test
	public void testLeaveSuggestions() throws Throwable
	{
		_service.leaveSuggestionsResult = List.of(INCLUDED);
		Assert.assertEquals(List.of(INCLUDED), _poller.getLeaveSuggestions(FOLDER_ID, new CancellationToken()));
		_service.errors.put(FakeFolderInviteService.LEAVE_SUGGESTIONS, "CHATLIST_INVALID");
		Assert.assertTrue(_poller.getLeaveSuggestions(FOLDER_ID, new CancellationToken()).isEmpty());
	}


	private FolderUpdatesPoller _createPoller(IPollFailurePolicy policy)
	{
		return new FolderUpdatesPoller(new SilentLogger(), _account, _store, new SingleThreadedScheduler(_service), new LocalUpdateApplier(_store), _prefs, _observations, policy);
	}

	private int _now()
	{
		return MiscHelpers.unixSeconds(_account.currentTimeMillis());
	}
}
