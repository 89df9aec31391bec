package com.jeffdisher.folderlinks.data;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;


public class TestStateDispatcher
{
	@Test
	public void testRunsInOrderOffThread() throws Throwable
	{
		StateDispatcher dispatcher = new StateDispatcher();
		dispatcher.start();
		Thread caller = Thread.currentThread();
		List<Integer> order = new ArrayList<>();
		boolean[] sawOtherThread = new boolean[] { true };
		for (int i = 0; i < 5; ++i)
		{
			int value = i;
			dispatcher.accept(() -> {
				sawOtherThread[0] &= (Thread.currentThread() != caller);
				order.add(value);
			});
		}
		dispatcher.shutdown();
		Assert.assertEquals(List.of(0, 1, 2, 3, 4), order);
		Assert.assertTrue(sawOtherThread[0]);
	}

	@Test
	public void testDropsAfterShutdown() throws Throwable
	{
		StateDispatcher dispatcher = new StateDispatcher();
		dispatcher.start();
		dispatcher.shutdown();
		int[] runs = new int[1];
		dispatcher.accept(() -> runs[0] += 1);
		Assert.assertEquals(0, runs[0]);
	}
}
