package com.jeffdisher.folderlinks.utils;


/**
 * Assertion idioms which can't be disabled at runtime.  These are for states which the engine considers impossible,
 * not for errors which a caller could cause.
 */
public class Assert
{
	/**
	 * Called when an exception was not expected.
	 * 
	 * @param e The unexpected exception.
	 * @return Does not return - this is only here so the caller can throw this to satisfy the compiler.
	 */
	public static AssertionError unexpected(Exception e)
	{
		throw new AssertionError("Unexpected exception", e);
	}

	/**
	 * States that something must be true, failing if it isn't.
	 * 
	 * @param flag The statement which must be true.
	 */
	public static void assertTrue(boolean flag)
	{
		if (!flag)
		{
			throw new AssertionError("Expected true");
		}
	}

	/**
	 * Called when a code path which is statically never expected to be reachable is executed.
	 * 
	 * @return Does not return - this is only here so the caller can throw this to satisfy the compiler.
	 */
	public static AssertionError unreachable()
	{
		throw new AssertionError("Unreachable code path hit");
	}
}
