package org.javai.specmark.effect;

/**
 * Well-known effect names.
 */
public final class Effects {

	/** The algorithm may call back into author code. */
	public static final String USER_CODE = "user-code";

	private Effects() {}
}
