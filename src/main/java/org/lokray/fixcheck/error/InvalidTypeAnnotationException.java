package org.lokray.fixcheck.error;

/**
 * Raised for a malformed type token, or a signed token with no room for the sign bit (S8F8).
 */
public class InvalidTypeAnnotationException extends FixedPointException
{
	private final String token;

	public InvalidTypeAnnotationException(String token, String reason)
	{
		super(reason + ": " + token);
		this.token = token;
	}

	public String getToken()
	{
		return token;
	}
}
