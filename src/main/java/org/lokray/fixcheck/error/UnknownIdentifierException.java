package org.lokray.fixcheck.error;

public class UnknownIdentifierException extends FixedPointException
{
	private final String name;

	public UnknownIdentifierException(String name)
	{
		super("Unknown identifier: " + name);
		this.name = name;
	}

	public String getName()
	{
		return name;
	}
}
