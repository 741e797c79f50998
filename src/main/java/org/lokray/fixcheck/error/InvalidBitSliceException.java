package org.lokray.fixcheck.error;

public class InvalidBitSliceException extends FixedPointException
{
	private final String name;
	private final int high;
	private final int low;

	public InvalidBitSliceException(String name, int high, int low)
	{
		super(String.format("Invalid bit slice width: %d for %s[%d:%d]", high - low + 1, name, high, low));
		this.name = name;
		this.high = high;
		this.low = low;
	}

	public String getName()
	{
		return name;
	}

	public int getHigh()
	{
		return high;
	}

	public int getLow()
	{
		return low;
	}
}
