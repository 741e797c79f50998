package org.lokray.fixcheck.semantic;

/**
 * How binary operators size their result.
 */
public enum EvaluationMode
{
	/**
	 * Overflow-avoiding growth: products widen to the sum of their operands, signedness is the OR of both sides.
	 */
	STRICT,

	/**
	 * Mirrors Verilog's silent truncation: results keep the wider operand's width, signedness is the AND of both sides.
	 */
	TRUNCATING;

	public static EvaluationMode fromName(String name)
	{
		for (EvaluationMode mode : values())
		{
			if (mode.name().equalsIgnoreCase(name))
			{
				return mode;
			}
		}
		throw new IllegalArgumentException("Unknown evaluation mode: " + name + " (expected strict or truncating)");
	}
}
