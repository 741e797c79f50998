package org.lokray.fixcheck.ast;

public enum BinaryOperator
{
	ADD("+"),
	SUBTRACT("-"),
	MULTIPLY("*"),
	DIVIDE("/"),
	SHIFT_LEFT("<<"),
	SHIFT_RIGHT(">>"),
	SHIFT_RIGHT_SIGNED(">>>");

	private final String symbol;

	BinaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public boolean isAdditive()
	{
		return this == ADD || this == SUBTRACT;
	}

	public boolean isMultiplicative()
	{
		return this == MULTIPLY || this == DIVIDE;
	}

	public boolean isShift()
	{
		return this == SHIFT_LEFT || this == SHIFT_RIGHT || this == SHIFT_RIGHT_SIGNED;
	}

	public static BinaryOperator fromSymbol(String symbol)
	{
		for (BinaryOperator op : values())
		{
			if (op.symbol.equals(symbol))
			{
				return op;
			}
		}
		throw new IllegalArgumentException("Unknown operator: " + symbol);
	}

	@Override
	public String toString()
	{
		return symbol;
	}
}
