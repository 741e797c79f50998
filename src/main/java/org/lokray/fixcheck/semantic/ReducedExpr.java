package org.lokray.fixcheck.semantic;

import org.lokray.fixcheck.semantic.type.FixedPointType;

/**
 * A sub-expression after reduction: its type plus its canonical, fully parenthesized text.
 */
public final class ReducedExpr
{
	private final FixedPointType type;
	private final String text;

	public ReducedExpr(FixedPointType type, String text)
	{
		this.type = type;
		this.text = text;
	}

	public FixedPointType getType()
	{
		return type;
	}

	public String getText()
	{
		return text;
	}

	@Override
	public String toString()
	{
		return text + " : " + type;
	}
}
