package org.lokray.fixcheck.analysis;

import java.util.List;

public enum Status
{
	OK,
	ERROR,
	PARSE_ERROR,
	MISSING_TYPE,
	MISSING_COMMENT;

	/**
	 * Status of an evaluation that succeeded: any issue at all makes it an error.
	 */
	public static Status fromIssues(List<String> issues)
	{
		return issues.isEmpty() ? OK : ERROR;
	}
}
