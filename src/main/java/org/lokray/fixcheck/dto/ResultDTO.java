package org.lokray.fixcheck.dto;

import java.util.ArrayList;
import java.util.List;

public class ResultDTO
{
	public int line;
	public String status;
	public String expression;
	public String computedText;
	public String declared;
	public String computed;
	public List<String> issues = new ArrayList<>();
	public StatementDTO statement;
}
