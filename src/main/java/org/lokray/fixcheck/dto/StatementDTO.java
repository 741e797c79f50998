package org.lokray.fixcheck.dto;

import java.util.ArrayList;
import java.util.List;

public class StatementDTO
{
	public int line;
	public String status;
	public String expression;
	public String computed;
	public List<String> issues = new ArrayList<>();
}
