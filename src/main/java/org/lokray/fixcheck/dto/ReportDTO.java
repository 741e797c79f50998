package org.lokray.fixcheck.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ReportDTO
{
	public String file;
	public String mode;
	public List<String> warnings = new ArrayList<>();
	public List<ResultDTO> results = new ArrayList<>();
	public Map<String, Integer> summary = new LinkedHashMap<>();
}
