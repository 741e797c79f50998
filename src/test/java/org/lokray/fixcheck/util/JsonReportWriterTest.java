package org.lokray.fixcheck.util;

import com.google.gson.Gson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lokray.fixcheck.analysis.AnalysisResult;
import org.lokray.fixcheck.analysis.Analyzer;
import org.lokray.fixcheck.dto.ReportDTO;
import org.lokray.fixcheck.dto.ResultDTO;
import org.lokray.fixcheck.semantic.EvaluationMode;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JsonReportWriterTest
{

	private static ReportDTO report()
	{
		List<AnalysisResult> results = new Analyzer().analyze(ReportPrinterTest.SOURCE);
		return JsonReportWriter.toDTO("synth.v", EvaluationMode.STRICT, List.of("Warning: something"), results);
	}

	@Test
	void reportCarriesResultsAndSummary()
	{
		ReportDTO report = report();

		assertEquals("synth.v", report.file);
		assertEquals("strict", report.mode);
		assertEquals(List.of("Warning: something"), report.warnings);
		assertEquals(3, report.results.size());
		assertEquals(3, report.summary.get("TOTAL"));
		assertEquals(1, report.summary.get("OK"));
		assertEquals(0, report.summary.get("MISSING_COMMENT"));

		ResultDTO first = report.results.get(0);
		assertEquals(3, first.line);
		assertEquals("OK", first.status);
		assertEquals("U8F0", first.declared);
		assertEquals("(vol + 8'd1)", first.computedText);
		assertEquals(4, first.statement.line);

		ResultDTO parseError = report.results.get(2);
		assertNull(parseError.computed);
		assertNull(parseError.statement);
	}

	@Test
	void writesReadableJson(@TempDir Path dir) throws Exception
	{
		Path out = dir.resolve("nested").resolve("report.json");
		JsonReportWriter.write(report(), out);

		ReportDTO read = new Gson().fromJson(Files.readString(out), ReportDTO.class);
		assertEquals(3, read.results.size());
		assertEquals("ERROR", read.results.get(1).status);
		assertEquals(3, read.summary.get("TOTAL"));
	}
}
