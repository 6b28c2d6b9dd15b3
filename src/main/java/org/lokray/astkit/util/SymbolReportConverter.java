package org.lokray.astkit.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.lokray.astkit.ast.Node;
import org.lokray.astkit.check.SourceLocation;
import org.lokray.astkit.check.SyntaxChecker;
import org.lokray.astkit.dto.ScopeDTO;
import org.lokray.astkit.dto.SymbolDTO;
import org.lokray.astkit.dto.SymbolReportDTO;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;

public class SymbolReportConverter
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static SymbolReportDTO toReport(String source, SyntaxChecker checker)
	{
		SymbolReportDTO report = new SymbolReportDTO();
		report.source = source;
		for (Map.Entry<String, Map<String, Node>> scope : checker.reportSymbols().entrySet())
		{
			ScopeDTO dto = new ScopeDTO();
			dto.name = scope.getKey();
			scope.getValue().forEach((name, node) -> dto.symbols.add(symbolToDTO(checker, name, node)));
			report.scopes.add(dto);
		}
		return report;
	}

	private static SymbolDTO symbolToDTO(SyntaxChecker checker, String name, Node node)
	{
		SymbolDTO dto = new SymbolDTO();
		dto.name = name;
		dto.kind = node.getKind();
		dto.nodeId = node.getId();
		SourceLocation location = checker.findNodeLine(node, null);
		if (location != null)
		{
			dto.line = location.getLine();
			dto.column = location.getColumn();
		}
		return dto;
	}

	public static String toJson(SymbolReportDTO report)
	{
		return GSON.toJson(report);
	}

	public static SymbolReportDTO fromJson(String json)
	{
		return GSON.fromJson(json, SymbolReportDTO.class);
	}

	public static void write(SymbolReportDTO report, Path outPath) throws IOException
	{
		if (outPath.getParent() != null)
		{
			Files.createDirectories(outPath.getParent());
		}
		Files.writeString(outPath, toJson(report), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote symbol report to: " + outPath);
	}
}
