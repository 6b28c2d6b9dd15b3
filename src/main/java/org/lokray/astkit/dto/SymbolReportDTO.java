package org.lokray.astkit.dto;

import java.util.ArrayList;
import java.util.List;

public class SymbolReportDTO
{
	public String source;
	public List<ScopeDTO> scopes = new ArrayList<>();
}
