package org.lokray.astkit.dto;

import java.util.ArrayList;
import java.util.List;

public class ScopeDTO
{
	public String name;
	public List<SymbolDTO> symbols = new ArrayList<>();
}
