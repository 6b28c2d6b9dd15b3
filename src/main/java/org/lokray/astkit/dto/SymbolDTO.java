package org.lokray.astkit.dto;

public class SymbolDTO
{
	public String name;
	public String kind;
	public long nodeId;
	public Integer line;
	public Integer column;
}
