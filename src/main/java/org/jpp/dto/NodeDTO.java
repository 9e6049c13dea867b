package org.jpp.dto;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class NodeDTO
{
	public String kind;
	public Map<String, Object> properties = new LinkedHashMap<>();
	public Map<String, List<NodeDTO>> children = new LinkedHashMap<>();
}
