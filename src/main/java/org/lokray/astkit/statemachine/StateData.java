package org.lokray.astkit.statemachine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a visit learned about one state.
 */
class StateData
{
	final List<String> actions = new ArrayList<>();
	// event name -> target state name
	final Map<String, String> transitions = new LinkedHashMap<>();
}
