package org.lokray.astkit.statemachine;

import org.lokray.astkit.visit.VisitResult;
import org.lokray.astkit.visit.Visitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects states, actions and transitions without checking them. A state name seen twice keeps the data
 * of its first declaration.
 */
public class StateMachineVisitor extends Visitor
{
	private final Map<String, StateData> stateData = new LinkedHashMap<>();
	private final Deque<String> stateStack = new ArrayDeque<>();
	private boolean ignoreState = false;

	public StateMachineVisitor()
	{
		this(Map.of());
	}

	public StateMachineVisitor(Map<String, ?> options)
	{
		super(options);
		onPreVisit("State", (visitor, node) -> enterState((State) node));
		onPostVisit("State", (visitor, node) -> exitState());
		onPostVisit("Transition", (visitor, node) ->
		{
			Transition transition = (Transition) node;
			currentStateData().transitions.put(transition.getEvent().getName(), transition.getToState().getName());
			return VisitResult.keep();
		});
		onPostVisit("Action", (visitor, node) ->
		{
			if (getCurrentState() != null)
			{
				currentStateData().actions.add(((Action) node).getCommand().getName());
			}
			return VisitResult.keep();
		});
	}

	private void enterState(State state)
	{
		if (stateData.containsKey(state.getName()))
		{
			dontVisitChildren();
			ignoreState = true;
			return;
		}
		stateData.put(state.getName(), new StateData());
		stateStack.push(state.getName());
	}

	private VisitResult exitState()
	{
		if (!ignoreState)
		{
			stateStack.pop();
		}
		else
		{
			ignoreState = false;
		}
		return VisitResult.keep();
	}

	public List<String> getStates()
	{
		return new ArrayList<>(stateData.keySet());
	}

	public String getCurrentState()
	{
		return stateStack.peek();
	}

	private StateData currentStateData()
	{
		return stateData.get(getCurrentState());
	}

	public List<String> getStateActions(String state)
	{
		return Collections.unmodifiableList(stateData.get(state).actions);
	}

	public Map<String, String> getStateTransitions(String state)
	{
		return Collections.unmodifiableMap(stateData.get(state).transitions);
	}
}
