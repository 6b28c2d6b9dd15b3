package org.lokray.astkit.statemachine;

import org.lokray.astkit.check.SyntaxChecker;
import org.lokray.astkit.visit.VisitControl;
import org.lokray.astkit.visit.VisitResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks state machines: an event may trigger at most one transition per state, and a transition must
 * lead to another state. Each {@link State} is a scope holding the events it reacts to.
 */
public class StateMachineChecker extends SyntaxChecker
{
	private final Map<String, StateData> stateData = new LinkedHashMap<>();
	private String currentState;

	public StateMachineChecker(String text)
	{
		this(text, Map.of());
	}

	public StateMachineChecker(String text, Map<String, ?> options)
	{
		super(text, options);
		registerError(StateMachineError.EVENT_REDECLARED, "Event redeclared", "In state {s}: event {e} redeclared");
		registerError(StateMachineError.EVENT_NO_EFFECT, "Event has no effect", "In state {s}: event {e} has no effect");

		onPreVisit("State", (visitor, node) -> enterState((State) node));
		onPreVisit("Transition", VisitControl.noChildVisits((visitor, node) -> checkTransition((Transition) node)));
		onPostVisit("Transition", (visitor, node) -> recordTransition((Transition) node));
		onPostVisit("Action", (visitor, node) -> recordAction((Action) node));
	}

	private void enterState(State state)
	{
		currentState = state.getName();
		stateData.put(state.getName(), new StateData());
	}

	private void checkTransition(Transition transition)
	{
		String event = transition.getEvent().getName();
		if (scopedSymbolLookup(event) != null)
		{
			throw getErrorFromCode(transition, StateMachineError.EVENT_REDECLARED, Map.of("e", event, "s", currentState));
		}
		collectSymbol(event, transition.getEvent());

		if (transition.getToState().getName().equals(currentState))
		{
			throw getErrorFromCode(transition, StateMachineError.EVENT_NO_EFFECT, Map.of("e", event, "s", currentState));
		}
	}

	private VisitResult recordTransition(Transition transition)
	{
		getCurrentStateData().transitions.put(transition.getEvent().getName(), transition.getToState().getName());
		return VisitResult.keep();
	}

	private VisitResult recordAction(Action action)
	{
		if (currentState != null)
		{
			getCurrentStateData().actions.add(action.getCommand().getName());
		}
		return VisitResult.keep();
	}

	public List<String> getStates()
	{
		return new ArrayList<>(stateData.keySet());
	}

	public String getCurrentState()
	{
		return currentState;
	}

	private StateData getCurrentStateData()
	{
		return currentState == null ? null : stateData.get(currentState);
	}

	public List<String> getStateActions(String state)
	{
		return Collections.unmodifiableList(dataOf(state).actions);
	}

	public Map<String, String> getStateTransitions(String state)
	{
		return Collections.unmodifiableMap(dataOf(state).transitions);
	}

	private StateData dataOf(String state)
	{
		StateData data = stateData.get(state);
		if (data == null)
		{
			throw new IllegalArgumentException("unknown state: " + state);
		}
		return data;
	}
}
