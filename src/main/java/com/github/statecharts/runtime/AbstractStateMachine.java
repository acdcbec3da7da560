package com.github.statecharts.runtime;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.statecharts.StatechartException;
import com.github.statecharts.StatechartException.Code;

/**
 * Base class of the generated state machines.
 *
 * Notes for users:<br>
 * 1. the states enum must end with the three sentinels {@code IGNORING_EVENT},
 * {@code CANNOT_HAPPEN} and {@code MAX_STATES}; real states are declared before them<br>
 *
 * 2. an external event dispatches its table of transitions: the first entry leaving the current
 * state whose guard passes wins. When every entry leaving the current state is refused by its
 * guard the machine stays where it is, when no entry leaves the current state the event is
 * ignored<br>
 *
 * 3. a transition requested from within a hook (typically the internal dispatch of the new state)
 * is memorized and processed by the loop of the running transition once the hook returns. Hooks
 * therefore never recurse into the machine<br>
 *
 * 4. leaving and entering hooks only run when the state changes<br>
 *
 * 5. instances are not thread-safe<br>
 */
public abstract class AbstractStateMachine<S extends Enum<S>> {
  private static final Logger logger =
      LogManager.getLogger(AbstractStateMachine.class.getSimpleName());

  private final S initialState;
  private final S ignoringEvent;
  private final S cannotHappen;
  private final S maxStates;
  private final Map<S, StateHooks> states;

  private S currentState;
  // transition requested while nesting, null when none
  private S nestingState;
  private Reaction nestingAction;
  private boolean nesting;

  protected AbstractStateMachine(final Class<S> stateType, final S initialState) {
    this.initialState = initialState;
    this.ignoringEvent = Enum.valueOf(stateType, "IGNORING_EVENT");
    this.cannotHappen = Enum.valueOf(stateType, "CANNOT_HAPPEN");
    this.maxStates = Enum.valueOf(stateType, "MAX_STATES");
    if (initialState.ordinal() >= maxStates.ordinal()) {
      throw new IllegalArgumentException("Initial state " + initialState + " is not a state");
    }
    this.states = new EnumMap<>(stateType);
    this.currentState = initialState;
  }

  /**
   * Reset the machine to its initial state. Generated machines extend it to reset their nested
   * machines and run the initial internal transition.
   */
  public void enter() throws StatechartException {
    reset();
    logDebug("Entering, current state " + stateName());
  }

  /**
   * Forget any memorized transition. Generated machines extend it to exit their nested machines.
   */
  public void exit() {
    nestingState = null;
    nestingAction = null;
    nesting = false;
    logDebug("Exiting from state " + stateName());
  }

  public void reset() {
    currentState = initialState;
    nestingState = null;
    nestingAction = null;
    nesting = false;
  }

  public S state() {
    return currentState;
  }

  public String stateName() {
    return currentState.toString();
  }

  public boolean isNesting() {
    return nesting;
  }

  /**
   * Hooks of the given state, created on first access.
   */
  protected StateHooks hooks(final S state) {
    StateHooks hooks = states.get(state);
    if (hooks == null) {
      hooks = new StateHooks();
      states.put(state, hooks);
    }
    return hooks;
  }

  /**
   * React to an external event.
   */
  protected void transition(final Transitions<S> transitions) throws StatechartException {
    logDebug("Reacting to event from state " + stateName());
    final List<Transitions.Entry<S>> candidates = transitions.from(currentState);
    if (candidates.isEmpty()) {
      transition(ignoringEvent, null);
      return;
    }
    for (final Transitions.Entry<S> candidate : candidates) {
      if (candidate.accepts()) {
        transition(candidate.getDestination(), candidate.getAction());
        return;
      }
      logDebug("Transition refused by the " + candidate.getDestination() + " guard");
    }
    logDebug("Stay in state " + stateName());
  }

  /**
   * Go to the destination state, running the action first. Called directly by the internal
   * dispatch of event-less transitions, whose guards are already checked.
   */
  protected void transition(final S destination, final Reaction action)
      throws StatechartException {
    nestingState = destination;
    nestingAction = action;
    if (nesting) {
      logDebug("Internal event. Memorize state " + destination);
      return;
    }
    do {
      final S nextState = nestingState;
      final Reaction reaction = nestingAction;
      nestingState = null;
      nestingAction = null;
      if (nextState == cannotHappen) {
        logger.error("[STATE MACHINE] Forbidden event in state " + stateName() + ". Aborting!");
        throw new StatechartException(Code.FORBIDDEN_EVENT,
            "Forbidden event in state " + stateName());
      } else if (nextState == ignoringEvent) {
        logDebug("Ignoring external event");
        return;
      } else if (nextState.ordinal() >= maxStates.ordinal()) {
        logger.error("[STATE MACHINE] Unknown state " + nextState + ". Aborting!");
        throw new StatechartException(Code.UNKNOWN_STATE, "Unknown state " + nextState);
      }
      final S previousState = currentState;
      currentState = nextState;
      nesting = true;
      try {
        logDebug("Transitioning to new state " + nextState);
        if (reaction != null) {
          logDebug("Do the action of transition " + previousState + " -> " + nextState);
          reaction.react();
        }
        if (previousState != nextState) {
          final StateHooks leaving = states.get(previousState);
          if (leaving != null && leaving.leaving != null) {
            logDebug("Do the state " + previousState + " 'on leaving' action");
            leaving.leaving.react();
          }
          final StateHooks entering = states.get(nextState);
          if (entering != null) {
            if (entering.entering != null) {
              logDebug("Do the state " + nextState + " 'on entry' action");
              entering.entering.react();
            }
            if (entering.activity != null) {
              logDebug("Do the state " + nextState + " activity");
              entering.activity.react();
            }
            if (entering.internal != null) {
              logDebug("Do the state " + nextState + " internal transition");
              entering.internal.react();
            }
          }
        } else {
          logDebug("Was previously in this state: no actions to perform");
        }
      } catch (StatechartException problem) {
        nestingState = null;
        nestingAction = null;
        throw problem;
      } finally {
        nesting = false;
      }
    } while (nestingState != null);
  }

  private static void logDebug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug("[STATE MACHINE] " + message);
    }
  }

  /**
   * Optional reactions attached to one state.
   */
  public static final class StateHooks {
    private Reaction entering;
    private Reaction leaving;
    private Reaction internal;
    private Reaction activity;

    public StateHooks entering(final Reaction entering) {
      this.entering = entering;
      return this;
    }

    public StateHooks leaving(final Reaction leaving) {
      this.leaving = leaving;
      return this;
    }

    public StateHooks internal(final Reaction internal) {
      this.internal = internal;
      return this;
    }

    public StateHooks activity(final Reaction activity) {
      this.activity = activity;
      return this;
    }
  }
}
