package tlaedit.trans.passes.effects;

import tlaedit.model.tla.TLAExpression;
import tlaedit.model.tla.TLAUnary;

import java.util.*;

/**
 * What one leaf branch of an action does to the state.
 */
public class BranchEffects {

	private final List<String> assigned;
	private final List<String> unchanged;
	private final List<String> unknownUnchanged;
	private final List<TLAUnary> unchangedNodes;
	private final Set<String> expandedTuples;
	private final List<TLAExpression> pathCondition;
	private final List<String> delegated;
	private final List<TLAExpression> choices;
	private final TLAExpression container;

	BranchEffects(List<String> assigned, List<String> unchanged, List<String> unknownUnchanged,
	              List<TLAUnary> unchangedNodes, Set<String> expandedTuples, List<TLAExpression> pathCondition,
	              List<String> delegated, List<TLAExpression> choices, TLAExpression container) {
		this.assigned = Collections.unmodifiableList(assigned);
		this.unchanged = Collections.unmodifiableList(unchanged);
		this.unknownUnchanged = Collections.unmodifiableList(unknownUnchanged);
		this.unchangedNodes = Collections.unmodifiableList(unchangedNodes);
		this.expandedTuples = Collections.unmodifiableSet(expandedTuples);
		this.pathCondition = Collections.unmodifiableList(pathCondition);
		this.delegated = Collections.unmodifiableList(delegated);
		this.choices = Collections.unmodifiableList(choices);
		this.container = container;
	}

	/**
	 * @return the primed variable of every assignment on this branch, repeats included
	 */
	public List<String> getAssigned() {
		return assigned;
	}

	public Set<String> getPrimed() {
		return new LinkedHashSet<>(assigned);
	}

	/**
	 * @return the variables listed by this branch's UNCHANGED clauses, with tuple definitions expanded
	 * and repeats included
	 */
	public List<String> getUnchanged() {
		return unchanged;
	}

	public Set<String> getUnchangedSet() {
		return new LinkedHashSet<>(unchanged);
	}

	/**
	 * @return the text of everything an UNCHANGED clause lists that is not a variable
	 */
	public List<String> getUnknownUnchanged() {
		return unknownUnchanged;
	}

	public List<TLAUnary> getUnchangedNodes() {
		return unchangedNodes;
	}

	/**
	 * @return the tuple definitions (such as vars) the UNCHANGED clauses were expanded through
	 */
	public Set<String> getExpandedTuples() {
		return expandedTuples;
	}

	public List<TLAExpression> getPathCondition() {
		return pathCondition;
	}

	public List<String> getDelegated() {
		return delegated;
	}

	/**
	 * @return true if this branch hands over to another action, whose own branches account for the state
	 */
	public boolean isDelegated() {
		return !delegated.isEmpty();
	}

	/**
	 * @return the disjuncts and conditional arms taken to reach this branch, outermost first
	 */
	public List<TLAExpression> getChoices() {
		return choices;
	}

	/**
	 * @return the innermost expression that holds this branch and nothing else: its last choice, or the
	 * whole action body for an action without any
	 */
	public TLAExpression getContainer() {
		return container;
	}

	/**
	 * @return how often this branch accounts for variable, by assignment or UNCHANGED
	 */
	public int coverageOf(String variable) {
		return Collections.frequency(assigned, variable) + Collections.frequency(unchanged, variable);
	}

	@Override
	public String toString() {
		return "BranchEffects [assigned=" + assigned + ", unchanged=" + unchanged + ", delegated=" + delegated + "]";
	}
}
