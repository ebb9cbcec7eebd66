package tlaedit.trans;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Split an action in two at a new control location.
 *
 * The variables in the first half are still assigned by the original action; every other effect moves
 * to the new action. By default the first half is empty, so the original action only moves to the new
 * location. Names left null are derived from the action's and its locations' naming scheme.
 */
public class SplitActionRequest extends EditRequest {

	private final String actionName;
	private final List<String> firstHalf;
	private final String newName;
	private final String newLocation;

	public SplitActionRequest(String actionName, List<String> firstHalf, String newName, String newLocation) {
		this.actionName = actionName;
		this.firstHalf = firstHalf == null ? Collections.emptyList() : Collections.unmodifiableList(firstHalf);
		this.newName = newName;
		this.newLocation = newLocation;
	}

	public SplitActionRequest(String actionName) {
		this(actionName, null, null, null);
	}

	public String getActionName() {
		return actionName;
	}

	public List<String> getFirstHalf() {
		return firstHalf;
	}

	public String getNewName() {
		return newName;
	}

	public String getNewLocation() {
		return newLocation;
	}

	@Override
	public <T, E extends Throwable> T accept(EditRequestVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		SplitActionRequest other = (SplitActionRequest) obj;
		return actionName.equals(other.actionName) && firstHalf.equals(other.firstHalf) &&
				Objects.equals(newName, other.newName) && Objects.equals(newLocation, other.newLocation);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((actionName == null) ? 0 : actionName.hashCode());
		result = prime * result + ((firstHalf == null) ? 0 : firstHalf.hashCode());
		result = prime * result + ((newName == null) ? 0 : newName.hashCode());
		result = prime * result + ((newLocation == null) ? 0 : newLocation.hashCode());
		return result;
	}

	@Override
	public String toString() {
		return "split action " + actionName + (firstHalf.isEmpty() ? "" : " keeping " + firstHalf);
	}
}
