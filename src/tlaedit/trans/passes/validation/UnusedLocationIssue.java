package tlaedit.trans.passes.validation;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;
import tlaedit.trans.intermediate.ControlLocation;

/**
 * An enumerated control location that no action is guarded on or moves to. Only a warning: unused
 * locations are sometimes left in on purpose.
 */
public class UnusedLocationIssue extends Issue {

	private final ControlLocation location;

	public UnusedLocationIssue(ControlLocation location) {
		this.location = location;
	}

	public ControlLocation getLocation() {
		return location;
	}

	@Override
	public ErrorKind getKind() {
		return ErrorKind.VIOLATION;
	}

	@Override
	public boolean isWarning() {
		return true;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
