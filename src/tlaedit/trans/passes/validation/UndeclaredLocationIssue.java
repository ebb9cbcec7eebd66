package tlaedit.trans.passes.validation;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;
import tlaedit.trans.intermediate.ControlLocation;

public class UndeclaredLocationIssue extends Issue {

	private final String action;
	private final ControlLocation location;

	public UndeclaredLocationIssue(String action, ControlLocation location) {
		this.action = action;
		this.location = location;
	}

	public String getAction() {
		return action;
	}

	public ControlLocation getLocation() {
		return location;
	}

	@Override
	public ErrorKind getKind() {
		return ErrorKind.VIOLATION;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
