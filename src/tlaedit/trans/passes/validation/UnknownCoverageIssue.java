package tlaedit.trans.passes.validation;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

/**
 * A branch of an action assigns or leaves unchanged something that is not a variable.
 */
public class UnknownCoverageIssue extends Issue {

	private final String action;
	private final int branch;
	private final String name;

	public UnknownCoverageIssue(String action, int branch, String name) {
		this.action = action;
		this.branch = branch;
		this.name = name;
	}

	public String getAction() {
		return action;
	}

	public int getBranch() {
		return branch;
	}

	public String getName() {
		return name;
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
