package tlaedit.trans.passes.validation;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

/**
 * A branch of an action accounts for a variable more than once.
 */
public class OverlappingCoverageIssue extends Issue {

	private final String action;
	private final int branch;
	private final String variable;
	private final int count;

	public OverlappingCoverageIssue(String action, int branch, String variable, int count) {
		this.action = action;
		this.branch = branch;
		this.variable = variable;
		this.count = count;
	}

	public String getAction() {
		return action;
	}

	public int getBranch() {
		return branch;
	}

	public String getVariable() {
		return variable;
	}

	public int getCount() {
		return count;
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
