package tlaedit.trans.passes.validation;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

/**
 * A branch of an action neither assigns a variable nor leaves it unchanged.
 */
public class UncoveredVariableIssue extends Issue {

	private final String action;
	private final int branch;
	private final String variable;

	public UncoveredVariableIssue(String action, int branch, String variable) {
		this.action = action;
		this.branch = branch;
		this.variable = variable;
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

	@Override
	public ErrorKind getKind() {
		return ErrorKind.VIOLATION;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
