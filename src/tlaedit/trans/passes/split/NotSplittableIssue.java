package tlaedit.trans.passes.split;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

public class NotSplittableIssue extends Issue {

	private final String action;
	private final String reason;

	public NotSplittableIssue(String action, String reason) {
		this.action = action;
		this.reason = reason;
	}

	public String getAction() {
		return action;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public ErrorKind getKind() {
		return ErrorKind.NOT_SPLITTABLE;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
