package tlaedit.trans.passes.split;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

public class CollisionUnresolvableIssue extends Issue {

	private final String name;
	private final String reason;

	public CollisionUnresolvableIssue(String name, String reason) {
		this.name = name;
		this.reason = reason;
	}

	public String getName() {
		return name;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public ErrorKind getKind() {
		return ErrorKind.COLLISION_UNRESOLVABLE;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
