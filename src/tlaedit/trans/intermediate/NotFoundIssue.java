package tlaedit.trans.intermediate;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

/**
 * A definition or a role (such as the initial predicate) an edit depends on does not exist.
 */
public class NotFoundIssue extends Issue {

	private final String what;
	private final String name;

	public NotFoundIssue(String what, String name) {
		this.what = what;
		this.name = name;
	}

	public String getWhat() {
		return what;
	}

	public String getName() {
		return name;
	}

	@Override
	public ErrorKind getKind() {
		return ErrorKind.NOT_FOUND;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
