package tlaedit.trans.passes.addvar;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

/**
 * The name of a variable to add is already taken.
 */
public class DuplicateNameIssue extends Issue {

	private final String name;

	public DuplicateNameIssue(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public ErrorKind getKind() {
		return ErrorKind.DUPLICATE_NAME;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
