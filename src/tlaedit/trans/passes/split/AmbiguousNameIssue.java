package tlaedit.trans.passes.split;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

/**
 * No name can be derived for a new action or location, and none was given.
 */
public class AmbiguousNameIssue extends Issue {

	private final String what;
	private final String basedOn;

	public AmbiguousNameIssue(String what, String basedOn) {
		this.what = what;
		this.basedOn = basedOn;
	}

	public String getWhat() {
		return what;
	}

	public String getBasedOn() {
		return basedOn;
	}

	@Override
	public ErrorKind getKind() {
		return ErrorKind.AMBIGUOUS_NAME;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
