package tlaedit.trans.passes.parse.option;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

public class OptionParserIssue extends Issue {
	private final String message;

	public OptionParserIssue(String message) {
		this.message = message;
	}

	public String getMessage() {
		return message;
	}

	@Override
	public ErrorKind getKind() {
		return ErrorKind.OPTION_ERROR;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
