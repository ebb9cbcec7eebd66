package tlaedit.trans.passes.parse;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;
import tlaedit.parser.TLAParseException;

public class ParsingIssue extends Issue {
	private final String what;
	private final TLAParseException error;

	public ParsingIssue(String what, TLAParseException error) {
		initCause(error);
		this.what = what;
		this.error = error;
	}

	public TLAParseException getError() {
		return error;
	}

	/**
	 * @return what was being parsed, such as "TLA+ module" or "initial value"
	 */
	public String getWhat() { return what; }

	@Override
	public ErrorKind getKind() {
		return ErrorKind.SYNTAX_ERROR;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
