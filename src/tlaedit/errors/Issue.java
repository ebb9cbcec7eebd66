package tlaedit.errors;

import tlaedit.Unreachable;
import tlaedit.formatters.IndentingWriter;
import tlaedit.formatters.IssueFormattingVisitor;
import tlaedit.trans.EditException;

import java.io.IOException;
import java.io.StringWriter;

public abstract class Issue extends EditException {
	public Issue() {
		super("");
	}
	public Issue(String msg) {
		super(msg);
	}

	@Override
	public String getMessage() {
		StringWriter sw = new StringWriter();
		IndentingWriter out = new IndentingWriter(sw);
		try {
			accept(new IssueFormattingVisitor(out));
		} catch (IOException e) {
			throw new Unreachable(); // string ops don't throw IO exceptions
		}
		return sw.getBuffer().toString();
	}

	public abstract ErrorKind getKind();

	/**
	 * Warnings are reported alongside errors but never make an edit fail.
	 */
	public boolean isWarning() {
		return false;
	}

	public Issue withContext(Context ctx) {
		return new IssueWithContext(this, ctx);
	}

	public abstract <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E;

}
