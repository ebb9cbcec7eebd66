package tlaedit.trans.passes.addvar;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;
import tlaedit.model.tla.TLAIdentifier;

/**
 * An expression supplied with a request refers to a name the module does not declare. In an initial
 * value this is a syntax error; in a type it means no usable type was given.
 */
public class UnresolvedReferenceIssue extends Issue {

	private final TLAIdentifier reference;
	private final boolean inType;

	public UnresolvedReferenceIssue(TLAIdentifier reference, boolean inType) {
		this.reference = reference;
		this.inType = inType;
	}

	public TLAIdentifier getReference() {
		return reference;
	}

	public boolean isInType() {
		return inType;
	}

	@Override
	public ErrorKind getKind() {
		return inType ? ErrorKind.MISSING_TYPE : ErrorKind.SYNTAX_ERROR;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
