package tlaedit.trans.passes.addvar;

import tlaedit.errors.ErrorKind;
import tlaedit.errors.Issue;
import tlaedit.errors.IssueVisitor;

public class MissingTypeIssue extends Issue {

	private final String variable;
	private final String typeInvariant;

	public MissingTypeIssue(String variable, String typeInvariant) {
		this.variable = variable;
		this.typeInvariant = typeInvariant;
	}

	public String getVariable() {
		return variable;
	}

	public String getTypeInvariant() {
		return typeInvariant;
	}

	@Override
	public ErrorKind getKind() {
		return ErrorKind.MISSING_TYPE;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
