package tlaedit.errors;

public class IssueWithContext extends Issue {
	Context context;
	Issue issue;

	public IssueWithContext(Issue issue, Context context) {
		this.issue = issue;
		this.context = context;
	}

	public Issue getIssue() {
		return issue;
	}

	public Context getContext() {
		return context;
	}

	@Override
	public ErrorKind getKind() {
		return issue.getKind();
	}

	@Override
	public boolean isWarning() {
		return issue.isWarning();
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
