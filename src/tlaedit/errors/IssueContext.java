package tlaedit.errors;

public abstract class IssueContext {

	public abstract void error(Issue err);

	/**
	 * @return true if any issue that is not a warning was reported
	 */
	public abstract boolean hasErrors();

	public IssueContext withContext(Context context) {
		return new NestedIssueContext(this, context);
	}
}
