package tlaedit.errors;

import tlaedit.trans.intermediate.IOErrorIssue;
import tlaedit.trans.intermediate.NotFoundIssue;
import tlaedit.trans.passes.addvar.DuplicateNameIssue;
import tlaedit.trans.passes.addvar.MissingTypeIssue;
import tlaedit.trans.passes.addvar.UnresolvedReferenceIssue;
import tlaedit.trans.passes.parse.ParsingIssue;
import tlaedit.trans.passes.parse.option.OptionParserIssue;
import tlaedit.trans.passes.split.AmbiguousNameIssue;
import tlaedit.trans.passes.split.CollisionUnresolvableIssue;
import tlaedit.trans.passes.split.NotSplittableIssue;
import tlaedit.trans.passes.validation.*;

public abstract class IssueVisitor<T, E extends Throwable> {

	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(NotFoundIssue notFoundIssue) throws E;
	public abstract T visit(DuplicateNameIssue duplicateNameIssue) throws E;
	public abstract T visit(UnresolvedReferenceIssue unresolvedReferenceIssue) throws E;
	public abstract T visit(MissingTypeIssue missingTypeIssue) throws E;
	public abstract T visit(NotSplittableIssue notSplittableIssue) throws E;
	public abstract T visit(AmbiguousNameIssue ambiguousNameIssue) throws E;
	public abstract T visit(CollisionUnresolvableIssue collisionUnresolvableIssue) throws E;
	public abstract T visit(UncoveredVariableIssue uncoveredVariableIssue) throws E;
	public abstract T visit(OverlappingCoverageIssue overlappingCoverageIssue) throws E;
	public abstract T visit(UnknownCoverageIssue unknownCoverageIssue) throws E;
	public abstract T visit(UndeclaredLocationIssue undeclaredLocationIssue) throws E;
	public abstract T visit(UnusedLocationIssue unusedLocationIssue) throws E;

}
