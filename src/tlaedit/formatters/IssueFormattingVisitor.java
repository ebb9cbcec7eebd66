package tlaedit.formatters;

import tlaedit.errors.IssueVisitor;
import tlaedit.errors.IssueWithContext;
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

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("unable to parse options: ");
		out.write(optionParserIssue.getMessage());
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing " + parsingIssue.getWhat() + ": ");
		out.write(parsingIssue.getError().getMsg());
		return null;
	}

	@Override
	public Void visit(NotFoundIssue notFoundIssue) throws IOException {
		out.write("could not find ");
		out.write(notFoundIssue.getWhat());
		if (notFoundIssue.getName() != null) {
			out.write(" ");
			out.write(notFoundIssue.getName());
		}
		return null;
	}

	@Override
	public Void visit(DuplicateNameIssue duplicateNameIssue) throws IOException {
		out.write("name ");
		out.write(duplicateNameIssue.getName());
		out.write(" is already declared");
		return null;
	}

	@Override
	public Void visit(UnresolvedReferenceIssue unresolvedReferenceIssue) throws IOException {
		out.write(unresolvedReferenceIssue.isInType() ? "type" : "initial value");
		out.write(" refers to undeclared name ");
		out.write(unresolvedReferenceIssue.getReference().getId());
		out.write(" ");
		unresolvedReferenceIssue.getReference().getLocation().writePretty(out);
		return null;
	}

	@Override
	public Void visit(MissingTypeIssue missingTypeIssue) throws IOException {
		out.write("a type is required for variable ");
		out.write(missingTypeIssue.getVariable());
		out.write(" to extend the type invariant ");
		out.write(missingTypeIssue.getTypeInvariant());
		return null;
	}

	@Override
	public Void visit(NotSplittableIssue notSplittableIssue) throws IOException {
		out.write("cannot split action ");
		out.write(notSplittableIssue.getAction());
		out.write(": ");
		out.write(notSplittableIssue.getReason());
		return null;
	}

	@Override
	public Void visit(AmbiguousNameIssue ambiguousNameIssue) throws IOException {
		out.write("cannot derive a name for the new ");
		out.write(ambiguousNameIssue.getWhat());
		out.write(" from ");
		out.write(ambiguousNameIssue.getBasedOn());
		out.write("; please name it explicitly");
		return null;
	}

	@Override
	public Void visit(CollisionUnresolvableIssue collisionUnresolvableIssue) throws IOException {
		out.write("cannot rename to ");
		out.write(collisionUnresolvableIssue.getName());
		out.write(": ");
		out.write(collisionUnresolvableIssue.getReason());
		return null;
	}

	@Override
	public Void visit(UncoveredVariableIssue uncoveredVariableIssue) throws IOException {
		out.write("variable ");
		out.write(uncoveredVariableIssue.getVariable());
		out.write(" is neither assigned nor unchanged in branch ");
		out.write(Integer.toString(uncoveredVariableIssue.getBranch()));
		out.write(" of action ");
		out.write(uncoveredVariableIssue.getAction());
		return null;
	}

	@Override
	public Void visit(OverlappingCoverageIssue overlappingCoverageIssue) throws IOException {
		out.write("variable ");
		out.write(overlappingCoverageIssue.getVariable());
		out.write(" is accounted for ");
		out.write(Integer.toString(overlappingCoverageIssue.getCount()));
		out.write(" times in branch ");
		out.write(Integer.toString(overlappingCoverageIssue.getBranch()));
		out.write(" of action ");
		out.write(overlappingCoverageIssue.getAction());
		return null;
	}

	@Override
	public Void visit(UnknownCoverageIssue unknownCoverageIssue) throws IOException {
		out.write(unknownCoverageIssue.getName());
		out.write(" is not a variable, but branch ");
		out.write(Integer.toString(unknownCoverageIssue.getBranch()));
		out.write(" of action ");
		out.write(unknownCoverageIssue.getAction());
		out.write(" assigns it or leaves it unchanged");
		return null;
	}

	@Override
	public Void visit(UndeclaredLocationIssue undeclaredLocationIssue) throws IOException {
		out.write("action ");
		out.write(undeclaredLocationIssue.getAction());
		out.write(" uses control location ");
		out.write(undeclaredLocationIssue.getLocation().toString());
		out.write(", which is missing from the location enumeration");
		return null;
	}

	@Override
	public Void visit(UnusedLocationIssue unusedLocationIssue) throws IOException {
		out.write("control location ");
		out.write(unusedLocationIssue.getLocation().toString());
		out.write(" is enumerated but no action uses it");
		return null;
	}
}
