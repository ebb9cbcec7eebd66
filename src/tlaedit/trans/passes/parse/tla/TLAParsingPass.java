package tlaedit.trans.passes.parse.tla;

import tlaedit.errors.Issue;
import tlaedit.model.tla.TLAExpression;
import tlaedit.model.tla.TLAGeneralIdentifier;
import tlaedit.model.tla.TLAModule;
import tlaedit.parser.TLAParseException;
import tlaedit.parser.TLAParser;
import tlaedit.trans.passes.parse.ParsingIssue;
import tlaedit.util.SourceFile;

import java.nio.file.Path;
import java.util.Collections;

public class TLAParsingPass {
	private TLAParsingPass() {}

	public static TLAModule perform(Path inputFileName, String inputFileContents) throws Issue {
		try {
			return TLAParser.readModule(new SourceFile(inputFileName, inputFileContents));
		} catch (TLAParseException e) {
			throw new ParsingIssue("TLA+ module", e);
		}
	}

	/**
	 * Parses an expression that came with an edit request.
	 *
	 * @param what what the expression is for, used in error messages
	 */
	public static TLAExpression performExpression(String what, String text) throws Issue {
		try {
			return TLAParser.readExpression(new SourceFile(null, text));
		} catch (TLAParseException e) {
			throw new ParsingIssue(what, e);
		}
	}

	/**
	 * Parses a name that came with an edit request, which has to be a single identifier.
	 */
	public static String performIdentifier(String what, String text) throws Issue {
		TLAExpression expr = performExpression(what, text);
		if (!(expr instanceof TLAGeneralIdentifier)) {
			throw new ParsingIssue(what,
					new TLAParseException(expr.getLocation(), Collections.singletonList("identifier")));
		}
		return ((TLAGeneralIdentifier) expr).getName().getId();
	}
}
