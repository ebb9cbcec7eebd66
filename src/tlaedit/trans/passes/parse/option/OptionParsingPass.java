package tlaedit.trans.passes.parse.option;

import tlaedit.TLAEditOptionException;
import tlaedit.TLAEditOptions;
import tlaedit.errors.IssueContext;

import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static TLAEditOptions perform(IssueContext ctx, Logger logger, String[] args) {
		TLAEditOptions opts = new TLAEditOptions(args);
		try {
			opts.parse();
		} catch (TLAEditOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the logger's log level based on command line arguments
		if (opts.quiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.verbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}
}
