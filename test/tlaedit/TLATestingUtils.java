package tlaedit;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.io.FileUtils;

import tlaedit.errors.Issue;
import tlaedit.errors.IssueWithContext;
import tlaedit.model.tla.TLAModule;
import tlaedit.parser.TLAParseException;
import tlaedit.parser.TLAParser;
import tlaedit.util.SourceFile;

public class TLATestingUtils {

	private TLATestingUtils() {}

	public static Path fixturePath(String name) {
		return Paths.get("test", "tla", name + ".tla");
	}

	public static String readFixture(String name) {
		try {
			return FileUtils.readFileToString(fixturePath(name).toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	public static TLAModule loadModule(String name) throws TLAParseException {
		return TLAParser.readModule(new SourceFile(fixturePath(name), readFixture(name)));
	}

	public static TLAModule parseModule(String text) throws TLAParseException {
		return TLAParser.readModule(new SourceFile(Paths.get("TEST"), text));
	}

	/**
	 * Strips away any context an issue was reported with.
	 */
	public static Issue unwrap(Issue issue) {
		while (issue instanceof IssueWithContext) {
			issue = ((IssueWithContext) issue).getIssue();
		}
		return issue;
	}

}
