package tlaedit.parser;

import tlaedit.TLAEditException;
import tlaedit.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a module or expression cannot be parsed. Carries the location of the furthest point the
 * parser reached and a description of what it expected to find there.
 */
public class TLAParseException extends TLAEditException {

	private final SourceLocation location;
	private final List<String> expected;

	public TLAParseException(SourceLocation location, List<String> expected) {
		super("TLA+ syntax error", "expected " + describe(expected) + " " + location.prettyString());
		this.location = location;
		this.expected = Collections.unmodifiableList(expected);
	}

	public TLAParseException(SourceLocation location, String message) {
		super("TLA+ syntax error", message + " " + location.prettyString());
		this.location = location;
		this.expected = Collections.emptyList();
	}

	private static String describe(List<String> expected) {
		if (expected.size() == 1) {
			return expected.get(0);
		}
		return "one of " + String.join(", ", expected);
	}

	public SourceLocation getLocation() {
		return location;
	}

	public List<String> getExpected() {
		return expected;
	}

}
