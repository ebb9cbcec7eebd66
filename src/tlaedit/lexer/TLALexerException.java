package tlaedit.lexer;

import tlaedit.TLAEditException;
import tlaedit.util.SourceLocation;

public class TLALexerException extends TLAEditException {

	private final SourceLocation location;

	public TLALexerException(SourceLocation location, String msg) {
		super("TLA Lexer error", msg + " " + location.prettyString());
		this.location = location;
	}

	public SourceLocation getLocation() {
		return location;
	}

}
