package tlaedit.util;

/**
 * A common abstract base, typically meant for AST nodes and tokens, that should be
 * implemented by anything that needs to be traced back to its original location.
 */
public abstract class SourceLocatable {

	public abstract SourceLocation getLocation();

}
