package tlaedit.errors;

/**
 * The machine-checkable category of an {@link Issue}.
 */
public enum ErrorKind {
	SYNTAX_ERROR,
	DUPLICATE_NAME,
	NOT_FOUND,
	AMBIGUOUS_NAME,
	NOT_SPLITTABLE,
	COLLISION_UNRESOLVABLE,
	MISSING_TYPE,
	VIOLATION,
	IO_ERROR,
	OPTION_ERROR,
}
