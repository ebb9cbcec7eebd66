package tlaedit.lexer;

public enum TLATokenType {
	STRING,
	IDENT,
	NUMBER,
	BUILTIN,
	// a line of 4 or more dashes: the module header delimiters and unit separators
	SEPARATOR,
	// the ==== line closing the module
	MODULE_END,
}
