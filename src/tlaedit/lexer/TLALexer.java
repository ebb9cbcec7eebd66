package tlaedit.lexer;

import tlaedit.util.SourceFile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A simple TLA+ lexer that tries to replicate the TLC's lexing behaviour.
 *
 * For simple changes like adding a builtin token type you can just add
 * it to the BUILTIN list. For more complex changes editing the readTokens
 * method may be necessary.
 *
 * Whitespace and comments never become tokens: they stay in the gaps between
 * token offsets, which is what lets an unmodified module be reproduced exactly.
 */
public class TLALexer {

	static final Pattern WHITESPACE = Pattern.compile("\\s+");

	static final Pattern MODULE_HEADER = Pattern.compile("----+[ \\t]*MODULE\\b");
	static final Pattern DASHES = Pattern.compile("----+");
	static final Pattern MODULE_END = Pattern.compile("====+");

	static final List<String> BUILTIN = Arrays.asList(
		// boolean constants
		"TRUE",
		"FALSE",
		"BOOLEAN",

		"ASSUME",
		"ELSE",
		"LOCAL",
		"UNION",
		"ASSUMPTION",
		"ENABLED",
		"MODULE",
		"VARIABLE",
		"AXIOM",
		"EXCEPT",
		"OTHER",
		"VARIABLES",
		"CASE",
		"EXTENDS",
		"SF_",
		"WF_",
		"CHOOSE",
		"IF",
		"SUBSET",
		"WITH",
		"CONSTANT",
		"IN",
		"THEN",
		"CONSTANTS",
		"INSTANCE",
		"THEOREM",
		"DOMAIN",
		"LET",
		"UNCHANGED",
		"RECURSIVE",
		"LAMBDA",
		// comma
		",",
		// parens
		"(",
		")",
		// brackets
		"[",
		"]",
		"]_",
		// braces
		"{",
		"}",
		// : for use in \E
		":",
		// EXCEPT paths and the old value inside them
		"!",
		"@",
		// quantifiers
		"\\A",
		"\\E",
		"\\AA",
		"\\EE",
		// tuple delimiters
		"<<",
		">>",
		">>_",
		// infix operators (non-alpha)
		"!!",
		"#",
		"##",
		"$",
		"$$",
		"%",
		"%%",
		"&",
		"&&",
		"(+)",
		"(-)",
		"(.)",
		"(/)",
		"(\\X)",
		"*",
		"**",
		"+",
		"++",
		"-",
		"-+->",
		"--",
		"-|",
		"..",
		"...",
		"/",
		"//",
		"/=",
		"/\\",
		"::=",
		":=",
		":>",
		"<",
		"<:",
		"<=>",
		"=",
		"=<",
		"=>",
		"=|",
		">",
		">=",
		"<=",
		"?",
		"??",
		"@@",
		"\\",
		"\\/",
		"^",
		"^^",
		"|",
		"|-",
		"|=",
		"||",
		"~>",
		".",
		// infix operators (alpha)
		"\\approx",
		"\\geq",
		"\\oslash",
		"\\sqsupseteq",
		"\\asymp",
		"\\gg",
		"\\otimes",
		"\\star",
		"\\bigcirc",
		"\\in",
		"\\notin",
		"\\prec",
		"\\subset",
		"\\bullet",
		"\\intersect",
		"\\preceq",
		"\\subseteq",
		"\\cap",
		"\\land",
		"\\propto",
		"\\succ",
		"\\cdot",
		"\\leq",
		"\\sim",
		"\\succeq",
		"\\circ",
		"\\ll",
		"\\simeq",
		"\\supset",
		"\\cong",
		"\\lor",
		"\\sqcap",
		"\\supseteq",
		"\\cup",
		"\\o",
		"\\sqcup",
		"\\union",
		"\\div",
		"\\odot",
		"\\sqsubset",
		"\\uplus",
		"\\doteq",
		"\\ominus",
		"\\sqsubseteq",
		"\\wr",
		"\\equiv",
		"\\oplus",
		"\\sqsupset",
		"\\X",
		"\\times",
		// prefix ops (alpha)
		"\\lnot",
		"\\neg",
		// prefix ops (non-alpha)
		"~",
		"[]",
		"<>",
		// postfix ops
		"^+",
		"^*",
		"^#",
		"'",
		// operator definition
		"==",
		// functions and records
		"->",
		"|->"
	).stream()
			.distinct()
			.sorted(Comparator.comparingInt(String::length).reversed())
			.collect(Collectors.toList());

	static final Pattern IDENT = Pattern.compile("[a-z0-9_A-Z]*[a-zA-Z][a-z0-9_A-Z]*");

	static final Pattern[] NUMBER = {
		Pattern.compile("[0-9]*\\.[0-9]+"),
		Pattern.compile("[0-9]+"),
		Pattern.compile("\\\\[bB][01]+"),
		Pattern.compile("\\\\[oO][0-7]+"),
		Pattern.compile("\\\\[hH][0-9a-fA-F]+"),
	};

	static final Pattern STRING = Pattern.compile("\"((?:[^\"\\\\\\n]|\\\\.)*)\"");

	static final String COMMENT_START = "(*";
	static final String COMMENT_END = "*)";
	static final String LINE_COMMENT = "\\*";

	private final SourceFile file;
	private final String text;
	private boolean moduleRequired;

	public TLALexer(SourceFile file) {
		this.file = file;
		this.text = file.getContents();
		this.moduleRequired = true;
	}

	/**
	 * @param yes whether to require that the input begins with a TLA module declaration, defaults to true
	 */
	public void requireModule(boolean yes) {
		this.moduleRequired = yes;
	}

	private TLAToken makeToken(String value, TLATokenType type, int start, int end) {
		return new TLAToken(value, type, file.locationOf(start, end));
	}

	/**
	 * Finds the end of the comment starting at pos, honouring nesting of (* *) comments.
	 */
	private int skipComment(int pos) throws TLALexerException {
		if (text.startsWith(LINE_COMMENT, pos)) {
			int end = text.indexOf('\n', pos);
			return end == -1 ? text.length() : end;
		}
		int depth = 0;
		int column = pos;
		while (column < text.length()) {
			if (text.startsWith(COMMENT_START, column)) {
				++depth;
				column += COMMENT_START.length();
			} else if (text.startsWith(COMMENT_END, column)) {
				--depth;
				column += COMMENT_END.length();
				if (depth == 0) {
					return column;
				}
			} else {
				++column;
			}
		}
		throw new TLALexerException(file.locationOf(pos, pos), "unterminated comment");
	}

	/**
	 * @return a list of tokens scanned from the file the lexer was given
	 * @throws TLALexerException if the lexer cannot understand part of the input
	 */
	public List<TLAToken> readTokens() throws TLALexerException {
		List<TLAToken> tokens = new ArrayList<>();
		int column = 0;
		if (moduleRequired) {
			Matcher header = MODULE_HEADER.matcher(text);
			if (!header.find()) {
				throw new TLALexerException(file.locationOf(0, 0), "could not find a module header");
			}
			Matcher dashes = DASHES.matcher(text);
			dashes.region(header.start(), text.length());
			dashes.lookingAt();
			tokens.add(makeToken(dashes.group(), TLATokenType.SEPARATOR, dashes.start(), dashes.end()));
			column = dashes.end();
		}
		while (column < text.length()) {
			Matcher m = WHITESPACE.matcher(text);
			m.region(column, text.length());
			if (m.lookingAt()) {
				column = m.end();
				continue;
			}

			// handle reaching the beginning of a comment (both line and delimited)
			if (text.startsWith(COMMENT_START, column) || text.startsWith(LINE_COMMENT, column)) {
				column = skipComment(column);
				continue;
			}

			// check for the "-----..." that is part of MODULE ... or separates units
			m = DASHES.matcher(text);
			m.region(column, text.length());
			if (m.lookingAt()) {
				tokens.add(makeToken(m.group(), TLATokenType.SEPARATOR, m.start(), m.end()));
				column = m.end();
				continue;
			}

			// check for the end of the module, anything after it is left alone
			m = MODULE_END.matcher(text);
			m.region(column, text.length());
			if (m.lookingAt()) {
				tokens.add(makeToken(m.group(), TLATokenType.MODULE_END, m.start(), m.end()));
				if (moduleRequired) {
					return tokens;
				}
				column = m.end();
				continue;
			}

			// try to match an identifier
			String possibleIdentifier = null;
			m = IDENT.matcher(text);
			m.region(column, text.length());
			if (m.lookingAt()) {
				possibleIdentifier = m.group();
			}

			// try to match the biggest number we can
			String possibleNumber = null;
			for (Pattern numberPattern : NUMBER) {
				m = numberPattern.matcher(text);
				m.region(column, text.length());
				if (m.lookingAt()) {
					String group = m.group();
					if (possibleNumber == null || group.length() > possibleNumber.length()) {
						possibleNumber = group;
					}
				}
			}

			// match the longest builtin we can, BUILTIN is sorted longest first
			String possibleBuiltin = null;
			for (String builtin : BUILTIN) {
				if (text.startsWith(builtin, column)) {
					possibleBuiltin = builtin;
					break;
				}
			}

			// WF_vars and SF_vars lex as a fairness keyword followed by the subscript
			if (possibleIdentifier != null && possibleIdentifier.length() > 3 &&
					(possibleIdentifier.startsWith("WF_") || possibleIdentifier.startsWith("SF_"))) {
				tokens.add(makeToken(possibleIdentifier.substring(0, 3), TLATokenType.BUILTIN, column, column + 3));
				column += 3;
				continue;
			}

			// now reconcile the tokens we generated:
			// if a possible identifier is longer than a builtin, it's an identifier. Otherwise it's the
			// builtin
			if (possibleIdentifier != null && possibleBuiltin != null) {
				if (possibleIdentifier.length() > possibleBuiltin.length()) {
					tokens.add(makeToken(possibleIdentifier, TLATokenType.IDENT, column,
							column + possibleIdentifier.length()));
					column += possibleIdentifier.length();
				} else {
					tokens.add(makeToken(possibleBuiltin, TLATokenType.BUILTIN, column,
							column + possibleBuiltin.length()));
					column += possibleBuiltin.length();
				}
				continue;
			}
			if (possibleIdentifier != null &&
					(possibleNumber == null || possibleIdentifier.length() >= possibleNumber.length())) {
				tokens.add(makeToken(possibleIdentifier, TLATokenType.IDENT, column,
						column + possibleIdentifier.length()));
				column += possibleIdentifier.length();
				continue;
			}
			// numbers trump things like the dot operator
			if (possibleNumber != null) {
				tokens.add(makeToken(possibleNumber, TLATokenType.NUMBER, column, column + possibleNumber.length()));
				column += possibleNumber.length();
				continue;
			}
			// builtins not matching any identifiers or numbers are treated as builtins
			if (possibleBuiltin != null) {
				tokens.add(makeToken(possibleBuiltin, TLATokenType.BUILTIN, column, column + possibleBuiltin.length()));
				column += possibleBuiltin.length();
				continue;
			}

			m = STRING.matcher(text);
			m.region(column, text.length());
			if (m.lookingAt()) {
				tokens.add(makeToken(m.group(1), TLATokenType.STRING, m.start(), m.end()));
				column = m.end();
				continue;
			}

			throw new TLALexerException(file.locationOf(column, column + 1),
					"unexpected character '" + text.charAt(column) + "'");
		}
		if (moduleRequired) {
			throw new TLALexerException(file.locationOf(text.length(), text.length()),
					"module is not terminated by ====");
		}
		return tokens;
	}

	/**
	 * Removes every comment from a run of text found between two tokens. Interior lines that held
	 * nothing but comments or a line of dashes are dropped altogether, so only the line structure and
	 * indentation remain.
	 */
	public static String stripComments(String text) {
		final char mark = '\u0000';
		StringBuilder code = new StringBuilder();
		int depth = 0;
		int i = 0;
		while (i < text.length()) {
			if (text.startsWith(COMMENT_START, i)) {
				if (depth == 0) {
					code.append(mark);
				}
				++depth;
				i += COMMENT_START.length();
			} else if (depth > 0 && text.startsWith(COMMENT_END, i)) {
				--depth;
				i += COMMENT_END.length();
			} else if (depth == 0 && text.startsWith(LINE_COMMENT, i)) {
				code.append(mark);
				int end = text.indexOf('\n', i);
				i = end == -1 ? text.length() : end;
			} else {
				if (depth == 0) {
					code.append(text.charAt(i));
				}
				++i;
			}
		}
		String[] lines = code.toString().split("\n", -1);
		List<String> kept = new ArrayList<>();
		for (int n = 0; n < lines.length; ++n) {
			String line = lines[n];
			boolean interior = n > 0 && n < lines.length - 1;
			boolean marked = line.indexOf(mark) != -1;
			String cleaned = line.replaceAll("[ \\t]*\u0000", "");
			if (interior && ((marked && cleaned.trim().isEmpty()) || DASHES.matcher(cleaned.trim()).matches())) {
				continue;
			}
			kept.add(cleaned);
		}
		return String.join("\n", kept);
	}
}
