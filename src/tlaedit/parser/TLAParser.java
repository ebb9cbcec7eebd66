package tlaedit.parser;

import tlaedit.lexer.TLALexer;
import tlaedit.lexer.TLALexerException;
import tlaedit.lexer.TLAToken;
import tlaedit.lexer.TLATokenType;
import tlaedit.model.tla.*;
import tlaedit.util.SourceFile;
import tlaedit.util.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 *
 * <p>
 * A recursive descent parser for the subset of TLA+ the editing passes understand.
 * Start reading with {@link TLAParser#readModule} or {@link TLAParser#readExpression}.
 * </p>
 *
 * <h3> Operators </h3>
 *
 * <p>Since TLA+ operators come in all shapes and sizes but also follow a fairly consistent set of rules,
 * they are treated using a set of static tables that give each operator the low and high bounds (inclusive)
 * of its precedence range. Instead of recursing over each operator in reverse precedence order we recurse
 * directly over precedences themselves, matching any qualifying operators as we go.</p>
 *
 * <h3> Indentation sensitivity </h3>
 *
 * <p>Items of a bulleted {@code /\} or {@code \/} list must be indented strictly past the column of their
 * bullet, and the following bullet must sit at exactly that column. The minColumn field holds the current
 * constraint: a token left of it ends the expression being read.</p>
 *
 * <p>A token that starts a line and begins a new definition ({@code Name ==}, {@code Name(a) ==},
 * {@code f[x \in S] ==}) or a declaration also ends the current expression, which is how the body of one
 * definition stops before the next.</p>
 *
 */
public final class TLAParser {

	public static final Map<String, Integer> INFIX_OPERATORS_LOW_PRECEDENCE = new HashMap<>();
	public static final Map<String, Integer> INFIX_OPERATORS_HI_PRECEDENCE = new HashMap<>();
	public static final Set<String> INFIX_OPERATORS_LEFT_ASSOCIATIVE = new HashSet<>();
	public static final Map<String, Integer> PREFIX_OPERATORS_LOW_PRECEDENCE = new HashMap<>();
	public static final Map<String, Integer> PREFIX_OPERATORS_HI_PRECEDENCE = new HashMap<>();
	public static final Map<String, Integer> POSTFIX_OPERATORS_PRECEDENCE = new HashMap<>();

	private static void infix(String op, int lo, int hi) {
		INFIX_OPERATORS_LOW_PRECEDENCE.put(op, lo);
		INFIX_OPERATORS_HI_PRECEDENCE.put(op, hi);
	}

	private static void leftInfix(String op, int lo, int hi) {
		infix(op, lo, hi);
		INFIX_OPERATORS_LEFT_ASSOCIATIVE.add(op);
	}

	private static void prefix(String op, int lo, int hi) {
		PREFIX_OPERATORS_LOW_PRECEDENCE.put(op, lo);
		PREFIX_OPERATORS_HI_PRECEDENCE.put(op, hi);
	}

	static {
		// infix operators (non-alpha)
		infix("!!", 9, 13);
		infix("#", 5, 5);
		leftInfix("##", 9, 13);
		leftInfix("$", 9, 13);
		leftInfix("$$", 9, 13);
		infix("%", 10, 11);
		leftInfix("%%", 10, 11);
		leftInfix("&", 13, 13);
		leftInfix("&&", 13, 13);
		infix("(+)", 10, 10);
		infix("(-)", 11, 11);
		infix("(.)", 13, 13);
		infix("(/)", 13, 13);
		infix("(\\X)", 13, 13);
		leftInfix("*", 13, 13);
		leftInfix("**", 13, 13);
		leftInfix("+", 10, 10);
		leftInfix("++", 10, 10);
		leftInfix("-", 11, 11);
		infix("-+->", 2, 2);
		leftInfix("--", 11, 11);
		infix("-|", 5, 5);
		infix("..", 9, 9);
		infix("...", 9, 9);
		infix("/", 13, 13);
		infix("//", 13, 13);
		infix("/=", 5, 5);
		leftInfix("/\\", 3, 3);
		infix("::=", 5, 5);
		infix(":=", 5, 5);
		infix(":>", 7, 7);
		infix("<", 5, 5);
		infix("<:", 7, 7);
		infix("<=", 5, 5);
		infix("<=>", 2, 2);
		infix("=", 5, 5);
		infix("=<", 5, 5);
		infix("=>", 1, 1);
		infix("=|", 5, 5);
		infix(">", 5, 5);
		infix(">=", 5, 5);
		infix("?", 5, 5);
		leftInfix("??", 9, 13);
		leftInfix("@@", 6, 6);
		infix("\\", 8, 8);
		leftInfix("\\/", 3, 3);
		infix("^", 14, 14);
		infix("^^", 14, 14);
		leftInfix("|", 10, 11);
		infix("|-", 5, 5);
		infix("|=", 5, 5);
		leftInfix("||", 10, 11);
		infix("~>", 2, 2);
		// infix operators (alpha)
		infix("\\approx", 5, 5);
		infix("\\geq", 5, 5);
		infix("\\oslash", 13, 13);
		infix("\\sqsupseteq", 5, 5);
		infix("\\asymp", 5, 5);
		infix("\\gg", 5, 5);
		leftInfix("\\otimes", 13, 13);
		leftInfix("\\star", 13, 13);
		infix("\\bigcirc", 13, 13);
		infix("\\in", 5, 5);
		infix("\\notin", 5, 5);
		infix("\\prec", 5, 5);
		infix("\\subset", 5, 5);
		leftInfix("\\bullet", 13, 13);
		infix("\\intersect", 8, 8);
		infix("\\preceq", 5, 5);
		infix("\\subseteq", 5, 5);
		leftInfix("\\cap", 8, 8);
		leftInfix("\\land", 3, 3);
		infix("\\propto", 5, 5);
		infix("\\succ", 5, 5);
		leftInfix("\\cdot", 5, 14);
		infix("\\leq", 5, 5);
		infix("\\sim", 5, 5);
		infix("\\succeq", 5, 5);
		leftInfix("\\circ", 13, 13);
		infix("\\ll", 5, 5);
		infix("\\simeq", 5, 5);
		infix("\\supset", 5, 5);
		infix("\\cong", 5, 5);
		leftInfix("\\lor", 3, 3);
		leftInfix("\\sqcap", 9, 13);
		infix("\\supseteq", 5, 5);
		leftInfix("\\cup", 8, 8);
		leftInfix("\\o", 13, 13);
		leftInfix("\\sqcup", 9, 13);
		leftInfix("\\union", 8, 8);
		infix("\\div", 13, 13);
		leftInfix("\\odot", 13, 13);
		infix("\\sqsubset", 5, 5);
		leftInfix("\\uplus", 9, 13);
		infix("\\doteq", 5, 5);
		leftInfix("\\ominus", 11, 11);
		infix("\\sqsubseteq", 5, 5);
		infix("\\wr", 9, 14);
		infix("\\equiv", 2, 2);
		leftInfix("\\oplus", 10, 10);
		infix("\\sqsupset", 5, 5);
		leftInfix("\\X", 10, 13);
		leftInfix("\\times", 10, 13);

		prefix("-", 12, 12);
		prefix("~", 4, 4);
		prefix("\\lnot", 4, 4);
		prefix("\\neg", 4, 4);
		prefix("[]", 4, 15);
		prefix("<>", 4, 15);
		prefix("DOMAIN", 9, 9);
		prefix("ENABLED", 4, 15);
		prefix("SUBSET", 8, 8);
		prefix("UNCHANGED", 4, 15);
		prefix("UNION", 8, 8);

		POSTFIX_OPERATORS_PRECEDENCE.put("^+", 15);
		POSTFIX_OPERATORS_PRECEDENCE.put("^*", 15);
		POSTFIX_OPERATORS_PRECEDENCE.put("^#", 15);
		POSTFIX_OPERATORS_PRECEDENCE.put("'", 15);
	}

	/**
	 * Signals a failed match; carries no data, the furthest failure is tracked by the parser itself.
	 */
	private static final class Failure extends RuntimeException {
		private static final long serialVersionUID = 1L;

		Failure() {
			super(null, null, false, false);
		}
	}

	private static final Failure FAILURE = new Failure();

	private final SourceFile file;
	private final List<TLAToken> tokens;
	private int pos;
	private TLAToken lastConsumed;
	private int minColumn;
	private int unitStartAllowedAt;
	private int furthestPos;
	private final Set<String> furthestExpected;

	private TLAParser(SourceFile file, List<TLAToken> tokens) {
		this.file = file;
		this.tokens = tokens;
		this.pos = 0;
		this.lastConsumed = null;
		this.minColumn = -1;
		this.unitStartAllowedAt = -1;
		this.furthestPos = -1;
		this.furthestExpected = new LinkedHashSet<>();
	}

	/**
	 * Parses a complete module. The resulting module spans the entire file.
	 */
	public static TLAModule readModule(SourceFile file) throws TLAParseException {
		TLALexer lexer = new TLALexer(file);
		List<TLAToken> tokens;
		try {
			tokens = lexer.readTokens();
		} catch (TLALexerException e) {
			throw new TLAParseException(e.getLocation(), e.getMsg());
		}
		TLAParser parser = new TLAParser(file, tokens);
		try {
			return parser.parseModule();
		} catch (Failure f) {
			throw parser.furthestFailure();
		}
	}

	/**
	 * Parses a standalone expression, such as an initial value supplied with an edit request.
	 */
	public static TLAExpression readExpression(SourceFile file) throws TLAParseException {
		TLALexer lexer = new TLALexer(file);
		lexer.requireModule(false);
		List<TLAToken> tokens;
		try {
			tokens = lexer.readTokens();
		} catch (TLALexerException e) {
			throw new TLAParseException(e.getLocation(), e.getMsg());
		}
		TLAParser parser = new TLAParser(file, tokens);
		try {
			TLAExpression result = parser.parseExpression();
			if (parser.pos != tokens.size()) {
				parser.fail("end of expression");
			}
			return result;
		} catch (Failure f) {
			throw parser.furthestFailure();
		}
	}

	private TLAParseException furthestFailure() {
		SourceLocation location;
		if (furthestPos < tokens.size() && furthestPos >= 0) {
			location = tokens.get(furthestPos).getLocation();
		} else {
			int end = file.getContents().length();
			location = file.locationOf(end, end);
		}
		return new TLAParseException(location, new ArrayList<>(furthestExpected));
	}

	// token level helpers

	private Failure fail(String expected) {
		if (pos > furthestPos) {
			furthestPos = pos;
			furthestExpected.clear();
		}
		if (pos == furthestPos) {
			furthestExpected.add(expected);
		}
		throw FAILURE;
	}

	private boolean isFirstOnLine(int index) {
		return index == 0 ||
				tokens.get(index - 1).getLocation().getEndLine() != tokens.get(index).getLocation().getStartLine();
	}

	private int closingIndex(int index, String open, String close) {
		int depth = 0;
		for (int i = index; i < tokens.size(); ++i) {
			TLAToken t = tokens.get(i);
			if (t.isBuiltin(open)) {
				++depth;
			} else if (t.isBuiltin(close)) {
				--depth;
				if (depth == 0) {
					return i;
				}
			} else if (t.getType() == TLATokenType.MODULE_END || t.getType() == TLATokenType.SEPARATOR) {
				return -1;
			}
		}
		return -1;
	}

	/**
	 * @return true if the token at index begins a new unit of the module
	 */
	private boolean isUnitStart(int index) {
		TLAToken t = tokens.get(index);
		switch (t.getType()) {
			case SEPARATOR:
			case MODULE_END:
				return true;
			case BUILTIN:
				switch (t.getValue()) {
					case "VARIABLE":
					case "VARIABLES":
					case "CONSTANT":
					case "CONSTANTS":
					case "ASSUME":
					case "ASSUMPTION":
					case "AXIOM":
					case "THEOREM":
					case "LOCAL":
						return true;
					default:
						return false;
				}
			case IDENT:
				if (index + 1 >= tokens.size()) {
					return false;
				}
				TLAToken next = tokens.get(index + 1);
				int after;
				if (next.isBuiltin("==")) {
					return true;
				} else if (next.isBuiltin("(")) {
					after = closingIndex(index + 1, "(", ")");
				} else if (next.isBuiltin("[")) {
					after = closingIndex(index + 1, "[", "]");
				} else {
					return false;
				}
				return after != -1 && after + 1 < tokens.size() && tokens.get(after + 1).isBuiltin("==");
			default:
				return false;
		}
	}

	/**
	 * @return the next token, or null if there is none that the current expression may consume
	 */
	private TLAToken peek() {
		if (pos >= tokens.size()) {
			return null;
		}
		TLAToken t = tokens.get(pos);
		if (t.getLocation().getStartColumn() < minColumn) {
			return null;
		}
		if (pos != unitStartAllowedAt && isFirstOnLine(pos) && isUnitStart(pos)) {
			return null;
		}
		return t;
	}

	private TLAToken peekAhead(int offset) {
		int index = pos + offset;
		if (index >= tokens.size()) {
			return null;
		}
		TLAToken t = tokens.get(index);
		if (t.getLocation().getStartColumn() < minColumn) {
			return null;
		}
		return t;
	}

	private TLAToken consume() {
		lastConsumed = tokens.get(pos);
		++pos;
		return lastConsumed;
	}

	private boolean atBuiltin(String value) {
		TLAToken t = peek();
		return t != null && t.isBuiltin(value);
	}

	private boolean atType(TLATokenType type) {
		TLAToken t = peek();
		return t != null && t.getType() == type;
	}

	private TLAToken expectBuiltin(String value) {
		if (!atBuiltin(value)) {
			fail(value);
		}
		return consume();
	}

	private TLAIdentifier parseIdentifier() {
		if (!atType(TLATokenType.IDENT)) {
			fail("identifier");
		}
		TLAToken t = consume();
		return new TLAIdentifier(t.getLocation(), t.getValue());
	}

	private SourceLocation locationFrom(TLAToken start) {
		return file.locationOf(start.getLocation().getStartOffset(), lastConsumed.getLocation().getEndOffset());
	}

	private SourceLocation locationFrom(TLANode start) {
		return file.locationOf(start.getLocation().getStartOffset(), lastConsumed.getLocation().getEndOffset());
	}

	private <T> T attempt(Supplier<T> action) {
		int savedPos = pos;
		TLAToken savedLast = lastConsumed;
		int savedMinColumn = minColumn;
		try {
			return action.get();
		} catch (Failure f) {
			pos = savedPos;
			lastConsumed = savedLast;
			minColumn = savedMinColumn;
			return null;
		}
	}

	// module structure

	private void expectSeparator() {
		// read directly, peek() treats a separator starting a line as the end of the current unit
		if (pos >= tokens.size() || tokens.get(pos).getType() != TLATokenType.SEPARATOR) {
			fail("----");
		}
		consume();
	}

	private TLAModule parseModule() {
		expectSeparator();
		expectBuiltin("MODULE");
		TLAIdentifier name = parseIdentifier();
		expectSeparator();
		List<TLAIdentifier> exts = new ArrayList<>();
		if (atBuiltin("EXTENDS")) {
			consume();
			exts.add(parseIdentifier());
			while (atBuiltin(",")) {
				consume();
				exts.add(parseIdentifier());
			}
		}
		List<TLAUnit> units = new ArrayList<>();
		while (true) {
			if (pos >= tokens.size()) {
				fail("====");
			}
			TLAToken t = tokens.get(pos);
			if (t.getType() == TLATokenType.MODULE_END) {
				consume();
				break;
			}
			if (t.getType() == TLATokenType.SEPARATOR) {
				consume();
				continue;
			}
			units.add(parseUnit());
		}
		String text = file.getContents();
		return new TLAModule(file.locationOf(0, text.length()), name, exts, units);
	}

	private TLAUnit parseUnit() {
		int savedAllowed = unitStartAllowedAt;
		unitStartAllowedAt = pos;
		try {
			TLAToken start = peek();
			if (start == null) {
				fail("definition or declaration");
			}
			if (start.isBuiltin("VARIABLE") || start.isBuiltin("VARIABLES")) {
				consume();
				List<TLAIdentifier> vars = parseIdentifierList();
				return new TLAVariableDeclaration(locationFrom(start), vars);
			}
			if (start.isBuiltin("CONSTANT") || start.isBuiltin("CONSTANTS")) {
				consume();
				List<TLAIdentifier> constants = parseIdentifierList();
				return new TLAConstantDeclaration(locationFrom(start), constants);
			}
			if (start.isBuiltin("ASSUME") || start.isBuiltin("ASSUMPTION") || start.isBuiltin("AXIOM")) {
				consume();
				TLAExpression assumption = parseExpression();
				return new TLAAssumption(locationFrom(start), assumption);
			}
			if (start.isBuiltin("THEOREM")) {
				consume();
				TLAExpression theorem = parseExpression();
				return new TLATheorem(locationFrom(start), theorem);
			}
			boolean isLocal = false;
			if (start.isBuiltin("LOCAL")) {
				consume();
				isLocal = true;
			}
			return parseDefinition(start, isLocal);
		} finally {
			unitStartAllowedAt = savedAllowed;
		}
	}

	private List<TLAIdentifier> parseIdentifierList() {
		List<TLAIdentifier> ids = new ArrayList<>();
		ids.add(parseIdentifier());
		while (atBuiltin(",")) {
			consume();
			ids.add(parseIdentifier());
		}
		return ids;
	}

	private TLAUnit parseDefinition(TLAToken start, boolean isLocal) {
		TLAIdentifier name = parseIdentifier();
		if (atBuiltin("[")) {
			consume();
			List<TLAQuantifierBound> bounds = parseQuantifierBounds();
			expectBuiltin("]");
			expectBuiltin("==");
			TLAExpression body = parseExpression();
			return new TLAFunctionDefinition(locationFrom(start), name, bounds, body);
		}
		List<TLAIdentifier> args = Collections.emptyList();
		if (atBuiltin("(")) {
			consume();
			args = parseIdentifierList();
			expectBuiltin(")");
		}
		expectBuiltin("==");
		TLAExpression body = parseExpression();
		return new TLAOperatorDefinition(locationFrom(start), name, args, body, isLocal);
	}

	// expressions

	private TLAExpression parseExpression() {
		return parseExpressionFromPrecedence(1);
	}

	private TLAExpression parseExpressionFromPrecedence(int precedence) {
		// parentheses are not nodes, so locations start from the first token rather than the first child
		TLAToken start = pos < tokens.size() ? tokens.get(pos) : null;
		TLAExpression lhs = parsePrefixOrPrimary();
		TLAJunction chain = null;
		while (true) {
			TLAToken t = peek();
			if (t == null || t.getType() != TLATokenType.BUILTIN) {
				break;
			}
			String op = t.getValue();
			Integer lo = INFIX_OPERATORS_LOW_PRECEDENCE.get(op);
			if (lo == null || lo < precedence) {
				break;
			}
			int hi = INFIX_OPERATORS_HI_PRECEDENCE.get(op);
			consume();
			TLASymbol symbol = new TLASymbol(t.getLocation(), op);
			TLAExpression rhs = parseExpressionFromPrecedence(hi + 1);
			TLAJunction.Kind kind = junctionKind(op);
			if (kind != null) {
				List<TLAExpression> items = new ArrayList<>();
				if (chain != null && chain == lhs && chain.getKind() == kind) {
					items.addAll(chain.getItems());
				} else {
					items.add(lhs);
				}
				items.add(rhs);
				chain = new TLAJunction(locationFrom(start), kind, false, items);
				lhs = chain;
			} else {
				lhs = new TLABinOp(locationFrom(start), symbol, lhs, rhs);
			}
		}
		return lhs;
	}

	private static TLAJunction.Kind junctionKind(String op) {
		switch (op) {
			case "/\\":
			case "\\land":
				return TLAJunction.Kind.CONJUNCTION;
			case "\\/":
			case "\\lor":
				return TLAJunction.Kind.DISJUNCTION;
			default:
				return null;
		}
	}

	private TLAExpression parsePrefixOrPrimary() {
		TLAToken t = peek();
		if (t == null) {
			fail("expression");
		}
		if (t.isBuiltin("/\\") || t.isBuiltin("\\/")) {
			return parseBulletedJunction();
		}
		if (t.getType() == TLATokenType.BUILTIN && PREFIX_OPERATORS_HI_PRECEDENCE.containsKey(t.getValue())) {
			consume();
			int hi = PREFIX_OPERATORS_HI_PRECEDENCE.get(t.getValue());
			TLAExpression operand = parseExpressionFromPrecedence(hi + 1);
			return new TLAUnary(locationFrom(t), new TLASymbol(t.getLocation(), t.getValue()), operand, false);
		}
		return parsePostfix(t, parsePrimary());
	}

	private TLAExpression parseBulletedJunction() {
		TLAToken first = peek();
		String bullet = first.getValue();
		int column = first.getLocation().getStartColumn();
		List<TLAExpression> items = new ArrayList<>();
		while (true) {
			TLAToken t = peek();
			if (t == null || !t.isBuiltin(bullet) || t.getLocation().getStartColumn() != column) {
				break;
			}
			consume();
			int savedMinColumn = minColumn;
			minColumn = column + 1;
			try {
				items.add(parseExpression());
			} finally {
				minColumn = savedMinColumn;
			}
		}
		return new TLAJunction(locationFrom(first), junctionKind(bullet), true, items);
	}

	private TLAExpression parsePostfix(TLAToken start, TLAExpression expr) {
		while (true) {
			TLAToken t = peek();
			if (t == null) {
				return expr;
			}
			if (t.getType() == TLATokenType.BUILTIN && POSTFIX_OPERATORS_PRECEDENCE.containsKey(t.getValue())) {
				consume();
				expr = new TLAUnary(locationFrom(start), new TLASymbol(t.getLocation(), t.getValue()), expr, true);
			} else if (t.isBuiltin("[")) {
				consume();
				List<TLAExpression> params = parseCommaList();
				expectBuiltin("]");
				expr = new TLAFunctionCall(locationFrom(start), expr, params);
			} else if (t.isBuiltin(".") && peekAhead(1) != null && peekAhead(1).getType() == TLATokenType.IDENT) {
				consume();
				TLAIdentifier field = parseIdentifier();
				expr = new TLADot(locationFrom(start), expr, field);
			} else {
				return expr;
			}
		}
	}

	private List<TLAExpression> parseCommaList() {
		List<TLAExpression> items = new ArrayList<>();
		items.add(parseExpression());
		while (atBuiltin(",")) {
			consume();
			items.add(parseExpression());
		}
		return items;
	}

	private List<TLAQuantifierBound> parseQuantifierBounds() {
		List<TLAQuantifierBound> bounds = new ArrayList<>();
		bounds.add(parseQuantifierBound());
		while (atBuiltin(",")) {
			consume();
			bounds.add(parseQuantifierBound());
		}
		return bounds;
	}

	private TLAQuantifierBound parseQuantifierBound() {
		TLAIdentifier first = parseIdentifier();
		List<TLAIdentifier> ids = new ArrayList<>();
		ids.add(first);
		while (atBuiltin(",")) {
			consume();
			ids.add(parseIdentifier());
		}
		expectBuiltin("\\in");
		TLAExpression set = parseExpression();
		return new TLAQuantifierBound(locationFrom(first), ids, set);
	}

	private TLAExpression parseSubscript() {
		if (atBuiltin("<<")) {
			TLAToken start = consume();
			return parseTupleRest(start);
		}
		TLAIdentifier id = parseIdentifier();
		return new TLAGeneralIdentifier(id.getLocation(), id);
	}

	private TLATuple parseTupleRest(TLAToken start) {
		List<TLAExpression> elements = new ArrayList<>();
		if (!atBuiltin(">>")) {
			elements = parseCommaList();
		}
		expectBuiltin(">>");
		return new TLATuple(locationFrom(start), elements);
	}

	private TLAExpression parsePrimary() {
		TLAToken t = peek();
		if (t == null) {
			fail("expression");
		}
		switch (t.getType()) {
			case IDENT: {
				TLAIdentifier name = parseIdentifier();
				if (atBuiltin("(")) {
					consume();
					List<TLAExpression> args = parseCommaList();
					expectBuiltin(")");
					return new TLAOperatorCall(locationFrom(t), name, args);
				}
				return new TLAGeneralIdentifier(t.getLocation(), name);
			}
			case NUMBER:
				consume();
				return new TLANumber(t.getLocation(), t.getValue());
			case STRING:
				consume();
				return new TLAString(t.getLocation(), t.getValue());
			case BUILTIN:
				break;
			default:
				fail("expression");
		}
		switch (t.getValue()) {
			case "TRUE":
			case "FALSE":
				consume();
				return new TLABool(t.getLocation(), t.getValue().equals("TRUE"));
			case "BOOLEAN":
				consume();
				return new TLAGeneralIdentifier(t.getLocation(), new TLAIdentifier(t.getLocation(), "BOOLEAN"));
			case "@":
				consume();
				return new TLASpecialVariableValue(t.getLocation());
			case "(": {
				consume();
				int savedMinColumn = minColumn;
				minColumn = -1;
				TLAExpression inner;
				try {
					inner = parseExpression();
				} finally {
					minColumn = savedMinColumn;
				}
				expectBuiltin(")");
				return inner;
			}
			case "<<":
				return parseTupleOrRequiredAction();
			case "{":
				return parseBraces();
			case "[":
				return parseBrackets();
			case "IF":
				return parseIf();
			case "CASE":
				return parseCase();
			case "LET":
				return parseLet();
			case "\\E":
			case "\\A":
				return parseQuantified();
			case "CHOOSE":
				return parseChoose();
			case "WF_":
			case "SF_":
				return parseFairness();
			default:
				throw fail("expression");
		}
	}

	private TLAExpression parseTupleOrRequiredAction() {
		TLAToken start = consume();
		List<TLAExpression> elements = new ArrayList<>();
		if (!atBuiltin(">>") && !atBuiltin(">>_")) {
			elements = parseCommaList();
		}
		if (atBuiltin(">>_") && elements.size() == 1) {
			consume();
			TLAExpression vars = parseSubscript();
			return new TLARequiredAction(locationFrom(start), elements.get(0), vars);
		}
		expectBuiltin(">>");
		return new TLATuple(locationFrom(start), elements);
	}

	private TLAExpression parseBraces() {
		TLAToken start = consume();
		if (atBuiltin("}")) {
			consume();
			return new TLASetConstructor(locationFrom(start), Collections.emptyList());
		}
		TLAExpression refinement = attempt(() -> {
			TLAIdentifier id = parseIdentifier();
			expectBuiltin("\\in");
			TLAExpression from = parseExpression();
			expectBuiltin(":");
			TLAExpression when = parseExpression();
			expectBuiltin("}");
			return new TLASetRefinement(locationFrom(start), id, from, when);
		});
		if (refinement != null) {
			return refinement;
		}
		TLAExpression first = parseExpression();
		if (atBuiltin(":")) {
			consume();
			List<TLAQuantifierBound> bounds = parseQuantifierBounds();
			expectBuiltin("}");
			return new TLASetComprehension(locationFrom(start), first, bounds);
		}
		List<TLAExpression> contents = new ArrayList<>();
		contents.add(first);
		while (atBuiltin(",")) {
			consume();
			contents.add(parseExpression());
		}
		expectBuiltin("}");
		return new TLASetConstructor(locationFrom(start), contents);
	}

	private List<TLARecordField> parseRecordFields(String separator) {
		List<TLARecordField> fields = new ArrayList<>();
		do {
			if (!fields.isEmpty()) {
				consume();
			}
			TLAIdentifier name = parseIdentifier();
			expectBuiltin(separator);
			TLAExpression value = parseExpression();
			fields.add(new TLARecordField(locationFrom(name), name, value));
		} while (atBuiltin(","));
		return fields;
	}

	private TLAExpression parseBrackets() {
		TLAToken start = consume();
		TLAToken next = peekAhead(1);
		if (atType(TLATokenType.IDENT) && next != null && next.isBuiltin("|->")) {
			List<TLARecordField> fields = parseRecordFields("|->");
			expectBuiltin("]");
			return new TLARecordConstructor(locationFrom(start), fields);
		}
		if (atType(TLATokenType.IDENT) && next != null && next.isBuiltin(":")) {
			List<TLARecordField> fields = parseRecordFields(":");
			expectBuiltin("]");
			return new TLARecordSet(locationFrom(start), fields);
		}
		TLAExpression function = attempt(() -> {
			List<TLAQuantifierBound> bounds = parseQuantifierBounds();
			expectBuiltin("|->");
			TLAExpression body = parseExpression();
			expectBuiltin("]");
			return new TLAFunction(locationFrom(start), bounds, body);
		});
		if (function != null) {
			return function;
		}
		TLAExpression first = parseExpression();
		if (atBuiltin("->")) {
			consume();
			TLAExpression to = parseExpression();
			expectBuiltin("]");
			return new TLAFunctionSet(locationFrom(start), first, to);
		}
		if (atBuiltin("EXCEPT")) {
			consume();
			List<TLAFunctionSubstitutionPair> pairs = new ArrayList<>();
			do {
				if (!pairs.isEmpty()) {
					consume();
				}
				pairs.add(parseSubstitutionPair());
			} while (atBuiltin(","));
			expectBuiltin("]");
			return new TLAFunctionSubstitution(locationFrom(start), first, pairs);
		}
		if (atBuiltin("]_")) {
			consume();
			TLAExpression vars = parseSubscript();
			return new TLAMaybeAction(locationFrom(start), first, vars);
		}
		fail("]_");
		return null;
	}

	private TLAFunctionSubstitutionPair parseSubstitutionPair() {
		TLAToken start = expectBuiltin("!");
		List<TLASubstitutionKey> keys = new ArrayList<>();
		do {
			TLAToken keyStart = peek();
			if (atBuiltin("[")) {
				consume();
				List<TLAExpression> indices = parseCommaList();
				expectBuiltin("]");
				keys.add(new TLASubstitutionKey(locationFrom(keyStart), indices));
			} else if (atBuiltin(".")) {
				consume();
				TLAIdentifier field = parseIdentifier();
				keys.add(new TLASubstitutionKey(locationFrom(keyStart), field));
			} else {
				fail("[ or .");
			}
		} while (atBuiltin("[") || atBuiltin("."));
		expectBuiltin("=");
		TLAExpression value = parseExpression();
		return new TLAFunctionSubstitutionPair(locationFrom(start), keys, value);
	}

	private TLAExpression parseIf() {
		TLAToken start = consume();
		TLAExpression cond = parseExpression();
		expectBuiltin("THEN");
		TLAExpression tval = parseExpression();
		expectBuiltin("ELSE");
		TLAExpression fval = parseExpression();
		return new TLAIf(locationFrom(start), cond, tval, fval);
	}

	private TLAExpression parseCase() {
		TLAToken start = consume();
		List<TLACaseArm> arms = new ArrayList<>();
		TLAExpression other = null;
		do {
			if (!arms.isEmpty()) {
				consume();
			}
			if (atBuiltin("OTHER")) {
				consume();
				expectBuiltin("->");
				other = parseExpression();
				break;
			}
			TLAToken armStart = peek();
			TLAExpression cond = parseExpression();
			expectBuiltin("->");
			TLAExpression result = parseExpression();
			arms.add(new TLACaseArm(locationFrom(armStart), cond, result));
		} while (atBuiltin("[]"));
		return new TLACase(locationFrom(start), arms, other);
	}

	private TLAExpression parseLet() {
		TLAToken start = consume();
		List<TLAUnit> definitions = new ArrayList<>();
		do {
			int savedAllowed = unitStartAllowedAt;
			unitStartAllowedAt = pos;
			try {
				TLAToken defStart = peek();
				if (defStart == null) {
					fail("definition");
				}
				definitions.add(parseDefinition(defStart, false));
			} finally {
				unitStartAllowedAt = savedAllowed;
			}
		} while (!atBuiltin("IN"));
		expectBuiltin("IN");
		TLAExpression body = parseExpression();
		return new TLALet(locationFrom(start), definitions, body);
	}

	private TLAExpression parseQuantified() {
		TLAToken start = consume();
		List<TLAQuantifierBound> bounds = parseQuantifierBounds();
		expectBuiltin(":");
		TLAExpression body = parseExpression();
		if (start.getValue().equals("\\E")) {
			return new TLAQuantifiedExistential(locationFrom(start), bounds, body);
		}
		return new TLAQuantifiedUniversal(locationFrom(start), bounds, body);
	}

	private TLAExpression parseChoose() {
		TLAToken start = consume();
		TLAIdentifier id = parseIdentifier();
		TLAExpression set = null;
		if (atBuiltin("\\in")) {
			consume();
			set = parseExpression();
		}
		expectBuiltin(":");
		TLAExpression body = parseExpression();
		return new TLAChoose(locationFrom(start), id, set, body);
	}

	private TLAExpression parseFairness() {
		TLAToken start = consume();
		TLAExpression vars = parseSubscript();
		expectBuiltin("(");
		int savedMinColumn = minColumn;
		minColumn = -1;
		TLAExpression action;
		try {
			action = parseExpression();
		} finally {
			minColumn = savedMinColumn;
		}
		expectBuiltin(")");
		TLAFairness.Type type = start.getValue().equals("WF_") ? TLAFairness.Type.WEAK : TLAFairness.Type.STRONG;
		return new TLAFairness(locationFrom(start), type, vars, action);
	}
}
