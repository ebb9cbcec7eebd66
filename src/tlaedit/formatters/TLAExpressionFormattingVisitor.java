package tlaedit.formatters;

import tlaedit.model.tla.*;
import tlaedit.parser.TLAParser;

import java.io.IOException;
import java.util.List;

/**
 * Formats expressions that have no source text of their own. Sub-expressions go back through the
 * {@link TLASourceRenderer}, so parsed children keep their original text, and are parenthesized only
 * where operator precedence requires it.
 */
public class TLAExpressionFormattingVisitor extends TLAExpressionVisitor<Void, IOException> {
	private final TLASourceRenderer renderer;
	private final IndentingWriter out;

	public TLAExpressionFormattingVisitor(TLASourceRenderer renderer) {
		this.renderer = renderer;
		this.out = renderer.getWriter();
	}

	private static final int ATOMIC = 16;

	/**
	 * @return the lowest precedence at which expr could be parsed without parentheses; expressions that
	 * extend as far right as possible (IF, LET, quantifiers) get 0
	 */
	static int precedence(TLAExpression expr) {
		if (expr instanceof TLABinOp) {
			return TLAParser.INFIX_OPERATORS_LOW_PRECEDENCE.get(((TLABinOp) expr).getOperation().getValue());
		}
		if (expr instanceof TLAJunction) {
			return 3;
		}
		if (expr instanceof TLAUnary) {
			TLAUnary unary = (TLAUnary) expr;
			if (unary.isPostfix()) {
				return 15;
			}
			return TLAParser.PREFIX_OPERATORS_LOW_PRECEDENCE.get(unary.getOperation().getValue());
		}
		if (expr instanceof TLAIf || expr instanceof TLACase || expr instanceof TLALet ||
				expr instanceof TLAQuantifiedExistential || expr instanceof TLAQuantifiedUniversal ||
				expr instanceof TLAChoose) {
			return 0;
		}
		return ATOMIC;
	}

	/**
	 * @param parent the expression being written
	 * @param index the position of child within parent's children
	 * @param child the child to be written
	 * @return true if child must be wrapped in parentheses to be read back as the same tree
	 */
	public static boolean needsParentheses(TLAExpression parent, int index, TLAExpression child) {
		int childPrecedence = precedence(child);
		if (parent instanceof TLABinOp) {
			String op = ((TLABinOp) parent).getOperation().getValue();
			int hi = TLAParser.INFIX_OPERATORS_HI_PRECEDENCE.get(op);
			if (index == 0 && child instanceof TLABinOp &&
					((TLABinOp) child).getOperation().getValue().equals(op) &&
					TLAParser.INFIX_OPERATORS_LEFT_ASSOCIATIVE.contains(op)) {
				return false;
			}
			return childPrecedence <= hi;
		}
		if (parent instanceof TLAJunction) {
			TLAJunction junction = (TLAJunction) parent;
			if (junction.isBulleted()) {
				return false;
			}
			if (child instanceof TLAJunction && ((TLAJunction) child).getKind() == junction.getKind() &&
					!((TLAJunction) child).isBulleted()) {
				return false;
			}
			return childPrecedence <= 3;
		}
		if (parent instanceof TLAUnary) {
			TLAUnary unary = (TLAUnary) parent;
			if (unary.isPostfix()) {
				return childPrecedence < ATOMIC;
			}
			return childPrecedence <= TLAParser.PREFIX_OPERATORS_HI_PRECEDENCE.get(unary.getOperation().getValue());
		}
		if (parent instanceof TLAFunctionCall || parent instanceof TLADot) {
			return index == 0 && childPrecedence < ATOMIC;
		}
		return false;
	}

	private void writeChild(TLAExpression parent, int index, TLAExpression child) throws IOException {
		if (needsParentheses(parent, index, child)) {
			out.write("(");
			renderer.write(child);
			out.write(")");
		} else {
			renderer.write(child);
		}
	}

	private void writeAll(List<? extends TLANode> nodes) throws IOException {
		FormattingTools.writeCommaSeparated(out, nodes, renderer::write);
	}

	@Override
	public Void visit(TLAJunction tlaJunction) throws IOException {
		List<TLAExpression> items = tlaJunction.getItems();
		String symbol = tlaJunction.getKind().getSymbol();
		if (tlaJunction.isBulleted()) {
			int column = out.getHorizontalPosition();
			for (int i = 0; i < items.size(); ++i) {
				if (i > 0) {
					out.write("\n");
					out.write(TLASourceRenderer.spaces(column));
				}
				out.write(symbol);
				out.write(" ");
				writeChild(tlaJunction, i, items.get(i));
			}
		} else {
			for (int i = 0; i < items.size(); ++i) {
				if (i > 0) {
					out.write(" ");
					out.write(symbol);
					out.write(" ");
				}
				writeChild(tlaJunction, i, items.get(i));
			}
		}
		return null;
	}

	@Override
	public Void visit(TLABinOp tlaBinOp) throws IOException {
		writeChild(tlaBinOp, 0, tlaBinOp.getLHS());
		out.write(" ");
		renderer.write(tlaBinOp.getOperation());
		out.write(" ");
		writeChild(tlaBinOp, 1, tlaBinOp.getRHS());
		return null;
	}

	@Override
	public Void visit(TLAUnary tlaUnary) throws IOException {
		String op = tlaUnary.getOperation().getValue();
		if (tlaUnary.isPostfix()) {
			writeChild(tlaUnary, 0, tlaUnary.getOperand());
			out.write(op);
		} else {
			out.write(op);
			if (Character.isLetter(op.charAt(0)) || op.startsWith("\\")) {
				out.write(" ");
			}
			writeChild(tlaUnary, 0, tlaUnary.getOperand());
		}
		return null;
	}

	@Override
	public Void visit(TLAIf tlaIf) throws IOException {
		out.write("IF ");
		renderer.write(tlaIf.getCond());
		out.write(" THEN ");
		renderer.write(tlaIf.getTval());
		out.write(" ELSE ");
		renderer.write(tlaIf.getFval());
		return null;
	}

	@Override
	public Void visit(TLACase tlaCase) throws IOException {
		out.write("CASE ");
		FormattingTools.writeSeparated(out, " [] ", tlaCase.getArms(), renderer::write);
		if (tlaCase.getOther() != null) {
			out.write(" [] OTHER -> ");
			renderer.write(tlaCase.getOther());
		}
		return null;
	}

	@Override
	public Void visit(TLALet tlaLet) throws IOException {
		int column = out.getHorizontalPosition();
		out.write("LET ");
		FormattingTools.writeSeparated(out, "\n" + TLASourceRenderer.spaces(column + 4), tlaLet.getDefinitions(),
				renderer::write);
		out.write("\n");
		out.write(TLASourceRenderer.spaces(column));
		out.write("IN  ");
		renderer.write(tlaLet.getBody());
		return null;
	}

	@Override
	public Void visit(TLAGeneralIdentifier tlaGeneralIdentifier) throws IOException {
		renderer.write(tlaGeneralIdentifier.getName());
		return null;
	}

	@Override
	public Void visit(TLAOperatorCall tlaOperatorCall) throws IOException {
		renderer.write(tlaOperatorCall.getName());
		out.write("(");
		writeAll(tlaOperatorCall.getArgs());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TLAFunctionCall tlaFunctionCall) throws IOException {
		writeChild(tlaFunctionCall, 0, tlaFunctionCall.getFunction());
		out.write("[");
		writeAll(tlaFunctionCall.getParams());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(TLATuple tlaTuple) throws IOException {
		out.write("<<");
		writeAll(tlaTuple.getElements());
		out.write(">>");
		return null;
	}

	@Override
	public Void visit(TLASetConstructor tlaSetConstructor) throws IOException {
		out.write("{");
		writeAll(tlaSetConstructor.getContents());
		out.write("}");
		return null;
	}

	@Override
	public Void visit(TLASetRefinement tlaSetRefinement) throws IOException {
		out.write("{");
		renderer.write(tlaSetRefinement.getIdent());
		out.write(" \\in ");
		renderer.write(tlaSetRefinement.getFrom());
		out.write(" : ");
		renderer.write(tlaSetRefinement.getWhen());
		out.write("}");
		return null;
	}

	@Override
	public Void visit(TLASetComprehension tlaSetComprehension) throws IOException {
		out.write("{");
		renderer.write(tlaSetComprehension.getBody());
		out.write(" : ");
		writeAll(tlaSetComprehension.getBounds());
		out.write("}");
		return null;
	}

	@Override
	public Void visit(TLAQuantifiedExistential tlaQuantifiedExistential) throws IOException {
		out.write("\\E ");
		writeAll(tlaQuantifiedExistential.getBounds());
		out.write(" : ");
		renderer.write(tlaQuantifiedExistential.getBody());
		return null;
	}

	@Override
	public Void visit(TLAQuantifiedUniversal tlaQuantifiedUniversal) throws IOException {
		out.write("\\A ");
		writeAll(tlaQuantifiedUniversal.getBounds());
		out.write(" : ");
		renderer.write(tlaQuantifiedUniversal.getBody());
		return null;
	}

	@Override
	public Void visit(TLAChoose tlaChoose) throws IOException {
		out.write("CHOOSE ");
		renderer.write(tlaChoose.getIdent());
		if (tlaChoose.getSet() != null) {
			out.write(" \\in ");
			renderer.write(tlaChoose.getSet());
		}
		out.write(" : ");
		renderer.write(tlaChoose.getBody());
		return null;
	}

	@Override
	public Void visit(TLAFunction tlaFunction) throws IOException {
		out.write("[");
		writeAll(tlaFunction.getBounds());
		out.write(" |-> ");
		renderer.write(tlaFunction.getBody());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(TLAFunctionSet tlaFunctionSet) throws IOException {
		out.write("[");
		renderer.write(tlaFunctionSet.getFrom());
		out.write(" -> ");
		renderer.write(tlaFunctionSet.getTo());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(TLARecordConstructor tlaRecordConstructor) throws IOException {
		out.write("[");
		writeAll(tlaRecordConstructor.getFields());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(TLARecordSet tlaRecordSet) throws IOException {
		out.write("[");
		FormattingTools.writeCommaSeparated(out, tlaRecordSet.getFields(), field -> {
			renderer.write(field.getName());
			out.write(" : ");
			renderer.write(field.getValue());
		});
		out.write("]");
		return null;
	}

	@Override
	public Void visit(TLAFunctionSubstitution tlaFunctionSubstitution) throws IOException {
		out.write("[");
		renderer.write(tlaFunctionSubstitution.getSource());
		out.write(" EXCEPT ");
		writeAll(tlaFunctionSubstitution.getSubstitutions());
		out.write("]");
		return null;
	}

	@Override
	public Void visit(TLADot tlaDot) throws IOException {
		writeChild(tlaDot, 0, tlaDot.getExpression());
		out.write(".");
		renderer.write(tlaDot.getField());
		return null;
	}

	@Override
	public Void visit(TLANumber tlaNumber) throws IOException {
		out.write(tlaNumber.getVal());
		return null;
	}

	@Override
	public Void visit(TLAString tlaString) throws IOException {
		out.write("\"");
		out.write(tlaString.getValue());
		out.write("\"");
		return null;
	}

	@Override
	public Void visit(TLABool tlaBool) throws IOException {
		if (tlaBool.getValue()) {
			out.write("TRUE");
		} else {
			out.write("FALSE");
		}
		return null;
	}

	@Override
	public Void visit(TLASpecialVariableValue tlaSpecialVariableValue) throws IOException {
		out.write("@");
		return null;
	}

	@Override
	public Void visit(TLAFairness tlaFairness) throws IOException {
		out.write(tlaFairness.getType().getKeyword());
		renderer.write(tlaFairness.getVars());
		out.write("(");
		renderer.write(tlaFairness.getExpression());
		out.write(")");
		return null;
	}

	@Override
	public Void visit(TLAMaybeAction tlaMaybeAction) throws IOException {
		out.write("[");
		renderer.write(tlaMaybeAction.getBody());
		out.write("]_");
		renderer.write(tlaMaybeAction.getVars());
		return null;
	}

	@Override
	public Void visit(TLARequiredAction tlaRequiredAction) throws IOException {
		out.write("<<");
		renderer.write(tlaRequiredAction.getBody());
		out.write(">>_");
		renderer.write(tlaRequiredAction.getVars());
		return null;
	}

}
