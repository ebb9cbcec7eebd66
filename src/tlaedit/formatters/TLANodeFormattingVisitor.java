package tlaedit.formatters;

import tlaedit.model.tla.*;

import java.io.IOException;
import java.util.List;

public class TLANodeFormattingVisitor extends TLANodeVisitor<Void, IOException> {
	private final TLASourceRenderer renderer;
	private final IndentingWriter out;

	public TLANodeFormattingVisitor(TLASourceRenderer renderer) {
		this.renderer = renderer;
		this.out = renderer.getWriter();
	}

	@Override
	public Void visit(TLAModule module) throws IOException {
		out.write("---- MODULE ");
		renderer.write(module.getName());
		out.write(" ----\n");
		List<TLAIdentifier> exts = module.getExtends();
		if (!exts.isEmpty()) {
			out.write("EXTENDS ");
			FormattingTools.writeCommaSeparated(out, exts, renderer::write);
			out.write("\n");
		}
		for (TLAUnit unit : module.getUnits()) {
			out.write("\n");
			renderer.write(unit);
			out.write("\n");
		}
		out.write("\n====\n");
		return null;
	}

	@Override
	public Void visit(TLAExpression expression) throws IOException {
		expression.accept(new TLAExpressionFormattingVisitor(renderer));
		return null;
	}

	@Override
	public Void visit(TLAUnit unit) throws IOException {
		unit.accept(new TLAUnitFormattingVisitor(renderer));
		return null;
	}

	@Override
	public Void visit(TLACaseArm caseArm) throws IOException {
		renderer.write(caseArm.getCondition());
		out.write(" -> ");
		renderer.write(caseArm.getResult());
		return null;
	}

	@Override
	public Void visit(TLAQuantifierBound quantifierBound) throws IOException {
		FormattingTools.writeCommaSeparated(out, quantifierBound.getIds(), renderer::write);
		out.write(" \\in ");
		renderer.write(quantifierBound.getSet());
		return null;
	}

	@Override
	public Void visit(TLARecordField recordField) throws IOException {
		renderer.write(recordField.getName());
		out.write(" |-> ");
		renderer.write(recordField.getValue());
		return null;
	}

	@Override
	public Void visit(TLAFunctionSubstitutionPair functionSubstitutionPair) throws IOException {
		out.write("!");
		for (TLASubstitutionKey key : functionSubstitutionPair.getKeys()) {
			renderer.write(key);
		}
		out.write(" = ");
		renderer.write(functionSubstitutionPair.getValue());
		return null;
	}

	@Override
	public Void visit(TLASubstitutionKey substitutionKey) throws IOException {
		if (substitutionKey.getField() != null) {
			out.write(".");
			renderer.write(substitutionKey.getField());
		} else {
			out.write("[");
			FormattingTools.writeCommaSeparated(out, substitutionKey.getIndices(), renderer::write);
			out.write("]");
		}
		return null;
	}

	@Override
	public Void visit(TLAIdentifier identifier) throws IOException {
		out.write(identifier.getId());
		return null;
	}

	@Override
	public Void visit(TLASymbol symbol) throws IOException {
		out.write(symbol.getValue());
		return null;
	}

}
