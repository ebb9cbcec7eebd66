package tlaedit.formatters;

import tlaedit.model.tla.*;

import java.io.IOException;
import java.util.List;

public class TLAUnitFormattingVisitor extends TLAUnitVisitor<Void, IOException> {

	private final TLASourceRenderer renderer;
	private final IndentingWriter out;

	public TLAUnitFormattingVisitor(TLASourceRenderer renderer) {
		this.renderer = renderer;
		this.out = renderer.getWriter();
	}

	@Override
	public Void visit(TLAVariableDeclaration variableDeclaration) throws IOException {
		List<TLAIdentifier> variables = variableDeclaration.getVariables();
		out.write(variables.size() == 1 ? "VARIABLE " : "VARIABLES ");
		FormattingTools.writeCommaSeparated(out, variables, renderer::write);
		return null;
	}

	@Override
	public Void visit(TLAConstantDeclaration constantDeclaration) throws IOException {
		List<TLAIdentifier> constants = constantDeclaration.getConstants();
		out.write(constants.size() == 1 ? "CONSTANT " : "CONSTANTS ");
		FormattingTools.writeCommaSeparated(out, constants, renderer::write);
		return null;
	}

	@Override
	public Void visit(TLAOperatorDefinition operatorDefinition) throws IOException {
		if (operatorDefinition.isLocal()) {
			out.write("LOCAL ");
		}
		renderer.write(operatorDefinition.getName());
		List<TLAIdentifier> args = operatorDefinition.getArgs();
		if (!args.isEmpty()) {
			out.write("(");
			FormattingTools.writeCommaSeparated(out, args, renderer::write);
			out.write(")");
		}
		out.write(" == ");
		renderer.write(operatorDefinition.getBody());
		return null;
	}

	@Override
	public Void visit(TLAFunctionDefinition functionDefinition) throws IOException {
		renderer.write(functionDefinition.getName());
		out.write("[");
		FormattingTools.writeCommaSeparated(out, functionDefinition.getBounds(), renderer::write);
		out.write("] == ");
		renderer.write(functionDefinition.getBody());
		return null;
	}

	@Override
	public Void visit(TLAAssumption assumption) throws IOException {
		out.write("ASSUME ");
		renderer.write(assumption.getAssumption());
		return null;
	}

	@Override
	public Void visit(TLATheorem theorem) throws IOException {
		out.write("THEOREM ");
		renderer.write(theorem.getTheorem());
		return null;
	}

}
