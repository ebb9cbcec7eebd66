package tlaedit.model.tla;

public abstract class TLAUnitVisitor<T, E extends Throwable> {
	public abstract T visit(TLAVariableDeclaration variableDeclaration) throws E;
	public abstract T visit(TLAConstantDeclaration constantDeclaration) throws E;
	public abstract T visit(TLAOperatorDefinition operatorDefinition) throws E;
	public abstract T visit(TLAFunctionDefinition functionDefinition) throws E;
	public abstract T visit(TLAAssumption assumption) throws E;
	public abstract T visit(TLATheorem theorem) throws E;
}
