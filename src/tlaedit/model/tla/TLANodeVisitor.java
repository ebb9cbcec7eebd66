package tlaedit.model.tla;

public abstract class TLANodeVisitor<T, E extends Throwable> {
	public abstract T visit(TLAModule module) throws E;
	public abstract T visit(TLAExpression expression) throws E;
	public abstract T visit(TLAUnit unit) throws E;
	public abstract T visit(TLACaseArm caseArm) throws E;
	public abstract T visit(TLAQuantifierBound quantifierBound) throws E;
	public abstract T visit(TLARecordField recordField) throws E;
	public abstract T visit(TLAFunctionSubstitutionPair functionSubstitutionPair) throws E;
	public abstract T visit(TLASubstitutionKey substitutionKey) throws E;
	public abstract T visit(TLAIdentifier identifier) throws E;
	public abstract T visit(TLASymbol symbol) throws E;
}
