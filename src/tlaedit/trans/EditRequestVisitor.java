package tlaedit.trans;

public abstract class EditRequestVisitor<T, E extends Throwable> {
	public abstract T visit(AddVariableRequest addVariableRequest) throws E;
	public abstract T visit(SplitActionRequest splitActionRequest) throws E;
}
