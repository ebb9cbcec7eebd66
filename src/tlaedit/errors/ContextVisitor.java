package tlaedit.errors;

import tlaedit.trans.intermediate.InDefinition;
import tlaedit.trans.intermediate.WhileProcessingFile;

public abstract class ContextVisitor<T, E extends Throwable> {

	public abstract T visit(InDefinition inDefinition) throws E;
	public abstract T visit(WhileProcessingFile whileProcessingFile) throws E;

}
