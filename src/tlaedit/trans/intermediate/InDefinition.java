package tlaedit.trans.intermediate;

import tlaedit.errors.Context;
import tlaedit.errors.ContextVisitor;

public class InDefinition extends Context {

	private final String name;

	public InDefinition(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
