package tlaedit.trans.intermediate;

import tlaedit.errors.Context;
import tlaedit.errors.ContextVisitor;

import java.nio.file.Path;

public class WhileProcessingFile extends Context {

	private final Path path;

	public WhileProcessingFile(Path path) {
		this.path = path;
	}

	public Path getPath() {
		return path;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> ctx) throws E {
		return ctx.visit(this);
	}

}
