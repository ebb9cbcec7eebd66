package tlaedit.formatters;

import tlaedit.errors.ContextVisitor;
import tlaedit.trans.intermediate.InDefinition;
import tlaedit.trans.intermediate.WhileProcessingFile;

import java.io.IOException;

public class ContextFormattingVisitor extends ContextVisitor<Void, IOException> {

	private IndentingWriter out;

	public ContextFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(InDefinition inDefinition) throws IOException {
		out.write("in definition ");
		out.write(inDefinition.getName());
		return null;
	}

	@Override
	public Void visit(WhileProcessingFile whileProcessingFile) throws IOException {
		out.write("while processing file ");
		out.write(whileProcessingFile.getPath().toString());
		return null;
	}

}
