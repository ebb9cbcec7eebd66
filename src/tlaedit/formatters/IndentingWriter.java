package tlaedit.formatters;

import java.io.IOException;
import java.io.Writer;

/**
 * A writer that keeps track of the column it is writing at. Lines are always terminated with a bare
 * line feed, so that text copied from an input keeps its exact bytes.
 */
public class IndentingWriter extends Writer {

	Writer out;
	int indent = 0;
	boolean shouldIndent = false;
	int defaultIndent = 4;
	int horizontalPosition = 0;

	public static class Indent implements AutoCloseable {

		IndentingWriter writer;
		int spaces;

		public Indent(IndentingWriter writer, int spaces) {
			this.writer = writer;
			this.spaces = spaces;
		}

		@Override
		public void close() {
			writer.unindent(spaces);
		}

	}

	public Indent indent(int spaces) {
		indent += spaces;
		return new Indent(this, spaces);
	}

	public Indent indent() {
		return indent(defaultIndent);
	}

	/**
	 * @return the 0-based position along the current line of text being written
	 */
	public int getHorizontalPosition() {
		return shouldIndent ? indent : horizontalPosition;
	}

	public void unindent(int spaces) {
		if (spaces > indent) {
			throw new RuntimeException("can't unindent below 0");
		}
		indent -= spaces;
	}

	public IndentingWriter(Writer out) {
		this.out = out;
	}

	public IndentingWriter(Writer out, int defaultIndent) {
		this.out = out;
		this.defaultIndent = defaultIndent;
	}

	@Override
	public void close() throws IOException {
		out.close();
	}

	@Override
	public void flush() throws IOException {
		out.flush();
	}

	public void newLine() throws IOException {
		write("\n");
	}

	@Override
	public void write(char[] chars, int offset, int len) throws IOException {
		String data = String.valueOf(chars, offset, len);
		int start = 0;
		while (start < data.length()) {
			if (shouldIndent) {
				// blank lines never carry trailing indentation
				if (data.charAt(start) != '\n') {
					for (int i = 0; i < indent; ++i) {
						out.write(" ");
					}
					horizontalPosition = indent;
				} else {
					horizontalPosition = 0;
				}
				shouldIndent = false;
			}
			int next = data.indexOf('\n', start);
			if (next != -1) {
				out.write(data, start, next + 1 - start);
				start = next + 1;
				horizontalPosition = 0;
				shouldIndent = true;
			} else {
				horizontalPosition += data.length() - start;
				out.write(data, start, data.length() - start);
				break;
			}
		}
	}

}
