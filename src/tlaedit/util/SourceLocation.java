package tlaedit.util;

import tlaedit.Unreachable;
import tlaedit.formatters.IndentingWriter;

import java.io.IOException;
import java.io.StringWriter;

public class SourceLocation implements Comparable<SourceLocation> {
	private final SourceFile file;
	private final int startOffset;
	private final int endOffset;
	private final int startLine;
	private final int endLine;
	private final int startColumn;
	private final int endColumn;

	public SourceLocation(SourceFile file, int startOffset, int endOffset, int startLine, int endLine,
	                      int startColumn, int endColumn) {
		this.file = file;
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.startLine = startLine;
		this.endLine = endLine;
		this.startColumn = startColumn;
		this.endColumn = endColumn;
	}

	public String prettyString() {
		StringWriter sw = new StringWriter();
		writePretty(new IndentingWriter(sw));
		return sw.getBuffer().toString();
	}

	public void writePretty(IndentingWriter out) {
		try {
			if (isUnknown()) {
				out.write("at unknown source location");
				return;
			}
			out.write("at ");
			if (startLine != endLine) {
				out.write("" + (startLine + 1) + ":" + (startColumn + 1) + "-" + (endLine + 1) + ":" + endColumn);
			} else if (startColumn != endColumn) {
				out.write("" + (startLine + 1) + ":" + (startColumn + 1) + "-" + endColumn);
			} else {
				out.write("" + (startLine + 1) + ":" + (startColumn + 1));
			}
			out.write(" in file " + file.getName());
			out.newLine();
			String text = file.getContents();
			int lineStart = file.lineStart(startLine);
			int lineEnd = text.indexOf('\n', startOffset);
			if (lineEnd == -1) {
				lineEnd = text.length();
			}
			out.write(text, lineStart, lineEnd - lineStart);
			out.newLine();
			for (int pos = lineStart; pos < startOffset; pos++) {
				out.append(' ');
			}
			int effectiveEndOffset = startOffset == endOffset ? endOffset + 1 : endOffset;
			for (int pos = startOffset; pos < lineEnd && pos < effectiveEndOffset; pos++) {
				out.append('^');
			}
			if (startOffset == text.length()) {
				out.append("^ EOF");
			}
		} catch (IOException e) {
			throw new Unreachable(); // string ops shouldn't throw IO exceptions
		}
	}

	public static SourceLocation unknown() {
		return new SourceLocation(null, -1, -1, -1, -1, -1, -1);
	}

	public boolean isUnknown() {
		return file == null;
	}

	public SourceLocation combine(SourceLocation other) {
		if (isUnknown()) {
			return other;
		} else if (other.isUnknown()) {
			return this;
		}
		// combining locations from two inputs is a programming error
		if (file != other.file) {
			throw new RuntimeException("Tried to combine source locations from two different files: " +
					file.getName() + ", " + other.file.getName());
		}
		return file.locationOf(Integer.min(startOffset, other.startOffset), Integer.max(endOffset, other.endOffset));
	}

	public SourceFile getFile() {
		return file;
	}

	public int getStartOffset() {
		return startOffset;
	}

	public int getEndOffset() {
		return endOffset;
	}

	public int getStartLine() {
		return startLine;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndColumn() {
		return endColumn;
	}

	/**
	 * @return the exact source text this location covers
	 */
	public String getText() {
		return file.slice(startOffset, endOffset);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((file == null) ? 0 : file.hashCode());
		result = prime * result + startOffset;
		result = prime * result + endOffset;
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		SourceLocation other = (SourceLocation) obj;
		return startOffset == other.startOffset && endOffset == other.endOffset && file == other.file;
	}

	@Override
	public String toString() {
		if (isUnknown()) {
			return "SourceLocation [UNKNOWN]";
		}
		return "SourceLocation [file=" + file.getName() + ", startOffset=" + startOffset + ", endOffset=" +
				endOffset + ", startLine=" + startLine + ", endLine=" + endLine + ", startColumn=" + startColumn +
				", endColumn=" + endColumn + "]";
	}

	@Override
	public int compareTo(SourceLocation o) {
		if (isUnknown() && o.isUnknown()) {
			return 0;
		}
		if (isUnknown()) {
			return -1;
		}
		if (o.isUnknown()) {
			return 1;
		}
		int comparedStartOffset = Integer.compare(startOffset, o.startOffset);
		if (comparedStartOffset != 0) {
			return comparedStartOffset;
		}
		return Integer.compare(endOffset, o.endOffset);
	}
}
