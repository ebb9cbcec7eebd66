package tlaedit.util;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The full text of one input, together with a line table so that offsets can be turned
 * into line and column numbers.
 */
public class SourceFile {
	private final Path path;
	private final String contents;
	private final List<Integer> lineStarts;

	public SourceFile(Path path, String contents) {
		this.path = path;
		this.contents = contents;
		List<Integer> starts = new ArrayList<>();
		starts.add(0);
		for (int i = 0; i < contents.length(); ++i) {
			if (contents.charAt(i) == '\n') {
				starts.add(i + 1);
			}
		}
		this.lineStarts = Collections.unmodifiableList(starts);
	}

	public Path getPath() {
		return path;
	}

	public String getContents() {
		return contents;
	}

	public String getName() {
		return path == null ? "<input>" : path.toString();
	}

	/**
	 * @return the 0-based line containing offset
	 */
	public int lineOf(int offset) {
		int lo = 0;
		int hi = lineStarts.size() - 1;
		while (lo < hi) {
			int mid = (lo + hi + 1) / 2;
			if (lineStarts.get(mid) <= offset) {
				lo = mid;
			} else {
				hi = mid - 1;
			}
		}
		return lo;
	}

	/**
	 * @return the 0-based column of offset within its line
	 */
	public int columnOf(int offset) {
		return offset - lineStarts.get(lineOf(offset));
	}

	public int lineStart(int line) {
		return lineStarts.get(line);
	}

	public SourceLocation locationOf(int startOffset, int endOffset) {
		return new SourceLocation(this, startOffset, endOffset, lineOf(startOffset), lineOf(endOffset),
				columnOf(startOffset), columnOf(endOffset));
	}

	public String slice(int startOffset, int endOffset) {
		return contents.substring(startOffset, endOffset);
	}

	@Override
	public String toString() {
		return "SourceFile [" + getName() + "]";
	}
}
