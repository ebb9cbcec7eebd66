package tlaedit.formatters;

import tlaedit.InternalEngineError;
import tlaedit.lexer.TLALexer;
import tlaedit.model.tla.*;
import tlaedit.util.SourceFile;
import tlaedit.util.SourceLocation;

import java.io.IOException;
import java.io.StringWriter;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 *
 * Writes TLA+ nodes back out as source text.
 *
 * <ul>
 *     <li>A parsed node is written as the exact text it was parsed from.</li>
 *     <li>A node derived from a parsed node re-uses the text found between the parsed node's children
 *     (operators, brackets, comments, line breaks and indentation), and writes each of its own children
 *     in turn. Children that were added are separated from their neighbours the way the nearest
 *     existing neighbours are, minus any comments.</li>
 *     <li>A brand new node is formatted from scratch by the formatting visitors.</li>
 * </ul>
 *
 * When text is written at a different column than it was read from, every line after the first is
 * shifted by the same amount, so that bulleted lists stay aligned.
 *
 */
public class TLASourceRenderer {

	private final IndentingWriter out;

	public TLASourceRenderer(IndentingWriter out) {
		this.out = out;
	}

	public static String render(TLANode node) {
		StringWriter buffer = new StringWriter();
		try {
			new TLASourceRenderer(new IndentingWriter(buffer)).write(node);
		} catch (IOException e) {
			throw new InternalEngineError(e);
		}
		return buffer.toString();
	}

	public IndentingWriter getWriter() {
		return out;
	}

	public void write(TLANode node) throws IOException {
		if (node.isVerbatim()) {
			SourceLocation location = node.getLocation();
			writeShifted(location.getText(), out.getHorizontalPosition() - location.getStartColumn());
			return;
		}
		TLANode template = node.getLayoutSource();
		if (template == null || template.getChildren().isEmpty()) {
			node.accept(new TLANodeFormattingVisitor(this));
			return;
		}
		writeFromTemplate(node, template);
	}

	private void writeShifted(String text, int delta) throws IOException {
		if (delta == 0 || text.indexOf('\n') == -1) {
			out.write(text);
			return;
		}
		String[] lines = text.split("\n", -1);
		out.write(lines[0]);
		for (int i = 1; i < lines.length; ++i) {
			out.write("\n");
			String line = lines[i];
			if (line.trim().isEmpty()) {
				out.write(line);
			} else if (delta > 0) {
				out.write(spaces(delta));
				out.write(line);
			} else {
				int strip = 0;
				while (strip < -delta && strip < line.length() && line.charAt(strip) == ' ') {
					++strip;
				}
				out.write(line.substring(strip));
			}
		}
	}

	static String spaces(int count) {
		StringBuilder builder = new StringBuilder(count);
		for (int i = 0; i < count; ++i) {
			builder.append(' ');
		}
		return builder.toString();
	}

	private static String between(SourceFile file, int from, int to) {
		return file.slice(from, to);
	}

	private void writeFromTemplate(TLANode node, TLANode template) throws IOException {
		SourceLocation templateLocation = template.getLocation();
		SourceFile file = templateLocation.getFile();
		List<TLANode> templateChildren = template.getChildren();
		List<TLANode> children = node.getChildren();
		int startColumn = out.getHorizontalPosition();
		int delta = startColumn - templateLocation.getStartColumn();

		// gaps[i] is the text in front of template child i; gaps[size] is the text after the last child
		String[] gaps = new String[templateChildren.size() + 1];
		int previousEnd = templateLocation.getStartOffset();
		for (int i = 0; i < templateChildren.size(); ++i) {
			SourceLocation childLocation = templateChildren.get(i).getLocation();
			gaps[i] = between(file, previousEnd, childLocation.getStartOffset());
			previousEnd = childLocation.getEndOffset();
		}
		gaps[templateChildren.size()] = between(file, previousEnd, templateLocation.getEndOffset());

		// nodes compare structurally, so correspondence has to be established by identity
		Map<TLANode, Integer> templateIndex = new IdentityHashMap<>();
		for (int i = 0; i < templateChildren.size(); ++i) {
			templateIndex.put(templateChildren.get(i), i);
		}
		int[] match = new int[children.size()];
		boolean[] used = new boolean[templateChildren.size()];
		boolean positional = children.size() == templateChildren.size();
		for (int j = 0; j < children.size(); ++j) {
			TLANode child = children.get(j);
			Integer index = templateIndex.get(child);
			if (index == null && child.getLayoutSource() != null) {
				index = templateIndex.get(child.getLayoutSource());
			}
			if (index != null && !used[index]) {
				used[index] = true;
				match[j] = index;
			} else {
				match[j] = -1;
			}
			if (match[j] != -1 && match[j] != j) {
				positional = false;
			}
		}

		writeShifted(gaps[0], delta);
		int lastMatched = -1;
		for (int j = 0; j < children.size(); ++j) {
			TLANode child = children.get(j);
			if (j > 0) {
				if (positional) {
					writeShifted(gaps[j], delta);
				} else if (match[j] > 0) {
					writeShifted(gaps[match[j]], delta);
				} else {
					String separator = insertedSeparator(gaps, lastMatched);
					if (separator != null) {
						writeShifted(separator, delta);
					} else {
						out.write(defaultSeparator(node, startColumn));
					}
				}
			}
			boolean parenthesize = match[j] == -1 && child instanceof TLAExpression &&
					node instanceof TLAExpression &&
					TLAExpressionFormattingVisitor.needsParentheses((TLAExpression) node, j, (TLAExpression) child);
			if (parenthesize) {
				out.write("(");
			}
			write(child);
			if (parenthesize) {
				out.write(")");
			}
			if (match[j] != -1) {
				lastMatched = match[j];
			}
		}
		writeShifted(gaps[templateChildren.size()], delta);
	}

	/**
	 * @return the separator of the nearest existing neighbour with its comments removed, or null if the
	 * template has only one child to learn from
	 */
	private static String insertedSeparator(String[] gaps, int lastMatched) {
		int childCount = gaps.length - 1;
		if (lastMatched >= 1) {
			return TLALexer.stripComments(gaps[lastMatched]);
		} else if (childCount >= 2) {
			return TLALexer.stripComments(gaps[1]);
		}
		return null;
	}

	private static String defaultSeparator(TLANode node, int startColumn) {
		if (node instanceof TLAJunction) {
			TLAJunction junction = (TLAJunction) node;
			if (junction.isBulleted()) {
				return "\n" + spaces(startColumn) + junction.getKind().getSymbol() + " ";
			}
			return " " + junction.getKind().getSymbol() + " ";
		}
		if (node instanceof TLAModule) {
			return "\n\n";
		}
		if (node instanceof TLALet) {
			return "\n" + spaces(startColumn + 4);
		}
		return ", ";
	}

}
