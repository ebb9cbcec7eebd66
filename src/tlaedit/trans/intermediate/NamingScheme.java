package tlaedit.trans.intermediate;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How a name fits into a family: either a shared prefix followed by a decimal index (ActionX_1, L2,
 * a07), or a descriptive name with no index at all.
 */
public class NamingScheme {

	private static final Pattern NUMBERED = Pattern.compile("^(.*?)([0-9]+)$");

	private final String prefix;
	private final int index;
	private final int width;

	private NamingScheme(String prefix, int index, int width) {
		this.prefix = prefix;
		this.index = index;
		this.width = width;
	}

	public static NamingScheme of(String name) {
		Matcher matcher = NUMBERED.matcher(name);
		if (matcher.matches() && !matcher.group(1).isEmpty() && matcher.group(2).length() <= 9) {
			return new NamingScheme(matcher.group(1), Integer.parseInt(matcher.group(2)), matcher.group(2).length());
		}
		return new NamingScheme(name, -1, 0);
	}

	public boolean isNumeric() {
		return index != -1;
	}

	public String getPrefix() {
		return prefix;
	}

	public int getIndex() {
		return index;
	}

	/**
	 * @return true if other is a numbered name with the same prefix
	 */
	public boolean isSameFamily(NamingScheme other) {
		return isNumeric() && other.isNumeric() && prefix.equals(other.prefix);
	}

	/**
	 * @return the name of the family member with the given index, zero-padded like this name
	 */
	public String withIndex(int newIndex) {
		if (!isNumeric()) {
			throw new IllegalStateException("descriptive name " + prefix + " has no family");
		}
		return prefix + String.format("%0" + width + "d", newIndex);
	}

	public String successor() {
		return withIndex(index + 1);
	}

	public String getName() {
		return isNumeric() ? withIndex(index) : prefix;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null) {
			return false;
		}
		if (getClass() != obj.getClass()) {
			return false;
		}
		NamingScheme other = (NamingScheme) obj;
		return index == other.index && width == other.width && prefix.equals(other.prefix);
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((prefix == null) ? 0 : prefix.hashCode());
		result = prime * result + index;
		result = prime * result + width;
		return result;
	}

	@Override
	public String toString() {
		return getName();
	}
}
