package tlaedit.lexer;

import tlaedit.util.SourceLocatable;
import tlaedit.util.SourceLocation;

import java.util.Objects;

public class TLAToken extends SourceLocatable {

	private final String value;
	private final TLATokenType type;
	private final SourceLocation location;

	public TLAToken(String value, TLATokenType type, SourceLocation location) {
		this.value = value;
		this.type = type;
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public String getValue() {
		return value;
	}

	public TLATokenType getType() {
		return type;
	}

	public boolean isBuiltin(String builtin) {
		return type == TLATokenType.BUILTIN && value.equals(builtin);
	}

	@Override
	public String toString() {
		return "TLAToken [value=" + value + ", type=" + type + ", location=" + location + "]";
	}

	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		result = prime * result + ((location == null) ? 0 : location.hashCode());
		result = prime * result + ((type == null) ? 0 : type.hashCode());
		result = prime * result + ((value == null) ? 0 : value.hashCode());
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
		TLAToken other = (TLAToken) obj;
		return Objects.equals(value, other.value) && type == other.type && Objects.equals(location, other.location);
	}

}
