package tlaedit;

/**
 * A TLAEdit exception consisting of a prefix (type of error) and a message.
 */
public abstract class TLAEditException extends RuntimeException {
	private final String msg;
	private final String prefix;

	public TLAEditException(String prefix, String msg) {
		super(prefix.isEmpty() ? msg : prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}
}
