package tlaedit;

/**
 * Exception raised when the command line cannot be made sense of
 */
public class TLAEditOptionException extends TLAEditException {

	private static final long serialVersionUID = 2818410529061172904L;
	private static final String prefix = "Option Error";

	public TLAEditOptionException(String msg) {
		super(prefix, msg);
	}

}
