package tlaedit.trans;

import tlaedit.TLAEditException;

/**
 * Exception raised while applying an edit to a module
 */
public class EditException extends TLAEditException {

	private static final long serialVersionUID = 6091842264181930811L;
	private static final String prefix = "Edit Error";

	public EditException(String msg) {
		super(prefix, msg);
	}

}
