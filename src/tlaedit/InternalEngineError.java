package tlaedit;

public class InternalEngineError extends RuntimeException {
	public InternalEngineError() {
		super("internal engine error");
	}

	public InternalEngineError(String msg) {
		super("internal engine error: " + msg);
	}

	public InternalEngineError(Exception e) {
		super("internal engine error", e);
	}
}
