package tlaedit;

public class Unreachable extends RuntimeException {
	public Unreachable() {
		super("unreachable code reached");
	}
}
