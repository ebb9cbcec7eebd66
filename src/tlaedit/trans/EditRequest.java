package tlaedit.trans;

/**
 * An already decided edit to perform on a module.
 */
public abstract class EditRequest {

	public abstract <T, E extends Throwable> T accept(EditRequestVisitor<T, E> v) throws E;

}
