package tlaedit.trans.intermediate;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The named operators a standard module makes visible to a module that EXTENDS it.
 */
public class BuiltinModule {

	private final Set<String> operators;

	public BuiltinModule() {
		this.operators = new HashSet<>();
	}

	public BuiltinModule(BuiltinModule exts) {
		this.operators = new HashSet<>(exts.operators);
	}

	public void addOperator(String name) {
		operators.add(name);
	}

	public void addOperators(List<String> names) {
		operators.addAll(names);
	}

	public void addOperators(String... names) {
		addOperators(Arrays.asList(names));
	}

	public boolean hasOperator(String name) {
		return operators.contains(name);
	}

	public Set<String> getOperators() {
		return operators;
	}

}
