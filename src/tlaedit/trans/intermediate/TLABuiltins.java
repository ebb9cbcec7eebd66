package tlaedit.trans.intermediate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class TLABuiltins {
	private TLABuiltins() {}

	private static final BuiltinModule universalBuiltIns = new BuiltinModule();
	private static final Map<String, BuiltinModule> builtinModules = new HashMap<>();

	static {
		universalBuiltIns.addOperators("TRUE", "FALSE", "BOOLEAN", "STRING");

		BuiltinModule Naturals = new BuiltinModule();
		builtinModules.put("Naturals", Naturals);
		Naturals.addOperators("Nat");

		BuiltinModule Integers = new BuiltinModule(Naturals);
		builtinModules.put("Integers", Integers);
		Integers.addOperators("Int");

		BuiltinModule Reals = new BuiltinModule(Integers);
		builtinModules.put("Reals", Reals);
		Reals.addOperators("Real", "Infinity");

		BuiltinModule Sequences = new BuiltinModule(Naturals);
		builtinModules.put("Sequences", Sequences);
		Sequences.addOperators("Seq", "Len", "Append", "Head", "Tail", "SubSeq", "SelectSeq");

		BuiltinModule FiniteSets = new BuiltinModule(Naturals);
		builtinModules.put("FiniteSets", FiniteSets);
		FiniteSets.addOperators("IsFiniteSet", "Cardinality");

		BuiltinModule Bags = new BuiltinModule(Naturals);
		builtinModules.put("Bags", Bags);
		Bags.addOperators("IsABag", "BagToSet", "SetToBag", "BagIn", "EmptyBag", "CopiesIn", "BagCup",
				"BagUnion", "SubBag", "BagOfAll", "BagCardinality");

		BuiltinModule TLC = new BuiltinModule(Sequences);
		builtinModules.put("TLC", TLC);
		TLC.addOperators("Print", "PrintT", "Assert", "JavaTime", "TLCGet", "TLCSet", "Permutations",
				"SortSeq", "RandomElement", "Any", "ToString", "TLCEval");

		BuiltinModule SequencesExt = new BuiltinModule(Sequences);
		builtinModules.put("SequencesExt", SequencesExt);
		SequencesExt.addOperators("ToSet", "SetToSeq", "Reverse", "Remove", "ReplaceAll", "Cons", "Front",
				"Last", "IsPrefix", "FoldLeft", "FoldRight");

		BuiltinModule FiniteSetsExt = new BuiltinModule(FiniteSets);
		builtinModules.put("FiniteSetsExt", FiniteSetsExt);
		FiniteSetsExt.addOperators("FoldSet", "SumSet", "ProductSet", "Max", "Min", "Quantify", "kSubset");
	}

	public static BuiltinModule getUniversalBuiltIns() {
		return universalBuiltIns;
	}

	public static BuiltinModule findBuiltinModule(String name) {
		return builtinModules.get(name);
	}

	public static boolean isBuiltinModule(String name) {
		return builtinModules.containsKey(name);
	}

	/**
	 * @return true if name is made visible by the language itself or by one of the extended modules
	 */
	public static boolean isBuiltin(List<String> extendedModules, String name) {
		if (universalBuiltIns.hasOperator(name)) {
			return true;
		}
		for (String moduleName : extendedModules) {
			BuiltinModule module = builtinModules.get(moduleName);
			if (module != null && module.hasOperator(name)) {
				return true;
			}
		}
		return false;
	}
}
