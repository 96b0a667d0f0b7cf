package org.learningjava.pyml.domain.service.classify;

import org.learningjava.pyml.domain.error.TranslationException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Names known so far in one transpilation run, filled in document order.
 * Owned by a single run and discarded with it.
 */
public class SymbolTable {

    private final Map<String, Integer> functions = new LinkedHashMap<>();
    private final Map<String, String> memberImports = new LinkedHashMap<>();
    private final Set<String> modules = new HashSet<>();
    private final Set<String> variables = new HashSet<>();
    private final Map<String, Integer> pendingCalls = new LinkedHashMap<>();

    /**
     * Registers a function definition. A bare or keyed call to the same name seen
     * earlier in the document is a forward reference and fails the run.
     */
    public void declareFunction(String name, int line) {
        Integer callLine = pendingCalls.remove(name);
        if (callLine != null) {
            throw TranslationException.undefinedCallable(callLine, name, line);
        }
        functions.putIfAbsent(name, line);
    }

    public void declareImport(StatementSyntax.ImportPath path) {
        if (path.isMember()) {
            memberImports.put(path.member(), path.module());
        } else {
            modules.add(path.module());
        }
        modules.add(rootOf(path.module()));
    }

    public void declareVariable(String name) {
        variables.add(rootOf(name));
    }

    /** Records a call; unknown callees are remembered until the end of the run. */
    public void recordCall(String name, int line) {
        if (!isCallable(name)) {
            pendingCalls.putIfAbsent(name, line);
        }
    }

    /** Declared function, imported member, or a dotted name rooted at an imported module. */
    public boolean isCallable(String name) {
        if (functions.containsKey(name) || memberImports.containsKey(name)) {
            return true;
        }
        int dot = name.indexOf('.');
        return dot > 0 && modules.contains(name.substring(0, dot));
    }

    /** Whether a root name is bound by an import, a definition or an assignment. */
    public boolean isBound(String root) {
        return functions.containsKey(root) || memberImports.containsKey(root)
                || modules.contains(root) || variables.contains(root);
    }

    public Set<String> functionNames() {
        return functions.keySet();
    }

    private static String rootOf(String name) {
        int dot = name.indexOf('.');
        return dot < 0 ? name : name.substring(0, dot);
    }
}
