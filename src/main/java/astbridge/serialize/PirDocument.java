package astbridge.serialize;

import astbridge.analyzer.AstFunction;
import astbridge.base.builder.ProgramContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Everything stored in one PIR file: the functions of a binary, its global symbols and code fragments.
 */
public class PirDocument {
    private static final Pattern HEX = Pattern.compile("([0-9a-f]{2})*");

    private final String version;
    private final ProgramContext context;
    private final List<AstFunction> functions = new ArrayList<>();
    private final Set<String> codeFragments = new LinkedHashSet<>();

    public PirDocument(String version, ProgramContext context) {
        this.version = version;
        this.context = context;
    }

    public String getVersion() {
        return version;
    }

    public ProgramContext getContext() {
        return context;
    }

    public void addFunction(AstFunction function) {
        functions.add(function);
    }

    public List<AstFunction> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    /**
     * Add a verbatim byte sequence given as hex. Identical fragments are kept once.
     */
    public void addCodeFragment(String hex) {
        var normalized = hex.toLowerCase(Locale.ROOT);
        if (!HEX.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Not a hex byte sequence: " + hex);
        }
        codeFragments.add(normalized);
    }

    public Set<String> getCodeFragments() {
        return Collections.unmodifiableSet(codeFragments);
    }
}
