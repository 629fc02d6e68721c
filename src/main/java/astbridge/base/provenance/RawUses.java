package astbridge.base.provenance;

import java.util.List;

/**
 * The uses of {@code variable} given by the addresses of the instructions that read it.
 */
public class RawUses {
    private final String variable;
    private final List<String> locations;

    public RawUses(String variable, List<String> locations) {
        this.variable = variable;
        this.locations = List.copyOf(locations);
    }

    public String getVariable() {
        return variable;
    }

    public List<String> getLocations() {
        return locations;
    }

    @Override
    public String toString() {
        return variable + "@" + locations;
    }
}
