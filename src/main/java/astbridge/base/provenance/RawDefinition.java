package astbridge.base.provenance;

import java.util.List;

/**
 * A definition of {@code variable} given by the addresses of the instructions that write it.
 */
public class RawDefinition {
    private final String variable;
    private final List<String> locations;

    public RawDefinition(String variable, List<String> locations) {
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
