package astbridge.base.provenance;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Use sites of one definition, as instruction ids. Inactivated sites stay recorded.
 */
public class UseLocations {
    private final Set<Integer> recorded = new LinkedHashSet<>();
    private final Set<Integer> inactive = new LinkedHashSet<>();

    public void add(int instrId) {
        recorded.add(instrId);
    }

    /**
     * @return false if the location was never recorded
     */
    public boolean inactivate(int instrId) {
        if (!recorded.contains(instrId)) {
            return false;
        }
        inactive.add(instrId);
        return true;
    }

    public Set<Integer> getRecorded() {
        return Collections.unmodifiableSet(recorded);
    }

    public Set<Integer> getInactive() {
        return Collections.unmodifiableSet(inactive);
    }

    public Set<Integer> getActive() {
        Set<Integer> active = new LinkedHashSet<>(recorded);
        active.removeAll(inactive);
        return active;
    }

    public boolean hasActive() {
        return !inactive.containsAll(recorded);
    }

    public boolean isEmpty() {
        return recorded.isEmpty();
    }

    @Override
    public String toString() {
        return "UseLocations{recorded=" + recorded + ", inactive=" + inactive + "}";
    }
}
