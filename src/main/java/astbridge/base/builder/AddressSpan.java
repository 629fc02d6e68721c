package astbridge.base.builder;

import java.util.Objects;

/**
 * The bytes of one decoded instruction: hex base address and length.
 */
public class AddressSpan {
    private final String baseVa;
    private final int size;

    public AddressSpan(String baseVa, int size) {
        this.baseVa = baseVa;
        this.size = size;
    }

    public String getBaseVa() {
        return baseVa;
    }

    public int getSize() {
        return size;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof AddressSpan other)) {
            return false;
        }
        return size == other.size && baseVa.equals(other.baseVa);
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseVa, size);
    }

    @Override
    public String toString() {
        return baseVa + ":" + size;
    }
}
