package astbridge.base.builder;

/**
 * Where the value of an lvalue lives in the binary.
 */
public class Storage {
    public enum Kind {
        REGISTER("reg"),
        FLAG("flag"),
        STACK("stack"),
        GLOBAL("global"),
        BASE("base");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        public static Kind fromWireName(String name) {
            for (var kind : values()) {
                if (kind.wireName.equals(name)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown storage kind: " + name);
        }
    }

    private final Kind kind;
    /** register, flag or base name */
    private final String name;
    /** stack or base offset */
    private final Integer offset;
    /** global address */
    private final String address;
    private final Integer size;

    private Storage(Kind kind, String name, Integer offset, String address, Integer size) {
        this.kind = kind;
        this.name = name;
        this.offset = offset;
        this.address = address;
        this.size = size;
    }

    public static Storage register(String register, Integer size) {
        return new Storage(Kind.REGISTER, register, null, null, size);
    }

    public static Storage flag(String flag) {
        return new Storage(Kind.FLAG, flag, null, null, null);
    }

    public static Storage stack(int offset, Integer size) {
        return new Storage(Kind.STACK, null, offset, null, size);
    }

    public static Storage global(String address, Integer size) {
        return new Storage(Kind.GLOBAL, null, null, address, size);
    }

    public static Storage base(String base, int offset, Integer size) {
        return new Storage(Kind.BASE, base, offset, null, size);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public Integer getOffset() {
        return offset;
    }

    public String getAddress() {
        return address;
    }

    public boolean hasSize() {
        return size != null;
    }

    public Integer getSize() {
        return size;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case REGISTER, FLAG -> name;
            case STACK -> offset == 0 ? "stack:0"
                    : offset > 0 ? "parentstack:" + offset : "localstack:" + (-offset);
            case GLOBAL -> "global:" + address;
            case BASE -> name + ":" + offset;
        };
    }
}
