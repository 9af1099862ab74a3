package io.uabridge.protocol;

public enum AttributeId {
    NODE_ID(1),
    NODE_CLASS(2),
    BROWSE_NAME(3),
    DISPLAY_NAME(4),
    DESCRIPTION(5),
    VALUE(13),
    DATA_TYPE(14),
    VALUE_RANK(15),
    ARRAY_DIMENSIONS(16),
    ACCESS_LEVEL(17),
    USER_ACCESS_LEVEL(18);

    private final int id;

    AttributeId(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }
}
