package io.uabridge.protocol;

public enum NodeClass {
    UNSPECIFIED(0, "Unspecified"),
    OBJECT(1, "Object"),
    VARIABLE(2, "Variable"),
    METHOD(4, "Method"),
    OBJECT_TYPE(8, "ObjectType"),
    VARIABLE_TYPE(16, "VariableType"),
    REFERENCE_TYPE(32, "ReferenceType"),
    DATA_TYPE(64, "DataType"),
    VIEW(128, "View");

    private final int value;
    private final String displayName;

    NodeClass(int value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    public int value() {
        return value;
    }

    public String displayName() {
        return "NodeClass" + displayName;
    }

    // Variables and methods are leaves in the browse tree.
    public boolean mayHaveChildren() {
        return this != VARIABLE && this != METHOD;
    }

    public static NodeClass fromValue(int value) {
        for (NodeClass nodeClass : values()) {
            if (nodeClass.value == value) {
                return nodeClass;
            }
        }
        return UNSPECIFIED;
    }
}
