package io.uabridge.protocol;

/**
 * Session user identity. Only anonymous and username/password tokens are supported.
 *
 * @param policyId optional user token policy id the endpoint must advertise
 */
public record UserIdentity(Type type, String username, String password, String policyId) {
    public enum Type {
        ANONYMOUS,
        USERNAME
    }

    public static UserIdentity anonymous(String policyId) {
        return new UserIdentity(Type.ANONYMOUS, null, null, policyId);
    }

    public static UserIdentity username(String username, String password, String policyId) {
        return new UserIdentity(Type.USERNAME, username, password, policyId);
    }

    @Override
    public String toString() {
        return "UserIdentity[type=" + type + ", username=" + username + ", policyId=" + policyId + "]";
    }
}
