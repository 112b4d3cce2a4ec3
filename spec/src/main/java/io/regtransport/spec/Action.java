package io.regtransport.spec;

import org.jspecify.annotations.Nullable;

/**
 * The capability requested when exchanging credentials for a Bearer token.
 * <p>
 * Each action maps to the value embedded in the token scope:
 * <ul>
 *   <li><b>PULL:</b> {@code pull}</li>
 *   <li><b>PUSH:</b> {@code push,pull}, pushing implies pulling</li>
 *   <li><b>DELETE:</b> {@code push,pull}, deletion requires the read/write ACL</li>
 *   <li><b>CATALOG:</b> {@code catalog}</li>
 * </ul>
 */
public enum Action {
    PULL("pull"),
    PUSH("push,pull"),
    DELETE("push,pull"),
    CATALOG("catalog");

    private final String scope;

    Action(String scope) {
        this.scope = scope;
    }

    /**
     * Returns the value used for this action inside a token scope.
     *
     * @return the scope value, e.g. {@code push,pull}
     */
    public String scope() {
        return scope;
    }

    /**
     * Resolves an action from its name ({@code pull}, {@code push}, {@code delete},
     * {@code catalog}) or from its scope value ({@code push,pull}).
     *
     * @param value the action name
     * @return the matching action
     * @throws BadStateException if the value does not name an action
     */
    public static Action fromValue(@Nullable String value) throws BadStateException {
        if (value != null) {
            for (Action action : values()) {
                if (action.name().equalsIgnoreCase(value)) {
                    return action;
                }
            }
            // DELETE shares the push scope; resolve the scope literal to PUSH.
            for (Action action : values()) {
                if (action.scope.equals(value)) {
                    return action;
                }
            }
        }
        throw new BadStateException("Invalid action supplied to RegistryTransport: " + value);
    }
}
