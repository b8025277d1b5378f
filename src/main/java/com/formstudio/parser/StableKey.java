package com.formstudio.parser;

/**
 * Identity rule shared by windows, gadgets and sections: the assigned variable when the
 * object is created with {@code #PB_Any}, otherwise the literal first argument.
 */
public final class StableKey {

    public static final String PB_ANY = "#PB_Any";

    private StableKey() {
    }

    /**
     * @param key    the identity used to address the object
     * @param pbAny  whether the first argument is {@code #PB_Any}
     * @param stable false when {@code #PB_Any} has no assignment to take a name from
     */
    public record Identity(String key, boolean pbAny, boolean stable) {
    }

    public static boolean isPbAny(String token) {
        return token != null && PB_ANY.equalsIgnoreCase(token.trim());
    }

    public static Identity resolve(String firstParam, String assignedVar) {
        String first = firstParam != null ? firstParam.trim() : "";
        if (isPbAny(first)) {
            if (assignedVar != null && !assignedVar.isEmpty()) {
                return new Identity(assignedVar, true, true);
            }
            return new Identity(PB_ANY, true, false);
        }
        return new Identity(first, false, true);
    }

    public static Identity of(Call call) {
        return resolve(call.firstParam(), call.getAssignedVar());
    }
}
