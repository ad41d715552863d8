package org.pyken.model;

import java.util.List;
import java.util.Locale;

/**
 * The closed set of validator purposes, each with the parameter roles its
 * handler takes, in order.
 */
public enum ValidatorKind {

    SPEND("spend", ParameterRole.DATUM, ParameterRole.REDEEMER, ParameterRole.CONTEXT),
    MINT("mint", ParameterRole.REDEEMER, ParameterRole.CONTEXT),
    WITHDRAW("withdraw", ParameterRole.REDEEMER, ParameterRole.CONTEXT),
    PUBLISH("publish", ParameterRole.REDEEMER, ParameterRole.CONTEXT),
    FALLBACK("else", ParameterRole.CONTEXT);

    private final String handlerName;
    private final List<ParameterRole> roles;

    ValidatorKind(String handlerName, ParameterRole... roles) {
        this.handlerName = handlerName;
        this.roles = List.of(roles);
    }

    /** Handler name inside an Aiken {@code validator} block. */
    public String handlerName() {
        return handlerName;
    }

    public List<ParameterRole> roles() {
        return roles;
    }

    public int arity() {
        return roles.size();
    }

    /**
     * Kind for a decorator tag such as {@code spend} or {@code pyken.mint}. Only
     * the last dotted segment counts; anything unrecognised is a fallback handler.
     */
    public static ValidatorKind fromTag(String tag) {
        String last = tag.substring(tag.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
        switch (last) {
            case "spend":
                return SPEND;
            case "mint":
                return MINT;
            case "withdraw":
                return WITHDRAW;
            case "publish":
                return PUBLISH;
            default:
                return FALLBACK;
        }
    }

    /** Whether {@code tag} names one of the four purpose-specific kinds. */
    public static boolean isPurposeTag(String tag) {
        return fromTag(tag) != FALLBACK;
    }
}
