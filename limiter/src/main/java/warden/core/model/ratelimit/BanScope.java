package warden.core.model.ratelimit;

/**
 * Reach of a ban once it fires.
 */
public enum BanScope {

    /** A ban blocks the identifier only on the rule that produced it. */
    RULE,

    /** A ban blocks the identifier on every rule. */
    SITE
}
