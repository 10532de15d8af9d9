package me.golemcore.toolgate.domain.strap;

/**
 * Resource of a domain tool. Implemented by enums so the set is closed.
 */
public interface StrapResource {

    /** Name used on the wire. */
    String wireName();

    default String description() {
        return "";
    }
}
