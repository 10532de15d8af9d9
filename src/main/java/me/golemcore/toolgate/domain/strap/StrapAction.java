package me.golemcore.toolgate.domain.strap;

/**
 * Action of a domain tool. Implemented by enums so the set is closed.
 */
public interface StrapAction {

    /** Name used on the wire. */
    String wireName();
}
