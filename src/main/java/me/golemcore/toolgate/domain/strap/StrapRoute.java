package me.golemcore.toolgate.domain.strap;

/**
 * Validated (resource, action) pair of a domain tool call.
 */
public record StrapRoute<R extends Enum<R> & StrapResource, A extends Enum<A> & StrapAction>(R resource, A action) {
}
