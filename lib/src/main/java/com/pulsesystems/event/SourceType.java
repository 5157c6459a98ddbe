package com.pulsesystems.event;

/**
 * Kind of component that produced an event.
 */
public enum SourceType {
    KERNEL,
    MODULE,
    AGENT,
    USER,
    SYSTEM
}
