package net.spookly.multiupstream.registry;

public enum RegistryEventType {
    LOADED,
    UNLOADED
}
