package ai.acsl.injector.inject;

public enum InjectionPointKind {
    FUNCTION,
    LOOP
}
