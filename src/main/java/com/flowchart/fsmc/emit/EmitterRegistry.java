package com.flowchart.fsmc.emit;

import com.flowchart.fsmc.api.Emitter;
import com.flowchart.fsmc.api.EmitterKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Registry mapping {@link EmitterKind}s to emitter factories.
 */
public final class EmitterRegistry {
    private final Map<EmitterKind, Function<OutputLayout, Emitter>> factories = new EnumMap<>(EmitterKind.class);

    public EmitterRegistry() {
        this(TestStyle.SMOKE);
    }

    public EmitterRegistry(TestStyle testStyle) {
        registerBuiltIns(testStyle);
    }

    /** Registers or replaces the factory for a kind. */
    public EmitterRegistry registerFactory(EmitterKind kind, Function<OutputLayout, Emitter> factory) {
        factories.put(kind, factory);
        return this;
    }

    public boolean isRegistered(EmitterKind kind) {
        return factories.containsKey(kind);
    }

    /** Creates an emitter bound to the given layout. */
    public Emitter create(EmitterKind kind, OutputLayout layout) {
        Function<OutputLayout, Emitter> factory = factories.get(kind);
        if (factory == null)
            throw new IllegalArgumentException("No emitter registered for " + kind);
        Emitter emitter = factory.apply(layout);
        if (emitter.kind() != kind)
            throw new IllegalStateException("Factory for " + kind + " produced a " + emitter.kind() + " emitter");
        return emitter;
    }

    private void registerBuiltIns(TestStyle testStyle) {
        registerFactory(EmitterKind.MACHINE, MachineEmitter::new);
        registerFactory(EmitterKind.SMOKE_TEST, layout -> new TestSuiteEmitter(layout, testStyle));
        registerFactory(EmitterKind.TRANSITION_TEST, TransitionTestEmitter::new);
        registerFactory(EmitterKind.ERROR_TEST, ErrorTestEmitter::new);
        registerFactory(EmitterKind.DEMO, DemoEmitter::new);
        registerFactory(EmitterKind.SERVICE, ServiceEmitter::new);
    }
}
