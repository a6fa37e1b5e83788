package com.flowchart.fsmc.api;

import com.flowchart.fsmc.ir.GeneratedMachine;

/**
 * Renders a {@link GeneratedMachine} into the text of one artifact.
 *
 * <p>
 * Implementations are pure: the same machine always yields byte-identical
 * text, nothing is written anywhere, and no state is shared between calls or
 * between emitters.
 */
public interface Emitter {

    EmitterKind kind();

    String render(GeneratedMachine machine);
}
