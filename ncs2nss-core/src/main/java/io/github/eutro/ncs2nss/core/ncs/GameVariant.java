package io.github.eutro.ncs2nss.core.ncs;

import io.github.eutro.ncs2nss.core.ast.NssType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The two game releases whose script VMs are targeted. They share the instruction set,
 * but differ in engine structure types and in the engine function catalog.
 */
public enum GameVariant {
    /**
     * Knights of the Old Republic.
     */
    K1("nwscript/k1.nss", NssType.EFFECT, NssType.EVENT, NssType.LOCATION, NssType.TALENT),
    /**
     * The Sith Lords.
     */
    K2("nwscript/k2.nss", NssType.EFFECT, NssType.EVENT, NssType.LOCATION, NssType.TALENT, NssType.ITEMPROPERTY),
    ;

    private final String signatureResource;
    private final List<NssType> engineTypes;

    GameVariant(String signatureResource, NssType... engineTypes) {
        this.signatureResource = signatureResource;
        this.engineTypes = Collections.unmodifiableList(Arrays.asList(engineTypes));
    }

    /**
     * Get the classpath resource holding this variant's engine function declarations.
     *
     * @return The resource path.
     */
    public String getSignatureResource() {
        return signatureResource;
    }

    /**
     * Get the engine structure type with the given index, as used by the {@code 0x10}-based type qualifiers.
     *
     * @param index The index.
     * @return The type, or {@link NssType#ANY} if this variant has no such engine type.
     */
    public NssType engineType(int index) {
        return index >= 0 && index < engineTypes.size() ? engineTypes.get(index) : NssType.ANY;
    }

    public List<NssType> getEngineTypes() {
        return engineTypes;
    }
}
