package io.github.eutro.ncs2nss.core.ncs;

import io.github.eutro.ncs2nss.core.DecompilationException;

/**
 * Thrown when a script's bytes cannot be decoded: a bad header, a truncated operand or an unknown opcode.
 */
public class MalformedBytecodeException extends DecompilationException {
    public MalformedBytecodeException(String message, int offset) {
        super(message, offset);
    }
}
