/**
 * A configurable API over the lower-level core decompiler.
 * <p>
 * The main entrypoint to this API is the
 * {@link io.github.eutro.ncs2nss.api.NcsDecompiler},
 * to which compiled scripts can be submitted for decompilation.
 * <p>
 * The decompiler can be configured using the {@link io.github.eutro.ncs2nss.api.events
 * events API}, and extended with {@link io.github.eutro.ncs2nss.api.bits.Bit bits}.
 */
package io.github.eutro.ncs2nss.api;
