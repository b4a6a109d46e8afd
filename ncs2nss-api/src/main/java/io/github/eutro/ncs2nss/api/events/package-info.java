/**
 * Events that occur during a decompilation.
 * <p>
 * These can be used to inspect or replace the intermediate results of the pipeline,
 * to run extra passes, and the like.
 * <p>
 * The API revolves around {@link io.github.eutro.ncs2nss.api.events.EventSupplier}s,
 * which can dispatch (or have dispatched on them) events that subclass a specific type.
 */
package io.github.eutro.ncs2nss.api.events;
