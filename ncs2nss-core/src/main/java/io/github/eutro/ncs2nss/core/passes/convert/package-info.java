/**
 * Passes that carry a script from one representation to the next:
 * bytecode to control-flow graph, graph to statements, statements to source text.
 * <p>
 * Recovery and structuring attach their results to the graph they are given
 * rather than building a new one, so later passes can still see the blocks.
 */
package io.github.eutro.ncs2nss.core.passes.convert;
