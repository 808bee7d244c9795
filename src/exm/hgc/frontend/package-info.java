/**
 * The frontend package reads the textual IR into the tree representation
 * in {@link exm.hgc.ir.tree}.
 */
package exm.hgc.frontend;
