/**
 * A serial interpreter for proc networks, used to check the behaviour of
 * programs before and after transformation.
 */
package exm.hgc.runtime;
