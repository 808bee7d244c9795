/**
 * Channel legalization: ensures every channel side is driven by a single
 * well-defined operation per activation, either by proving the existing
 * operations never fire together or by routing them through a
 * synthesized adapter proc.
 */
package exm.hgc.ir.legalize;
