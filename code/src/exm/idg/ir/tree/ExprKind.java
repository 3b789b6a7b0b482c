package exm.idg.ir.tree;

/**
 * Discriminates transformations between iteration domains.
 * Code that matches transformations must handle every kind.
 */
public enum ExprKind {
  SPLIT,     // One input, outputs (outer, inner)
  MERGE,     // Inputs (outer, inner), one output
  SWIZZLE2D, // Inputs (x, y), outputs (x, y) in a permuted order
  RESIZE,    // One input expanded or shrunk at either end, one output
  ;
}
