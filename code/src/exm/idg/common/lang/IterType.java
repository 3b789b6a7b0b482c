package exm.idg.common.lang;

/**
 * How a dimension is iterated over
 */
public enum IterType {
  ITERATION, // Ordinary data-parallel dimension
  BROADCAST, // Size-one dimension that is resolved against another tensor
  REDUCTION, // Dimension reduced away by the defining tensor operation
  ;
}
