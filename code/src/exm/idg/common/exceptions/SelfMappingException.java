package exm.idg.common.exceptions;

import exm.idg.graph.SelfMappingInfo;

/**
 * Two distinct dimensions of one tensor were found to be equivalent.
 * Most of lowering assumes this never happens.
 */
public class SelfMappingException extends UserException {

  private static final long serialVersionUID = 1L;

  public final SelfMappingInfo info;

  public SelfMappingException(SelfMappingInfo info) {
    super("Unsupported domain mapping detected in " + info.tensor() + ". " +
          info.domainName() + " domains, " + info.first() + " and " +
          info.second() + ", are mapped with each other in " + info.mode() +
          " mode.");
    this.info = info;
  }
}
