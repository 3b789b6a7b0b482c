package exm.idg.common.lang;

import exm.idg.common.exceptions.IDGRuntimeError;

/**
 * Size of a dimension, or a split factor.  Either a known constant or a
 * symbolic expression identified by its printed form.  Two extents are
 * the same if they are the same constant or the same symbolic expression.
 */
public class Extent {
  public static enum ExtentKind {
    CONSTANT, SYMBOLIC
  }

  public static final Extent ZERO = constant(0);
  public static final Extent ONE = constant(1);

  public final ExtentKind kind;
  private final long value;
  private final String symbol;

  private Extent(ExtentKind kind, long value, String symbol) {
    this.kind = kind;
    this.value = value;
    this.symbol = symbol;
  }

  public static Extent constant(long value) {
    return new Extent(ExtentKind.CONSTANT, value, null);
  }

  public static Extent symbolic(String symbol) {
    assert(symbol != null);
    return new Extent(ExtentKind.SYMBOLIC, -1, symbol);
  }

  public boolean isConstant() {
    return kind == ExtentKind.CONSTANT;
  }

  public long getConstant() {
    if (!isConstant()) {
      throw new IDGRuntimeError("Extent " + this + " is not constant");
    }
    return value;
  }

  public boolean isOne() {
    return isConstant() && value == 1;
  }

  public boolean isZero() {
    return isConstant() && value == 0;
  }

  public boolean sameAs(Extent other) {
    return this.equals(other);
  }

  public Extent mul(Extent other) {
    if (this.isOne()) {
      return other;
    } else if (other.isOne()) {
      return this;
    } else if (this.isConstant() && other.isConstant()) {
      return constant(this.value * other.value);
    }
    return symbolic("(" + this + " * " + other + ")");
  }

  public Extent add(Extent other) {
    if (this.isZero()) {
      return other;
    } else if (other.isZero()) {
      return this;
    } else if (this.isConstant() && other.isConstant()) {
      return constant(this.value + other.value);
    }
    return symbolic("(" + this + " + " + other + ")");
  }

  public Extent ceilDiv(Extent divisor) {
    if (divisor.isOne()) {
      return this;
    } else if (this.isConstant() && divisor.isConstant()) {
      assert(divisor.value > 0) : divisor;
      return constant((this.value + divisor.value - 1) / divisor.value);
    }
    return symbolic("ceilDiv(" + this + ", " + divisor + ")");
  }

  @Override
  public int hashCode() {
    if (isConstant()) {
      return (int)(value ^ (value >>> 32));
    } else {
      return symbol.hashCode();
    }
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Extent)) {
      return false;
    }
    Extent other = (Extent)obj;
    if (kind != other.kind) {
      return false;
    }
    if (isConstant()) {
      return value == other.value;
    } else {
      return symbol.equals(other.symbol);
    }
  }

  @Override
  public String toString() {
    if (isConstant()) {
      return Long.toString(value);
    } else {
      return symbol;
    }
  }
}
